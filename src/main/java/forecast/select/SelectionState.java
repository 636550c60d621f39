package forecast.select;

public enum SelectionState {
    INSUFFICIENT_DATA("insufficient_data"),
    QUICK_SELECTION("quick_selection"),
    FULL_EVALUATION("full_evaluation"),
    /** Terminal recovery state after every candidate failed. */
    FALLBACK("fallback");

    private final String wireName;

    SelectionState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
