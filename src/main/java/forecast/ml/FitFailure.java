package forecast.ml;

/**
 * Why a model could not be fitted. A value, not an exception: candidate failures are expected and
 * are handled by the selector, never propagated past it.
 */
public final class FitFailure {

    private final String modelName;
    private final String reason;

    public FitFailure(String modelName, String reason) {
        this.modelName = modelName;
        this.reason = reason;
    }

    public static FitFailure of(String modelName, Throwable cause) {
        String msg = cause.getMessage();
        return new FitFailure(modelName, msg != null && !msg.isEmpty() ? msg : cause.getClass().getSimpleName());
    }

    public String getModelName() { return modelName; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return modelName + " fit failed: " + reason;
    }
}
