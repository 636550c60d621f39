package forecast.data;

/**
 * Raised for caller input that cannot be turned into a usable series or request:
 * empty series, malformed timestamps, unknown metric types. Never retried.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
