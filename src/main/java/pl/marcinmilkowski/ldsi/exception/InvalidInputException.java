package pl.marcinmilkowski.ldsi.exception;

/**
 * Raised when a caller hands the engine structurally invalid input: a missing
 * text, a token list containing nulls, or configuration values that cannot
 * define a scoring run.
 *
 * <p>Empty or very short texts are not invalid. They are scored with the
 * fallback constants of each metric.</p>
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception for a required argument that was null.
     */
    public static InvalidInputException missing(String what) {
        return new InvalidInputException(String.format("Missing %s: got null", what));
    }

    /**
     * Creates an exception for an argument outside its allowed domain.
     */
    public static InvalidInputException invalidParameter(String paramName, Object value, String expected) {
        return new InvalidInputException(
                String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
    }
}
