package domain.format;

/**
 * Base class of every formatting failure.
 *
 * <p>Callers can catch this to handle all failures, or one of the subclasses to tell
 * an unsupported construct, a formatter defect and bad input apart.</p>
 */
public class SqlFormatException extends RuntimeException {

    public SqlFormatException(String message) {
        super(message);
    }

    public SqlFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
