package domain.format;

/**
 * Re-parsing the formatted text did not give back the original statement.
 *
 * <p>This is a defect in the formatter, never in the user's input, so it is not retried and
 * not downgraded to a warning.</p>
 */
public class RoundTripVerificationException extends SqlFormatException {

    private final String expected;
    private final String actual;

    public RoundTripVerificationException(String message, String expected, String actual) {
        super(message);
        this.expected = expected == null ? "" : expected;
        this.actual = actual == null ? "" : actual;
    }

    public RoundTripVerificationException(String message, Throwable cause) {
        super(message, cause);
        this.expected = "";
        this.actual = "";
    }

    /** Canonical text of the original statement. */
    public String getExpected() {
        return expected;
    }

    /** Canonical text of what the formatted output parsed back into. */
    public String getActual() {
        return actual;
    }
}
