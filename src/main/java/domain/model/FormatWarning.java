package domain.model;

/**
 * A single warning emitted while formatting.
 *
 * <p>Warnings are not fatal; they flag statements that were kept verbatim or inputs that
 * operators should review.</p>
 */
public final class FormatWarning {

    private final FormatWarningCode code;
    private final String source;
    private final int statementIndex;
    private final String message;
    private final String detail;

    /**
     * @param statementIndex 1-based position of the statement in its document, {@code 0} when the
     *                       warning concerns the whole document
     */
    public FormatWarning(
            FormatWarningCode code,
            String source,
            int statementIndex,
            String message,
            String detail
    ) {
        this.code = code == null ? FormatWarningCode.FORMAT_ERROR : code;
        this.source = nullToEmpty(source);
        this.statementIndex = Math.max(0, statementIndex);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FormatWarning of(FormatWarningCode code, String source, String message) {
        return new FormatWarning(code, source, 0, message, "");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public FormatWarningCode getCode() {
        return code;
    }

    public String getSource() {
        return source;
    }

    public int getStatementIndex() {
        return statementIndex;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + "[" + source + "#" + statementIndex + "] " + message
                + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
