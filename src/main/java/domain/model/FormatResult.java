package domain.model;

/**
 * One per-file formatting outcome row for reporting.
 *
 * <p>Kept as a simple value object (no behavior), not tied to any report library.</p>
 */
public final class FormatResult {

    public static final String FORMATTED = "FORMATTED";
    public static final String UNCHANGED = "UNCHANGED";
    public static final String NEEDS_FORMAT = "NEEDS_FORMAT";
    public static final String SKIP = "SKIP";
    public static final String FAILED = "FAILED";

    /**
     * FORMATTED / UNCHANGED / NEEDS_FORMAT (check mode) / SKIP / FAILED
     */
    private final String status;
    private final String file;
    private final int statements;

    /**
     * reason message for SKIP / FAILED (usually the exception class)
     */
    private final String message;

    /**
     * optional detail (exception message, ...)
     */
    private final String detail;
    private final long elapsedMs;

    public FormatResult(String status, String file, String message) {
        this(status, file, 0, message, null, 0L);
    }

    public FormatResult(String status, String file, int statements, String message, String detail, long elapsedMs) {
        this.status = nullToEmpty(status);
        this.file = nullToEmpty(file);
        this.statements = Math.max(0, statements);
        this.message = nullToEmpty(message);
        this.detail = nullToNullIfBlank(detail);
        this.elapsedMs = Math.max(0L, elapsedMs);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String nullToNullIfBlank(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public String getStatus() {
        return status;
    }

    public String getFile() {
        return file;
    }

    public int getStatements() {
        return statements;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isFailure() {
        return FAILED.equals(status);
    }
}
