package domain.model;

/**
 * Standard warning codes for formatting/reporting.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum FormatWarningCode {

    /**
     * Statement kind has no layout (INSERT, UPDATE, DDL, ...) and was rendered verbatim.
     */
    UNSUPPORTED_STATEMENT_FALLBACK,

    /**
     * SELECT carries a shape the layout does not place (set operation, unknown clause, non-CTE WITH entry)
     * and was rendered verbatim.
     */
    UNSUPPORTED_CLAUSE_FALLBACK,

    /**
     * Input carries comments, which formatting drops. The input file is never overwritten in that case.
     */
    COMMENTS_DROPPED,
    /**
     * Input file contains no statement.
     */
    SQL_TEXT_EMPTY,

    /**
     * Formatting failed with an exception.
     */
    FORMAT_ERROR,

    /**
     * Processing time exceeded the configured slow threshold.
     */
    SLOW_FILE
}
