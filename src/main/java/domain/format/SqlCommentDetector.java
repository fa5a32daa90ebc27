package domain.format;

/**
 * Finds line ({@code --}) and block comments in raw SQL text.
 *
 * <p>The parser drops comments, so a formatted document never carries them. Callers use this to
 * tell whether writing the formatted text back would lose something. Markers inside single-quoted
 * literals and double-quoted or backtick-quoted identifiers are not comments.</p>
 */
public final class SqlCommentDetector {

    private SqlCommentDetector() {
    }

    public static boolean containsComment(String sql) {
        if (sql == null || sql.isEmpty()) return false;

        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(sql, i, c);
                continue;
            }
            if (i + 1 < n) {
                char next = sql.charAt(i + 1);
                if (c == '-' && next == '-') return true;
                if (c == '/' && next == '*') return true;
            }
            i++;
        }
        return false;
    }

    /** Index just past the closing quote; a doubled quote is an escaped one. Unterminated runs to the end. */
    private static int skipQuoted(String s, int start, char quote) {
        int i = start + 1;
        int n = s.length();
        while (i < n) {
            if (s.charAt(i) == quote) {
                if (i + 1 < n && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n;
    }
}
