package domain.format;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into top-level statement trees with a single parser call.
 *
 * <p>The returned list keeps the document order and may contain {@code null} entries, which
 * callers skip.</p>
 */
final class SqlStatementSplitter {

    private SqlStatementSplitter() {
    }

    static List<Statement> split(String sql) {
        if (isEmptyDocument(sql)) return List.of();

        Statements parsed;
        try {
            parsed = CCJSqlParserUtil.parseStatements(sql);
        } catch (JSQLParserException e) {
            throw new MalformedSqlException("Invalid SQL syntax: " + firstLine(e.getMessage()), e);
        }
        if (parsed == null || parsed.getStatements() == null) return List.of();
        return new ArrayList<>(parsed.getStatements());
    }

    /** Blank, or nothing but terminators and whitespace (the parser rejects a lone {@code ;}). */
    static boolean isEmptyDocument(String sql) {
        if (sql == null) return true;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c != ';' && !Character.isWhitespace(c)) return false;
        }
        return true;
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return nl < 0 ? s.trim() : s.substring(0, nl).trim();
    }
}
