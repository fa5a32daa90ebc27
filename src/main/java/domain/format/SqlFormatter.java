package domain.format;

import domain.model.FormatWarningSink;
import net.sf.jsqlparser.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical SQL formatter.
 *
 * <p>Parses the whole document once, then for every statement in order: lay it out, append the
 * terminator, verify the result by re-parsing, keep it. The output is the kept fragments followed by
 * one trailing newline.</p>
 *
 * <pre>{@code
 * SqlFormatter formatter = new SqlFormatter(FallbackPolicy.LENIENT, warningSink);
 * String out = formatter.format("select a, b from t");
 * // SELECT
 * //     a
 * //     , b
 * // FROM t
 * // ;
 * }</pre>
 *
 * <p>Fail-fast: the first {@link SqlFormatException} abandons the whole document, nothing is
 * returned for the statements already formatted.</p>
 */
public final class SqlFormatter {

    public static final String STATEMENT_TERMINATOR = "\n;";
    public static final String DOCUMENT_END = "\n";

    private static final Logger log = LoggerFactory.getLogger(SqlFormatter.class);

    private final FallbackPolicy policy;
    private final StatementFormatter statementFormatter;
    private final RoundTripVerifier verifier = new RoundTripVerifier();

    public SqlFormatter() {
        this(FallbackPolicy.defaultPolicy(), FormatWarningSink.none());
    }

    public SqlFormatter(FallbackPolicy policy, FormatWarningSink warningSink) {
        this.policy = policy == null ? FallbackPolicy.defaultPolicy() : policy;
        this.statementFormatter = new StatementFormatter(this.policy, warningSink);
    }

    public FallbackPolicy getPolicy() {
        return policy;
    }

    public String format(String sql) {
        return format(sql, "");
    }

    /**
     * @param source label of the document (file name, ...) attached to warnings
     * @throws UnsupportedConstructException  unsupported statement under {@link FallbackPolicy#STRICT}
     * @throws RoundTripVerificationException formatted text is not equivalent to the input
     * @throws MalformedSqlException          the input does not parse
     */
    public String format(String sql, String source) {
        return formatDocument(sql, source).getText();
    }

    /** Same as {@link #format(String, String)}, also reporting how many statements were formatted. */
    public FormattedSql formatDocument(String sql, String source) {
        List<Statement> statements = SqlStatementSplitter.split(sql);
        List<String> fragments = new ArrayList<>(statements.size());

        int index = 0;
        for (Statement statement : statements) {
            if (statement == null) continue;
            index++;
            log.debug("formatting {}#{}: {}", source, index, statement);

            String fragment = statementFormatter.format(statement, source, index) + STATEMENT_TERMINATOR;
            verifier.verify(statement, fragment);
            fragments.add(fragment);
        }
        return new FormattedSql(String.join("", fragments) + DOCUMENT_END, index);
    }
}
