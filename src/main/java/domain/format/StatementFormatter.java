package domain.format;

import domain.model.FormatWarning;
import domain.model.FormatWarningCode;
import domain.model.FormatWarningSink;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches one top-level statement on its {@link StatementKind}.
 *
 * <p>Every statement that cannot be laid out raises {@link UnsupportedConstructException} inside
 * {@link #layout(Statement, StatementKind, FormattingContext)}; {@link #format} is the only place that
 * applies the {@link FallbackPolicy} to it.</p>
 */
final class StatementFormatter {

    private static final Logger log = LoggerFactory.getLogger(StatementFormatter.class);

    private final FallbackPolicy policy;
    private final FormatWarningSink warningSink;

    StatementFormatter(FallbackPolicy policy, FormatWarningSink warningSink) {
        this.policy = policy == null ? FallbackPolicy.defaultPolicy() : policy;
        this.warningSink = warningSink == null ? FormatWarningSink.none() : warningSink;
    }

    /**
     * @param source         label of the document, used in warnings only
     * @param statementIndex 1-based index of the statement in its document
     * @return formatted text without terminator
     */
    String format(Statement statement, String source, int statementIndex) {
        StatementKind kind = StatementKind.of(statement);
        try {
            return layout(statement, kind, FormattingContext.root());
        } catch (UnsupportedConstructException e) {
            if (policy == FallbackPolicy.STRICT) throw e;
            return fallback(statement, kind, source, statementIndex, e);
        }
    }

    private String layout(Statement statement, StatementKind kind, FormattingContext ctx) {
        return switch (kind) {
            case SELECT -> layoutSelect((Select) statement, ctx);
            case INSERT, UPDATE, DELETE, CREATE, ALTER, DROP, OTHER -> throw new UnsupportedConstructException(
                    kind.name(),
                    "no layout for statement kind " + kind + " (" + statement.getClass().getSimpleName() + ")");
        };
    }

    private static String layoutSelect(Select select, FormattingContext ctx) {
        String text = SelectFormatter.format(select, ctx);
        ensureLayoutCovers(select, text);
        return text;
    }

    /**
     * The layout must place every token the parser renders for the statement. Anything it left
     * out is a clause without a layout rule, reported as unsupported instead of surfacing later
     * as a verification failure.
     */
    private static void ensureLayoutCovers(Statement statement, String laidOut) {
        String expected = SqlNodeRenderer.withoutWhitespace(SqlNodeRenderer.render(statement));
        String actual = SqlNodeRenderer.withoutWhitespace(laidOut);
        if (!expected.equals(actual)) {
            throw new UnsupportedConstructException(statement.getClass().getSimpleName(),
                    "select carries clauses without a layout rule");
        }
    }

    private String fallback(Statement statement, StatementKind kind, String source, int statementIndex,
                            UnsupportedConstructException cause) {
        FormatWarningCode code = kind.isLaidOut()
                ? FormatWarningCode.UNSUPPORTED_CLAUSE_FALLBACK
                : FormatWarningCode.UNSUPPORTED_STATEMENT_FALLBACK;
        log.warn("[FALLBACK] {}#{} {} rendered verbatim: {}", source, statementIndex, kind, cause.getMessage());
        warningSink.warn(new FormatWarning(code, source, statementIndex,
                "rendered verbatim: " + cause.getConstruct(), cause.getMessage()));
        return SqlNodeRenderer.render(statement);
    }
}
