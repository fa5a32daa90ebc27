package domain.format;

import net.sf.jsqlparser.statement.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Proves a formatted fragment still means the same thing as the statement it came from.
 *
 * <p>The fragment (terminator included) is parsed again and must yield exactly one statement that is
 * structurally equal to the original. JSqlParser nodes do not override {@code equals}, so structural
 * equality is pinned down here as: same node class and same canonical deparsed text. The deparsed
 * text is produced from the tree alone, so it ignores source whitespace but does see every
 * identifier, keyword and literal spelling.</p>
 */
final class RoundTripVerifier {

    void verify(Statement original, String formattedFragment) {
        List<Statement> reparsed;
        try {
            reparsed = nonNull(SqlStatementSplitter.split(formattedFragment));
        } catch (MalformedSqlException e) {
            throw new RoundTripVerificationException("formatted output does not parse: " + e.getMessage(), e);
        }

        if (reparsed.size() != 1) {
            throw new RoundTripVerificationException(
                    "formatted output parses into " + reparsed.size() + " statements, expected 1",
                    SqlNodeRenderer.render(original),
                    formattedFragment);
        }

        Statement roundTripped = reparsed.get(0);
        if (!structurallyEqual(original, roundTripped)) {
            throw new RoundTripVerificationException(
                    "formatted output changed the statement",
                    SqlNodeRenderer.render(original),
                    SqlNodeRenderer.render(roundTripped));
        }
    }

    static boolean structurallyEqual(Statement a, Statement b) {
        if (a == null || b == null) return a == b;
        if (a.getClass() != b.getClass()) return false;
        return Objects.equals(SqlNodeRenderer.render(a), SqlNodeRenderer.render(b));
    }

    private static List<Statement> nonNull(List<Statement> statements) {
        List<Statement> out = new ArrayList<>(statements.size());
        for (Statement s : statements) {
            if (s != null) out.add(s);
        }
        return out;
    }
}
