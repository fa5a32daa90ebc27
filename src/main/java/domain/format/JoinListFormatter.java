package domain.format;

import net.sf.jsqlparser.statement.select.Join;

import java.util.ArrayList;
import java.util.List;

/**
 * One join per line at the current indent, each join rendered verbatim.
 *
 * <p>A simple (comma) join deparses without its comma, so the comma is put back in front of it;
 * otherwise {@code FROM a, b} would lose the cross product.</p>
 */
final class JoinListFormatter {

    private JoinListFormatter() {
    }

    static String format(List<?> joins, FormattingContext ctx) {
        if (joins == null || joins.isEmpty()) return "";

        List<String> lines = new ArrayList<>(joins.size());
        for (Object entry : joins) {
            if (!(entry instanceof Join join)) {
                throw new UnsupportedConstructException(
                        entry == null ? "null" : entry.getClass().getSimpleName(),
                        "joins entry is not a join: " + entry);
            }
            String text = SqlNodeRenderer.render(join);
            if (join.isSimple()) text = ", " + text;
            lines.add(ctx.indent() + text);
        }
        return String.join("\n", lines);
    }
}
