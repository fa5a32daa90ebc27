package domain.format;

import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.WithItem;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code WITH} block: every CTE as {@code <alias> AS (}, its body one level deeper, then a closing
 * parenthesis at the current indent. CTEs keep their definition order and are joined by {@code ",\n"}.
 *
 * <p>The alias header ({@code name}, optional column list, {@code RECURSIVE}/{@code MATERIALIZED})
 * is taken verbatim from the parser's rendering of the item minus the rendering of its body.</p>
 */
final class WithClauseFormatter {

    /** Formats a CTE body at the given (already nested) context. */
    @FunctionalInterface
    interface BodyFormatter {
        String format(Select body, FormattingContext ctx);
    }

    private WithClauseFormatter() {
    }

    static String format(List<?> withItems, FormattingContext ctx, BodyFormatter bodyFormatter) {
        if (withItems == null || withItems.isEmpty()) return "";

        String indent = ctx.indent();
        List<String> items = new ArrayList<>(withItems.size());
        for (Object entry : withItems) {
            if (!(entry instanceof WithItem item)) {
                throw new UnsupportedConstructException(
                        entry == null ? "null" : entry.getClass().getSimpleName(),
                        "WITH entry is not a common table expression: " + entry);
            }
            Select body = item.getSelect();
            if (body == null) {
                throw new UnsupportedConstructException("WithItem", "WITH entry has no query body: " + item);
            }

            String header = header(item, body);
            String nested = bodyFormatter.format(unwrap(body), ctx.nested());
            String lead = items.isEmpty() ? "WITH " : "";
            items.add(indent + lead + header + " (\n" + nested + "\n" + indent + ")");
        }
        return String.join(",\n", items);
    }

    private static String header(WithItem item, Select body) {
        String whole = SqlNodeRenderer.render(item);
        String bodyText = SqlNodeRenderer.render(body);
        if (bodyText.isEmpty() || !whole.endsWith(bodyText)) {
            throw new UnsupportedConstructException("WithItem", "cannot separate CTE header from its body: " + whole);
        }
        String header = whole.substring(0, whole.length() - bodyText.length()).trim();
        if (header.isEmpty()) {
            throw new UnsupportedConstructException("WithItem", "CTE has no alias: " + whole);
        }
        return header;
    }

    private static Select unwrap(Select body) {
        if (body instanceof ParenthesedSelect) {
            Select inner = ((ParenthesedSelect) body).getSelect();
            if (inner != null) return inner;
        }
        return body;
    }
}
