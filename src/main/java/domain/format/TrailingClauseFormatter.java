package domain.format;

import net.sf.jsqlparser.statement.select.PlainSelect;

import java.util.ArrayList;
import java.util.List;

/**
 * Clauses after the joins: {@code WHERE}, {@code GROUP BY}, {@code HAVING}, {@code ORDER BY},
 * {@code LIMIT}, {@code OFFSET}, {@code FETCH}. Each gets its own line at the current indent and
 * keeps its content verbatim.
 */
final class TrailingClauseFormatter {

    private TrailingClauseFormatter() {
    }

    static List<String> format(PlainSelect select, FormattingContext ctx) {
        List<String> lines = new ArrayList<>(4);
        String indent = ctx.indent();

        if (select.getWhere() != null) {
            lines.add(indent + "WHERE " + SqlNodeRenderer.render(select.getWhere()));
        }
        if (select.getGroupBy() != null) {
            // GroupByElement deparses with its own keyword
            lines.add(indent + SqlNodeRenderer.render(select.getGroupBy()));
        }
        if (select.getHaving() != null) {
            lines.add(indent + "HAVING " + SqlNodeRenderer.render(select.getHaving()));
        }
        List<?> orderBy = select.getOrderByElements();
        if (orderBy != null && !orderBy.isEmpty()) {
            List<String> parts = new ArrayList<>(orderBy.size());
            for (Object element : orderBy) {
                parts.add(SqlNodeRenderer.render(element));
            }
            lines.add(indent + "ORDER BY " + String.join(", ", parts));
        }
        if (select.getLimit() != null) {
            lines.add(indent + SqlNodeRenderer.render(select.getLimit()));
        }
        if (select.getOffset() != null) {
            lines.add(indent + SqlNodeRenderer.render(select.getOffset()));
        }
        if (select.getFetch() != null) {
            lines.add(indent + SqlNodeRenderer.render(select.getFetch()));
        }
        return lines;
    }
}
