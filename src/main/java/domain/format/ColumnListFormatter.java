package domain.format;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the {@code SELECT} line and its projection list.
 *
 * <ul>
 *   <li>one column stays on the {@code SELECT} line: {@code SELECT a}</li>
 *   <li>two or more columns start on the next line, one level deeper, later ones led by the separator</li>
 * </ul>
 */
final class ColumnListFormatter {

    private ColumnListFormatter() {
    }

    /**
     * @param columns  projection items, rendered verbatim
     * @param modifier text kept on the {@code SELECT} line before the columns ({@code DISTINCT}, ...), may be null
     */
    static String format(List<?> columns, Object modifier, FormattingContext ctx) {
        StringBuilder out = new StringBuilder(64);
        out.append(ctx.indent()).append("SELECT");

        String mod = SqlNodeRenderer.render(modifier);
        if (!mod.isEmpty()) out.append(' ').append(mod);

        List<String> texts = new ArrayList<>(columns == null ? 0 : columns.size());
        if (columns != null) {
            for (Object column : columns) {
                texts.add(SqlNodeRenderer.render(column));
            }
        }

        if (texts.size() == 1) {
            out.append(' ');
        } else if (texts.size() > 1) {
            out.append('\n').append(Indentation.indentText(ctx.getLevel() + 1));
        }
        out.append(String.join(ctx.itemSeparator(), texts));
        return out.toString();
    }
}
