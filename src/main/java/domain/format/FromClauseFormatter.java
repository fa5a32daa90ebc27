package domain.format;

/** {@code FROM} line. The from item (table, subquery, ...) is kept verbatim on that line. */
final class FromClauseFormatter {

    private FromClauseFormatter() {
    }

    static String format(Object fromItem, FormattingContext ctx) {
        return ctx.indent() + "FROM " + SqlNodeRenderer.render(fromItem);
    }
}
