package domain.format;

import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive layout of a plain {@code SELECT}.
 *
 * <p>Fragments in fixed order: {@code WITH} block, {@code SELECT} line with columns, {@code FROM},
 * joins, trailing clauses. The fragments are joined once by newlines; the result carries no
 * statement terminator (the caller owns termination).</p>
 *
 * <p>CTE bodies are formatted by this same class one level deeper, so a CTE inside a CTE ends up
 * two levels deep.</p>
 */
final class SelectFormatter {

    private SelectFormatter() {
    }

    static String format(Select select, FormattingContext ctx) {
        if (!(select instanceof PlainSelect plain)) {
            String construct = select == null ? "null" : select.getClass().getSimpleName();
            throw new UnsupportedConstructException(construct, "no layout for select shape " + construct);
        }

        List<String> fragments = new ArrayList<>(8);

        List<?> withItems = plain.getWithItemsList();
        if (withItems != null && !withItems.isEmpty()) {
            fragments.add(WithClauseFormatter.format(withItems, ctx, SelectFormatter::format));
        }

        fragments.add(ColumnListFormatter.format(plain.getSelectItems(), plain.getDistinct(), ctx));

        if (plain.getFromItem() != null) {
            fragments.add(FromClauseFormatter.format(plain.getFromItem(), ctx));
        }

        String joins = JoinListFormatter.format(plain.getJoins(), ctx);
        if (!joins.isEmpty()) {
            fragments.add(joins);
        }

        fragments.addAll(TrailingClauseFormatter.format(plain, ctx));
        return String.join("\n", fragments);
    }
}
