package domain.format;

import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClauseFormattersTest {

    @Test
    void single_column_stays_on_select_line() {
        String out = ColumnListFormatter.format(List.of("a"), null, FormattingContext.root());
        assertEquals("SELECT a", out);
    }

    @Test
    void multiple_columns_start_on_own_line_one_level_deeper() {
        String out = ColumnListFormatter.format(List.of("a", "b", "c"), null, FormattingContext.root());
        assertEquals("SELECT\n    a\n    , b\n    , c", out);
    }

    @Test
    void columns_in_nested_context_are_indented_from_the_nested_select() {
        String out = ColumnListFormatter.format(List.of("a", "b"), null, FormattingContext.root().nested());
        assertEquals("    SELECT\n        a\n        , b", out);
    }

    @Test
    void zero_columns_yield_bare_select() {
        assertEquals("SELECT", ColumnListFormatter.format(List.of(), null, FormattingContext.root()));
    }

    @Test
    void select_modifier_stays_on_select_line() {
        String out = ColumnListFormatter.format(List.of("a", "b"), "DISTINCT", FormattingContext.root());
        assertEquals("SELECT DISTINCT\n    a\n    , b", out);
    }

    @Test
    void from_is_rendered_verbatim_at_indent() {
        assertEquals("    FROM t AS x", FromClauseFormatter.format("t AS x", FormattingContext.root().nested()));
    }

    @Test
    void joins_are_one_per_line() throws Exception {
        PlainSelect select = (PlainSelect) CCJSqlParserUtil.parse(
                "select a from t join u on t.id = u.id left join v on v.id = u.id");

        String out = JoinListFormatter.format(select.getJoins(), FormattingContext.root());

        assertEquals("JOIN u ON t.id = u.id\nLEFT JOIN v ON v.id = u.id", out);
    }

    @Test
    void comma_join_keeps_its_comma() throws Exception {
        PlainSelect select = (PlainSelect) CCJSqlParserUtil.parse("select a from t, u");

        assertEquals(", u", JoinListFormatter.format(select.getJoins(), FormattingContext.root()));
    }

    @Test
    void non_join_entry_is_rejected() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> JoinListFormatter.format(List.of("JOIN u ON 1 = 1"), FormattingContext.root()));
        assertEquals("String", e.getConstruct());
    }

    @Test
    void non_cte_with_entry_is_rejected() {
        assertThrows(UnsupportedConstructException.class,
                () -> WithClauseFormatter.format(List.of("c AS (SELECT 1)"), FormattingContext.root(),
                        (body, ctx) -> ""));
    }

    @Test
    void with_block_nests_bodies_one_level_deeper() throws Exception {
        PlainSelect select = (PlainSelect) CCJSqlParserUtil.parse(
                "with c as (select x from y), d as (select z from c) select * from d");

        String out = WithClauseFormatter.format(select.getWithItemsList(), FormattingContext.root(),
                (body, ctx) -> ctx.indent() + "<" + ctx.getLevel() + ">");

        assertEquals("WITH c AS (\n    <1>\n),\nd AS (\n    <1>\n)", out);
    }
}
