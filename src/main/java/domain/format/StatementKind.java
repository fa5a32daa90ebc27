package domain.format;

import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.alter.Alter;
import net.sf.jsqlparser.statement.create.index.CreateIndex;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.view.CreateView;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.drop.Drop;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;

/**
 * Closed set of statement kinds the formatter distinguishes.
 *
 * <p>The parser's node hierarchy is open; everything it produces is mapped onto one of these
 * tags, with {@link #OTHER} catching the rest, so dispatch stays an exhaustive switch.</p>
 */
public enum StatementKind {
    SELECT(true),
    INSERT(false),
    UPDATE(false),
    DELETE(false),
    CREATE(false),
    ALTER(false),
    DROP(false),
    OTHER(false);

    private final boolean laidOut;

    StatementKind(boolean laidOut) {
        this.laidOut = laidOut;
    }

    /** Whether this kind has a dedicated layout (everything else goes through the fallback path). */
    public boolean isLaidOut() {
        return laidOut;
    }

    public static StatementKind of(Statement statement) {
        if (statement == null) throw new IllegalArgumentException("statement is null");
        if (statement instanceof Select) return SELECT;
        if (statement instanceof Insert) return INSERT;
        if (statement instanceof Update) return UPDATE;
        if (statement instanceof Delete) return DELETE;
        if (statement instanceof CreateTable
                || statement instanceof CreateView
                || statement instanceof CreateIndex) return CREATE;
        if (statement instanceof Alter) return ALTER;
        if (statement instanceof Drop) return DROP;
        return OTHER;
    }
}
