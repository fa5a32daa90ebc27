package domain.format;

/** Formatted document text plus the number of statements it holds. */
public final class FormattedSql {

    private final String text;
    private final int statementCount;

    FormattedSql(String text, int statementCount) {
        this.text = text;
        this.statementCount = statementCount;
    }

    public String getText() {
        return text;
    }

    public int getStatementCount() {
        return statementCount;
    }

    @Override
    public String toString() {
        return text;
    }
}
