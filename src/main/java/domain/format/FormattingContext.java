package domain.format;

/**
 * Per-call formatting context: nesting level plus the column separator token.
 *
 * <p>Immutable. A nested scope gets a new instance from {@link #nested()}, so every recursive
 * call sees its own indent depth.</p>
 */
public final class FormattingContext {

    public static final String DEFAULT_SEPARATOR = ",";

    private final int level;
    private final String separatorToken;

    public FormattingContext(int level, String separatorToken) {
        if (level < 0) throw new IllegalArgumentException("level must be >= 0: " + level);
        this.level = level;
        this.separatorToken = (separatorToken == null || separatorToken.isBlank())
                ? DEFAULT_SEPARATOR
                : separatorToken.trim();
    }

    public static FormattingContext root() {
        return new FormattingContext(0, DEFAULT_SEPARATOR);
    }

    public FormattingContext nested() {
        return new FormattingContext(level + 1, separatorToken);
    }

    public int getLevel() {
        return level;
    }

    public String getSeparatorToken() {
        return separatorToken;
    }

    public String indent() {
        return Indentation.indentText(level);
    }

    /** Separator for items of a list laid out one level below this context. */
    public String itemSeparator() {
        return Indentation.columnSeparator(level + 1, separatorToken);
    }

    @Override
    public String toString() {
        return "FormattingContext{level=" + level + ", separator='" + separatorToken + "'}";
    }
}
