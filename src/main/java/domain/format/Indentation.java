package domain.format;

/**
 * Indent math shared by every clause formatter.
 *
 * <p>The column-list formatter and the CTE formatter must agree on nesting depth, so both
 * go through here instead of building their own padding.</p>
 */
public final class Indentation {

    public static final int SPACES_PER_LEVEL = 4;

    private Indentation() {
    }

    /**
     * @return {@code 4 * level} spaces
     * @throws IllegalArgumentException when {@code level} is negative
     */
    public static String indentText(int level) {
        if (level < 0) throw new IllegalArgumentException("level must be >= 0: " + level);
        return " ".repeat(SPACES_PER_LEVEL * level);
    }

    /**
     * String placed between adjacent list items so each following item starts on its own line,
     * led by the separator token: {@code "\n" + indent + token + " "}.
     */
    public static String columnSeparator(int level, String separatorToken) {
        return "\n" + indentText(level) + (separatorToken == null ? "" : separatorToken) + " ";
    }
}
