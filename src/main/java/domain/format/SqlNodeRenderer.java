package domain.format;

import java.util.regex.Pattern;

/**
 * Verbatim serializer for parser nodes.
 *
 * <p>JSqlParser nodes deparse themselves through {@code toString()}. Several of them emit a leading
 * space (e.g. {@code " LIMIT 10"}), so the text is trimmed before it is placed on a line.</p>
 */
final class SqlNodeRenderer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SqlNodeRenderer() {
    }

    static String render(Object node) {
        if (node == null) return "";
        return node.toString().trim();
    }

    /**
     * Text with every whitespace run removed. Two renderings that only differ in layout
     * collapse to the same value.
     */
    static String withoutWhitespace(String text) {
        if (text == null || text.isEmpty()) return "";
        return WHITESPACE.matcher(text).replaceAll("");
    }
}
