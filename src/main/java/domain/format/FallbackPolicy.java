package domain.format;

import java.util.Locale;

/** What happens to a statement the layout does not support. */
public enum FallbackPolicy {

    /** Fail with {@link UnsupportedConstructException}. */
    STRICT,

    /** Keep the parser's own rendering of the statement and emit a warning. */
    LENIENT;

    public static FallbackPolicy defaultPolicy() {
        return LENIENT;
    }

    /**
     * Lenient parse of user input ({@code strict}, {@code STRICT}, {@code lenient}, {@code fallback}).
     * Blank input yields the default policy.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static FallbackPolicy parse(String raw) {
        if (raw == null || raw.isBlank()) return defaultPolicy();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("strict") || v.equals("fail")) return STRICT;
        if (v.equals("lenient") || v.equals("fallback") || v.equals("verbatim")) return LENIENT;
        throw new IllegalArgumentException("unknown fallback policy: " + raw + " (expected strict|lenient)");
    }
}
