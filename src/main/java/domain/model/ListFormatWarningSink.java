package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects warnings into a caller-owned list, keeping the first of any identical warnings.
 *
 * <p>Two warnings are identical when code, source, statement index, message and detail all match.
 * A statement that falls back for the same reason twice (the CLI re-reading one file) yields one
 * report row.</p>
 */
public final class ListFormatWarningSink implements FormatWarningSink {

    private final List<FormatWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListFormatWarningSink(List<FormatWarning> target) {
        this.target = target;
    }

    private static String key(FormatWarning w) {
        return safe(w.getCode() == null ? "" : w.getCode()
                .name()) + "|"
                + safe(w.getSource()) + "|"
                + w.getStatementIndex() + "|"
                + safe(w.getMessage()) + "|"
                + safe(w.getDetail());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void warn(FormatWarning warning) {
        if (warning == null || target == null) return;
        String k = key(warning);
        if (seen.add(k)) {
            target.add(warning);
        }
    }
}
