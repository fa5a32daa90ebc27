package domain.model;

/**
 * Sink for formatting diagnostics.
 *
 * <p>Fallback rendering and slow inputs are reported from the formatter and from the CLI loop.
 * The sink is handed in explicitly so callers (and tests) see every warning without depending
 * on the logging configuration.</p>
 */
public interface FormatWarningSink {

    static FormatWarningSink none() {
        return NullFormatWarningSink.INSTANCE;
    }

    void warn(FormatWarning warning);
}
