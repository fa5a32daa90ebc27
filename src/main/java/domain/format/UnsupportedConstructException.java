package domain.format;

/**
 * A statement kind or clause shape the layout has no rule for.
 *
 * <p>Thrown to the caller under {@link FallbackPolicy#STRICT}; under {@link FallbackPolicy#LENIENT}
 * it is caught once per statement and turned into a verbatim rendering plus a warning.</p>
 */
public class UnsupportedConstructException extends SqlFormatException {

    private final String construct;

    public UnsupportedConstructException(String construct, String message) {
        super(message);
        this.construct = construct == null ? "" : construct;
    }

    /** Name of the offending construct, e.g. {@code INSERT} or {@code SetOperationList}. */
    public String getConstruct() {
        return construct;
    }
}
