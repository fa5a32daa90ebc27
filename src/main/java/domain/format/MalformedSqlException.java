package domain.format;

/** The parser could not build a statement tree from the input. The parser error is the cause. */
public class MalformedSqlException extends SqlFormatException {

    public MalformedSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
