package Exceptions;

/**
 * Raised by the normalizer when a scalar cannot be coerced to its column type.
 */
public class TypeCoercionException extends PipelineException {

    private final String column;
    private final String value;

    public TypeCoercionException(String column, String value, String transactionId) {
        super(ErrorKind.TYPE_COERCION,
                "Cannot coerce column '" + column + "' value '" + value + "' (transaction_id=" + transactionId + ")");
        this.column = column;
        this.value = value;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}
