package win.ixuni.s3wire.core.exception;

import lombok.Getter;

/**
 * A field value is not among its permitted set
 */
@Getter
public class InvalidEnumValueException extends S3WireException {

    private final String fieldName;
    private final String value;

    public InvalidEnumValueException(String fieldName, String value, String operationName) {
        super("InvalidEnumValue", String.format(
                "Invalid parameter \"%s\" for \"%s\". The value \"%s\" is not a valid \"%s\".",
                fieldName, operationName, value, fieldName));
        this.fieldName = fieldName;
        this.value = value;
    }
}
