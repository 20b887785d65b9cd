package win.ixuni.s3wire.core.exception;

import lombok.Getter;

/**
 * A mandatory operation field was null at build time
 */
@Getter
public class MissingRequiredFieldException extends S3WireException {

    /**
     * 缺失字段的输入名称，如 "Bucket"
     */
    private final String fieldName;

    public MissingRequiredFieldException(String fieldName, String operationName) {
        super("MissingRequiredField", String.format(
                "Missing parameter \"%s\" for \"%s\". The value cannot be null.", fieldName, operationName));
        this.fieldName = fieldName;
    }
}
