package win.ixuni.s3wire.core.util;

import win.ixuni.s3wire.core.exception.InvalidEnumValueException;
import win.ixuni.s3wire.core.exception.MissingRequiredFieldException;

import java.util.Collection;

/**
 * S3 request parameter validation utility class
 */
public final class S3ValidationUtils {

    private S3ValidationUtils() {
    }

    /**
     * Fail when a mandatory field is null
     *
     * @param value         field value
     * @param fieldName     input name of the field, e.g. "Bucket"
     * @param operationName 操作名称
     * @param <T>           field type
     * @return the value, never null
     */
    public static <T> T requireField(T value, String fieldName, String operationName) {
        if (value == null) {
            throw new MissingRequiredFieldException(fieldName, operationName);
        }
        return value;
    }

    /**
     * Fail when a value is outside its allow-list
     *
     * @param value         field value (non-null)
     * @param allowed       permitted values, compared case-sensitively
     * @param fieldName     input name of the field
     * @param operationName 操作名称
     */
    public static void requireAllowed(String value, Collection<String> allowed,
                                      String fieldName, String operationName) {
        if (!allowed.contains(value)) {
            throw new InvalidEnumValueException(fieldName, value, operationName);
        }
    }
}
