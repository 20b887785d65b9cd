package win.ixuni.s3wire.core.exception;

import lombok.Getter;

/**
 * S3Wire base exception
 */
@Getter
public class S3WireException extends RuntimeException {

    private final String errorCode;

    public S3WireException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public S3WireException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
