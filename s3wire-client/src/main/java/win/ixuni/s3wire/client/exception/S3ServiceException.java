package win.ixuni.s3wire.client.exception;

import lombok.Getter;
import win.ixuni.s3wire.core.exception.S3WireException;

/**
 * Error reported by the storage service
 * <p>
 * Raised for non-2xx responses and for 200 responses whose body is an
 * {@code <Error>} document.
 */
@Getter
public class S3ServiceException extends S3WireException {

    private final int statusCode;

    private final String requestId;

    public S3ServiceException(String errorCode, String message, int statusCode, String requestId) {
        super(errorCode, message);
        this.statusCode = statusCode;
        this.requestId = requestId;
    }
}
