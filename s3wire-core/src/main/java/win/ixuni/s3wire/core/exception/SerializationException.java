package win.ixuni.s3wire.core.exception;

/**
 * Request body could not be written as well-formed XML
 */
public class SerializationException extends S3WireException {

    public SerializationException(String message, Throwable cause) {
        super("SerializationError", message, cause);
    }
}
