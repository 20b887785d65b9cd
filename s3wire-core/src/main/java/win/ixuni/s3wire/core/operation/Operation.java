package win.ixuni.s3wire.core.operation;

/**
 * S3 操作基础接口
 * <p>
 * Each operation is an immutable parameter value; a matching {@link RequestBuilder}
 * turns it into a request. 泛型参数 R 表示服务端响应解析后的类型。
 *
 * @param <R> 操作返回类型
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging and error messages)
     *
     * @return 操作名称，如 "CompleteMultipartUpload"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        // Remove "Operation" suffix
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }

    /**
     * Per-request region override
     *
     * @return region, or null to use the configured one
     */
    default String getRegion() {
        return null;
    }
}
