package win.ixuni.s3wire.core.operation;

import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * Request builder interface
 * <p>
 * Turns one operation type into a {@link RequestDescriptor}. Implementations are
 * stateless and must either return a complete request or throw.
 *
 * @param <O> 操作类型
 */
public interface RequestBuilder<O extends Operation<?>> {

    /**
     * Build the request
     *
     * @param operation the operation instance
     * @return complete request
     */
    RequestDescriptor build(O operation);

    /**
     * 获取此构建器支持的操作类型
     *
     * @return 操作类类型
     */
    Class<O> getOperationType();
}
