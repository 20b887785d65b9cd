package win.ixuni.s3wire.core.operation;

import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * Request 拦截器链接口
 * <p>
 * Used in interceptors to invoke the next interceptor or the final builder.
 *
 * @param <O> 操作类型
 */
public interface InterceptorChain<O extends Operation<?>> {

    /**
     * 继续执行拦截器链
     *
     * @param operation the operation instance
     * @return built request
     */
    RequestDescriptor proceed(O operation);
}
