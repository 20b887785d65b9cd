package win.ixuni.s3wire.core.operation;

import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * Request 拦截器接口
 * <p>
 * Applies cross-cutting concerns (logging, endpoint decoration, etc.) around the
 * builder. Designed using the chain-of-responsibility pattern.
 */
public interface RequestInterceptor {

    /**
     * 拦截请求构建
     * <p>
     * Implementors can run logic before and after calling chain.proceed(), and may
     * return a decorated copy of the request.
     *
     * @param operation the operation instance
     * @param chain     后续拦截器链
     * @param <O>       operation type
     * @return built request
     */
    <O extends Operation<?>> RequestDescriptor intercept(O operation, InterceptorChain<O> chain);

    /**
     * Get interceptor priority (lower number = higher priority)
     *
     * @return priority ordinal
     */
    default int getOrder() {
        return 0;
    }
}
