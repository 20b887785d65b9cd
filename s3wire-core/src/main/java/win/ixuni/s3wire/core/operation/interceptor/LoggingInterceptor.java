package win.ixuni.s3wire.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3wire.core.operation.InterceptorChain;
import win.ixuni.s3wire.core.operation.Operation;
import win.ixuni.s3wire.core.operation.RequestInterceptor;
import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * 日志拦截器
 * <p>
 * 在请求构建前后记录日志，包括耗时和结果状态。Header values are never logged,
 * since they may carry customer-provided key material.
 */
@Slf4j
public class LoggingInterceptor implements RequestInterceptor {

    @Override
    public <O extends Operation<?>> RequestDescriptor intercept(O operation, InterceptorChain<O> chain) {
        final long startTime = System.nanoTime();
        final String operationName = operation.getOperationName();

        log.debug("Building request for operation: {}", operationName);

        try {
            RequestDescriptor request = chain.proceed(operation);
            if (log.isDebugEnabled()) {
                log.debug("Operation {} built {} {} ({} headers, {} body bytes) in {}us",
                        operationName, request.getMethod(), request.getPath(),
                        request.getHeaders().size(), request.getContentLength(), elapsedMicros(startTime));
            }
            return request;
        } catch (RuntimeException e) {
            log.warn("Operation {} failed to build after {}us: {}",
                    operationName, elapsedMicros(startTime), e.getMessage());
            throw e;
        }
    }

    @Override
    public int getOrder() {
        return -100; // 最外层拦截器
    }

    private static long elapsedMicros(long startTime) {
        return (System.nanoTime() - startTime) / 1_000;
    }
}
