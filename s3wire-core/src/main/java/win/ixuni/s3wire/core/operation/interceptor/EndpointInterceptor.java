package win.ixuni.s3wire.core.operation.interceptor;

import lombok.RequiredArgsConstructor;
import win.ixuni.s3wire.core.config.S3WireProperties;
import win.ixuni.s3wire.core.operation.InterceptorChain;
import win.ixuni.s3wire.core.operation.Operation;
import win.ixuni.s3wire.core.operation.RequestInterceptor;
import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * Endpoint 拦截器
 * <p>
 * Decorates every built request with its region and endpoint. The operation's
 * own region wins over the configured default.
 */
@RequiredArgsConstructor
public class EndpointInterceptor implements RequestInterceptor {

    private final S3WireProperties properties;

    @Override
    public <O extends Operation<?>> RequestDescriptor intercept(O operation, InterceptorChain<O> chain) {
        RequestDescriptor request = chain.proceed(operation);

        String region = operation.getRegion() != null ? operation.getRegion() : properties.getRegion();
        return request.toBuilder()
                .region(region)
                .endpoint(resolveEndpoint(region))
                .build();
    }

    /**
     * Configured endpoint, or the regional AWS endpoint when none is set
     */
    String resolveEndpoint(String region) {
        String endpoint = properties.getEndpoint();
        if (endpoint != null && !endpoint.isBlank()) {
            return endpoint;
        }
        return "https://s3." + region + ".amazonaws.com";
    }
}
