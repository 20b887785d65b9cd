package win.ixuni.s3wire.core;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.s3wire.core.config.S3WireProperties;
import win.ixuni.s3wire.core.operation.Operation;
import win.ixuni.s3wire.core.operation.RequestBuilderRegistry;
import win.ixuni.s3wire.core.operation.interceptor.EndpointInterceptor;
import win.ixuni.s3wire.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadRequestBuilder;
import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * S3 request factory
 * <p>
 * Entry point of the core: registers the built-in builders and interceptors and
 * turns operations into decorated requests. Thread-safe once constructed.
 * <p>
 * Usage example:
 *
 * <pre>
 * S3RequestFactory factory = new S3RequestFactory(new S3WireProperties());
 * RequestDescriptor request = factory.build(CompleteMultipartUploadOperation.builder()
 *         .bucket("my-bucket").key("a/b.bin").uploadId(uploadId)
 *         .build());
 * </pre>
 */
@Slf4j
public class S3RequestFactory {

    @Getter
    private final RequestBuilderRegistry registry = new RequestBuilderRegistry();

    public S3RequestFactory(S3WireProperties properties) {
        registry.register(new CompleteMultipartUploadRequestBuilder(properties.getRequestPayers()));
        registry.addInterceptor(new LoggingInterceptor());
        registry.addInterceptor(new EndpointInterceptor(properties));
        log.info("S3 request factory initialized: region={}, endpoint={}, {} operations",
                properties.getRegion(),
                properties.getEndpoint() != null ? properties.getEndpoint() : "<aws regional>",
                registry.size());
    }

    /**
     * Build the request for an operation
     *
     * @param operation the operation instance
     * @return request with endpoint and region resolved
     */
    public RequestDescriptor build(Operation<?> operation) {
        return registry.build(operation);
    }
}
