package win.ixuni.s3wire.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.s3wire.client.exception.S3ServiceException;
import win.ixuni.s3wire.client.transport.RequestTransport;
import win.ixuni.s3wire.client.transport.TransportResponse;
import win.ixuni.s3wire.core.S3RequestFactory;
import win.ixuni.s3wire.core.exception.S3WireException;
import win.ixuni.s3wire.core.model.CompleteMultipartUploadResult;
import win.ixuni.s3wire.core.model.S3ErrorResponse;
import win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadOperation;
import win.ixuni.s3wire.core.request.RequestDescriptor;
import win.ixuni.s3wire.core.util.XmlUtils;

/**
 * 分片上传客户端
 * <p>
 * Builds the request, sends it, and maps the response. Build failures surface as
 * {@code Mono.error} before anything is sent.
 */
@Slf4j
@RequiredArgsConstructor
public class MultipartUploadClient {

    static final String VERSION_ID = "x-amz-version-id";
    static final String SERVER_SIDE_ENCRYPTION = "x-amz-server-side-encryption";
    static final String REQUEST_CHARGED = "x-amz-request-charged";
    static final String EXPIRATION = "x-amz-expiration";
    static final String REQUEST_ID = "x-amz-request-id";

    private final S3RequestFactory requestFactory;
    private final RequestTransport transport;

    /**
     * 完成分片上传
     * POST /{bucket}/{key}?uploadId={uploadId}
     *
     * @param operation complete operation
     * @return assembled object info
     */
    public Mono<CompleteMultipartUploadResult> completeMultipartUpload(CompleteMultipartUploadOperation operation) {
        return Mono.fromCallable(() -> requestFactory.build(operation))
                .flatMap(request -> transport.send(request)
                        .switchIfEmpty(Mono.error(() -> new S3WireException("EmptyResponse",
                                "Transport completed without a response for " + request.getMethod() + " " + request.getPath())))
                        .map(response -> toResult(request, response)))
                .doOnSuccess(result -> log.info("CompleteMultipartUpload success: bucket={}, key={}, etag={}",
                        operation.getBucket(), operation.getKey(), result.getEtag()))
                .doOnError(error -> log.warn("CompleteMultipartUpload failed: bucket={}, key={}, uploadId={}: {}",
                        operation.getBucket(), operation.getKey(), operation.getUploadId(), error.getMessage()));
    }

    private CompleteMultipartUploadResult toResult(RequestDescriptor request, TransportResponse response) {
        byte[] body = response.getBody();

        // A 200 can still carry an <Error> document when assembly fails late
        if (!response.isSuccessful() || "Error".equals(XmlUtils.rootElementName(body))) {
            throw toServiceException(request, response);
        }

        CompleteMultipartUploadResult result = body.length > 0
                ? XmlUtils.fromXml(body, CompleteMultipartUploadResult.class)
                : new CompleteMultipartUploadResult();
        result.setVersionId(response.getHeader(VERSION_ID));
        result.setServerSideEncryption(response.getHeader(SERVER_SIDE_ENCRYPTION));
        result.setRequestCharged(response.getHeader(REQUEST_CHARGED));
        result.setExpiration(response.getHeader(EXPIRATION));
        return result;
    }

    private S3ServiceException toServiceException(RequestDescriptor request, TransportResponse response) {
        int status = response.getStatusCode();
        String requestId = response.getHeader(REQUEST_ID);

        if ("Error".equals(safeRootElementName(response.getBody()))) {
            S3ErrorResponse error = XmlUtils.fromXml(response.getBody(), S3ErrorResponse.class);
            return new S3ServiceException(
                    error.getCode() != null ? error.getCode() : "UnknownError",
                    error.getMessage() != null ? error.getMessage() : "HTTP " + status + " for " + request.getPath(),
                    status,
                    error.getRequestId() != null ? error.getRequestId() : requestId);
        }

        return new S3ServiceException("HttpStatus" + status,
                "HTTP " + status + " for " + request.getMethod() + " " + request.getPath(),
                status, requestId);
    }

    /**
     * Error bodies from proxies are not always XML
     */
    private static String safeRootElementName(byte[] body) {
        try {
            return XmlUtils.rootElementName(body);
        } catch (RuntimeException e) {
            log.debug("Error response body is not XML: {}", e.getMessage());
            return null;
        }
    }
}
