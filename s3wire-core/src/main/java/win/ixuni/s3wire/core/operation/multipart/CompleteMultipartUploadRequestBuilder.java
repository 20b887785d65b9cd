package win.ixuni.s3wire.core.operation.multipart;

import win.ixuni.s3wire.core.operation.RequestBuilder;
import win.ixuni.s3wire.core.request.RequestDescriptor;
import win.ixuni.s3wire.core.util.S3UriEncoder;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadOperation.BUCKET;
import static win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadOperation.KEY;
import static win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadOperation.UPLOAD_ID;
import static win.ixuni.s3wire.core.util.S3ValidationUtils.requireField;

/**
 * 完成分片上传请求构建器
 * <p>
 * POST /{bucket}/{key}?uploadId={uploadId}
 * <p>
 * Validation runs first, so an invalid operation never produces a partial request.
 */
public class CompleteMultipartUploadRequestBuilder implements RequestBuilder<CompleteMultipartUploadOperation> {

    static final String METHOD = "POST";

    private final CompleteMultipartUploadHeaders headers;
    private final CompleteMultipartUploadBodySerializer bodySerializer = new CompleteMultipartUploadBodySerializer();

    /**
     * @param allowedRequestPayers accepted x-amz-request-payer values
     */
    public CompleteMultipartUploadRequestBuilder(Collection<String> allowedRequestPayers) {
        this.headers = new CompleteMultipartUploadHeaders(
                Objects.requireNonNull(allowedRequestPayers, "allowedRequestPayers must not be null"));
    }

    @Override
    public RequestDescriptor build(CompleteMultipartUploadOperation operation) {
        String operationName = operation.getOperationName();

        // Bucket, then Key, then UploadId
        requireField(operation.getBucket(), BUCKET, operationName);
        requireField(operation.getKey(), KEY, operationName);
        requireField(operation.getUploadId(), UPLOAD_ID, operationName);

        Map<String, String> headerMap = headers.assemble(operation);

        Map<String, String> query = new LinkedHashMap<>();
        query.put("uploadId", operation.getUploadId());

        String path = S3UriEncoder.buildPath(
                requireField(operation.getBucket(), BUCKET, operationName),
                requireField(operation.getKey(), KEY, operationName));

        byte[] body = bodySerializer.serialize(operation.getMultipartUpload());

        return RequestDescriptor.builder()
                .method(METHOD)
                .path(path)
                .query(query)
                .headers(headerMap)
                .body(body)
                .build();
    }

    @Override
    public Class<CompleteMultipartUploadOperation> getOperationType() {
        return CompleteMultipartUploadOperation.class;
    }
}
