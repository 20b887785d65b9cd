package win.ixuni.s3wire.core.operation.multipart;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import win.ixuni.s3wire.core.model.CompleteMultipartUploadResult;
import win.ixuni.s3wire.core.model.CompletedMultipartUpload;
import win.ixuni.s3wire.core.model.CompletedPart;
import win.ixuni.s3wire.core.operation.Operation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Complete multipart upload operation
 * <p>
 * Immutable; every {@code withXxx} call returns a new value. Bucket, key and
 * upload ID are required at build time, everything else is optional and null
 * when absent.
 */
@Value
@With
@Builder(toBuilder = true)
public class CompleteMultipartUploadOperation implements Operation<CompleteMultipartUploadResult> {

    public static final String BUCKET = "Bucket";
    public static final String KEY = "Key";
    public static final String UPLOAD_ID = "UploadId";
    public static final String MULTIPART_UPLOAD = "MultipartUpload";
    public static final String CHECKSUM_CRC32 = "ChecksumCRC32";
    public static final String CHECKSUM_CRC32C = "ChecksumCRC32C";
    public static final String CHECKSUM_SHA1 = "ChecksumSHA1";
    public static final String CHECKSUM_SHA256 = "ChecksumSHA256";
    public static final String REQUEST_PAYER = "RequestPayer";
    public static final String EXPECTED_BUCKET_OWNER = "ExpectedBucketOwner";
    public static final String IF_MATCH = "IfMatch";
    public static final String IF_NONE_MATCH = "IfNoneMatch";
    public static final String SSE_CUSTOMER_ALGORITHM = "SSECustomerAlgorithm";
    public static final String SSE_CUSTOMER_KEY = "SSECustomerKey";
    public static final String SSE_CUSTOMER_KEY_MD5 = "SSECustomerKeyMD5";
    public static final String REGION = "@region";

    private static final String PARTS = "Parts";
    private static final String PART_NUMBER = "PartNumber";
    private static final String ETAG = "ETag";

    /**
     * Bucket 名称
     */
    String bucket;

    /**
     * 对象 Key
     */
    String key;

    /**
     * 上传 ID
     */
    String uploadId;

    /**
     * Parts to assemble, in the order the service should see them
     */
    CompletedMultipartUpload multipartUpload;

    /**
     * Base64-encoded whole-object checksums
     */
    String checksumCrc32;
    String checksumCrc32c;
    String checksumSha1;
    String checksumSha256;

    /**
     * x-amz-request-payer, see {@link win.ixuni.s3wire.core.model.RequestPayer}
     */
    String requestPayer;

    String expectedBucketOwner;

    /**
     * Conditional write predicates, passed through verbatim
     */
    String ifMatch;
    String ifNoneMatch;

    /**
     * SSE-C 参数
     */
    String sseCustomerAlgorithm;
    String sseCustomerKey;
    String sseCustomerKeyMd5;

    /**
     * Region override for this request only
     */
    String region;

    /**
     * Create an operation from key/value input
     * <p>
     * Keys follow the service's parameter names ("Bucket", "ChecksumCRC32", ...).
     * MultipartUpload may be a {@link CompletedMultipartUpload} or a map of the form
     * {@code {Parts: [{PartNumber: 1, ETag: "..."}, ...]}}. Unknown keys are ignored.
     *
     * @param input 输入参数
     * @return new operation
     * @throws IllegalArgumentException if a value has the wrong shape
     */
    public static CompleteMultipartUploadOperation fromInput(Map<String, ?> input) {
        return CompleteMultipartUploadOperation.builder()
                .bucket(string(input, BUCKET))
                .key(string(input, KEY))
                .uploadId(string(input, UPLOAD_ID))
                .multipartUpload(multipartUpload(input.get(MULTIPART_UPLOAD)))
                .checksumCrc32(string(input, CHECKSUM_CRC32))
                .checksumCrc32c(string(input, CHECKSUM_CRC32C))
                .checksumSha1(string(input, CHECKSUM_SHA1))
                .checksumSha256(string(input, CHECKSUM_SHA256))
                .requestPayer(string(input, REQUEST_PAYER))
                .expectedBucketOwner(string(input, EXPECTED_BUCKET_OWNER))
                .ifMatch(string(input, IF_MATCH))
                .ifNoneMatch(string(input, IF_NONE_MATCH))
                .sseCustomerAlgorithm(string(input, SSE_CUSTOMER_ALGORITHM))
                .sseCustomerKey(string(input, SSE_CUSTOMER_KEY))
                .sseCustomerKeyMd5(string(input, SSE_CUSTOMER_KEY_MD5))
                .region(string(input, REGION))
                .build();
    }

    private static CompletedMultipartUpload multipartUpload(Object value) {
        if (value == null || value instanceof CompletedMultipartUpload) {
            return (CompletedMultipartUpload) value;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(
                    MULTIPART_UPLOAD + " must be a CompletedMultipartUpload or a map, got " + value.getClass().getName());
        }
        Object parts = ((Map<?, ?>) value).get(PARTS);
        if (parts == null) {
            return CompletedMultipartUpload.builder().build();
        }
        if (!(parts instanceof List)) {
            throw new IllegalArgumentException(MULTIPART_UPLOAD + "." + PARTS + " must be a list");
        }
        List<CompletedPart> result = new ArrayList<>();
        for (Object part : (List<?>) parts) {
            result.add(completedPart(part));
        }
        return CompletedMultipartUpload.of(result);
    }

    private static CompletedPart completedPart(Object value) {
        if (value instanceof CompletedPart) {
            return (CompletedPart) value;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Each part must be a CompletedPart or a map");
        }
        Map<?, ?> part = (Map<?, ?>) value;
        return CompletedPart.builder()
                .partNumber(partNumber(part.get(PART_NUMBER)))
                .etag(string(part, ETAG))
                .checksumCrc32(string(part, CHECKSUM_CRC32))
                .checksumCrc32c(string(part, CHECKSUM_CRC32C))
                .checksumSha1(string(part, CHECKSUM_SHA1))
                .checksumSha256(string(part, CHECKSUM_SHA256))
                .build();
    }

    private static Integer partNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            // Reject anything that would name a different part once narrowed to int
            try {
                return new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + PART_NUMBER + ": " + value, e);
            }
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + PART_NUMBER + ": " + value, e);
        }
    }

    private static String string(Map<?, ?> input, String name) {
        Object value = input.get(name);
        return value != null ? value.toString() : null;
    }
}
