package win.ixuni.s3wire.core.operation.multipart;

import win.ixuni.s3wire.core.util.S3ValidationUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static win.ixuni.s3wire.core.operation.multipart.CompleteMultipartUploadOperation.REQUEST_PAYER;

/**
 * Header assembler for CompleteMultipartUpload
 * <p>
 * One header per present field, nothing for absent ones. Values are passed
 * through unchanged; If-None-Match "*" stays "*".
 */
class CompleteMultipartUploadHeaders {

    static final String CONTENT_TYPE = "content-type";
    static final String CHECKSUM_CRC32 = "x-amz-checksum-crc32";
    static final String CHECKSUM_CRC32C = "x-amz-checksum-crc32c";
    static final String CHECKSUM_SHA1 = "x-amz-checksum-sha1";
    static final String CHECKSUM_SHA256 = "x-amz-checksum-sha256";
    static final String REQUEST_PAYER_HEADER = "x-amz-request-payer";
    static final String EXPECTED_BUCKET_OWNER = "x-amz-expected-bucket-owner";
    static final String IF_MATCH = "If-Match";
    static final String IF_NONE_MATCH = "If-None-Match";
    static final String SSE_CUSTOMER_ALGORITHM = "x-amz-server-side-encryption-customer-algorithm";
    static final String SSE_CUSTOMER_KEY = "x-amz-server-side-encryption-customer-key";
    static final String SSE_CUSTOMER_KEY_MD5 = "x-amz-server-side-encryption-customer-key-MD5";

    static final List<String> CHECKSUM_HEADERS = List.of(
            CHECKSUM_CRC32, CHECKSUM_CRC32C, CHECKSUM_SHA1, CHECKSUM_SHA256);

    private static final String APPLICATION_XML = "application/xml";

    private final Set<String> allowedRequestPayers;

    CompleteMultipartUploadHeaders(Collection<String> allowedRequestPayers) {
        this.allowedRequestPayers = Set.copyOf(allowedRequestPayers);
    }

    Map<String, String> assemble(CompleteMultipartUploadOperation operation) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, APPLICATION_XML);

        putIfPresent(headers, CHECKSUM_CRC32, operation.getChecksumCrc32());
        putIfPresent(headers, CHECKSUM_CRC32C, operation.getChecksumCrc32c());
        putIfPresent(headers, CHECKSUM_SHA1, operation.getChecksumSha1());
        putIfPresent(headers, CHECKSUM_SHA256, operation.getChecksumSha256());

        if (operation.getRequestPayer() != null) {
            S3ValidationUtils.requireAllowed(operation.getRequestPayer(), allowedRequestPayers,
                    REQUEST_PAYER, operation.getOperationName());
            headers.put(REQUEST_PAYER_HEADER, operation.getRequestPayer());
        }

        putIfPresent(headers, EXPECTED_BUCKET_OWNER, operation.getExpectedBucketOwner());
        putIfPresent(headers, IF_MATCH, operation.getIfMatch());
        putIfPresent(headers, IF_NONE_MATCH, operation.getIfNoneMatch());

        // SSE-C: each header independent, consistency is checked by the service
        putIfPresent(headers, SSE_CUSTOMER_ALGORITHM, operation.getSseCustomerAlgorithm());
        putIfPresent(headers, SSE_CUSTOMER_KEY, operation.getSseCustomerKey());
        putIfPresent(headers, SSE_CUSTOMER_KEY_MD5, operation.getSseCustomerKeyMd5());

        return headers;
    }

    private static void putIfPresent(Map<String, String> headers, String name, String value) {
        if (value != null) {
            headers.put(name, value);
        }
    }
}
