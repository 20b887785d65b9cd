package win.ixuni.s3wire.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * 完成分片上传时提交的分片信息
 * <p>
 * Checksums are optional and only written when present.
 */
@Value
@Builder(toBuilder = true)
public class CompletedPart {

    /**
     * 分片编号
     */
    Integer partNumber;

    /**
     * 分片ETag
     */
    String etag;

    String checksumCrc32;

    String checksumCrc32c;

    String checksumSha1;

    String checksumSha256;

    public static CompletedPart of(int partNumber, String etag) {
        return CompletedPart.builder()
                .partNumber(partNumber)
                .etag(etag)
                .build();
    }
}
