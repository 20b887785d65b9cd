package win.ixuni.s3wire.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Complete multipart upload response
 * <p>
 * Body elements come from the XML document; version, encryption, charge and
 * expiration come from response headers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "CompleteMultipartUploadResult")
public class CompleteMultipartUploadResult {

    /**
     * 对象位置URL
     */
    @JacksonXmlProperty(localName = "Location")
    private String location;

    /**
     * Bucket名称
     */
    @JacksonXmlProperty(localName = "Bucket")
    private String bucket;

    /**
     * 对象Key
     */
    @JacksonXmlProperty(localName = "Key")
    private String key;

    /**
     * 对象ETag
     */
    @JacksonXmlProperty(localName = "ETag")
    private String etag;

    @JacksonXmlProperty(localName = "ChecksumCRC32")
    private String checksumCrc32;

    @JacksonXmlProperty(localName = "ChecksumCRC32C")
    private String checksumCrc32c;

    @JacksonXmlProperty(localName = "ChecksumSHA1")
    private String checksumSha1;

    @JacksonXmlProperty(localName = "ChecksumSHA256")
    private String checksumSha256;

    /**
     * x-amz-version-id
     */
    @JsonIgnore
    private String versionId;

    /**
     * x-amz-server-side-encryption
     */
    @JsonIgnore
    private String serverSideEncryption;

    /**
     * x-amz-request-charged
     */
    @JsonIgnore
    private String requestCharged;

    /**
     * x-amz-expiration
     */
    @JsonIgnore
    private String expiration;
}
