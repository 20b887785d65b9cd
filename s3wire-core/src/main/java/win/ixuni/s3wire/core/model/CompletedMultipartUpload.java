package win.ixuni.s3wire.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Completed multipart upload document
 * <p>
 * Parts keep the order they were added in; the service validates that order,
 * so they are never sorted by part number.
 *
 * <pre>
 * &lt;CompleteMultipartUpload xmlns="http://s3.amazonaws.com/doc/2006-03-01/"&gt;
 *     &lt;Part&gt;
 *         &lt;PartNumber&gt;1&lt;/PartNumber&gt;
 *         &lt;ETag&gt;"etag1"&lt;/ETag&gt;
 *     &lt;/Part&gt;
 * &lt;/CompleteMultipartUpload&gt;
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class CompletedMultipartUpload {

    /**
     * List of uploaded parts
     */
    @Singular
    List<CompletedPart> parts;

    public static CompletedMultipartUpload of(List<CompletedPart> parts) {
        return CompletedMultipartUpload.builder().parts(parts).build();
    }
}
