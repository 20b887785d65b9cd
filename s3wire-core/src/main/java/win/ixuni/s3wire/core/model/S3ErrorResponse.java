package win.ixuni.s3wire.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * S3 error document
 *
 * <pre>
 * &lt;Error&gt;
 *     &lt;Code&gt;InvalidPart&lt;/Code&gt;
 *     &lt;Message&gt;One or more of the specified parts could not be found.&lt;/Message&gt;
 *     &lt;Resource&gt;/mybucket/mykey&lt;/Resource&gt;
 *     &lt;RequestId&gt;xxx&lt;/RequestId&gt;
 * &lt;/Error&gt;
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "Error")
public class S3ErrorResponse {

    @JacksonXmlProperty(localName = "Code")
    private String code;

    @JacksonXmlProperty(localName = "Message")
    private String message;

    @JacksonXmlProperty(localName = "Resource")
    private String resource;

    @JacksonXmlProperty(localName = "RequestId")
    private String requestId;
}
