package win.ixuni.s3wire.core.request;

import lombok.Builder;
import lombok.Value;
import win.ixuni.s3wire.core.util.S3UriEncoder;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound HTTP request ready for any transport
 * <p>
 * Path is already percent-encoded; query values are raw and encoded by
 * {@link #getQueryString()}. Endpoint and region stay null until an
 * endpoint interceptor decorates the request.
 */
@Value
public class RequestDescriptor {

    String method;

    /**
     * 已编码的请求路径，如 /bucket/dir/file.txt
     */
    String path;

    Map<String, String> query;

    Map<String, String> headers;

    byte[] body;

    /**
     * Base endpoint, e.g. https://s3.us-east-1.amazonaws.com
     */
    String endpoint;

    String region;

    @Builder(toBuilder = true)
    private RequestDescriptor(String method, String path, Map<String, String> query,
                              Map<String, String> headers, byte[] body, String endpoint, String region) {
        this.method = method;
        this.path = path;
        this.query = query == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.headers = headers == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? new byte[0] : body.clone();
        this.endpoint = endpoint;
        this.region = region;
    }

    /**
     * Copy of the body bytes
     */
    public byte[] getBody() {
        return body.clone();
    }

    public int getContentLength() {
        return body.length;
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    public String getQueryString() {
        return S3UriEncoder.buildQueryString(query);
    }

    /**
     * Path plus encoded query string
     */
    public String getPathAndQuery() {
        String queryString = getQueryString();
        return queryString.isEmpty() ? path : path + "?" + queryString;
    }

    /**
     * Absolute URI of the request
     *
     * @throws IllegalStateException if no endpoint has been resolved
     */
    public URI toUri() {
        if (endpoint == null) {
            throw new IllegalStateException("Endpoint has not been resolved for " + method + " " + path);
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return URI.create(base + getPathAndQuery());
    }
}
