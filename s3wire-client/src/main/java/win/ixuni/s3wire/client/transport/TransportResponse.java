package win.ixuni.s3wire.client.transport;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw HTTP response returned by a transport
 * <p>
 * Header lookup is case-insensitive.
 */
@Value
public class TransportResponse {

    int statusCode;

    Map<String, String> headers;

    byte[] body;

    @Builder
    private TransportResponse(int statusCode, Map<String, String> headers, byte[] body) {
        this.statusCode = statusCode;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }
}
