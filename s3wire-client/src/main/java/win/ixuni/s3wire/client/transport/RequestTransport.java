package win.ixuni.s3wire.client.transport;

import reactor.core.publisher.Mono;
import win.ixuni.s3wire.core.request.RequestDescriptor;

/**
 * Sends built requests over HTTP
 * <p>
 * Implementations own connection handling and any retry policy; the request
 * itself is never rebuilt.
 */
public interface RequestTransport {

    /**
     * Send a request
     *
     * @param request request with a resolved endpoint
     * @return the response, whatever its status
     */
    Mono<TransportResponse> send(RequestDescriptor request);
}
