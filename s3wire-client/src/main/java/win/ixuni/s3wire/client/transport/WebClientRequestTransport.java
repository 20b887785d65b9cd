package win.ixuni.s3wire.client.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import win.ixuni.s3wire.core.request.RequestDescriptor;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spring WebFlux based transport
 * <p>
 * The URI is passed as a {@link URI} so WebClient does not encode the path a second time.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientRequestTransport implements RequestTransport {

    private final WebClient webClient;

    @Override
    public Mono<TransportResponse> send(RequestDescriptor request) {
        URI uri = request.toUri();
        log.debug("Sending {} {}", request.getMethod(), uri);

        WebClient.RequestBodySpec spec = webClient.method(HttpMethod.valueOf(request.getMethod()))
                .uri(uri)
                .headers(headers -> request.getHeaders().forEach(headers::set));

        WebClient.RequestHeadersSpec<?> ready = request.hasBody()
                ? spec.bodyValue(request.getBody())
                : spec;

        return ready.exchangeToMono(response -> response.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> TransportResponse.builder()
                        .statusCode(response.statusCode().value())
                        .headers(flatten(response.headers().asHttpHeaders()))
                        .body(body)
                        .build()))
                .doOnNext(response -> log.debug("Received {} for {} {}",
                        response.getStatusCode(), request.getMethod(), uri));
    }

    private static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                result.put(name, String.join(",", values));
            }
        });
        return result;
    }
}
