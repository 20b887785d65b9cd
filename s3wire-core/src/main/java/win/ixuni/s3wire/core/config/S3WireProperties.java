package win.ixuni.s3wire.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.s3wire.core.model.RequestPayer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * S3Wire main configuration
 */
@Data
@ConfigurationProperties(prefix = "s3wire")
public class S3WireProperties {

    /**
     * Default region, used when an operation carries no region override
     */
    private String region = "us-east-1";

    /**
     * Service endpoint, e.g. "http://localhost:9000" for MinIO
     * <p>
     * If not set, resolved as https://s3.{region}.amazonaws.com
     */
    private String endpoint;

    /**
     * Accepted x-amz-request-payer values, defaults to every {@link RequestPayer}
     */
    private List<String> requestPayers = Arrays.stream(RequestPayer.values())
            .map(RequestPayer::getValue)
            .collect(Collectors.toCollection(ArrayList::new));
}
