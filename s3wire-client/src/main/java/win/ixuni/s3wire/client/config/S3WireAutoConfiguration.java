package win.ixuni.s3wire.client.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;
import win.ixuni.s3wire.client.MultipartUploadClient;
import win.ixuni.s3wire.client.transport.RequestTransport;
import win.ixuni.s3wire.client.transport.WebClientRequestTransport;
import win.ixuni.s3wire.core.S3RequestFactory;
import win.ixuni.s3wire.core.config.S3WireProperties;

/**
 * S3Wire auto-configuration
 * <p>
 * Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(S3WireProperties.class)
public class S3WireAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public S3RequestFactory s3RequestFactory(S3WireProperties properties) {
        return new S3RequestFactory(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public WebClient s3WireWebClient() {
        return WebClient.builder().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestTransport requestTransport(WebClient s3WireWebClient) {
        return new WebClientRequestTransport(s3WireWebClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public MultipartUploadClient multipartUploadClient(S3RequestFactory s3RequestFactory,
                                                       RequestTransport requestTransport) {
        return new MultipartUploadClient(s3RequestFactory, requestTransport);
    }
}
