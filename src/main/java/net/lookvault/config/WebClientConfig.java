/**
 * Configuration for WebClient
 * - Defines the builders used by every upstream client
 * - Sets up default timeouts and connection settings
 */
package net.lookvault.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configures the application's WebClient instances
 * - Product providers share a short-timeout builder
 * - The try-on render client gets its own builder sized for multi-minute predictions
 */
@Configuration
public class WebClientConfig {

    private static final String DEFAULT_USER_AGENT = "LookVault/1.0 (+https://lookvault.net)";

    /**
     * Creates the default WebClient Builder bean
     * - Sets connection timeout to 5000ms
     * - Sets read and write timeouts to 10 seconds
     * - Sets response timeout to 10 seconds
     *
     * @return A WebClient Builder instance
     */
    @Bean
    @Primary
    public WebClient.Builder webClientBuilder() {
        return builderFor(Duration.ofSeconds(10));
    }

    /**
     * Builder for the try-on render upstream, whose predictions routinely run for tens of seconds.
     * The orchestrator still applies its own finite render timeout on top of this.
     *
     * @param cacheProperties supplies the render timeout
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder renderWebClientBuilder(AssetCacheProperties cacheProperties) {
        return builderFor(cacheProperties.getRenderTimeout().plusSeconds(15));
    }

    private WebClient.Builder builderFor(Duration responseTimeout) {
        long timeoutSeconds = Math.max(1, responseTimeout.getSeconds());
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            )
            .responseTimeout(responseTimeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, DEFAULT_USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
