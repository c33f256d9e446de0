package net.lookvault.service.provider;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import net.lookvault.exception.UpstreamProviderException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import tools.jackson.core.JacksonException;

/**
 * Maps transport and resilience failures onto {@link UpstreamProviderException}.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static UpstreamProviderException toUpstreamException(String providerName, Throwable error) {
        if (error instanceof UpstreamProviderException upstream) {
            return upstream;
        }
        if (error instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            boolean retryable = status == 429 || wcre.getStatusCode().is5xxServerError();
            return new UpstreamProviderException(providerName,
                providerName + " responded with HTTP " + status, retryable, wcre);
        }
        if (error instanceof WebClientRequestException wcre) {
            return new UpstreamProviderException(providerName,
                providerName + " request failed: " + wcre.getMessage(), true, wcre);
        }
        if (error instanceof CallNotPermittedException) {
            return new UpstreamProviderException(providerName, providerName + " circuit breaker is open", true, error);
        }
        if (error instanceof RequestNotPermitted) {
            return new UpstreamProviderException(providerName, providerName + " rate limit exceeded", true, error);
        }
        if (error instanceof JacksonException) {
            return new UpstreamProviderException(providerName, providerName + " returned a malformed payload", false, error);
        }
        return new UpstreamProviderException(providerName,
            providerName + " call failed: " + error.getMessage(), false, error);
    }
}
