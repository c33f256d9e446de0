package net.lookvault.service.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.exception.UpstreamProviderException;
import net.lookvault.model.ProductRecord;
import net.lookvault.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Secondary product provider backed by a marketplace Browse API.
 * <p>
 * Authenticates with an application (client-credentials) token that is cached in memory
 * until shortly before the {@code expires_in} the upstream reported, then searches item summaries.
 */
@Service
@Slf4j
public class MarketplaceBrowseProvider implements ProductSearchProvider {

    public static final String NAME = "marketplace_browse";
    static final String OAUTH_SCOPE = "https://api.ebay.com/oauth/api_scope";
    private static final String TOKEN_CACHE_KEY = "application";
    private static final Duration TOKEN_SAFETY_MARGIN = Duration.ofMinutes(5);
    private static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(2);

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final String clientId;
    private final String clientSecret;
    private final String marketplaceId;
    private final Cache<String, ApplicationToken> tokenCache;

    @Autowired
    public MarketplaceBrowseProvider(WebClient.Builder webClientBuilder,
                                     @Qualifier("marketplaceBrowseCircuitBreaker") CircuitBreaker circuitBreaker,
                                     @Qualifier("marketplaceBrowseRateLimiter") RateLimiter rateLimiter,
                                     @Value("${marketplace.browse.base-url:https://api.ebay.com}") String baseUrl,
                                     @Value("${marketplace.browse.client-id:}") String clientId,
                                     @Value("${marketplace.browse.client-secret:}") String clientSecret,
                                     @Value("${marketplace.browse.marketplace-id:EBAY_US}") String marketplaceId) {
        this(webClientBuilder, circuitBreaker, rateLimiter, baseUrl, clientId, clientSecret, marketplaceId, Ticker.systemTicker());
    }

    MarketplaceBrowseProvider(WebClient.Builder webClientBuilder,
                              CircuitBreaker circuitBreaker,
                              RateLimiter rateLimiter,
                              String baseUrl,
                              String clientId,
                              String clientSecret,
                              String marketplaceId,
                              Ticker ticker) {
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.marketplaceId = marketplaceId;
        this.tokenCache = Caffeine.newBuilder()
            .maximumSize(1)
            .expireAfter(new TokenExpiry())
            .ticker(ticker)
            .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public Mono<List<ProductRecord>> search(String term, int limit) {
        if (!StringUtils.hasText(clientId) || !StringUtils.hasText(clientSecret)) {
            ExternalApiLogger.logProviderDisabled(log, NAME, term);
            return Mono.just(List.of());
        }

        return accessToken()
            .flatMap(token -> webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/buy/browse/v1/item_summary/search")
                    .queryParam("q", term)
                    .queryParam("limit", limit)
                    .build())
                .headers(headers -> {
                    headers.setBearerAuth(token);
                    headers.set("X-EBAY-C-MARKETPLACE-ID", marketplaceId);
                })
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class))
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, NAME, "ITEM_SUMMARY_SEARCH", term))
            .map(root -> parseItemSummaries(root, limit))
            .defaultIfEmpty(List.of())
            .doOnNext(results -> ExternalApiLogger.logApiCallSuccess(log, NAME, "ITEM_SUMMARY_SEARCH", term, results.size()))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .onErrorMap(error -> ProviderErrors.toUpstreamException(NAME, error));
    }

    Mono<String> accessToken() {
        return Mono.defer(() -> {
            ApplicationToken cached = tokenCache.getIfPresent(TOKEN_CACHE_KEY);
            if (cached != null) {
                return Mono.just(cached.value());
            }
            return webClient.post()
                .uri("/identity/v1/oauth2/token")
                .headers(headers -> headers.setBasicAuth(clientId, clientSecret))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials").with("scope", OAUTH_SCOPE))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::cacheToken);
        });
    }

    private String cacheToken(JsonNode response) {
        String token = JsonFields.text(response.path("access_token"));
        if (token == null) {
            throw new UpstreamProviderException(NAME, NAME + " token response carried no access_token", false);
        }
        JsonNode expiresIn = response.path("expires_in");
        Duration lifetime = cacheLifetime(expiresIn.isNumber() ? Duration.ofSeconds(expiresIn.longValue()) : null);
        tokenCache.put(TOKEN_CACHE_KEY, new ApplicationToken(token, lifetime));
        log.debug("Cached {} application token for {}s", NAME, lifetime.toSeconds());
        return token;
    }

    /**
     * Time to keep a token: its reported lifetime minus a safety margin, or half of it for tokens too short for the margin.
     */
    static Duration cacheLifetime(Duration expiresIn) {
        if (expiresIn == null || expiresIn.isNegative() || expiresIn.isZero()) {
            return DEFAULT_TOKEN_TTL.minus(TOKEN_SAFETY_MARGIN);
        }
        if (expiresIn.compareTo(TOKEN_SAFETY_MARGIN.multipliedBy(2)) > 0) {
            return expiresIn.minus(TOKEN_SAFETY_MARGIN);
        }
        return expiresIn.dividedBy(2);
    }

    private record ApplicationToken(String value, Duration lifetime) {
    }

    private static final class TokenExpiry implements Expiry<String, ApplicationToken> {

        @Override
        public long expireAfterCreate(String key, ApplicationToken token, long currentTime) {
            return token.lifetime().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, ApplicationToken token, long currentTime, long currentDuration) {
            return token.lifetime().toNanos();
        }

        @Override
        public long expireAfterRead(String key, ApplicationToken token, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    List<ProductRecord> parseItemSummaries(JsonNode root, int limit) {
        JsonNode summaries = root.path("itemSummaries");
        if (!summaries.isArray()) {
            return List.of();
        }
        List<ProductRecord> products = new ArrayList<>();
        for (JsonNode item : summaries) {
            if (products.size() >= limit) {
                break;
            }
            String imageUrl = JsonFields.firstText(item.path("image").path("imageUrl"),
                item.path("thumbnailImages").path(0).path("imageUrl"));
            String merchantUrl = JsonFields.text(item.path("itemWebUrl"));
            if (imageUrl == null || merchantUrl == null) {
                continue;
            }
            String currency = JsonFields.text(item.path("price").path("currency"));
            products.add(ProductRecord.builder()
                .sourceProvider(NAME)
                .sourceIdentifier(JsonFields.text(item.path("itemId")))
                .title(JsonFields.text(item.path("title")))
                .price(JsonFields.price(item.path("price").path("value")))
                .currency(currency != null ? currency : "USD")
                .imageUrl(imageUrl)
                .merchantUrl(merchantUrl)
                .brand(JsonFields.text(item.path("brand")))
                .merchantName(JsonFields.text(item.path("seller").path("username")))
                .build());
        }
        return products;
    }
}
