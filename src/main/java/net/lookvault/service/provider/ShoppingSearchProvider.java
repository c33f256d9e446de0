package net.lookvault.service.provider;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.model.ProductRecord;
import net.lookvault.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Primary product provider backed by a realtime shopping-search scraper API.
 * <p>
 * Sends a parsed {@code google_shopping_search} query and reads the organic results at
 * {@code results[0].content.results.organic}. Listings without an image or a merchant
 * link are dropped because neither a render nor a purchase is possible for them.
 */
@Service
@Slf4j
public class ShoppingSearchProvider implements ProductSearchProvider {

    public static final String NAME = "shopping_search";
    private static final String DEFAULT_TITLE = "Fashion Item";
    private static final int MAX_BRAND_PREFIX_LENGTH = 30;

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final String username;
    private final String password;
    private final String geoLocation;
    private final String locale;

    public ShoppingSearchProvider(WebClient.Builder webClientBuilder,
                                  @Qualifier("shoppingSearchCircuitBreaker") CircuitBreaker circuitBreaker,
                                  @Qualifier("shoppingSearchRateLimiter") RateLimiter rateLimiter,
                                  @Value("${shopping.search.base-url:https://realtime.oxylabs.io}") String baseUrl,
                                  @Value("${shopping.search.username:}") String username,
                                  @Value("${shopping.search.password:}") String password,
                                  @Value("${shopping.search.geo-location:United States}") String geoLocation,
                                  @Value("${shopping.search.locale:en-us}") String locale) {
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.circuitBreaker = circuitBreaker;
        this.rateLimiter = rateLimiter;
        this.username = username;
        this.password = password;
        this.geoLocation = geoLocation;
        this.locale = locale;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public Mono<List<ProductRecord>> search(String term, int limit) {
        if (!StringUtils.hasText(username) || !StringUtils.hasText(password)) {
            ExternalApiLogger.logProviderDisabled(log, NAME, term);
            return Mono.just(List.of());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("source", "google_shopping_search");
        body.put("query", term);
        body.put("parse", true);
        body.put("geo_location", geoLocation);
        body.put("locale", locale);
        body.put("pages", 1);

        return webClient.post()
            .uri("/v1/queries")
            .headers(headers -> headers.setBasicAuth(username, password))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, NAME, "SHOPPING_SEARCH", term))
            .map(root -> parseOrganicResults(root, limit))
            .defaultIfEmpty(List.of())
            .doOnNext(results -> ExternalApiLogger.logApiCallSuccess(log, NAME, "SHOPPING_SEARCH", term, results.size()))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .onErrorMap(error -> ProviderErrors.toUpstreamException(NAME, error));
    }

    List<ProductRecord> parseOrganicResults(JsonNode root, int limit) {
        JsonNode organic = root.path("results").path(0).path("content").path("results").path("organic");
        if (!organic.isArray()) {
            return List.of();
        }
        List<ProductRecord> products = new ArrayList<>();
        for (JsonNode item : organic) {
            if (products.size() >= limit) {
                break;
            }
            String imageUrl = JsonFields.firstText(item.path("url_image"), item.path("thumbnail"));
            String merchantUrl = JsonFields.text(item.path("url"));
            if (imageUrl == null || merchantUrl == null) {
                continue;
            }
            String title = JsonFields.text(item.path("title"));
            String merchantName = JsonFields.firstText(item.path("merchant").path("name"), item.path("seller"));
            products.add(ProductRecord.builder()
                .sourceProvider(NAME)
                .sourceIdentifier(JsonFields.text(item.path("product_id")))
                .title(title != null ? title : DEFAULT_TITLE)
                .price(extractPrice(item))
                .currency(currencyOrDefault(JsonFields.text(item.path("currency"))))
                .imageUrl(imageUrl)
                .merchantUrl(merchantUrl)
                .brand(extractBrand(title, merchantName))
                .merchantName(merchantName)
                .build());
        }
        return products;
    }

    /**
     * Brand comes from a short {@code "Brand - Title"} or {@code "Brand | Title"} prefix,
     * then the merchant name, then the first two title words.
     */
    static String extractBrand(String title, String merchantName) {
        if (title != null) {
            for (String separator : new String[] {" - ", " | "}) {
                int index = title.indexOf(separator);
                if (index > 0 && index < MAX_BRAND_PREFIX_LENGTH) {
                    return title.substring(0, index).trim();
                }
            }
        }
        if (StringUtils.hasText(merchantName)) {
            return merchantName;
        }
        if (title == null) {
            return null;
        }
        String[] words = title.trim().split("\\s+");
        return words.length >= 2 ? words[0] + " " + words[1] : words[0];
    }

    private static BigDecimal extractPrice(JsonNode item) {
        BigDecimal price = JsonFields.price(item.path("price_str"));
        return price != null ? price : JsonFields.price(item.path("price"));
    }

    private static String currencyOrDefault(String currency) {
        return currency != null ? currency : "USD";
    }
}
