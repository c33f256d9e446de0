package net.lookvault.controller;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.controller.dto.ProductListResponse;
import net.lookvault.controller.dto.ProductSearchRequest;
import net.lookvault.controller.dto.RenderTryOnRequest;
import net.lookvault.controller.dto.RenderTryOnResponse;
import net.lookvault.controller.support.ErrorResponseUtils;
import net.lookvault.model.RenderOutcome;
import net.lookvault.service.ProductAssetCacheService;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Product search, try-on render and trending endpoints backed by the asset cache.
 */
@RestController
@RequestMapping("/api/products")
@Slf4j
public class ProductAssetController {

    static final int DEFAULT_TRENDING_LIMIT = 12;
    static final int MAX_TRENDING_LIMIT = 50;
    private static final Set<String> RENDERABLE_SCHEMES = Set.of("http", "https", "gs");

    private final ProductAssetCacheService productAssetCacheService;

    public ProductAssetController(ProductAssetCacheService productAssetCacheService) {
        this.productAssetCacheService = productAssetCacheService;
    }

    @PostMapping("/search")
    public Mono<ResponseEntity<Object>> search(@RequestBody ProductSearchRequest request) {
        if (request == null || (!StringUtils.hasText(request.query()) && !StringUtils.hasText(request.category()))) {
            return Mono.just(ErrorResponseUtils.badRequest("query or category is required"));
        }
        return productAssetCacheService.search(request.query(), request.userId(), request.category(), request.brand())
            .map(items -> ResponseEntity.<Object>ok(new ProductListResponse(items)))
            .onErrorResume(ex -> {
                log.error("Product search failed for query '{}', category '{}': {}",
                    request.query(), request.category(), ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.internalServerError("Product search failed"));
            });
    }

    /**
     * Serves a cached try-on render or generates one. Failures answer 422 with the source image to show instead.
     */
    @PostMapping("/render")
    public Mono<ResponseEntity<Object>> render(@RequestBody RenderTryOnRequest request) {
        if (request == null || !isRenderableUrl(request.sourceImageUrl())) {
            return Mono.just(ErrorResponseUtils.badRequest("source_image_url must be an http(s) or gs:// URL"));
        }
        return productAssetCacheService.renderTryOn(request.toRenderRequest())
            .map(ProductAssetController::toRenderResponse)
            .onErrorResume(ex -> {
                log.error("Try-on render request failed for '{}': {}", request.sourceImageUrl(), ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.internalServerError("Render request failed"));
            });
    }

    @GetMapping("/trending")
    public Mono<ResponseEntity<Object>> trending(@RequestParam(name = "user_id", required = false) String userId,
                                                 @RequestParam(name = "limit", defaultValue = "12") int limit) {
        int safeLimit = limit <= 0 ? DEFAULT_TRENDING_LIMIT : Math.min(limit, MAX_TRENDING_LIMIT);
        return productAssetCacheService.trending(userId, safeLimit)
            .map(items -> ResponseEntity.<Object>ok(new ProductListResponse(items)))
            .onErrorResume(ex -> {
                log.error("Failed to load trending products: {}", ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.internalServerError("Trending lookup failed"));
            });
    }

    private static ResponseEntity<Object> toRenderResponse(RenderOutcome outcome) {
        if (outcome.succeeded()) {
            return ResponseEntity.ok(RenderTryOnResponse.from(outcome));
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("fallback_image", outcome.fallbackImage());
        extra.put("content_hash", outcome.contentHash());
        return ErrorResponseUtils.unprocessable("Try-on render failed", extra);
    }

    static boolean isRenderableUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return false;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                && RENDERABLE_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))
                && StringUtils.hasText(uri.getAuthority());
        } catch (IllegalArgumentException ex) {
            log.debug("Rejecting malformed source image URL '{}': {}", url, ex.getMessage());
            return false;
        }
    }
}
