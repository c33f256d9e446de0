package net.lookvault.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.adapters.persistence.AssetLibraryRepository;
import net.lookvault.config.AssetCacheProperties;
import net.lookvault.model.AssetRecord;
import net.lookvault.model.ComplianceTags;
import net.lookvault.model.ProductRecord;
import net.lookvault.model.RenderOutcome;
import net.lookvault.model.RenderRequest;
import net.lookvault.model.UnifiedProduct;
import net.lookvault.service.AssetIndexingService.IndexingContext;
import net.lookvault.service.provider.CuratedFallbackCatalog;
import net.lookvault.service.render.TryOnRenderProvider;
import net.lookvault.util.CanonicalHasher;
import net.lookvault.util.ExternalApiLogger;
import net.lookvault.util.ProductSearchTerms;
import net.lookvault.util.SearchQueryUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Product asset cache in front of the paid product search and try-on upstreams.
 * <p>
 * Search tiers, in fixed priority order:
 * <ol>
 *   <li>asset library text lookup (free); enough hits end the search here</li>
 *   <li>every upstream provider, concurrently</li>
 *   <li>the curated fallback catalog when everything above came back empty</li>
 * </ol>
 * Renders are keyed by the hash of the product image URL; a stored render is always served
 * instead of paying for a new one. There is no single-flight guard: two concurrent misses
 * for the same image both render and the last upsert wins.
 */
@Service
@Slf4j
public class ProductAssetCacheService {

    static final String BRAND_FILTER_ALL = "all";
    static final String DEFAULT_RENDER_TITLE = "Marketplace Product";

    private final AssetLibraryRepository assetLibraryRepository;
    private final ProductSearchAggregator productSearchAggregator;
    private final AssetIndexingService assetIndexingService;
    private final CuratedFallbackCatalog curatedFallbackCatalog;
    private final AffiliateLinkService affiliateLinkService;
    private final TryOnRenderProvider tryOnRenderProvider;
    private final ComplianceTagger complianceTagger;
    private final AssetCacheProperties cacheProperties;
    private final ProductMergeDeduplicator deduplicator;
    private final Scheduler databaseScheduler;

    @Autowired
    public ProductAssetCacheService(AssetLibraryRepository assetLibraryRepository,
                                    ProductSearchAggregator productSearchAggregator,
                                    AssetIndexingService assetIndexingService,
                                    CuratedFallbackCatalog curatedFallbackCatalog,
                                    AffiliateLinkService affiliateLinkService,
                                    TryOnRenderProvider tryOnRenderProvider,
                                    ComplianceTagger complianceTagger,
                                    AssetCacheProperties cacheProperties) {
        this(assetLibraryRepository, productSearchAggregator, assetIndexingService, curatedFallbackCatalog,
            affiliateLinkService, tryOnRenderProvider, complianceTagger, cacheProperties, Schedulers.boundedElastic());
    }

    ProductAssetCacheService(AssetLibraryRepository assetLibraryRepository,
                             ProductSearchAggregator productSearchAggregator,
                             AssetIndexingService assetIndexingService,
                             CuratedFallbackCatalog curatedFallbackCatalog,
                             AffiliateLinkService affiliateLinkService,
                             TryOnRenderProvider tryOnRenderProvider,
                             ComplianceTagger complianceTagger,
                             AssetCacheProperties cacheProperties,
                             Scheduler databaseScheduler) {
        this.assetLibraryRepository = assetLibraryRepository;
        this.productSearchAggregator = productSearchAggregator;
        this.assetIndexingService = assetIndexingService;
        this.curatedFallbackCatalog = curatedFallbackCatalog;
        this.affiliateLinkService = affiliateLinkService;
        this.tryOnRenderProvider = tryOnRenderProvider;
        this.complianceTagger = complianceTagger;
        this.cacheProperties = cacheProperties;
        this.deduplicator = new ProductMergeDeduplicator(cacheProperties.getTitleMergeKeyLength());
        this.databaseScheduler = databaseScheduler;
    }

    /**
     * Searches products for a user.
     *
     * @param query free-text query; may be blank when a category is given
     * @param userId requesting user, used only for link attribution
     * @param category optional category filter
     * @param brand optional brand filter; blank or {@code "all"} disables it
     * @return link-rewritten listings; never empty unless the brand filter removed everything
     */
    public Mono<List<UnifiedProduct>> search(String query, String userId, String category, String brand) {
        String lookupQuery = SearchQueryUtils.hasText(query) ? query.trim() : null;
        String upstreamTerm = ProductSearchTerms.upstreamTerm(query, category);
        int threshold = cacheProperties.getSufficiencyThreshold();

        return Mono.fromCallable(() -> lookupCached(lookupQuery, category))
            .subscribeOn(databaseScheduler)
            .flatMap(cached -> {
                ExternalApiLogger.logTieredSearchStart(log, upstreamTerm, cached.size(), threshold);
                List<ProductRecord> cachedRecords = cached.stream().map(AssetRecord::toProductRecord).toList();
                if (cached.size() >= threshold) {
                    ExternalApiLogger.logTieredSearchComplete(log, upstreamTerm, cached.size(), 0, cachedRecords.size(), false);
                    return Mono.just(finish(cachedRecords, userId, category, brand));
                }
                return productSearchAggregator.searchAll(upstreamTerm)
                    .map(fresh -> mergeWithProviders(cachedRecords, fresh, upstreamTerm, userId, category, brand));
            });
    }

    /**
     * Serves a stored try-on render for the image, or pays for a new one and stores it.
     *
     * @param request render request; {@code sourceImageUrl} is required
     * @return cached or generated URLs, or a failed outcome carrying the source image as display fallback
     */
    public Mono<RenderOutcome> renderTryOn(RenderRequest request) {
        if (request == null || !SearchQueryUtils.hasText(request.getSourceImageUrl())) {
            return Mono.error(new IllegalArgumentException("sourceImageUrl is required"));
        }
        String sourceImageUrl = request.getSourceImageUrl().trim();
        String contentHash = CanonicalHasher.hashSourceImageUrl(sourceImageUrl);

        return Mono.fromCallable(() -> findExisting(contentHash))
            .subscribeOn(databaseScheduler)
            .flatMap(existing -> {
                if (existing.isPresent() && existing.get().hasRenders()) {
                    AssetRecord cached = existing.get();
                    log.info("Render cache HIT for {} ({} render(s))", abbreviate(contentHash), cached.getRenderedImageUrls().size());
                    return Mono.just(RenderOutcome.cached(contentHash, cached.getRenderedImageUrls(), cached.getPrimaryRenderedUrl()));
                }
                log.info("Render cache MISS for {}; dispatching try-on render", abbreviate(contentHash));
                return renderAndStore(request, sourceImageUrl, contentHash, existing.orElse(null));
            });
    }

    /**
     * Current trending listings, link-rewritten for the requesting user.
     */
    public Mono<List<UnifiedProduct>> trending(String userId, int limit) {
        return Mono.fromCallable(() -> assetLibraryRepository.fetchTrending(limit))
            .subscribeOn(databaseScheduler)
            .map(assets -> assets.stream()
                .map(asset -> toUnified(asset.toProductRecord(), userId, null))
                .toList());
    }

    private List<UnifiedProduct> mergeWithProviders(List<ProductRecord> cachedRecords,
                                                    List<ProductRecord> fresh,
                                                    String upstreamTerm,
                                                    String userId,
                                                    String category,
                                                    String brand) {
        List<ProductRecord> prioritized = new ArrayList<>(cachedRecords.size() + fresh.size());
        prioritized.addAll(cachedRecords);
        prioritized.addAll(fresh);
        List<ProductRecord> merged = deduplicator.deduplicate(prioritized);

        boolean fallbackUsed = merged.isEmpty();
        if (fallbackUsed) {
            log.warn("Library and all providers returned nothing for '{}'; serving curated fallback", upstreamTerm);
            merged = curatedFallbackCatalog.items();
        }

        assetIndexingService.indexAsync(fresh, IndexingContext.search(category));
        ExternalApiLogger.logTieredSearchComplete(log, upstreamTerm, cachedRecords.size(), fresh.size(), merged.size(), fallbackUsed);
        return finish(merged, userId, category, brand);
    }

    private List<UnifiedProduct> finish(List<ProductRecord> records, String userId, String category, String brand) {
        return records.stream()
            .filter(record -> matchesBrand(record, brand))
            .map(record -> toUnified(record, userId, category))
            .toList();
    }

    private Mono<RenderOutcome> renderAndStore(RenderRequest request, String sourceImageUrl, String contentHash, AssetRecord existing) {
        RenderOutcome failure = RenderOutcome.failed(contentHash, sourceImageUrl);
        return tryOnRenderProvider.render(sourceImageUrl, request.getModelReferenceUrl())
            .timeout(cacheProperties.getRenderTimeout())
            .filter(urls -> urls != null && !urls.isEmpty())
            .onErrorResume(error -> {
                log.warn("Try-on render failed for {}: {}", abbreviate(contentHash), error.toString());
                return Mono.empty();
            })
            .flatMap(urls -> {
                ComplianceTags compliance = complianceTagger.tag(contentHash);
                AssetRecord asset = buildRenderedAsset(request, sourceImageUrl, contentHash, existing, urls, compliance);
                return Mono.fromRunnable(() -> storeRender(asset))
                    .subscribeOn(databaseScheduler)
                    .thenReturn(RenderOutcome.generated(contentHash, urls));
            })
            .defaultIfEmpty(failure);
    }

    AssetRecord buildRenderedAsset(RenderRequest request,
                                   String sourceImageUrl,
                                   String contentHash,
                                   AssetRecord existing,
                                   List<String> renderedUrls,
                                   ComplianceTags compliance) {
        AssetRecord.AssetRecordBuilder builder = existing != null ? existing.toBuilder() : AssetRecord.builder();
        String title = firstText(request.getTitle(), existing != null ? existing.getTitle() : null, DEFAULT_RENDER_TITLE);
        String brand = firstText(request.getBrand(), existing != null ? existing.getBrand() : null, null);
        String category = firstText(request.getCategory(), existing != null ? existing.getCategory() : null, null);
        String trendKeyword = firstText(request.getTrendKeyword(), existing != null ? existing.getTrendKeyword() : null, null);
        boolean requestedTrending = Boolean.TRUE.equals(request.getTrending());
        boolean trending = request.getTrending() != null ? requestedTrending : existing != null && existing.isTrending();
        Instant trendRefreshedAt = requestedTrending ? Instant.now() : existing != null ? existing.getTrendRefreshedAt() : null;

        return builder
            .contentHash(contentHash)
            .sourceImageUrl(sourceImageUrl)
            .title(title)
            .brand(brand)
            .category(category)
            .price(request.getPrice() != null ? request.getPrice() : existing != null ? existing.getPrice() : null)
            .currency(firstText(request.getCurrency(), existing != null ? existing.getCurrency() : null, "USD"))
            .merchantUrl(firstText(request.getMerchantUrl(), existing != null ? existing.getMerchantUrl() : null, null))
            .renderedImageUrls(List.copyOf(renderedUrls))
            .primaryRenderedUrl(renderedUrls.get(0))
            .complianceFlags(compliance)
            .trending(trending)
            .trendKeyword(trendKeyword)
            .trendRefreshedAt(trendRefreshedAt)
            .searchTags(ProductSearchTerms.searchTags(brand, category, trendKeyword, title))
            .build();
    }

    private void storeRender(AssetRecord asset) {
        try {
            assetLibraryRepository.upsert(asset);
            log.info("Indexed render for {} ({} render(s))", abbreviate(asset.getContentHash()), asset.getRenderedImageUrls().size());
        } catch (DataAccessException ex) {
            log.error("Failed to persist render for {}; serving it uncached: {}", abbreviate(asset.getContentHash()), ex.getMessage(), ex);
        }
    }

    private List<AssetRecord> lookupCached(String query, String category) {
        try {
            return assetLibraryRepository.searchByText(query, category, cacheProperties.getTextLookupLimit());
        } catch (DataAccessException ex) {
            log.warn("Asset library lookup failed for query='{}', category='{}'; treating as empty: {}", query, category, ex.getMessage());
            return List.of();
        }
    }

    private Optional<AssetRecord> findExisting(String contentHash) {
        try {
            return assetLibraryRepository.fetchByHash(contentHash);
        } catch (DataAccessException ex) {
            log.warn("Asset library lookup failed for {}; treating as a miss: {}", abbreviate(contentHash), ex.getMessage());
            return Optional.empty();
        }
    }

    private UnifiedProduct toUnified(ProductRecord record, String userId, String requestedCategory) {
        String id = record.getAssetId() != null
            ? record.getAssetId().toString()
            : CanonicalHasher.hashSourceImageUrl(record.getImageUrl());
        String category = SearchQueryUtils.hasText(record.getCategory()) || record.isCuratedFallback()
            ? record.getCategory()
            : requestedCategory;
        return new UnifiedProduct(
            id,
            record.getTitle(),
            record.getPrice(),
            record.getCurrency(),
            record.getImageUrl(),
            affiliateLinkService.wrap(record.getMerchantUrl(), userId),
            record.getBrand(),
            category,
            record.getSourceIdentifier(),
            record.getSourceProvider(),
            record.getRenderedImageUrl()
        );
    }

    private static boolean matchesBrand(ProductRecord record, String brand) {
        if (!SearchQueryUtils.hasText(brand) || BRAND_FILTER_ALL.equals(brand.trim().toLowerCase(Locale.ROOT))) {
            return true;
        }
        return record.getBrand() != null && record.getBrand().trim().equalsIgnoreCase(brand.trim());
    }

    private static String firstText(String preferred, String fallback, String defaultValue) {
        if (SearchQueryUtils.hasText(preferred)) {
            return preferred.trim();
        }
        return SearchQueryUtils.hasText(fallback) ? fallback : defaultValue;
    }

    private static String abbreviate(String contentHash) {
        return contentHash.length() > 12 ? contentHash.substring(0, 12) + "…" : contentHash;
    }
}
