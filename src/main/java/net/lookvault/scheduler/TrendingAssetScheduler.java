package net.lookvault.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.adapters.persistence.AssetLibraryRepository;
import net.lookvault.config.AssetCacheProperties;
import net.lookvault.config.TrendRefreshProperties;
import net.lookvault.model.ProductRecord;
import net.lookvault.service.AssetIndexingService;
import net.lookvault.service.AssetIndexingService.IndexingContext;
import net.lookvault.service.AssetIndexingService.IndexingSummary;
import net.lookvault.service.ProductSearchAggregator;
import net.lookvault.util.ProductSearchTerms;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Keeps the trending feed populated from the primary provider.
 * <p>
 * Every run queries each seed keyword, indexes the listings as trending and then drops the
 * trending flag from rows the run (and recent runs) did not touch.
 */
@Component
@Slf4j
public class TrendingAssetScheduler {

    private static final Duration BLOCK_MARGIN = Duration.ofSeconds(5);

    private final TrendRefreshProperties trendProperties;
    private final AssetCacheProperties cacheProperties;
    private final ProductSearchAggregator productSearchAggregator;
    private final AssetIndexingService assetIndexingService;
    private final AssetLibraryRepository assetLibraryRepository;
    private final Clock clock;

    @Autowired
    public TrendingAssetScheduler(TrendRefreshProperties trendProperties,
                                  AssetCacheProperties cacheProperties,
                                  ProductSearchAggregator productSearchAggregator,
                                  AssetIndexingService assetIndexingService,
                                  AssetLibraryRepository assetLibraryRepository) {
        this(trendProperties, cacheProperties, productSearchAggregator, assetIndexingService, assetLibraryRepository,
            Clock.systemUTC());
    }

    TrendingAssetScheduler(TrendRefreshProperties trendProperties,
                           AssetCacheProperties cacheProperties,
                           ProductSearchAggregator productSearchAggregator,
                           AssetIndexingService assetIndexingService,
                           AssetLibraryRepository assetLibraryRepository,
                           Clock clock) {
        this.trendProperties = trendProperties;
        this.cacheProperties = cacheProperties;
        this.productSearchAggregator = productSearchAggregator;
        this.assetIndexingService = assetIndexingService;
        this.assetLibraryRepository = assetLibraryRepository;
        this.clock = clock;
    }

    @Scheduled(cron = "${lookvault.trends.cron:0 0 */6 * * *}")
    public void scheduledRefresh() {
        if (!trendProperties.isEnabled()) {
            log.debug("Trend refresh skipped: disabled via configuration.");
            return;
        }
        refreshTrends();
    }

    /**
     * Runs one refresh pass regardless of the enabled flag.
     *
     * @return number of listings persisted across all keywords
     */
    public int refreshTrends() {
        Instant start = clock.instant();
        List<String> keywords = trendProperties.getKeywords();
        log.info("Trend refresh started for {} keyword(s).", keywords.size());

        int persisted = 0;
        int failedKeywords = 0;
        for (String keyword : keywords) {
            if (!StringUtils.hasText(keyword)) {
                continue;
            }
            try {
                persisted += refreshKeyword(keyword.trim(), start);
            } catch (RuntimeException ex) {
                failedKeywords++;
                log.warn("Trend refresh failed for keyword '{}': {}", keyword, ex.getMessage());
            }
        }

        int cleared = clearStaleTrends(start);
        log.info("Trend refresh finished in {}ms (persisted={}, failedKeywords={}, clearedStale={}).",
            Duration.between(start, clock.instant()).toMillis(), persisted, failedKeywords, cleared);
        return persisted;
    }

    private int refreshKeyword(String keyword, Instant refreshedAt) {
        Duration wait = cacheProperties.getProviderTimeout().plus(BLOCK_MARGIN);
        List<ProductRecord> listings = productSearchAggregator
            .searchPrimary(ProductSearchTerms.trendingTerm(keyword), trendProperties.getItemsPerKeyword())
            .block(wait);
        if (listings == null || listings.isEmpty()) {
            log.debug("No listings returned for trend keyword '{}'.", keyword);
            return 0;
        }
        IndexingSummary summary = assetIndexingService.indexNow(listings, IndexingContext.trend(keyword, refreshedAt));
        return summary.persisted();
    }

    private int clearStaleTrends(Instant runStartedAt) {
        Instant cutoff = runStartedAt.minus(trendProperties.getStaleAfter());
        try {
            return assetLibraryRepository.clearTrendingBefore(cutoff);
        } catch (DataAccessException ex) {
            log.warn("Failed to clear stale trending flags older than {}: {}", cutoff, ex.getMessage());
            return 0;
        }
    }
}
