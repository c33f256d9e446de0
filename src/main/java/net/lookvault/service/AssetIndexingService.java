package net.lookvault.service;

import java.time.Instant;
import java.util.List;
import net.lookvault.adapters.persistence.AssetLibraryRepository;
import net.lookvault.model.AssetRecord;
import net.lookvault.model.ProductRecord;
import net.lookvault.util.CanonicalHasher;
import net.lookvault.util.ExternalApiLogger;
import net.lookvault.util.ProductSearchTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Writes freshly fetched provider listings into the asset library.
 * <p>
 * Listings are keyed by the hash of their image URL and stored without renders, so they
 * serve future text lookups immediately and become render-cache candidates later.
 * Indexing is best-effort: failures are logged per listing and never reach the caller.
 */
@Service
public class AssetIndexingService {

    private static final Logger logger = LoggerFactory.getLogger(AssetIndexingService.class);

    private final AssetLibraryRepository assetLibraryRepository;
    private final Scheduler indexingScheduler;

    @Autowired
    public AssetIndexingService(AssetLibraryRepository assetLibraryRepository) {
        this(assetLibraryRepository, Schedulers.boundedElastic());
    }

    AssetIndexingService(AssetLibraryRepository assetLibraryRepository, Scheduler indexingScheduler) {
        this.assetLibraryRepository = assetLibraryRepository;
        this.indexingScheduler = indexingScheduler;
    }

    /**
     * Why a batch of listings is being indexed, and the trend attributes to stamp on it.
     *
     * @param label log context, e.g. {@code SEARCH} or {@code TRENDS}
     * @param category category to apply when a listing has none
     * @param trendKeyword set only for trend refreshes
     * @param trendRefreshedAt set only for trend refreshes
     */
    public record IndexingContext(String label, String category, String trendKeyword, Instant trendRefreshedAt) {

        public static IndexingContext search(String category) {
            return new IndexingContext("SEARCH", category, null, null);
        }

        public static IndexingContext trend(String trendKeyword, Instant refreshedAt) {
            return new IndexingContext("TRENDS", null, trendKeyword, refreshedAt);
        }

        boolean trending() {
            return trendKeyword != null;
        }
    }

    /**
     * Result of one indexing batch.
     */
    public record IndexingSummary(int persisted, int skipped, int failed) {
    }

    /**
     * Schedules indexing without waiting for it; the returned value is not tied to the caller's response.
     */
    public void indexAsync(List<ProductRecord> records, IndexingContext context) {
        if (records == null || records.isEmpty()) {
            logger.debug("[EXTERNAL-API] [{}] indexAsync called with no listings", context.label());
            return;
        }
        List<ProductRecord> snapshot = List.copyOf(records);
        Mono.fromCallable(() -> indexNow(snapshot, context))
            .subscribeOn(indexingScheduler)
            .subscribe(
                summary -> logger.debug("[EXTERNAL-API] [{}] Background indexing finished: {}", context.label(), summary),
                error -> logger.error("[EXTERNAL-API] [{}] Background indexing failed: {}", context.label(), error.getMessage(), error)
            );
    }

    /**
     * Indexes listings one at a time on the calling thread.
     *
     * @throws IllegalStateException when the database is unreachable; the rest of the batch is abandoned
     */
    public IndexingSummary indexNow(List<ProductRecord> records, IndexingContext context) {
        ExternalApiLogger.logIndexingStart(logger, context.label(), records.size());
        int persisted = 0;
        int skipped = 0;
        int failed = 0;

        for (ProductRecord record : records) {
            if (!isIndexable(record)) {
                skipped++;
                continue;
            }
            AssetRecord asset = toListingAsset(record, context);
            try {
                assetLibraryRepository.upsertListing(asset);
                persisted++;
            } catch (DataAccessException ex) {
                failed++;
                ExternalApiLogger.logIndexingFailure(logger, context.label(), asset.getContentHash(), ex.getMessage());
                if (isSystemicDatabaseError(ex)) {
                    logger.error("[EXTERNAL-API] [{}] Aborting indexing batch due to systemic database error ({} persisted, {} failed before abort)",
                        context.label(), persisted, failed);
                    throw new IllegalStateException("Systemic database error during asset indexing", ex);
                }
            }
        }

        ExternalApiLogger.logIndexingComplete(logger, context.label(), persisted, failed);
        return new IndexingSummary(persisted, skipped, failed);
    }

    AssetRecord toListingAsset(ProductRecord record, IndexingContext context) {
        String category = StringUtils.hasText(record.getCategory()) ? record.getCategory() : context.category();
        return AssetRecord.builder()
            .contentHash(CanonicalHasher.hashSourceImageUrl(record.getImageUrl()))
            .sourceIdentifier(record.getSourceIdentifier())
            .sourceProvider(record.getSourceProvider())
            .title(record.getTitle())
            .brand(record.getBrand())
            .category(category)
            .merchantName(record.getMerchantName())
            .price(record.getPrice())
            .currency(record.getCurrency())
            .sourceImageUrl(record.getImageUrl().trim())
            .merchantUrl(record.getMerchantUrl())
            .renderedImageUrls(List.of())
            .trending(context.trending())
            .trendKeyword(context.trendKeyword())
            .trendRefreshedAt(context.trendRefreshedAt())
            .searchTags(ProductSearchTerms.searchTags(record.getBrand(), category, context.trendKeyword(), record.getTitle()))
            .build();
    }

    private static boolean isIndexable(ProductRecord record) {
        return record != null
            && !record.isCuratedFallback()
            && !record.isFromAssetLibrary()
            && StringUtils.hasText(record.getImageUrl());
    }

    private static boolean isSystemicDatabaseError(DataAccessException ex) {
        return ex instanceof DataAccessResourceFailureException;
    }
}
