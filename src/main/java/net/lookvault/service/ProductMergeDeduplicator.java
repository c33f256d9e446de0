package net.lookvault.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.lookvault.model.ProductRecord;
import net.lookvault.util.CanonicalHasher;
import net.lookvault.util.SearchQueryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses listings that several tiers returned for the same product.
 *
 * <p>Input must already be in priority order (library, then providers by priority); the
 * first occurrence of each merge key wins. The key is the provider-scoped offer id when
 * there is one, otherwise the leading characters of the normalized title.</p>
 */
final class ProductMergeDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(ProductMergeDeduplicator.class);

    private final int titleKeyLength;

    ProductMergeDeduplicator(int titleKeyLength) {
        this.titleKeyLength = titleKeyLength;
    }

    List<ProductRecord> deduplicate(List<ProductRecord> prioritized) {
        if (prioritized == null || prioritized.isEmpty()) {
            return List.of();
        }
        Map<String, ProductRecord> byKey = new LinkedHashMap<>();
        for (ProductRecord record : prioritized) {
            if (record == null) {
                continue;
            }
            ProductRecord existing = byKey.putIfAbsent(mergeKey(record), record);
            if (existing != null && log.isDebugEnabled()) {
                log.debug("Dropped {} listing '{}' already served by {}", record.getSourceProvider(),
                    record.getTitle(), existing.getSourceProvider());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    String mergeKey(ProductRecord record) {
        if (SearchQueryUtils.hasText(record.getSourceIdentifier())) {
            return "offer:" + record.offerNamespace() + ":" + record.getSourceIdentifier().trim();
        }
        String normalizedTitle = SearchQueryUtils.normalizeTitle(record.getTitle());
        if (!normalizedTitle.isEmpty()) {
            return "title:" + normalizedTitle.substring(0, Math.min(titleKeyLength, normalizedTitle.length()));
        }
        // Untitled listings are only ever duplicates of the same image
        return "image:" + CanonicalHasher.hashSourceImageUrl(record.getImageUrl());
    }
}
