package net.lookvault.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * A product listing in the asset library, optionally carrying its try-on renders.
 * <p>
 * Maps one-to-one onto the {@code asset_library} table. {@code contentHash} is the hash of the
 * source image URL and is unique; {@code merchantUrl} always holds the raw merchant link.
 */
@Value
@Builder(toBuilder = true)
public class AssetRecord {
    UUID id;
    String contentHash;

    // Listing provenance
    String sourceIdentifier;    // provider's native offer id, when it has one
    String sourceProvider;

    // Descriptive fields
    String title;
    String brand;
    String category;
    String merchantName;
    BigDecimal price;
    String currency;
    String sourceImageUrl;
    String merchantUrl;

    // Render output
    @Builder.Default
    List<String> renderedImageUrls = List.of();
    String primaryRenderedUrl;
    @Builder.Default
    ComplianceTags complianceFlags = ComplianceTags.none();

    // Trend feed
    boolean trending;
    String trendKeyword;
    Instant trendRefreshedAt;

    @Builder.Default
    List<String> searchTags = List.of();

    Instant createdAt;
    Instant updatedAt;

    public boolean hasRenders() {
        return renderedImageUrls != null && !renderedImageUrls.isEmpty();
    }

    /**
     * Exposes the stored listing in the shape the search merge works with.
     */
    public ProductRecord toProductRecord() {
        return ProductRecord.builder()
            .assetId(id)
            .sourceProvider(ProductRecord.ASSET_LIBRARY_SOURCE)
            .sourceIdentifier(sourceIdentifier)
            .title(title)
            .price(price)
            .currency(currency)
            .imageUrl(sourceImageUrl)
            .merchantUrl(merchantUrl)
            .brand(brand)
            .merchantName(merchantName)
            .category(category)
            .renderedImageUrl(primaryRenderedUrl)
            .originProvider(sourceProvider)
            .build();
    }
}
