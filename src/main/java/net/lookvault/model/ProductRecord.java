package net.lookvault.model;

import java.math.BigDecimal;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Provider-neutral product listing produced by every upstream provider after normalization.
 * Optional fields are {@code null} when the upstream did not supply them.
 */
@Value
@Builder(toBuilder = true)
public class ProductRecord {

    public static final String ASSET_LIBRARY_SOURCE = "asset_library";
    public static final String CURATED_FALLBACK_SOURCE = "curated_fallback";

    String sourceProvider;
    String sourceIdentifier;
    String title;
    BigDecimal price;
    String currency;
    String imageUrl;
    String merchantUrl;
    String brand;
    String merchantName;
    String category;

    // Set only for rows served from the asset library
    UUID assetId;
    String renderedImageUrl;
    String originProvider;

    public boolean isFromAssetLibrary() {
        return ASSET_LIBRARY_SOURCE.equals(sourceProvider);
    }

    public boolean isCuratedFallback() {
        return CURATED_FALLBACK_SOURCE.equals(sourceProvider);
    }

    /**
     * Provider whose offer id {@link #getSourceIdentifier()} belongs to.
     * Library rows keep the provider that originally listed them.
     */
    public String offerNamespace() {
        return originProvider != null ? originProvider : sourceProvider;
    }
}
