package net.lookvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

/**
 * Product card returned to callers of the search endpoints.
 *
 * @param id asset id for library rows, otherwise a provider-scoped listing id
 * @param affiliateUrl merchant link rewritten for the requesting user at read time
 * @param merchantOfferId provider's native offer id, when present
 * @param source which tier produced the listing
 * @param renderedImageUrl primary try-on render, when the asset has one
 */
public record UnifiedProduct(
    String id,
    String title,
    BigDecimal price,
    String currency,

    @JsonProperty("image_url")
    String imageUrl,

    @JsonProperty("affiliate_url")
    String affiliateUrl,

    String brand,
    String category,

    @JsonProperty("merchant_offer_id")
    String merchantOfferId,

    String source,

    @JsonProperty("rendered_image_url")
    String renderedImageUrl
) {
}
