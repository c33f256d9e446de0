package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import net.lookvault.model.RenderRequest;

/**
 * Body of {@code POST /api/products/render}. Only {@code source_image_url} is required.
 */
public record RenderTryOnRequest(
    @JsonProperty("source_image_url")
    String sourceImageUrl,

    @JsonProperty("model_reference_url")
    String modelReferenceUrl,

    @JsonProperty("merchant_url")
    String merchantUrl,

    String title,
    String brand,
    BigDecimal price,
    String currency,
    String category,

    @JsonProperty("trend_keyword")
    String trendKeyword,

    @JsonProperty("is_trending")
    Boolean trending
) {

    public RenderRequest toRenderRequest() {
        return RenderRequest.builder()
            .sourceImageUrl(sourceImageUrl)
            .modelReferenceUrl(modelReferenceUrl)
            .merchantUrl(merchantUrl)
            .title(title)
            .brand(brand)
            .price(price)
            .currency(currency)
            .category(category)
            .trendKeyword(trendKeyword)
            .trending(trending)
            .build();
    }
}
