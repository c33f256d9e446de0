package net.lookvault.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Try-on render request. Descriptive fields are optional and only used to enrich the persisted asset.
 */
@Value
@Builder
public class RenderRequest {
    String sourceImageUrl;
    String modelReferenceUrl;

    String merchantUrl;
    String title;
    String brand;
    BigDecimal price;
    String currency;
    String category;
    String trendKeyword;
    Boolean trending;
}
