package net.lookvault.service.provider;

import java.math.BigDecimal;
import java.util.List;
import net.lookvault.model.ProductRecord;
import org.springframework.stereotype.Component;

/**
 * Fixed listings served when the library and every provider come back empty, so the
 * product surface never renders blank. These are never indexed into the asset library.
 */
@Component
public class CuratedFallbackCatalog {

    private static final List<ProductRecord> ITEMS = List.of(
        ProductRecord.builder()
            .sourceProvider(ProductRecord.CURATED_FALLBACK_SOURCE)
            .sourceIdentifier("curated-cashmere-overcoat")
            .title("Nordstrom Cashmere Overcoat")
            .price(new BigDecimal("1250.00"))
            .currency("USD")
            .imageUrl("https://images.nordstrom.com/placeholder-overcoat.jpg")
            .merchantUrl("https://www.nordstrom.com/p/coat")
            .brand("Theory")
            .merchantName("Nordstrom")
            .category("Outerwear")
            .build(),
        ProductRecord.builder()
            .sourceProvider(ProductRecord.CURATED_FALLBACK_SOURCE)
            .sourceIdentifier("curated-silk-scarf")
            .title("Vintage Hermès Silk Scarf")
            .price(new BigDecimal("850.00"))
            .currency("USD")
            .imageUrl("https://i.ebayimg.com/placeholder-hermes.jpg")
            .merchantUrl("https://www.ebay.com/itm/VINTAGE-HERMES")
            .brand("Hermès")
            .merchantName("eBay")
            .category("Accessories")
            .build()
    );

    /**
     * @return the curated listings; never empty
     */
    public List<ProductRecord> items() {
        return ITEMS;
    }
}
