package net.lookvault.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds upstream search terms and persisted search tags for product listings.
 */
public final class ProductSearchTerms {

    static final int TITLE_TAG_WORDS = 5;

    private static final Map<String, String> CATEGORY_KEYWORDS = Map.of(
        "shirts", "luxury shirts men women designer",
        "outerwear", "luxury coats jackets designer outerwear",
        "dresses", "designer dresses women luxury",
        "activewear", "luxury activewear athleisure designer",
        "bags", "luxury handbags designer bags",
        "shoes", "luxury shoes designer footwear",
        "accessories", "luxury accessories designer jewelry watches",
        "swimwear", "luxury swimwear designer",
        "suits", "luxury suits designer tailored",
        "knitwear", "luxury knitwear cashmere designer"
    );

    private ProductSearchTerms() {
        // Utility class
    }

    /**
     * Resolves the term sent to upstream providers.
     * A free-text query wins; a category-only search uses the curated keyword set for that category.
     */
    public static String upstreamTerm(String query, String category) {
        if (SearchQueryUtils.hasText(query)) {
            return query.trim();
        }
        return categoryTerm(category);
    }

    public static String categoryTerm(String category) {
        if (!SearchQueryUtils.hasText(category)) {
            return "";
        }
        String key = category.trim().toLowerCase(Locale.ROOT);
        return CATEGORY_KEYWORDS.getOrDefault(key, "luxury " + key);
    }

    public static String trendingTerm(String trendKeyword) {
        return trendKeyword.trim() + " fashion";
    }

    /**
     * Lowercase tags stored with each asset: brand, category, trend keyword and the first words of the title.
     */
    public static List<String> searchTags(String brand, String category, String trendKeyword, String title) {
        Set<String> tags = new LinkedHashSet<>();
        addTag(tags, brand);
        addTag(tags, category);
        addTag(tags, trendKeyword);
        List<String> titleWords = SearchQueryUtils.tokens(title);
        tags.addAll(titleWords.subList(0, Math.min(TITLE_TAG_WORDS, titleWords.size())));
        return new ArrayList<>(tags);
    }

    private static void addTag(Set<String> tags, String value) {
        if (SearchQueryUtils.hasText(value)) {
            tags.add(value.trim().toLowerCase(Locale.ROOT));
        }
    }
}
