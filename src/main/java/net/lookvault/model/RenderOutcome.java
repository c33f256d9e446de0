package net.lookvault.model;

import java.util.List;

/**
 * Result of a try-on render request.
 * <p>
 * A failed outcome carries the original source image so the caller can display it instead.
 */
public record RenderOutcome(
    boolean succeeded,
    AssetSource source,
    String contentHash,
    List<String> renderedUrls,
    String primaryUrl,
    String fallbackImage
) {

    public RenderOutcome {
        renderedUrls = renderedUrls == null ? List.of() : List.copyOf(renderedUrls);
    }

    public static RenderOutcome cached(String contentHash, List<String> renderedUrls, String primaryUrl) {
        return new RenderOutcome(true, AssetSource.CACHE, contentHash, renderedUrls, primaryOrFirst(primaryUrl, renderedUrls), null);
    }

    public static RenderOutcome generated(String contentHash, List<String> renderedUrls) {
        return new RenderOutcome(true, AssetSource.GENERATED, contentHash, renderedUrls, primaryOrFirst(null, renderedUrls), null);
    }

    public static RenderOutcome failed(String contentHash, String sourceImageUrl) {
        return new RenderOutcome(false, null, contentHash, List.of(), null, sourceImageUrl);
    }

    private static String primaryOrFirst(String primaryUrl, List<String> renderedUrls) {
        if (primaryUrl != null && !primaryUrl.isBlank()) {
            return primaryUrl;
        }
        return renderedUrls == null || renderedUrls.isEmpty() ? null : renderedUrls.get(0);
    }
}
