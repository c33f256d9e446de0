package net.lookvault.service.render;

import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Paid virtual try-on upstream.
 */
public interface TryOnRenderProvider {

    /**
     * Renders the product in {@code sourceImageUrl} onto the model in {@code modelReferenceUrl}.
     * Cancelling the subscription abandons the upstream call.
     *
     * @param sourceImageUrl raw product image URL; kept in memory only
     * @param modelReferenceUrl person image, or {@code null} for the configured default model
     * @return publicly reachable render URLs, or an empty {@code Mono} on any failure
     */
    Mono<List<String>> render(String sourceImageUrl, String modelReferenceUrl);

    /**
     * Whether renders from this provider carry an invisible synthetic-media watermark.
     */
    boolean appliesSyntheticWatermark();
}
