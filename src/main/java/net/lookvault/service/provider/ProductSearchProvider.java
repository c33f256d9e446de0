package net.lookvault.service.provider;

import java.util.List;
import net.lookvault.model.ProductRecord;
import reactor.core.publisher.Mono;

/**
 * Upstream product source. Implementations normalize their native payloads into
 * {@link ProductRecord}s so nothing provider-specific leaks past this boundary.
 */
public interface ProductSearchProvider {

    /**
     * Stable provider name, stored as {@code source_provider} and used in merge keys.
     */
    String name();

    /**
     * Merge priority; lower values win when two providers list the same product.
     */
    int priority();

    /**
     * Searches the upstream.
     *
     * @param term upstream search term
     * @param limit maximum listings to return
     * @return normalized listings; errors surface as {@link net.lookvault.exception.UpstreamProviderException}
     */
    Mono<List<ProductRecord>> search(String term, int limit);
}
