package net.lookvault.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.config.AssetCacheProperties;
import net.lookvault.model.ProductRecord;
import net.lookvault.service.provider.ProductSearchProvider;
import net.lookvault.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Fans a search term out to every upstream product provider concurrently.
 * <p>
 * Each call carries its own timeout and recovers to an empty list, so a slow or failing
 * provider costs at most {@code providerTimeout} and never fails the search.
 */
@Service
@Slf4j
public class ProductSearchAggregator {

    private final List<ProductSearchProvider> providers;
    private final AssetCacheProperties cacheProperties;
    private final Scheduler providerScheduler;

    @Autowired
    public ProductSearchAggregator(List<ProductSearchProvider> providers, AssetCacheProperties cacheProperties) {
        this(providers, cacheProperties, Schedulers.boundedElastic());
    }

    ProductSearchAggregator(List<ProductSearchProvider> providers,
                            AssetCacheProperties cacheProperties,
                            Scheduler providerScheduler) {
        List<ProductSearchProvider> ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparingInt(ProductSearchProvider::priority));
        this.providers = List.copyOf(ordered);
        this.cacheProperties = cacheProperties;
        this.providerScheduler = providerScheduler;
    }

    /**
     * Queries every provider and waits for all of them to settle.
     *
     * @param term upstream search term
     * @return listings concatenated in provider priority order; empty when every provider failed
     */
    public Mono<List<ProductRecord>> searchAll(String term) {
        if (!StringUtils.hasText(term) || providers.isEmpty()) {
            return Mono.just(List.of());
        }
        int limit = cacheProperties.getProviderResultLimit();
        Duration timeout = cacheProperties.getProviderTimeout();

        List<Mono<List<ProductRecord>>> calls = new ArrayList<>(providers.size());
        for (ProductSearchProvider provider : providers) {
            calls.add(guardedSearch(provider, term, limit, timeout));
        }
        // mergeSequential subscribes to every call up front and replays results in provider order
        return Flux.mergeSequential(calls)
            .flatMapIterable(results -> results)
            .collectList();
    }

    /**
     * Queries only the highest-priority provider, used by the trend refresh.
     */
    public Mono<List<ProductRecord>> searchPrimary(String term, int limit) {
        if (!StringUtils.hasText(term) || providers.isEmpty()) {
            return Mono.just(List.of());
        }
        return guardedSearch(providers.get(0), term, limit, cacheProperties.getProviderTimeout());
    }

    List<String> providerNames() {
        return providers.stream().map(ProductSearchProvider::name).toList();
    }

    private Mono<List<ProductRecord>> guardedSearch(ProductSearchProvider provider, String term, int limit, Duration timeout) {
        return Mono.defer(() -> provider.search(term, limit))
            .subscribeOn(providerScheduler)
            .timeout(timeout)
            .defaultIfEmpty(List.of())
            .onErrorResume(error -> {
                String reason = error instanceof TimeoutException
                    ? "timed out after " + timeout.toMillis() + " ms"
                    : error.getMessage();
                ExternalApiLogger.logApiCallFailure(log, provider.name(), "PRODUCT_SEARCH", term, reason);
                return Mono.just(List.of());
            });
    }
}
