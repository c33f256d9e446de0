package net.lookvault.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import net.lookvault.adapters.persistence.AssetLibraryRepository;
import net.lookvault.config.AssetCacheProperties;
import net.lookvault.config.TrendRefreshProperties;
import net.lookvault.model.ProductRecord;
import net.lookvault.service.AssetIndexingService;
import net.lookvault.service.AssetIndexingService.IndexingContext;
import net.lookvault.service.AssetIndexingService.IndexingSummary;
import net.lookvault.service.ProductSearchAggregator;
import net.lookvault.exception.UpstreamProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
class TrendingAssetSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    @Mock
    private ProductSearchAggregator aggregator;

    @Mock
    private AssetIndexingService indexingService;

    @Mock
    private AssetLibraryRepository repository;

    private TrendRefreshProperties trendProperties;
    private TrendingAssetScheduler scheduler;

    @BeforeEach
    void setUp() {
        trendProperties = new TrendRefreshProperties();
        trendProperties.setKeywords(Arrays.asList("quiet luxury", " ", "mob wife"));
        scheduler = new TrendingAssetScheduler(trendProperties, new AssetCacheProperties(), aggregator,
            indexingService, repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void refreshTrends_IndexesEachKeywordAsTrendingAndClearsStaleRows() {
        List<ProductRecord> quietLuxury = List.of(listing("q-1"), listing("q-2"));
        List<ProductRecord> mobWife = List.of(listing("m-1"));
        when(aggregator.searchPrimary("quiet luxury fashion", 4)).thenReturn(Mono.just(quietLuxury));
        when(aggregator.searchPrimary("mob wife fashion", 4)).thenReturn(Mono.just(mobWife));
        when(indexingService.indexNow(quietLuxury, IndexingContext.trend("quiet luxury", NOW)))
            .thenReturn(new IndexingSummary(2, 0, 0));
        when(indexingService.indexNow(mobWife, IndexingContext.trend("mob wife", NOW)))
            .thenReturn(new IndexingSummary(1, 0, 0));

        int persisted = scheduler.refreshTrends();

        assertThat(persisted).isEqualTo(3);
        verify(repository).clearTrendingBefore(NOW.minus(Duration.ofDays(2)));
    }

    @Test
    void refreshTrends_ContinuesPastFailingKeyword() {
        List<ProductRecord> mobWife = List.of(listing("m-1"));
        when(aggregator.searchPrimary("quiet luxury fashion", 4))
            .thenReturn(Mono.error(new UpstreamProviderException("shopping_search", "quota exceeded", true)));
        when(aggregator.searchPrimary("mob wife fashion", 4)).thenReturn(Mono.just(mobWife));
        when(indexingService.indexNow(eq(mobWife), any(IndexingContext.class))).thenReturn(new IndexingSummary(1, 0, 0));

        assertThat(scheduler.refreshTrends()).isEqualTo(1);
        verify(repository).clearTrendingBefore(any(Instant.class));
    }

    @Test
    void refreshTrends_SkipsIndexingWhenProviderReturnsNothing() {
        when(aggregator.searchPrimary(anyString(), anyInt())).thenReturn(Mono.just(List.of()));

        assertThat(scheduler.refreshTrends()).isZero();
        verify(indexingService, never()).indexNow(any(), any());
    }

    @Test
    void refreshTrends_SurvivesStaleClearFailure() {
        when(aggregator.searchPrimary(anyString(), anyInt())).thenReturn(Mono.just(List.of()));
        when(repository.clearTrendingBefore(any(Instant.class)))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThat(scheduler.refreshTrends()).isZero();
    }

    @Test
    void scheduledRefresh_DoesNothingWhenDisabled() {
        trendProperties.setEnabled(false);

        scheduler.scheduledRefresh();

        verifyNoInteractions(aggregator, indexingService, repository);
    }

    private static ProductRecord listing(String id) {
        return ProductRecord.builder()
            .sourceProvider("shopping_search")
            .sourceIdentifier(id)
            .title("Trend piece " + id)
            .price(new BigDecimal("120.00"))
            .currency("USD")
            .imageUrl("https://cdn.example.com/" + id + ".jpg")
            .merchantUrl("https://shop.example.com/" + id)
            .build();
    }
}
