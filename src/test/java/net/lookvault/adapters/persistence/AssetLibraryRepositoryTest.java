package net.lookvault.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import net.lookvault.model.AssetRecord;
import net.lookvault.model.ComplianceTags;
import net.lookvault.util.CanonicalHasher;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.postgresql.PostgreSQLContainer;
import tools.jackson.databind.ObjectMapper;

@Testcontainers(disabledWithoutDocker = true)
class AssetLibraryRepositoryTest {

    @Container
    static PostgreSQLContainer postgres = new PostgreSQLContainer("postgres:15-alpine");

    private static JdbcTemplate jdbcTemplate;

    private AssetLibraryRepository repository;

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource =
            new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("TRUNCATE asset_library");
        repository = new AssetLibraryRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void upsert_IsIdempotentPerContentHash() {
        AssetRecord rendered = rendered("https://cdn.example.com/cargo.jpg", "Cargo Leather Biker Jacket");

        repository.upsert(rendered);
        repository.upsert(rendered);

        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM asset_library", Integer.class);
        assertThat(rows).isEqualTo(1);
        AssetRecord stored = repository.fetchByHash(rendered.getContentHash()).orElseThrow();
        assertThat(stored.getRenderedImageUrls()).containsExactly("https://storage.googleapis.com/r/1.png");
        assertThat(stored.getComplianceFlags().aiDisclosureApplied()).isTrue();
        assertThat(stored.getComplianceFlags().disclosureMetadata()).containsEntry("credit", "AI-generated");
    }

    @Test
    void upsertListing_KeepsExistingRenders() {
        AssetRecord rendered = rendered("https://cdn.example.com/cargo.jpg", "Cargo Leather Biker Jacket");
        repository.upsert(rendered);

        repository.upsertListing(listing("https://cdn.example.com/cargo.jpg", "Cargo Biker Jacket (restocked)")
            .toBuilder()
            .price(new BigDecimal("499.00"))
            .build());

        AssetRecord stored = repository.fetchByHash(rendered.getContentHash()).orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("Cargo Biker Jacket (restocked)");
        assertThat(stored.getPrice()).isEqualByComparingTo("499.00");
        assertThat(stored.getRenderedImageUrls()).containsExactly("https://storage.googleapis.com/r/1.png");
        assertThat(stored.getComplianceFlags().aiDisclosureApplied()).isTrue();
    }

    @Test
    void searchByText_MatchesTitleBrandAndTagsWithinCategory() {
        repository.upsertListing(listing("https://cdn.example.com/a.jpg", "Leather Jacket Classic"));
        repository.upsertListing(listing("https://cdn.example.com/b.jpg", "Suede Bomber").toBuilder()
            .searchTags(List.of("leather", "outerwear"))
            .build());
        repository.upsertListing(listing("https://cdn.example.com/c.jpg", "Leather Tote").toBuilder()
            .category("Bags")
            .build());

        assertThat(repository.searchByText("leather", "outerwear", 20))
            .extracting(AssetRecord::getTitle)
            .containsExactlyInAnyOrder("Leather Jacket Classic", "Suede Bomber");
        assertThat(repository.searchByText(null, "Bags", 20))
            .extracting(AssetRecord::getTitle)
            .containsExactly("Leather Tote");
        assertThat(repository.searchByText("100%_off", null, 20)).isEmpty();
    }

    @Test
    void clearTrendingBefore_DropsOnlyStaleRows() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        repository.upsertListing(listing("https://cdn.example.com/fresh.jpg", "Fresh Trend").toBuilder()
            .trending(true).trendKeyword("quiet luxury").trendRefreshedAt(now)
            .build());
        repository.upsertListing(listing("https://cdn.example.com/stale.jpg", "Stale Trend").toBuilder()
            .trending(true).trendKeyword("mob wife").trendRefreshedAt(now.minus(3, ChronoUnit.DAYS))
            .build());

        int cleared = repository.clearTrendingBefore(now.minus(2, ChronoUnit.DAYS));

        assertThat(cleared).isEqualTo(1);
        assertThat(repository.fetchTrending(10)).extracting(AssetRecord::getTitle).containsExactly("Fresh Trend");
    }

    @Test
    void upsertListing_NeverLowersTrendingFlag() {
        Instant now = Instant.now();
        AssetRecord trending = listing("https://cdn.example.com/t.jpg", "Trend Piece").toBuilder()
            .trending(true).trendKeyword("quiet luxury").trendRefreshedAt(now)
            .build();
        repository.upsertListing(trending);

        repository.upsertListing(listing("https://cdn.example.com/t.jpg", "Trend Piece"));

        AssetRecord stored = repository.fetchByHash(trending.getContentHash()).orElseThrow();
        assertThat(stored.isTrending()).isTrue();
        assertThat(stored.getTrendKeyword()).isEqualTo("quiet luxury");
    }

    private static AssetRecord listing(String imageUrl, String title) {
        return AssetRecord.builder()
            .contentHash(CanonicalHasher.hashSourceImageUrl(imageUrl))
            .sourceProvider("shopping_search")
            .sourceIdentifier("offer-" + title.hashCode())
            .title(title)
            .brand("AllSaints")
            .category("Outerwear")
            .price(new BigDecimal("549.00"))
            .currency("USD")
            .sourceImageUrl(imageUrl)
            .merchantUrl("https://shop.example.com/p")
            .searchTags(List.of("allsaints", "outerwear"))
            .build();
    }

    private static AssetRecord rendered(String imageUrl, String title) {
        return listing(imageUrl, title).toBuilder()
            .renderedImageUrls(List.of("https://storage.googleapis.com/r/1.png"))
            .primaryRenderedUrl("https://storage.googleapis.com/r/1.png")
            .complianceFlags(new ComplianceTags(true, true, Map.of("credit", "AI-generated")))
            .build();
    }
}
