package net.lookvault.adapters.persistence;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.lookvault.model.AssetRecord;
import net.lookvault.model.ComplianceTags;
import net.lookvault.util.SearchQueryUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for the product asset library.
 *
 * <p>Owns all SQL for the {@code asset_library} table. Rows are keyed by the hash of the
 * source image URL and the unique index on {@code content_hash} is what keeps concurrent
 * writers from producing duplicates; no application-level locking is involved.</p>
 */
@Repository
public class AssetLibraryRepository {

    private static final Logger log = LoggerFactory.getLogger(AssetLibraryRepository.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT id, content_hash, source_identifier, source_provider, title, brand, category,
               merchant_name, price, currency, source_image_url, merchant_url,
               rendered_image_urls, primary_rendered_url, ai_disclosure_applied,
               synthetic_watermark_applied, disclosure_metadata::text AS disclosure_metadata,
               is_trending, trend_keyword, trend_refreshed_at, search_tags, created_at, updated_at
        FROM asset_library
        """;

    private static final String INSERT_PREFIX = """
        INSERT INTO asset_library (
            id, content_hash, source_identifier, source_provider, title, brand, category,
            merchant_name, price, currency, source_image_url, merchant_url,
            rendered_image_urls, primary_rendered_url, ai_disclosure_applied,
            synthetic_watermark_applied, disclosure_metadata, is_trending, trend_keyword,
            trend_refreshed_at, search_tags, created_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, NOW(), NOW())
        """;

    // Last-write-wins on everything except the key and the creation time.
    private static final String UPSERT_SQL = INSERT_PREFIX + """
        ON CONFLICT (content_hash) DO UPDATE SET
            source_identifier = EXCLUDED.source_identifier,
            source_provider = EXCLUDED.source_provider,
            title = EXCLUDED.title,
            brand = EXCLUDED.brand,
            category = EXCLUDED.category,
            merchant_name = EXCLUDED.merchant_name,
            price = EXCLUDED.price,
            currency = EXCLUDED.currency,
            source_image_url = EXCLUDED.source_image_url,
            merchant_url = EXCLUDED.merchant_url,
            rendered_image_urls = EXCLUDED.rendered_image_urls,
            primary_rendered_url = EXCLUDED.primary_rendered_url,
            ai_disclosure_applied = EXCLUDED.ai_disclosure_applied,
            synthetic_watermark_applied = EXCLUDED.synthetic_watermark_applied,
            disclosure_metadata = EXCLUDED.disclosure_metadata,
            is_trending = EXCLUDED.is_trending,
            trend_keyword = EXCLUDED.trend_keyword,
            trend_refreshed_at = EXCLUDED.trend_refreshed_at,
            search_tags = EXCLUDED.search_tags,
            updated_at = NOW()
        """;

    // Listing refresh: renders and compliance columns belong to the render path and are never touched here.
    private static final String UPSERT_LISTING_SQL = INSERT_PREFIX + """
        ON CONFLICT (content_hash) DO UPDATE SET
            source_identifier = COALESCE(EXCLUDED.source_identifier, asset_library.source_identifier),
            source_provider = COALESCE(EXCLUDED.source_provider, asset_library.source_provider),
            title = COALESCE(EXCLUDED.title, asset_library.title),
            brand = COALESCE(EXCLUDED.brand, asset_library.brand),
            category = COALESCE(EXCLUDED.category, asset_library.category),
            merchant_name = COALESCE(EXCLUDED.merchant_name, asset_library.merchant_name),
            price = COALESCE(EXCLUDED.price, asset_library.price),
            currency = EXCLUDED.currency,
            merchant_url = COALESCE(EXCLUDED.merchant_url, asset_library.merchant_url),
            is_trending = asset_library.is_trending OR EXCLUDED.is_trending,
            trend_keyword = CASE WHEN EXCLUDED.is_trending THEN EXCLUDED.trend_keyword ELSE asset_library.trend_keyword END,
            trend_refreshed_at = CASE WHEN EXCLUDED.is_trending THEN EXCLUDED.trend_refreshed_at ELSE asset_library.trend_refreshed_at END,
            search_tags = ARRAY(SELECT DISTINCT t FROM unnest(asset_library.search_tags || EXCLUDED.search_tags) AS t),
            updated_at = NOW()
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<AssetRecord> rowMapper = this::mapRow;

    public AssetLibraryRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the asset stored under the given content hash.
     *
     * @param contentHash hash of the source image URL
     * @return the stored asset when present
     */
    @Transactional(readOnly = true)
    public Optional<AssetRecord> fetchByHash(String contentHash) {
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("contentHash is required");
        }
        List<AssetRecord> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE content_hash = ?", rowMapper, contentHash);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Approximate lookup used before any exact hash is known.
     * <p>
     * A row matches when its title or brand contains the query (case-insensitive) or its
     * search tags share a token with the query, and, when given, its category matches.
     * There is no relevance ranking: rows come back in storage order.
     *
     * @param query free-text query, may be blank when a category is given
     * @param category optional category filter
     * @param limit maximum number of rows
     * @return matching assets, possibly empty
     */
    @Transactional(readOnly = true)
    public List<AssetRecord> searchByText(String query, String category, int limit) {
        boolean hasQuery = SearchQueryUtils.hasText(query);
        boolean hasCategory = SearchQueryUtils.hasText(category);
        if ((!hasQuery && !hasCategory) || limit <= 0) {
            return List.of();
        }

        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE TRUE");
        List<Object> args = new ArrayList<>();
        if (hasQuery) {
            String pattern = "%" + SearchQueryUtils.escapeLike(query.trim()) + "%";
            sql.append(" AND (title ILIKE ? OR brand ILIKE ? OR search_tags && ?)");
            args.add(pattern);
            args.add(pattern);
            args.add(SearchQueryUtils.tokens(query).toArray(new String[0]));
        }
        if (hasCategory) {
            sql.append(" AND LOWER(category) = LOWER(?)");
            args.add(category.trim());
        }
        sql.append(" ORDER BY created_at, id LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql.toString());
            for (int i = 0; i < args.size(); i++) {
                Object arg = args.get(i);
                if (arg instanceof String[] tokens) {
                    ps.setArray(i + 1, textArray(connection, Arrays.asList(tokens)));
                } else {
                    ps.setObject(i + 1, arg);
                }
            }
            return ps;
        }, rowMapper);
    }

    /**
     * Inserts or fully replaces the asset stored under {@code record.contentHash}.
     * Repeating the call with the same record converges on the same row.
     *
     * @param record asset to persist
     */
    @Transactional
    public void upsert(AssetRecord record) {
        write(UPSERT_SQL, record);
    }

    /**
     * Inserts a listing, or refreshes the listing columns of an existing asset while
     * keeping its renders and compliance flags. The trending flag is only ever raised here.
     *
     * @param record listing to persist
     */
    @Transactional
    public void upsertListing(AssetRecord record) {
        write(UPSERT_LISTING_SQL, record);
    }

    @Transactional(readOnly = true)
    public List<AssetRecord> fetchTrending(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE is_trending ORDER BY trend_refreshed_at DESC NULLS LAST, created_at, id LIMIT ?",
            rowMapper,
            limit
        );
    }

    /**
     * Drops the trending flag from rows not refreshed since {@code cutoff}.
     *
     * @return number of rows updated
     */
    @Transactional
    public int clearTrendingBefore(Instant cutoff) {
        int cleared = jdbcTemplate.update(
            """
            UPDATE asset_library
            SET is_trending = FALSE, updated_at = NOW()
            WHERE is_trending AND (trend_refreshed_at IS NULL OR trend_refreshed_at < ?)
            """,
            Timestamp.from(cutoff)
        );
        if (cleared > 0) {
            log.info("Cleared trending flag from {} stale asset(s) refreshed before {}", cleared, cutoff);
        }
        return cleared;
    }

    private void write(String sql, AssetRecord record) {
        validate(record);
        ComplianceTags compliance = record.getComplianceFlags() != null ? record.getComplianceFlags() : ComplianceTags.none();
        String metadataJson = serializeJson(compliance.disclosureMetadata());
        UUID id = record.getId() != null ? record.getId() : UUID.randomUUID();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            ps.setObject(1, id);
            ps.setString(2, record.getContentHash());
            ps.setString(3, record.getSourceIdentifier());
            ps.setString(4, record.getSourceProvider());
            ps.setString(5, record.getTitle());
            ps.setString(6, record.getBrand());
            ps.setString(7, record.getCategory());
            ps.setString(8, record.getMerchantName());
            ps.setBigDecimal(9, record.getPrice());
            ps.setString(10, record.getCurrency() != null ? record.getCurrency() : "USD");
            ps.setString(11, record.getSourceImageUrl());
            ps.setString(12, record.getMerchantUrl());
            ps.setArray(13, textArray(connection, record.getRenderedImageUrls()));
            ps.setString(14, record.getPrimaryRenderedUrl());
            ps.setBoolean(15, compliance.aiDisclosureApplied());
            ps.setBoolean(16, compliance.syntheticWatermarkApplied());
            ps.setString(17, metadataJson);
            ps.setBoolean(18, record.isTrending());
            ps.setString(19, record.getTrendKeyword());
            if (record.getTrendRefreshedAt() != null) {
                ps.setTimestamp(20, Timestamp.from(record.getTrendRefreshedAt()));
            } else {
                ps.setNull(20, Types.TIMESTAMP);
            }
            ps.setArray(21, textArray(connection, record.getSearchTags()));
            return ps;
        });
    }

    private static void validate(AssetRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record is required");
        }
        if (record.getContentHash() == null || record.getContentHash().isBlank()) {
            throw new IllegalArgumentException("contentHash is required");
        }
        if (record.getSourceImageUrl() == null || record.getSourceImageUrl().isBlank()) {
            throw new IllegalArgumentException("sourceImageUrl is required");
        }
    }

    private AssetRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        ComplianceTags compliance = new ComplianceTags(
            rs.getBoolean("ai_disclosure_applied"),
            rs.getBoolean("synthetic_watermark_applied"),
            parseJsonb(rs.getString("disclosure_metadata"))
        );
        BigDecimal price = rs.getBigDecimal("price");
        return AssetRecord.builder()
            .id(rs.getObject("id", UUID.class))
            .contentHash(rs.getString("content_hash"))
            .sourceIdentifier(rs.getString("source_identifier"))
            .sourceProvider(rs.getString("source_provider"))
            .title(rs.getString("title"))
            .brand(rs.getString("brand"))
            .category(rs.getString("category"))
            .merchantName(rs.getString("merchant_name"))
            .price(price)
            .currency(rs.getString("currency"))
            .sourceImageUrl(rs.getString("source_image_url"))
            .merchantUrl(rs.getString("merchant_url"))
            .renderedImageUrls(parseTextArray(rs.getArray("rendered_image_urls")))
            .primaryRenderedUrl(rs.getString("primary_rendered_url"))
            .complianceFlags(compliance)
            .trending(rs.getBoolean("is_trending"))
            .trendKeyword(rs.getString("trend_keyword"))
            .trendRefreshedAt(toInstant(rs.getTimestamp("trend_refreshed_at")))
            .searchTags(parseTextArray(rs.getArray("search_tags")))
            .createdAt(toInstant(rs.getTimestamp("created_at")))
            .updatedAt(toInstant(rs.getTimestamp("updated_at")))
            .build();
    }

    private static Array textArray(Connection connection, List<String> values) throws SQLException {
        String[] array = values == null ? new String[0] : values.toArray(new String[0]);
        return connection.createArrayOf("text", array);
    }

    private static List<String> parseTextArray(Array sqlArray) throws SQLException {
        if (sqlArray == null) {
            return List.of();
        }
        String[] array = (String[]) sqlArray.getArray();
        return array == null ? List.of() : Arrays.asList(array);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private Map<String, Object> parseJsonb(String jsonb) {
        if (jsonb == null || jsonb.isBlank() || jsonb.equals("{}")) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(jsonb, MAP_TYPE);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Corrupted disclosure metadata cannot be parsed: " + ex.getMessage(), ex);
        }
    }

    private String serializeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize disclosure metadata", ex);
        }
    }
}
