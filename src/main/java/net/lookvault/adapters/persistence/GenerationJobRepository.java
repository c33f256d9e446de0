package net.lookvault.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.lookvault.model.GenerationJob;
import net.lookvault.model.GenerationJobStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Postgres adapter for {@code generation_jobs}.
 *
 * <p>Content hashes are not unique here: several jobs may carry the same hash, and cache
 * lookups always take the most recent qualifying one.</p>
 */
@Repository
public class GenerationJobRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, content_hash, model, status, output_reference, created_at, updated_at
        FROM generation_jobs
        """;

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<GenerationJob> rowMapper = GenerationJobRepository::mapRow;

    public GenerationJobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Finds the newest completed job of {@code userId} for {@code contentHash} that has an
     * output and was created at or after {@code createdSince}.
     *
     * @param userId owner of the job
     * @param contentHash canonical hash of the generation parameters
     * @param createdSince lower bound of the freshness window
     * @return the reusable job when one exists
     */
    @Transactional(readOnly = true)
    public Optional<GenerationJob> findLatestCompleted(String userId, String contentHash, Instant createdSince) {
        List<GenerationJob> rows = jdbcTemplate.query(
            SELECT_COLUMNS + """
            WHERE content_hash = ?
              AND user_id = ?
              AND status = 'completed'
              AND output_reference IS NOT NULL
              AND created_at >= ?
            ORDER BY created_at DESC
            LIMIT 1
            """,
            rowMapper,
            contentHash,
            userId,
            Timestamp.from(createdSince)
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Transactional(readOnly = true)
    public Optional<GenerationJob> findById(UUID jobId) {
        List<GenerationJob> rows = jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", rowMapper, jobId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Creates a {@code pending} job tagged with the content hash it will be cacheable under.
     */
    @Transactional
    public GenerationJob insertPending(String userId, String contentHash, String model) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return jdbcTemplate.queryForObject(
            """
            INSERT INTO generation_jobs (id, user_id, content_hash, model, status, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, NOW(), NOW())
            RETURNING id, user_id, content_hash, model, status, output_reference, created_at, updated_at
            """,
            rowMapper,
            UUID.randomUUID(),
            userId,
            contentHash,
            model,
            GenerationJobStatus.PENDING.dbValue()
        );
    }

    /**
     * Moves a job to a new status, optionally recording its output.
     *
     * @return {@code true} when the job exists
     */
    @Transactional
    public boolean updateStatus(UUID jobId, GenerationJobStatus status, String outputReference) {
        int updated = jdbcTemplate.update(
            """
            UPDATE generation_jobs
            SET status = ?, output_reference = COALESCE(?, output_reference), updated_at = NOW()
            WHERE id = ?
            """,
            status.dbValue(),
            outputReference,
            jobId
        );
        return updated > 0;
    }

    private static GenerationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new GenerationJob(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            rs.getString("content_hash"),
            rs.getString("model"),
            GenerationJobStatus.fromDbValue(rs.getString("status")),
            rs.getString("output_reference"),
            createdAt == null ? null : createdAt.toInstant(),
            updatedAt == null ? null : updatedAt.toInstant()
        );
    }
}
