package net.lookvault.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A row of {@code generation_jobs}. Several jobs may share one content hash.
 */
public record GenerationJob(
    UUID id,
    String userId,
    String contentHash,
    String model,
    GenerationJobStatus status,
    String outputReference,
    Instant createdAt,
    Instant updatedAt
) {
}
