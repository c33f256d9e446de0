package net.lookvault.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a generation cache check: either a reusable output or the hash to tag the new job with.
 */
public record GenerationCacheResult(
    boolean found,
    String contentHash,
    String outputReference,
    UUID jobId,
    String model,
    Instant createdAt
) {

    public static GenerationCacheResult hit(String contentHash, GenerationJob job) {
        return new GenerationCacheResult(true, contentHash, job.outputReference(), job.id(), job.model(), job.createdAt());
    }

    public static GenerationCacheResult miss(String contentHash) {
        return new GenerationCacheResult(false, contentHash, null, null, null, null);
    }
}
