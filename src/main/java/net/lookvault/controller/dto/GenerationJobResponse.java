package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import net.lookvault.model.GenerationJob;

public record GenerationJobResponse(
    @JsonProperty("job_id")
    UUID jobId,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("content_hash")
    String contentHash,

    String model,
    String status,

    @JsonProperty("created_at")
    Instant createdAt
) {

    public static GenerationJobResponse from(GenerationJob job) {
        return new GenerationJobResponse(job.id(), job.userId(), job.contentHash(), job.model(),
            job.status().dbValue(), job.createdAt());
    }
}
