package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;
import net.lookvault.model.GenerationCacheResult;

/**
 * Hit: {@code found, output_reference, job_id, model, created_at}. Miss: {@code found, content_hash}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationCacheCheckResponse(
    boolean found,

    @JsonProperty("output_reference")
    String outputReference,

    @JsonProperty("job_id")
    UUID jobId,

    String model,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("content_hash")
    String contentHash
) {

    public static GenerationCacheCheckResponse from(GenerationCacheResult result) {
        if (result.found()) {
            return new GenerationCacheCheckResponse(true, result.outputReference(), result.jobId(), result.model(),
                result.createdAt(), null);
        }
        return new GenerationCacheCheckResponse(false, null, null, null, null, result.contentHash());
    }
}
