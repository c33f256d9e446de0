package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the job lifecycle endpoints; {@code content_hash} comes from a prior cache miss.
 */
public record GenerationJobRequest(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("content_hash")
    String contentHash,

    String model,

    @JsonProperty("output_reference")
    String outputReference
) {
}
