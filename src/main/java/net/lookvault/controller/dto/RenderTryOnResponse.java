package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import net.lookvault.model.RenderOutcome;

public record RenderTryOnResponse(
    @JsonProperty("rendered_urls")
    List<String> renderedUrls,

    @JsonProperty("primary_url")
    String primaryUrl,

    String source,

    @JsonProperty("content_hash")
    String contentHash
) {

    public static RenderTryOnResponse from(RenderOutcome outcome) {
        return new RenderTryOnResponse(
            outcome.renderedUrls(),
            outcome.primaryUrl(),
            outcome.source().wireValue(),
            outcome.contentHash()
        );
    }
}
