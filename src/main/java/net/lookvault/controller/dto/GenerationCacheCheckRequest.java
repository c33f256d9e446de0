package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import net.lookvault.model.GenerationParams;

public record GenerationCacheCheckRequest(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("generation_params")
    GenerationParamsPayload generationParams
) {

    /**
     * Wire shape of the output-affecting generation parameters.
     */
    public record GenerationParamsPayload(
        String prompt,
        String model,
        String resolution,
        Integer duration,

        @JsonProperty("preset_id")
        String presetId,

        @JsonProperty("aspect_ratio")
        String aspectRatio,

        @JsonProperty("camera_move")
        String cameraMove,

        @JsonProperty("style_ref")
        String styleRef
    ) {

        public GenerationParams toParams() {
            return new GenerationParams(prompt, model, resolution, duration, presetId, aspectRatio, cameraMove, styleRef);
        }
    }
}
