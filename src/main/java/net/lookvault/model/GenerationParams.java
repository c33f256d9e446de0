package net.lookvault.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output-affecting parameters of a video or image generation call.
 * Absent fields hash like their documented defaults.
 */
public record GenerationParams(
    String prompt,
    String model,
    String resolution,
    Integer duration,
    String presetId,
    String aspectRatio,
    String cameraMove,
    String styleRef
) {

    public static final String DEFAULT_MODEL = "veo-3.1-fast";
    public static final String DEFAULT_RESOLUTION = "720p";
    public static final int DEFAULT_DURATION_SECONDS = 5;
    public static final String DEFAULT_ASPECT_RATIO = "9:16";

    /**
     * Field map fed to the canonical hasher, with defaults applied.
     */
    public Map<String, Object> toCanonicalFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("prompt", orEmpty(prompt));
        fields.put("model", orDefault(model, DEFAULT_MODEL));
        fields.put("resolution", orDefault(resolution, DEFAULT_RESOLUTION));
        fields.put("duration", duration == null || duration <= 0 ? DEFAULT_DURATION_SECONDS : duration);
        fields.put("preset_id", orEmpty(presetId));
        fields.put("aspect_ratio", orDefault(aspectRatio, DEFAULT_ASPECT_RATIO));
        fields.put("camera_move", orEmpty(cameraMove));
        fields.put("style_ref", orEmpty(styleRef));
        return fields;
    }

    public String effectiveModel() {
        return orDefault(model, DEFAULT_MODEL);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
