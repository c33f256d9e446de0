package net.lookvault.service.render;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Try-on renders through the Vertex AI {@code virtual-try-on-001} prediction endpoint.
 * <p>
 * Images already in Cloud Storage are referenced by {@code gs://} URI; anything else is
 * downloaded and sent inline. Renders are written by the upstream to the configured
 * storage URI and returned as public {@code storage.googleapis.com} URLs.
 */
@Service
@Slf4j
public class VertexTryOnRenderClient implements TryOnRenderProvider {

    static final String MODEL_PATH =
        "/v1/projects/{project}/locations/{location}/publishers/google/models/virtual-try-on-001:predict";
    private static final String API_NAME = "VertexTryOn";
    private static final String GCS_SCHEME = "gs://";
    private static final String PUBLIC_STORAGE_HOST = "https://storage.googleapis.com/";

    private final WebClient webClient;
    private final String projectId;
    private final String location;
    private final String accessToken;
    private final String outputStorageUri;
    private final String defaultModelUri;
    private final int sampleCount;
    private final boolean addWatermark;

    public VertexTryOnRenderClient(@Qualifier("renderWebClientBuilder") WebClient.Builder webClientBuilder,
                                   @Value("${vertex.tryon.base-url:https://us-central1-aiplatform.googleapis.com}") String baseUrl,
                                   @Value("${vertex.tryon.project-id:}") String projectId,
                                   @Value("${vertex.tryon.location:us-central1}") String location,
                                   @Value("${vertex.tryon.access-token:}") String accessToken,
                                   @Value("${vertex.tryon.output-storage-uri:}") String outputStorageUri,
                                   @Value("${vertex.tryon.default-model-uri:}") String defaultModelUri,
                                   @Value("${vertex.tryon.sample-count:1}") int sampleCount,
                                   @Value("${vertex.tryon.add-watermark:true}") boolean addWatermark) {
        this.webClient = webClientBuilder.clone().baseUrl(baseUrl).build();
        this.projectId = projectId;
        this.location = location;
        this.accessToken = accessToken;
        this.outputStorageUri = outputStorageUri;
        this.defaultModelUri = defaultModelUri;
        this.sampleCount = Math.max(1, sampleCount);
        this.addWatermark = addWatermark;
    }

    @Override
    public boolean appliesSyntheticWatermark() {
        return addWatermark;
    }

    @Override
    public Mono<List<String>> render(String sourceImageUrl, String modelReferenceUrl) {
        if (!StringUtils.hasText(projectId) || !StringUtils.hasText(accessToken)) {
            ExternalApiLogger.logProviderDisabled(log, API_NAME, sourceImageUrl);
            return Mono.empty();
        }
        String modelUri = StringUtils.hasText(modelReferenceUrl) ? modelReferenceUrl : defaultModelUri;
        if (!StringUtils.hasText(modelUri) || !StringUtils.hasText(sourceImageUrl)) {
            log.warn("Try-on render skipped: missing {} image", StringUtils.hasText(modelUri) ? "product" : "model reference");
            return Mono.empty();
        }

        return Mono.zip(imagePayload(modelUri), imagePayload(sourceImageUrl))
            .flatMap(images -> webClient.post()
                .uri(MODEL_PATH, projectId, location)
                .headers(headers -> headers.setBearerAuth(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(images.getT1(), images.getT2()))
                .retrieve()
                .bodyToMono(JsonNode.class))
            .doOnSubscribe(s -> ExternalApiLogger.logApiCallAttempt(log, API_NAME, "PREDICT", sourceImageUrl))
            .map(this::extractPublicUrls)
            .filter(urls -> !urls.isEmpty())
            .doOnNext(urls -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "PREDICT", sourceImageUrl, urls.size()))
            .doOnCancel(() -> log.info("Try-on render for {} cancelled by caller", sourceImageUrl))
            .onErrorResume(error -> {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, "PREDICT", sourceImageUrl, error.getMessage());
                return Mono.empty();
            });
    }

    private Map<String, Object> requestBody(Map<String, Object> personImage, Map<String, Object> productImage) {
        Map<String, Object> instance = new LinkedHashMap<>();
        instance.put("personImage", Map.of("image", personImage));
        instance.put("productImages", List.of(Map.of("image", productImage)));

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("sampleCount", sampleCount);
        parameters.put("addWatermark", addWatermark);
        if (StringUtils.hasText(outputStorageUri)) {
            parameters.put("storageUri", outputStorageUri);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instances", List.of(instance));
        body.put("parameters", parameters);
        return body;
    }

    private Mono<Map<String, Object>> imagePayload(String imageUri) {
        if (imageUri.startsWith(GCS_SCHEME)) {
            return Mono.just(Map.of("gcsUri", imageUri));
        }
        return webClient.get()
            .uri(imageUri)
            .retrieve()
            .bodyToMono(byte[].class)
            .map(bytes -> Map.<String, Object>of("bytesBase64Encoded", Base64.getEncoder().encodeToString(bytes)));
    }

    List<String> extractPublicUrls(JsonNode response) {
        JsonNode predictions = response.path("predictions");
        if (!predictions.isArray()) {
            return List.of();
        }
        List<String> urls = new ArrayList<>();
        for (JsonNode prediction : predictions) {
            JsonNode gcsUri = prediction.path("gcsUri");
            if (gcsUri.isString() && StringUtils.hasText(gcsUri.asString())) {
                urls.add(toPublicUrl(gcsUri.asString()));
            } else if (prediction.has("bytesBase64Encoded")) {
                log.debug("Skipping inline try-on prediction without a storage URI");
            }
        }
        return urls;
    }

    /**
     * Maps {@code gs://bucket/object} to its public HTTPS form; other URIs pass through unchanged.
     */
    static String toPublicUrl(String gcsUri) {
        if (!gcsUri.startsWith(GCS_SCHEME)) {
            return gcsUri;
        }
        String path = gcsUri.substring(GCS_SCHEME.length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            return gcsUri;
        }
        return PUBLIC_STORAGE_HOST + path;
    }
}
