package net.lookvault.service.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import tools.jackson.databind.ObjectMapper;

class VertexTryOnRenderClientTest {

    private static final String PREDICTION_RESPONSE = """
        {
          "predictions": [
            {"mimeType": "image/png", "gcsUri": "gs://lookvault-renders/tryon/sample_0.png"},
            {"mimeType": "image/png", "bytesBase64Encoded": "iVBORw0KGgo="}
          ]
        }
        """;

    @Test
    void render_PostsPredictionAndMapsStorageUrisToPublicUrls() {
        List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        VertexTryOnRenderClient client = client(request -> {
            requests.add(request);
            return Mono.just(json(HttpStatus.OK, PREDICTION_RESPONSE));
        }, "lookvault-prod", "token-xyz");

        StepVerifier.create(client.render("gs://catalog/jacket.jpg", "gs://models/model-a.jpg"))
            .assertNext(urls -> assertThat(urls)
                .containsExactly("https://storage.googleapis.com/lookvault-renders/tryon/sample_0.png"))
            .verifyComplete();

        assertThat(requests).hasSize(1);
        ClientRequest predict = requests.get(0);
        assertThat(predict.method()).isEqualTo(HttpMethod.POST);
        assertThat(predict.url().getPath()).isEqualTo(
            "/v1/projects/lookvault-prod/locations/us-central1/publishers/google/models/virtual-try-on-001:predict");
        assertThat(predict.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer token-xyz");
    }

    @Test
    void render_DownloadsNonStorageImagesBeforePredicting() {
        List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        VertexTryOnRenderClient client = client(request -> {
            requests.add(request);
            if (request.method() == HttpMethod.GET) {
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_JPEG_VALUE)
                    .body("jpeg-bytes")
                    .build());
            }
            return Mono.just(json(HttpStatus.OK, PREDICTION_RESPONSE));
        }, "lookvault-prod", "token-xyz");

        StepVerifier.create(client.render("https://cdn.example.com/jacket.jpg", "gs://models/model-a.jpg"))
            .expectNextCount(1)
            .verifyComplete();

        assertThat(requests).extracting(request -> request.url().toString())
            .contains("https://cdn.example.com/jacket.jpg");
        assertThat(requests).filteredOn(request -> request.method() == HttpMethod.POST).hasSize(1);
    }

    @Test
    void render_CompletesEmptyOnUpstreamError() {
        VertexTryOnRenderClient client = client(
            request -> Mono.just(json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":{\"code\":500}}")),
            "lookvault-prod", "token-xyz");

        StepVerifier.create(client.render("gs://catalog/jacket.jpg", "gs://models/model-a.jpg"))
            .verifyComplete();
    }

    @Test
    void render_CompletesEmptyWhenNoPredictionHasStorageUri() {
        VertexTryOnRenderClient client = client(
            request -> Mono.just(json(HttpStatus.OK, "{\"predictions\":[{\"bytesBase64Encoded\":\"AAAA\"}]}")),
            "lookvault-prod", "token-xyz");

        StepVerifier.create(client.render("gs://catalog/jacket.jpg", "gs://models/model-a.jpg"))
            .verifyComplete();
    }

    @Test
    void render_CompletesEmptyWithoutCallingUpstreamWhenUnconfigured() {
        List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        VertexTryOnRenderClient client = client(request -> {
            requests.add(request);
            return Mono.just(json(HttpStatus.OK, PREDICTION_RESPONSE));
        }, "", "");

        StepVerifier.create(client.render("gs://catalog/jacket.jpg", "gs://models/model-a.jpg"))
            .verifyComplete();
        assertThat(requests).isEmpty();
    }

    @Test
    void render_UsesDefaultModelImageWhenRequestHasNone() {
        List<ClientRequest> requests = new CopyOnWriteArrayList<>();
        VertexTryOnRenderClient client = client(request -> {
            requests.add(request);
            return Mono.just(json(HttpStatus.OK, PREDICTION_RESPONSE));
        }, "lookvault-prod", "token-xyz");

        StepVerifier.create(client.render("gs://catalog/jacket.jpg", null))
            .expectNextCount(1)
            .verifyComplete();
        assertThat(requests).hasSize(1);
    }

    @Test
    void extractPublicUrls_IgnoresMissingPredictions() {
        VertexTryOnRenderClient client = client(request -> Mono.empty(), "lookvault-prod", "token-xyz");

        assertThat(client.extractPublicUrls(new ObjectMapper().readTree("{}"))).isEmpty();
    }

    @Test
    void toPublicUrl_LeavesNonStorageUrisAlone() {
        assertThat(VertexTryOnRenderClient.toPublicUrl("gs://bucket/a/b.png"))
            .isEqualTo("https://storage.googleapis.com/bucket/a/b.png");
        assertThat(VertexTryOnRenderClient.toPublicUrl("gs://bucket-only")).isEqualTo("gs://bucket-only");
        assertThat(VertexTryOnRenderClient.toPublicUrl("https://cdn.example.com/x.png")).isEqualTo("https://cdn.example.com/x.png");
    }

    @Test
    void appliesSyntheticWatermark_ReflectsConfiguration() {
        assertThat(client(request -> Mono.empty(), "p", "t").appliesSyntheticWatermark()).isTrue();
    }

    private static VertexTryOnRenderClient client(ExchangeFunction exchange, String projectId, String accessToken) {
        return new VertexTryOnRenderClient(
            WebClient.builder().exchangeFunction(exchange),
            "https://vertex.test",
            projectId,
            "us-central1",
            accessToken,
            "gs://lookvault-renders/tryon",
            "gs://models/default.jpg",
            1,
            true
        );
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
