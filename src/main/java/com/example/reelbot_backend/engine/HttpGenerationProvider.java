package com.example.reelbot_backend.engine;

import com.example.reelbot_backend.config.ProviderProperties;
import com.example.reelbot_backend.engine.Interfaces.GenerationProvider;
import com.example.reelbot_backend.service.queue.VideoResult;
import com.example.reelbot_backend.util.ProviderState;
import com.example.reelbot_backend.util.UnknownProviderStateException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Queue-style HTTP provider: submissions return a request id which is later polled for status and
 * result. Transient failures are retried a couple of times here before they surface to the caller.
 */
@Component
public class HttpGenerationProvider implements GenerationProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpGenerationProvider.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final ProviderProperties props;

    public HttpGenerationProvider(@Qualifier("providerWebClient") WebClient client, ProviderProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String submit(GenerationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", request.prompt());
        if (request.imageUrl() != null) body.put("image_url", request.imageUrl());
        if (request.voiceId() != null) body.put("voice", request.voiceId());
        if (request.aspectRatio() != null) body.put("aspect_ratio", request.aspectRatio());
        if (request.durationSeconds() != null) body.put("duration", String.valueOf(request.durationSeconds()));
        String model = modelFor(request.target());
        LOGGER.info("PROVIDER SUBMIT target={} model={} promptLength={}", request.target(), model,
                request.prompt() == null ? 0 : request.prompt().length());
        return enqueue(model, body);
    }

    @Override
    public String submitStitch(StitchRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("video_urls", request.videoUrls());
        if (request.aspectRatio() != null) body.put("aspect_ratio", request.aspectRatio());
        LOGGER.info("PROVIDER STITCH model={} clips={}", props.getStitchModel(), request.videoUrls().size());
        return enqueue(props.getStitchModel(), body);
    }

    @Override
    public ProviderStatus status(Target target, String handle) {
        String path = "/" + modelFor(target) + "/requests/" + handle + "/status";
        JsonNode root = call("status handle=" + handle, () -> client.get()
                .uri(b -> b.path(path).queryParam("logs", "0").build())
                .retrieve()
                .bodyToMono(JsonNode.class));
        String rawState = text(root, "status");
        ProviderState state;
        try {
            state = ProviderState.fromWire(rawState);
        } catch (UnknownProviderStateException e) {
            throw new ProviderException("Unknown provider state '" + rawState + "' for handle " + handle, false, e);
        }
        Integer position = root.hasNonNull("queue_position") ? root.get("queue_position").asInt() : null;
        return new ProviderStatus(state, position, text(root, "error"));
    }

    @Override
    public VideoResult result(Target target, String handle) {
        String path = "/" + modelFor(target) + "/requests/" + handle;
        JsonNode root = call("result handle=" + handle, () -> client.get()
                .uri(b -> b.path(path).build())
                .retrieve()
                .bodyToMono(JsonNode.class));
        return ProviderPayloads.parseVideo(root)
                .orElseThrow(() -> new ProviderException("Provider result for " + handle + " has no video URL", false));
    }

    private String enqueue(String model, Map<String, Object> body) {
        String callback = props.getWebhook().getCallbackUrl();
        JsonNode root = call("submit model=" + model, () -> client.post()
                .uri(b -> {
                    b.path("/" + model);
                    if (callback != null && !callback.isBlank()) b.queryParam("fal_webhook", callback);
                    return b.build();
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class));
        String handle = text(root, "request_id");
        if (handle == null || handle.isBlank()) {
            throw new ProviderException("Provider accepted the request without a request_id", false);
        }
        return handle;
    }

    private JsonNode call(String what, Supplier<Mono<JsonNode>> request) {
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        try {
            JsonNode root = request.get()
                    .timeout(timeout)
                    .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                            .filter(HttpGenerationProvider::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn("PROVIDER RETRY call={} attempt={} type={} message={}",
                                    what, signal.totalRetriesInARow() + 1,
                                    signal.failure().getClass().getSimpleName(), signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
            if (root == null) {
                throw new ProviderException("Empty provider response for " + what, true);
            }
            return root;
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            boolean retryable = isRetryable(cause);
            LOGGER.warn("PROVIDER FAIL call={} retryable={} error={}", what, retryable, cause.toString());
            throw new ProviderException("Provider call failed (" + what + "): " + describe(cause), retryable, cause);
        }
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof WebClientResponseException wre) {
            int code = wre.getStatusCode().value();
            return code == 429 || code == 502 || code == 503 || code == 504 || code == 408;
        }
        return t instanceof WebClientRequestException || t instanceof TimeoutException;
    }

    private static Throwable unwrap(RuntimeException e) {
        // block() wraps checked exceptions such as TimeoutException
        if (e.getCause() instanceof TimeoutException te) return te;
        return e;
    }

    private static String describe(Throwable t) {
        if (t instanceof WebClientResponseException wre) {
            return wre.getStatusCode().value() + " " + wre.getResponseBodyAsString();
        }
        if (t instanceof TimeoutException) {
            return "timeout";
        }
        return t.getMessage();
    }

    private String modelFor(Target target) {
        return switch (target) {
            case VIDEO -> props.getModel();
            case CLIP -> props.getClipModel();
            case STITCH -> props.getStitchModel();
        };
    }

    private static String text(JsonNode node, String field) {
        return ProviderPayloads.text(node, field);
    }
}
