package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.dto.webhook.ProviderWebhookPayload;
import com.example.reelbot_backend.dto.webhook.WebhookAck;
import com.example.reelbot_backend.service.StatusReconciler;
import com.example.reelbot_backend.service.WebhookSignatureVerifier;
import com.example.reelbot_backend.util.UnknownProviderStateException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Inbound provider notifications. The signature is checked on the raw bytes before anything is
 * parsed; authenticated notifications are always acknowledged unless they are malformed.
 */
@RestController
@RequestMapping("/v1/webhooks/provider")
public class ProviderWebhookController {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderWebhookController.class);

    private final WebhookSignatureVerifier verifier;
    private final StatusReconciler reconciler;
    private final ObjectMapper objectMapper;

    public ProviderWebhookController(WebhookSignatureVerifier verifier, StatusReconciler reconciler, ObjectMapper objectMapper) {
        this.verifier = verifier;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
    }

    @Operation(summary = "Receive a signed provider status notification")
    @ApiResponse(responseCode = "200", description = "Applied, duplicate or unmatched; always acknowledged")
    @ApiResponse(responseCode = "400", description = "Malformed payload or unknown provider state")
    @ApiResponse(responseCode = "401", description = "Missing or invalid signature")
    @PostMapping
    public ResponseEntity<?> receive(@RequestBody(required = false) byte[] body,
                                     @RequestHeader(value = "X-Provider-Signature", required = false) String providerSignature,
                                     @RequestHeader(value = "X-Webhook-Signature", required = false) String webhookSignature) {
        String signature = providerSignature != null ? providerSignature : webhookSignature;
        if (!verifier.verify(body, signature)) {
            LOGGER.warn("WEBHOOK rejected: invalid signature");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "INVALID_SIGNATURE"));
        }

        if (body == null || body.length == 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_JSON"));
        }
        ProviderWebhookPayload payload;
        try {
            payload = objectMapper.readValue(body, ProviderWebhookPayload.class);
        } catch (JsonProcessingException e) {
            LOGGER.warn("WEBHOOK rejected: invalid JSON {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_JSON"));
        } catch (IOException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_JSON"));
        }
        if (payload == null || isBlank(payload.requestId()) || isBlank(payload.status())) {
            return ResponseEntity.badRequest().body(Map.of("error", "MISSING_FIELDS"));
        }

        LOGGER.info("WEBHOOK received handle={} status={}", payload.requestId(), payload.status());
        try {
            StatusReconciler.Outcome outcome = reconciler.onWebhook(payload);
            return ResponseEntity.ok(new WebhookAck(true, outcome.name().toLowerCase(Locale.ROOT)));
        } catch (UnknownProviderStateException e) {
            LOGGER.warn("WEBHOOK rejected: unknown state {} handle={}", e.getRawState(), payload.requestId());
            return ResponseEntity.badRequest().body(Map.of("error", "UNKNOWN_STATE"));
        }
    }

    @GetMapping
    public Map<String, String> challenge(@RequestParam(required = false) String challenge) {
        return challenge == null ? Map.of("status", "ok") : Map.of("challenge", challenge);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
