package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.service.StatusReconciler;
import com.example.reelbot_backend.service.WebhookSignatureVerifier;
import com.example.reelbot_backend.util.UnknownProviderStateException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProviderWebhookController.class)
@AutoConfigureMockMvc(addFilters = false)
class ProviderWebhookControllerTest {

    private static final String COMPLETED = "{\"request_id\":\"req-1\",\"status\":\"COMPLETED\",\"payload\":{\"video\":{\"url\":\"https://cdn/v.mp4\"}}}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookSignatureVerifier verifier;

    @MockitoBean
    private StatusReconciler reconciler;

    @Test
    void invalidSignatureIsUnauthorized() throws Exception {
        when(verifier.verify(any(), eq("bad"))).thenReturn(false);

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Provider-Signature", "bad").content(COMPLETED))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));

        verify(reconciler, never()).onWebhook(any());
    }

    @Test
    void signedNotificationIsAcknowledgedWithOutcome() throws Exception {
        when(verifier.verify(any(), eq("good"))).thenReturn(true);
        when(reconciler.onWebhook(any())).thenReturn(StatusReconciler.Outcome.JOB);

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Webhook-Signature", "good").content(COMPLETED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true))
                .andExpect(jsonPath("$.outcome").value("job"));
    }

    @Test
    void unmatchedHandleIsStillAcknowledged() throws Exception {
        when(verifier.verify(any(), any())).thenReturn(true);
        when(reconciler.onWebhook(any())).thenReturn(StatusReconciler.Outcome.UNMATCHED);

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Provider-Signature", "sig").content(COMPLETED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("unmatched"));
    }

    @Test
    void malformedPayloadsAreBadRequests() throws Exception {
        when(verifier.verify(any(), any())).thenReturn(true);

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Provider-Signature", "sig").content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_JSON"));

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Provider-Signature", "sig").content("{\"status\":\"COMPLETED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_FIELDS"));
    }

    @Test
    void unknownStateIsBadRequest() throws Exception {
        when(verifier.verify(any(), any())).thenReturn(true);
        when(reconciler.onWebhook(any())).thenThrow(new UnknownProviderStateException("PAUSED"));

        mockMvc.perform(post("/v1/webhooks/provider").contentType(MediaType.APPLICATION_JSON)
                        .header("X-Provider-Signature", "sig")
                        .content("{\"request_id\":\"req-1\",\"status\":\"PAUSED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_STATE"));
    }

    @Test
    void challengeIsEchoed() throws Exception {
        mockMvc.perform(get("/v1/webhooks/provider").param("challenge", "abc123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.challenge").value("abc123"));
    }
}
