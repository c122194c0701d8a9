package com.example.reelbot_backend.controller;

import com.example.reelbot_backend.dto.composite.CompositeStartResponse;
import com.example.reelbot_backend.service.PipelineCoordinator;
import com.example.reelbot_backend.service.ProgressBroadcaster;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CompositeController.class)
@AutoConfigureMockMvc(addFilters = false)
class CompositeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PipelineCoordinator coordinator;

    @MockitoBean
    private ProgressBroadcaster broadcaster;

    @Test
    void startReturnsAcceptedWithEstimate() throws Exception {
        UUID id = UUID.randomUUID();
        when(coordinator.start(any())).thenReturn(new CompositeStartResponse(id, "generating_clips", 3, 180));

        mockMvc.perform(post("/v1/composites").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"o\",\"reviewId\":\"r\",\"actorId\":\"maya\",\"script\":\"Hello there friend.\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.compositeVideoId").value(id.toString()))
                .andExpect(jsonPath("$.totalClips").value(3))
                .andExpect(jsonPath("$.estimatedTime").value(180));
    }

    @Test
    void missingActorIsRejectedBeforeTheCoordinator() throws Exception {
        mockMvc.perform(post("/v1/composites").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"o\",\"reviewId\":\"r\",\"script\":\"Hello there friend.\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ACTOR_ID_REQUIRED"));
    }

    @Test
    void unknownCompositeIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(broadcaster.compositeSnapshot(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/composites/" + id)).andExpect(status().isNotFound());
    }

    @Test
    void retryOfHealthyClipIsConflict() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new IllegalStateException("Clip 2 is not failed")).when(coordinator).retryClip(id, 2);

        mockMvc.perform(post("/v1/composites/" + id + "/clips/2/retry"))
                .andExpect(status().isConflict());
    }

    @Test
    void failAndDeleteReturnNoContent() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(post("/v1/composites/" + id + "/fail").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"customer withdrew\"}"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/v1/composites/" + id)).andExpect(status().isNoContent());

        verify(coordinator).fail(id, "customer withdrew");
        verify(coordinator).delete(id);
    }

    @Test
    void deletingUnknownCompositeIsNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        doThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "COMPOSITE_NOT_FOUND")).when(coordinator).delete(id);

        mockMvc.perform(delete("/v1/composites/" + id)).andExpect(status().isNotFound());
    }
}
