package org.example.storyteller.controller;

import org.example.storyteller.model.FailoverEvent;
import org.example.storyteller.model.FailoverReason;
import org.example.storyteller.model.PlotPoint;
import org.example.storyteller.model.SegmentNarration;
import org.example.storyteller.model.SessionContext;
import org.example.storyteller.model.SynthesisResult;
import org.example.storyteller.service.StorySynthesisService;
import org.example.storyteller.service.backend.NarrationBackendRegistry;
import org.example.storyteller.service.backend.ScriptedNarrationBackend;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SynthesisController.class)
class SynthesisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StorySynthesisService storySynthesisService;

    @MockitoBean
    private NarrationBackendRegistry backendRegistry;

    @Test
    void synthesize_returnsResult() throws Exception {
        SynthesisResult result = new SynthesisResult(
                "Thorn drew his axe.",
                1,
                List.of("Thorn"),
                List.of(),
                List.of(new PlotPoint(0, "Thorn attacks the ogre")),
                1.0,
                List.of(new FailoverEvent(0, "remote", "offline", FailoverReason.UNAVAILABLE, "timeout")),
                0.25,
                true,
                null,
                null,
                List.of(new SegmentNarration(0, "Thorn drew his axe.", "offline", true, Duration.ofMillis(40)))
        );
        when(storySynthesisService.synthesize(
                eq("Thorn attacks the ogre."), isNull(), eq(List.of("remote", "offline")), isNull()))
                .thenReturn(result);

        mockMvc.perform(post("/api/synthesis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript\":\"Thorn attacks the ogre.\",\"backends\":[\"remote\",\"offline\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.storyText", is("Thorn drew his axe.")))
                .andExpect(jsonPath("$.characters[0]", is("Thorn")))
                .andExpect(jsonPath("$.failoverEvents", hasSize(1)))
                .andExpect(jsonPath("$.failoverEvents[0].toBackend", is("offline")))
                .andExpect(jsonPath("$.narrations[0].backendName", is("offline")));
    }

    @Test
    void synthesize_emptyTranscript_returnsBadRequestWithResult() throws Exception {
        when(storySynthesisService.synthesize(eq(""), any(), any(), eq(500)))
                .thenReturn(SynthesisResult.segmentationFailure("Transcript is empty; nothing to segment", 0.0));

        mockMvc.perform(post("/api/synthesis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript\":\"\",\"segmentTokenBudget\":500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.failureReason", is("SEGMENTATION_ERROR")))
                .andExpect(jsonPath("$.segmentsProcessed", is(0)));
    }

    @Test
    void synthesize_unknownBackend_returnsBadRequest() throws Exception {
        when(storySynthesisService.synthesize(anyString(), any(), any(), ArgumentMatchers.<Integer>any()))
                .thenThrow(new IllegalArgumentException("Unknown narration backend: cloud"));

        mockMvc.perform(post("/api/synthesis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transcript\":\"Some text.\",\"backends\":[\"cloud\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Unknown narration backend: cloud")));
    }

    @Test
    void synthesize_passesSessionContextThrough() throws Exception {
        when(storySynthesisService.synthesize(anyString(), any(), any(), ArgumentMatchers.<Integer>any()))
                .thenReturn(SynthesisResult.segmentationFailure("unused", 0.0));

        mockMvc.perform(post("/api/synthesis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"transcript":"Thorn: We ride at dawn.",
                         "context":{"sessionName":"Night 3","setting":"The Sword Coast",
                                    "characters":["Thorn","Vex"],"previousEvents":["The crypt flooded"]}}
                        """));

        ArgumentCaptor<SessionContext> context = ArgumentCaptor.forClass(SessionContext.class);
        verify(storySynthesisService).synthesize(eq("Thorn: We ride at dawn."), context.capture(), isNull(), isNull());
        assertEquals("Night 3", context.getValue().sessionName());
        assertEquals("The Sword Coast", context.getValue().setting());
        assertEquals(List.of("Thorn", "Vex"), context.getValue().characters());
        assertEquals(List.of("The crypt flooded"), context.getValue().previousEvents());
        assertNull(context.getValue().campaignNotes());
    }

    @Test
    void backends_listsConfiguredBackends() throws Exception {
        when(backendRegistry.getBackends()).thenReturn(List.of(
                ScriptedNarrationBackend.echo("local", 2500),
                ScriptedNarrationBackend.echo("offline", 2000)));
        when(backendRegistry.getDefaultPreference()).thenReturn(List.of("local", "offline"));

        mockMvc.perform(get("/api/synthesis/backends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultPreference[0]", is("local")))
                .andExpect(jsonPath("$.backends", hasSize(2)))
                .andExpect(jsonPath("$.backends[1].name", is("offline")))
                .andExpect(jsonPath("$.backends[1].maxTokensPerSegment", is(2000)))
                .andExpect(jsonPath("$.backends[1].metered", is(false)))
                .andExpect(jsonPath("$.backends[1].available", is(true)));
    }
}
