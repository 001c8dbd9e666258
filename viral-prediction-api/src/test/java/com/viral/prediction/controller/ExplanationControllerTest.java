package com.viral.prediction.controller;

import com.viral.prediction.dto.ViralPrediction;
import com.viral.prediction.model.Platform;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.explain.ExplainableAI;
import com.viral.prediction.service.feature.FeatureExtractor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExplanationController.class)
class ExplanationControllerTest {

    private static final String CONTENT = "{\"content\":{\"text\":\"Hello world\"},\"platform\":\"twitter\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FeatureExtractor featureExtractor;

    @MockBean
    private ExplainableAI explainableAI;

    @MockBean
    private ViralPredictionEngine engine;

    @Test
    void counterfactuals_usesGivenScoreAndDefaultTarget() throws Exception {
        mockMvc.perform(post("/api/explanations/counterfactuals").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":" + CONTENT + ",\"viralScore\":55}"))
                .andExpect(status().isOk());

        verify(explainableAI).generateCounterfactuals(eq(55.0), any(), eq(80.0));
        verifyNoInteractions(engine);
    }

    @Test
    void counterfactuals_honoursTargetScore() throws Exception {
        mockMvc.perform(post("/api/explanations/counterfactuals").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":" + CONTENT + ",\"viralScore\":55,\"targetScore\":65}"))
                .andExpect(status().isOk());

        verify(explainableAI).generateCounterfactuals(eq(55.0), any(), eq(65.0));
    }

    @Test
    void uncertainty_predictsWhenScoreIsAbsent() throws Exception {
        when(engine.predictViralPotential(any())).thenReturn(new ViralPrediction("p-1", 64, 0.7, Platform.TWITTER,
                12, 0.05, null, List.of(), List.of(), 0.6, null, null, Map.of(), false,
                Instant.parse("2024-01-10T12:00:00Z")));

        mockMvc.perform(post("/api/explanations/uncertainty").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":" + CONTENT + "}"))
                .andExpect(status().isOk());

        verify(explainableAI).explainUncertainty(eq(64.0), eq(0.7), any(), eq(Platform.TWITTER));
    }

    @Test
    void nonViral_unknownPlatformIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/explanations/non-viral").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":{\"content\":{\"text\":\"x\"},\"platform\":\"myspace\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_PLATFORM"));

        verifyNoInteractions(featureExtractor);
    }

    @Test
    void features_missingContentIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/explanations/features").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"viralScore\":40}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_BODY"));
    }

    @Test
    void features_analysesExtractedFeatures() throws Exception {
        when(explainableAI.explainFeatures(any(), eq(Platform.TWITTER))).thenReturn(List.of());

        mockMvc.perform(post("/api/explanations/features").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":" + CONTENT + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(featureExtractor).extractFeatures(any());
    }
}
