package com.viral.prediction.controller;

import com.viral.prediction.exception.InsufficientDataException;
import com.viral.prediction.exception.ModelBusyException;
import com.viral.prediction.model.Platform;
import com.viral.prediction.model.PlatformModelStateDocument;
import com.viral.prediction.service.engine.ModelPerformance;
import com.viral.prediction.service.engine.PlatformModelStateService;
import com.viral.prediction.service.engine.TrainingResult;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import com.viral.prediction.service.platform.PlatformModelRegistry;
import com.viral.prediction.service.platform.TwitterModel;
import com.viral.runtime.dto.TrainingJob;
import com.viral.runtime.exception.ModelRuntimeException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlatformModelRegistry modelRegistry;

    @MockBean
    private PlatformModelStateService modelStateService;

    @MockBean
    private ViralPredictionEngine engine;

    @Test
    void getModel_combinesConfigAndState() throws Exception {
        TwitterModel model = new TwitterModel();
        PlatformModelStateDocument state = new PlatformModelStateDocument(Platform.TWITTER);
        state.setRuntimeModelId("rt-twitter");
        state.setVersion("1.2.0");
        state.setAccuracy(0.88);
        when(modelRegistry.get(Platform.TWITTER)).thenReturn(model);
        when(modelStateService.state(Platform.TWITTER)).thenReturn(state);

        mockMvc.perform(get("/api/models/twitter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform").value("twitter"))
                .andExpect(jsonPath("$.runtimeModelId").value("rt-twitter"))
                .andExpect(jsonPath("$.version").value("1.2.0"))
                .andExpect(jsonPath("$.accuracy").value(0.88))
                .andExpect(jsonPath("$.config").exists());
    }

    @Test
    void getModel_unknownPlatformIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/models/myspace"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_PLATFORM"));
    }

    @Test
    void evaluate_returnsPerformance() throws Exception {
        when(engine.evaluateModel(Platform.TIKTOK)).thenReturn(new ModelPerformance(Platform.TIKTOK, 0.9, 0.8,
                1.0, 0.889, 0.95, List.of(List.of(5L, 1L), List.of(0L, 4L)), 10, "test-split",
                Instant.parse("2024-01-10T12:00:00Z")));

        mockMvc.perform(post("/api/models/tiktok/evaluate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accuracy").value(0.9))
                .andExpect(jsonPath("$.confusionMatrix[0][1]").value(1))
                .andExpect(jsonPath("$.source").value("test-split"));
    }

    @Test
    void evaluate_runtimeFailureIsBadGateway() throws Exception {
        when(engine.evaluateModel(Platform.YOUTUBE)).thenThrow(new ModelRuntimeException("getModelMetrics", "503"));

        mockMvc.perform(post("/api/models/youtube/evaluate"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("MODEL_RUNTIME_ERROR"));
    }

    @Test
    void train_returnsJobOutcome() throws Exception {
        when(engine.trainModel(Platform.TWITTER)).thenReturn(new TrainingResult(Platform.TWITTER,
                TrainingJob.Status.COMPLETED, "job-1", "ds-1", 0.83, "completed"));

        mockMvc.perform(post("/api/models/twitter/train"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void train_insufficientDataIsUnprocessable() throws Exception {
        when(engine.trainModel(Platform.LINKEDIN)).thenThrow(new InsufficientDataException(12, 1000));

        mockMvc.perform(post("/api/models/linkedin/train"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_DATA"))
                .andExpect(jsonPath("$.message").value("Insufficient data: 12 < 1000"));
    }

    @Test
    void train_runAlreadyInProgressIsConflict() throws Exception {
        when(engine.trainModel(Platform.TIKTOK)).thenThrow(new ModelBusyException("tiktok", "train"));

        mockMvc.perform(post("/api/models/tiktok/train"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("MODEL_BUSY"));
    }

    @Test
    void getAllModels_listsRegistry() throws Exception {
        when(modelRegistry.all()).thenReturn(Map.of(Platform.TWITTER, new TwitterModel()));
        when(modelStateService.state(Platform.TWITTER)).thenReturn(new PlatformModelStateDocument(Platform.TWITTER));

        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].platform").value("twitter"));
    }
}
