package com.viral.prediction.controller;

import com.viral.prediction.repository.PredictionRecordRepository;
import com.viral.prediction.repository.ViralDataPointRepository;
import com.viral.prediction.scheduler.LearningScheduler;
import com.viral.prediction.service.cache.PredictionCache;
import com.viral.prediction.service.engine.ViralPredictionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-01-10T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ViralDataPointRepository dataPointRepository;

    @MockBean
    private PredictionRecordRepository predictionRecordRepository;

    @MockBean
    private ViralPredictionEngine engine;

    @MockBean
    private LearningScheduler learningScheduler;

    @Test
    void health_reportsCountsCacheAndJobs() throws Exception {
        when(dataPointRepository.count()).thenReturn(42L);
        when(predictionRecordRepository.count()).thenReturn(7L);
        when(engine.getCacheStats()).thenReturn(new PredictionCache.CacheStats(2, 5, 5, 0.5, 0));
        when(learningScheduler.getJobs()).thenReturn(List.of(new LearningScheduler.JobStatus(
                LearningScheduler.TREND_REFRESH, Duration.ofMinutes(30), Instant.parse("2024-01-10T12:30:00Z"), false)));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.dataPointCount").value(42))
                .andExpect(jsonPath("$.pendingPredictionCount").value(7))
                .andExpect(jsonPath("$.dataAccess").value("OK"))
                .andExpect(jsonPath("$.cache.hitRate").value(0.5))
                .andExpect(jsonPath("$.scheduledJobs[0].name").value("trend-refresh"));
    }

    @Test
    void health_staysUpWhenDatabaseFails() throws Exception {
        when(dataPointRepository.count()).thenThrow(new IllegalStateException("connection refused"));
        when(learningScheduler.getJobs()).thenReturn(List.of());

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.dataAccess").value("ERROR: connection refused"));
    }
}
