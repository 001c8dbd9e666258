package com.viral.runtime.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.viral.runtime.config.ModelRuntimeProperties;
import com.viral.runtime.dto.ModelMetrics;
import com.viral.runtime.dto.ModelSpec;
import com.viral.runtime.dto.PredictRequest;
import com.viral.runtime.dto.RuntimePrediction;
import com.viral.runtime.dto.TrainRequest;
import com.viral.runtime.dto.TrainingConfig;
import com.viral.runtime.dto.TrainingJob;
import com.viral.runtime.exception.ModelRuntimeException;
import com.viral.runtime.exception.ModelRuntimeTimeoutException;
import org.junit.jupiter.api.BeforeEach;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ModelRuntimeClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private ModelRuntimeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ModelRuntimeProperties();
        properties.setCallTimeoutMs(200);
    }

    private ModelRuntimeClient clientReturning(HttpStatus status, String json) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(json)
                    .build());
        };
        WebClient webClient = WebClient.builder().baseUrl("http://runtime").exchangeFunction(exchange).build();
        return new ModelRuntimeClient(webClient, properties, new ObjectMapper());
    }

    @Test
    void registerModel_returnsModelIdFromRegistry() {
        ModelRuntimeClient client = clientReturning(HttpStatus.OK, "{\"modelId\":\"twitter-v1\",\"extra\":true}");

        String id = client.registerModel(new ModelSpec("viral-twitter", "twitter", "ensemble", "1.0.0", Map.of(), Map.of()));

        assertEquals("twitter-v1", id);
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertThat(requests.get(0).url().getPath()).isEqualTo("/models");
    }

    @Test
    void predict_mapsPredictionAndConfidence() {
        ModelRuntimeClient client = clientReturning(HttpStatus.OK,
                "{\"prediction\":0.62,\"confidence\":0.71,\"explanation\":{\"sentiment_score\":0.2}}");

        RuntimePrediction result = client.predict(new PredictRequest("m-1", Map.of("text_length", 80.0),
                PredictRequest.Options.full()));

        assertEquals(0.62, result.prediction(), 1e-9);
        assertEquals(0.71, result.confidence(), 1e-9);
        assertThat(result.explanation()).containsEntry("sentiment_score", 0.2);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/models/m-1/predict");
    }

    @Test
    void trainingJobAndMetrics_areDeserialized() {
        ModelRuntimeClient jobClient = clientReturning(HttpStatus.OK,
                "{\"jobId\":\"job-9\",\"status\":\"COMPLETED\",\"metrics\":{\"val_accuracy\":0.88}}");
        TrainingJob job = jobClient.getTrainingJob("job-9");
        assertTrue(job.isTerminal());
        assertEquals(0.88, job.metric("val_accuracy"), 1e-9);

        ModelRuntimeClient metricsClient = clientReturning(HttpStatus.OK, "{\"modelId\":\"m-1\",\"accuracy\":0.81}");
        ModelMetrics metrics = metricsClient.getModelMetrics("m-1");
        assertEquals(0.81, metrics.accuracy(), 1e-9);
        assertNull(metrics.auc());
    }

    @Test
    void trainModel_withoutJobId_isRejected() {
        ModelRuntimeClient client = clientReturning(HttpStatus.OK, "{}");

        assertThrows(ModelRuntimeException.class, () -> client.trainModel(
                new TrainRequest("m-1", "ds-1", TrainingConfig.viralDefaults())));
    }

    @Test
    void httpError_isWrappedAsModelRuntimeException() {
        ModelRuntimeClient client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}");

        ModelRuntimeException e = assertThrows(ModelRuntimeException.class, () -> client.getModelMetrics("m-1"));
        assertEquals("getModelMetrics", e.getOperation());
        assertThat(e.getMessage()).contains("503");
    }

    @Test
    void slowRuntime_raisesTimeout() {
        ExchangeFunction never = request -> Mono.never();
        WebClient webClient = WebClient.builder().baseUrl("http://runtime").exchangeFunction(never).build();
        ModelRuntimeClient client = new ModelRuntimeClient(webClient, properties, new ObjectMapper());

        assertThrows(ModelRuntimeTimeoutException.class, () -> client.predict(
                new PredictRequest("m-1", Map.of(), PredictRequest.Options.full())));
    }
}
