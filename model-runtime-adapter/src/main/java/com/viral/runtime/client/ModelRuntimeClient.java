package com.viral.runtime.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.viral.runtime.config.ModelRuntimeProperties;
import com.viral.runtime.dto.ModelMetrics;
import com.viral.runtime.dto.ModelSpec;
import com.viral.runtime.dto.PredictRequest;
import com.viral.runtime.dto.RegisteredModel;
import com.viral.runtime.dto.RuntimePrediction;
import com.viral.runtime.dto.TrainRequest;
import com.viral.runtime.dto.TrainingJob;
import com.viral.runtime.dto.TrainingJobRef;
import com.viral.runtime.exception.ModelRuntimeException;
import com.viral.runtime.exception.ModelRuntimeTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the model runtime.
 * Every call is blocking and bounded by {@code model-runtime.call-timeout-ms}.
 */
@Component
public class ModelRuntimeClient implements ModelRuntime {

    private static final Logger log = LoggerFactory.getLogger(ModelRuntimeClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration callTimeout;

    public ModelRuntimeClient(WebClient modelRuntimeWebClient, ModelRuntimeProperties properties, ObjectMapper objectMapper) {
        this.webClient = modelRuntimeWebClient;
        this.objectMapper = objectMapper;
        this.callTimeout = Duration.ofMillis(properties.getCallTimeoutMs());
    }

    @Override
    public String registerModel(ModelSpec spec) {
        RegisteredModel registered = exchange("registerModel",
                webClient.post().uri("/models").bodyValue(spec), RegisteredModel.class);
        if (registered.modelId() == null || registered.modelId().isBlank()) {
            throw new ModelRuntimeException("registerModel", "runtime returned no model id");
        }
        log.info("Registered runtime model {} for {}", registered.modelId(), spec.platform());
        return registered.modelId();
    }

    @Override
    public RuntimePrediction predict(PredictRequest request) {
        return exchange("predict",
                webClient.post().uri("/models/{modelId}/predict", request.modelId()).bodyValue(request),
                RuntimePrediction.class);
    }

    @Override
    public String trainModel(TrainRequest request) {
        TrainingJobRef ref = exchange("trainModel",
                webClient.post().uri("/models/{modelId}/train", request.modelId()).bodyValue(request),
                TrainingJobRef.class);
        if (ref.jobId() == null) {
            throw new ModelRuntimeException("trainModel", "runtime returned no job id");
        }
        return ref.jobId();
    }

    @Override
    public TrainingJob getTrainingJob(String jobId) {
        return exchange("getTrainingJob",
                webClient.get().uri("/jobs/{jobId}", jobId), TrainingJob.class);
    }

    @Override
    public ModelMetrics getModelMetrics(String modelId) {
        return exchange("getModelMetrics",
                webClient.get().uri("/models/{modelId}/metrics", modelId), ModelMetrics.class);
    }

    /**
     * Executes a request and maps the JSON body onto {@code type}.
     * HTTP errors, timeouts and unreadable bodies all surface as {@link ModelRuntimeException}.
     */
    private <T> T exchange(String operation, WebClient.RequestHeadersSpec<?> spec, Class<T> type) {
        log.debug("Calling model runtime: operation={}", operation);

        String body;
        try {
            body = spec.retrieve()
                    .bodyToMono(String.class)
                    .timeout(callTimeout)
                    .switchIfEmpty(Mono.error(new ModelRuntimeException(operation, "empty response")))
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Model runtime HTTP error: operation={}, status={}", operation, e.getStatusCode());
            throw new ModelRuntimeException(operation, "HTTP " + e.getStatusCode().value(), e);
        } catch (ModelRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (isTimeout(cause)) {
                log.warn("Model runtime timed out: operation={}, timeout={}ms", operation, callTimeout.toMillis());
                throw new ModelRuntimeTimeoutException(operation, callTimeout, cause);
            }
            log.error("Error calling model runtime: operation={}, error={}", operation, e.getMessage());
            throw new ModelRuntimeException(operation, e.getMessage(), e);
        }

        try {
            return objectMapper.readValue(body, type);
        } catch (Exception e) {
            throw new ModelRuntimeException(operation, "unreadable response: " + e.getMessage(), e);
        }
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException || current instanceof ReadTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
