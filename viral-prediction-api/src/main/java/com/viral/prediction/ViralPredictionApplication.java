package com.viral.prediction;

import com.viral.prediction.config.PredictionProperties;
import com.viral.runtime.config.ModelRuntimeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.viral.prediction", "com.viral.runtime"})
@EnableScheduling
@EnableConfigurationProperties({PredictionProperties.class, ModelRuntimeProperties.class})
public class ViralPredictionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ViralPredictionApplication.class, args);
    }
}
