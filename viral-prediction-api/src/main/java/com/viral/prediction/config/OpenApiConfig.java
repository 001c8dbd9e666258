package com.viral.prediction.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI viralPredictionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Viral Prediction API")
                        .description("Predicts the viral potential of social content per platform, explains the score " +
                                "and learns from recorded outcomes.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Viral Prediction")
                                .email("admin@example.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8082").description("Docker"),
                        new Server().url("http://localhost:8080").description("Local Dev")
                ));
    }
}
