package com.example.Orin.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Orin API",
                version = "v1",
                description = "Office assistant queries, document ingestion and search"
        )
)
public class OpenApiConfig {
}
