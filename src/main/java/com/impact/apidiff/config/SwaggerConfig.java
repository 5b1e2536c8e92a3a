package com.impact.apidiff.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.context.annotation.Configuration;

@OpenAPIDefinition(
        info = @Info(
                title = "API Impact Analyzer REST API",
                version = "v1",
                description = "Detects breaking changes between two revisions of a Python code base and finds the call sites they affect."
        )
)
@Configuration
public class SwaggerConfig {
}
