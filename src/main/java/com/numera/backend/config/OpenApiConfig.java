package com.numera.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    public static final String USER_HEADER = "X-User-Id";

    @Bean
    public OpenAPI numeraIngestionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Numera Ingestion API")
                        .description("Statement import, bank aggregator sync and payment processor sync into the Numera ledger.")
                        .version("v1"))
                // identity is resolved by the gateway and forwarded as a header
                .components(new Components()
                        .addParameters(USER_HEADER, new HeaderParameter()
                                .name(USER_HEADER)
                                .required(true)
                                .schema(new StringSchema().format("uuid"))));
    }
}
