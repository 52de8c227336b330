package com.kreasipositif.transactionservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI transactionServiceOpenAPI(BankingApiProperties apiProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(apiProperties.getTitle())
                        .description(apiProperties.getDescription() + """

                                **Exposed resources:**
                                - `/api/transactions`: list, search, look up and soft-delete transactions
                                - `/api/stats`: overview, amount distribution, per-type and daily statistics
                                - `/api/fraud`: heuristic fraud summary and single-transaction prediction
                                - `/api/customers`: per-customer aggregates and top customers
                                - `/api/system`: health and metadata
                                """)
                        .version(apiProperties.getVersion())
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
