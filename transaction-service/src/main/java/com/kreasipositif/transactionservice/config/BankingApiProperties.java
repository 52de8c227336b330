package com.kreasipositif.transactionservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code banking-api} section from application.yml.
 * Holds the descriptive metadata reported by the system endpoints and Swagger UI.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "banking-api")
public class BankingApiProperties {

    private String title = "Banking Transactions API";

    private String version = "1.0.0";

    private String description = "Exposes synthetic banking transactions derived from a card dataset";

    /** Deployment environment label: {@code dev} or {@code prod}. */
    private String environment = "dev";
}
