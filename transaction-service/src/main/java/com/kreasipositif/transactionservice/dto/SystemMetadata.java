package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
@Schema(description = "Service metadata")
public class SystemMetadata {

    @Schema(example = "1.0.0")
    private final String version;

    @Schema(example = "dev")
    private final String environment;

    @Schema(example = "24000")
    private final long totalTransactions;

    @Schema(example = "1200")
    private final long totalCustomers;

    @Schema(example = "classpath:data/cards_data.csv")
    private final String dataSource;

    private final LocalDateTime lastUpdated;
}
