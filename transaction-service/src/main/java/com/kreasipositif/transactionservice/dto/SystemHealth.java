package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

@Getter
@Builder
@Schema(description = "Service health")
public class SystemHealth {

    @Schema(description = "OK or ERROR", example = "OK")
    private final String status;

    private final LocalDateTime timestamp;

    @Schema(example = "true")
    private final boolean dataLoaded;

    @Schema(description = "Derived transactions held in memory", example = "24000")
    private final long transactionsCount;
}
