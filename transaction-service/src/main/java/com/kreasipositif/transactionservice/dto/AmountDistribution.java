package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@Schema(description = "Transactions falling into one amount range")
public class AmountDistribution {

    @Schema(description = "Amount range, lower bound inclusive", example = "100-500")
    private final String range;

    @Schema(description = "Number of transactions in range", example = "42")
    private final long count;

    @Schema(description = "Share of all visible transactions (%)", example = "12.5")
    private final double percentage;
}
