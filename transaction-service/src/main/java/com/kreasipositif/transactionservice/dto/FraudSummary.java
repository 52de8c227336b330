package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Fraud heuristics applied to every visible transaction.
 */
@Getter
@Builder
@Schema(description = "Fraud detection summary")
public class FraudSummary {

    @Schema(description = "Transactions with at least one suspicion reason", example = "75")
    private final long totalSuspicious;

    @Schema(description = "Transactions with two or more reasons", example = "3")
    private final long totalFlagged;

    @Schema(description = "Suspicious share of visible transactions (%)", example = "5.0")
    private final double fraudRate;

    @Schema(description = "Sum of flagged amounts", example = "15234.80")
    private final BigDecimal totalAmountAtRisk;
}
