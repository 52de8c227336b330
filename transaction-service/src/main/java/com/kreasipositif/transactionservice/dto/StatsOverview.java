package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Global statistics over the visible transactions. All numbers are zero when nothing is visible.
 */
@Getter
@Builder
@Schema(description = "Global statistics over visible transactions")
public class StatsOverview {

    @Schema(description = "Number of visible transactions", example = "1500")
    private final long totalTransactions;

    @Schema(description = "Sum of amounts", example = "243105.50")
    private final BigDecimal totalAmount;

    @Schema(description = "Mean amount, rounded to cents", example = "162.07")
    private final BigDecimal averageAmount;

    @Schema(description = "Smallest amount", example = "1.00")
    private final BigDecimal minAmount;

    @Schema(description = "Largest amount", example = "5120.75")
    private final BigDecimal maxAmount;

    @Schema(description = "Distinct sender clients", example = "320")
    private final long uniqueCustomers;

    @Schema(description = "Transaction count per status, largest first")
    private final Map<String, Long> transactionsByStatus;
}
