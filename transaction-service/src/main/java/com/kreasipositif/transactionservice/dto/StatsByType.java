package com.kreasipositif.transactionservice.dto;

import com.kreasipositif.transactionservice.domain.TransactionType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@Schema(description = "Statistics for one transaction type")
public class StatsByType {

    @Schema(example = "PURCHASE")
    private final TransactionType type;

    @Schema(example = "640")
    private final long count;

    @Schema(example = "98012.40")
    private final BigDecimal totalAmount;

    @Schema(example = "153.14")
    private final BigDecimal averageAmount;

    @Schema(description = "Share of all visible transactions (%)", example = "42.67")
    private final double percentage;
}
