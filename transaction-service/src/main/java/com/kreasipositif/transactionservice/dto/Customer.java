package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@Schema(description = "Customer with aggregates over the transactions they sent")
public class Customer {

    @Schema(example = "825")
    private final int id;

    @Schema(example = "12")
    private final long totalTransactions;

    @Schema(example = "2915.40")
    private final BigDecimal totalAmount;

    @Schema(example = "242.95")
    private final BigDecimal averageAmount;

    @Schema(description = "Cards the customer holds in the source data", example = "3")
    private final long cardsCount;
}
