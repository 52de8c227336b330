package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@Schema(description = "Customer ranking entry")
public class CustomerSummary {

    @Schema(example = "825")
    private final int id;

    @Schema(example = "12")
    private final long totalTransactions;

    @Schema(example = "2915.40")
    private final BigDecimal totalAmount;

    @Schema(example = "242.95")
    private final BigDecimal averageAmount;

    public static CustomerSummary from(Customer customer) {
        return CustomerSummary.builder()
                .id(customer.getId())
                .totalTransactions(customer.getTotalTransactions())
                .totalAmount(customer.getTotalAmount())
                .averageAmount(customer.getAverageAmount())
                .build();
    }
}
