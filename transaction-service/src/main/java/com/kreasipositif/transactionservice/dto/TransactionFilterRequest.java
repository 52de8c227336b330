package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JSON form of {@link TransactionFilter}, used inside search requests.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Optional transaction filters, combined with AND")
public class TransactionFilterRequest {

    @Schema(description = "Transaction type", example = "PURCHASE")
    private String type;

    @Schema(description = "Sender client ID", example = "825")
    private Integer clientId;

    @Schema(description = "Recipient client ID", example = "925")
    private Integer recipientId;

    @DecimalMin(value = "0", message = "min_amount must be greater than or equal to 0")
    @Schema(description = "Minimum amount (inclusive)", example = "10")
    private BigDecimal minAmount;

    @DecimalMin(value = "0", message = "max_amount must be greater than or equal to 0")
    @Schema(description = "Maximum amount (inclusive)", example = "500")
    private BigDecimal maxAmount;

    @Schema(description = "Start date (inclusive)", example = "2024-01-01")
    private LocalDate startDate;

    @Schema(description = "End date (inclusive)", example = "2024-12-31")
    private LocalDate endDate;

    @Schema(description = "Transaction status", example = "COMPLETED")
    private String status;

    public TransactionFilter toFilter() {
        return TransactionFilter.builder()
                .type(type)
                .clientId(clientId)
                .recipientId(recipientId)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .startDate(startDate)
                .endDate(endDate)
                .status(status)
                .build();
    }
}
