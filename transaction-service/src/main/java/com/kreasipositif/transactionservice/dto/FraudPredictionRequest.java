package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * A hypothetical transaction to score against the currently visible data.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Transaction to score")
public class FraudPredictionRequest {

    @Schema(description = "Optional transaction ID, informational only", example = "999999")
    private Integer transactionId;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0", message = "amount must be greater than or equal to 0")
    @Schema(example = "15000", requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal amount;

    @NotNull(message = "client_id is required")
    @Schema(example = "825", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer clientId;

    /**
     * Free-text type. Only an exact {@code TRANSFER} counts as a transfer; other values are
     * scored without the large-transfer rule.
     */
    @NotBlank(message = "transaction_type is required")
    @Schema(example = "TRANSFER", requiredMode = Schema.RequiredMode.REQUIRED)
    private String transactionType;

    @Schema(example = "925")
    private Integer recipientId;
}
