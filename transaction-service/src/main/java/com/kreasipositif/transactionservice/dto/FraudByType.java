package com.kreasipositif.transactionservice.dto;

import com.kreasipositif.transactionservice.domain.TransactionType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@Builder
@Schema(description = "Fraud statistics for one transaction type")
public class FraudByType {

    @Schema(example = "TRANSFER")
    private final TransactionType type;

    @Schema(example = "12")
    private final long suspiciousCount;

    @Schema(example = "2")
    private final long flaggedCount;

    @Schema(description = "Sum of all amounts of this type", example = "40211.15")
    private final BigDecimal totalAmount;
}
