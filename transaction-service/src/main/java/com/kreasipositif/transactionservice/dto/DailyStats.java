package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Builder
@Schema(description = "Statistics for one calendar day")
public class DailyStats {

    @Schema(description = "Date (YYYY-MM-DD)", example = "2024-01-15")
    private final LocalDate date;

    @Schema(example = "7")
    private final long count;

    @Schema(example = "1204.10")
    private final BigDecimal totalAmount;

    @Schema(example = "172.01")
    private final BigDecimal averageAmount;
}
