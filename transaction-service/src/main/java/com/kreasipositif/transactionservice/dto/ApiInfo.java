package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Service landing information")
public record ApiInfo(
        @Schema(example = "Banking Transactions API") String message,
        @Schema(example = "1.0.0") String version,
        @Schema(example = "/swagger-ui.html") String docs) {
}
