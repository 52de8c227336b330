package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement of a soft delete")
public record DeleteTransactionResponse(
        @Schema(example = "Transaction deleted successfully") String message,
        @Schema(example = "452400") int id) {
}
