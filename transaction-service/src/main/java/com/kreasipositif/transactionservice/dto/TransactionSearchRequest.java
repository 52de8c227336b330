package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request payload for free-text transaction search. Without {@code pagination} the whole
 * result is returned as a single page.
 */
@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Free-text search over description and type")
public class TransactionSearchRequest {

    @NotBlank(message = "query must not be blank")
    @Schema(description = "Case-insensitive text to look for", example = "card 4524",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String query;

    @Valid
    @Schema(description = "Optional filters applied before the text match")
    private TransactionFilterRequest filters;

    @Valid
    @Schema(description = "Optional pagination")
    private PaginationRequest pagination;
}
