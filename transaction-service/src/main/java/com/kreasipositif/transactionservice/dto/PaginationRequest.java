package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Pagination parameters")
public class PaginationRequest {

    @Min(value = 1, message = "page must be greater than or equal to 1")
    @Schema(description = "Page number", example = "1", defaultValue = "1")
    private int page = PageQuery.DEFAULT_PAGE;

    @Min(value = 1, message = "page_size must be between 1 and 100")
    @Max(value = 100, message = "page_size must be between 1 and 100")
    @Schema(description = "Items per page", example = "10", defaultValue = "10")
    private int pageSize = PageQuery.DEFAULT_PAGE_SIZE;

    public PageQuery toPageQuery() {
        return new PageQuery(page, pageSize);
    }
}
