package com.kreasipositif.transactionservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Paginated envelope. {@code total} counts every matching item before slicing.
 */
@Getter
@Builder
@Schema(description = "Paginated result envelope")
public class PagedResponse<T> {

    @Schema(description = "Items of the requested page")
    private final List<T> items;

    @Schema(description = "Number of matching items across all pages", example = "1234")
    private final long total;

    @Schema(description = "Current page (1-based)", example = "1")
    private final int page;

    @Schema(description = "Requested page size", example = "10")
    private final int pageSize;

    @Schema(description = "Number of pages; 0 when nothing matched", example = "124")
    private final int totalPages;

    /**
     * Slices an already ordered result list.
     */
    public static <T> PagedResponse<T> of(List<T> ordered, PageQuery pageQuery) {
        int from = (int) Math.min(pageQuery.offset(), ordered.size());
        int to = Math.min(from + pageQuery.pageSize(), ordered.size());
        return PagedResponse.<T>builder()
                .items(List.copyOf(ordered.subList(from, to)))
                .total(ordered.size())
                .page(pageQuery.page())
                .pageSize(pageQuery.pageSize())
                .totalPages(pageQuery.totalPages(ordered.size()))
                .build();
    }

    /**
     * Wraps a whole result list as a single page.
     */
    public static <T> PagedResponse<T> unpaged(List<T> ordered) {
        return PagedResponse.<T>builder()
                .items(List.copyOf(ordered))
                .total(ordered.size())
                .page(1)
                .pageSize(ordered.size())
                .totalPages(ordered.isEmpty() ? 0 : 1)
                .build();
    }
}
