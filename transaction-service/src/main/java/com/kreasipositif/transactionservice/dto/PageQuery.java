package com.kreasipositif.transactionservice.dto;

import com.kreasipositif.transactionservice.exception.InvalidQueryException;

/**
 * Validated pagination request: {@code page >= 1}, {@code 1 <= pageSize <= 100}.
 */
public record PageQuery(int page, int pageSize) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public PageQuery {
        if (page < 1) {
            throw new InvalidQueryException("page must be greater than or equal to 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidQueryException("page_size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    public static PageQuery of(Integer page, Integer pageSize) {
        return new PageQuery(
                page != null ? page : DEFAULT_PAGE,
                pageSize != null ? pageSize : DEFAULT_PAGE_SIZE);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    /** ceil(total / pageSize); 0 when there is nothing to page through. */
    public int totalPages(long total) {
        return (int) ((total + pageSize - 1) / pageSize);
    }
}
