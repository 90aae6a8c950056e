package com.florist.flowerservice.domain.shared;

/**
 * One page request: 1-based page number and page size.
 *
 * @param page 1-based page number
 * @param perPage rows per page
 */
public record Pagination(int page, int perPage) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PER_PAGE = 10;
    public static final int DEFAULT_MAX_PER_PAGE = 100;

    public Pagination {
        if (page < 1) {
            throw new BadRequestException("page must be at least 1");
        }
        if (perPage < 1) {
            throw new BadRequestException("per_page must be at least 1");
        }
    }

    /**
     * Builds a pagination from optional query values.
     *
     * @param page requested page, defaults to 1 when null
     * @param perPage requested size, defaults to {@code defaultPerPage} when null
     * @param defaultPerPage size used when none was requested
     * @param maxPerPage largest size accepted
     * @throws BadRequestException when a value is out of range
     */
    public static Pagination of(Integer page, Integer perPage, int defaultPerPage, int maxPerPage) {
        int resolvedPerPage = perPage != null ? perPage : defaultPerPage;
        if (resolvedPerPage > maxPerPage) {
            throw new BadRequestException("per_page must not exceed " + maxPerPage);
        }
        return new Pagination(page != null ? page : DEFAULT_PAGE, resolvedPerPage);
    }

    public static Pagination defaults() {
        return new Pagination(DEFAULT_PAGE, DEFAULT_PER_PAGE);
    }

    /** Rows to skip. */
    public long offset() {
        return (long) (page - 1) * perPage;
    }

    /** Rows to return. */
    public int limit() {
        return perPage;
    }
}
