package com.florist.flowerservice.domain.shared;

import java.util.List;
import java.util.function.Function;

/**
 * A slice of a larger result together with the counts a client needs to page through it.
 *
 * @param data rows on this page
 * @param total rows across all pages
 * @param page 1-based page number
 * @param perPage requested page size
 * @param totalPages {@code ceil(total / perPage)}
 */
public record Page<T>(List<T> data, long total, int page, int perPage, long totalPages) {

    public Page {
        data = List.copyOf(data);
    }

    public static <T> Page<T> of(List<T> data, long total, Pagination pagination) {
        long totalPages = (total + pagination.perPage() - 1) / pagination.perPage();
        return new Page<>(data, total, pagination.page(), pagination.perPage(), totalPages);
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = data.stream().<R>map(mapper).toList();
        return new Page<>(mapped, total, page, perPage, totalPages);
    }
}
