package com.discussboard.backend.global.common.paging;

import java.util.List;
import java.util.function.Function;

import org.springframework.data.domain.Page;

/**
 * Paged listing returned by every search endpoint.
 */
public record PageResponse<T>(Pagination pagination, List<T> data) {

    public record Pagination(int current, int limit, long records, int pages) {
    }

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        int limit = page.getSize();
        long records = page.getTotalElements();
        int pages = limit == 0 ? 0 : (int) Math.ceil((double) records / limit);
        List<T> data = page.getContent().stream().map(mapper).toList();
        return new PageResponse<>(new Pagination(page.getNumber() + 1, limit, records, pages), data);
    }

    public static <T> PageResponse<T> empty(int current, int limit) {
        return new PageResponse<>(new Pagination(current, limit, 0, 0), List.of());
    }
}
