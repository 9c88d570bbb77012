package org.kioskfleet.dto;

import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * One page of results plus the pagination block the admin UI renders.
 */
public record PagedResponse<T>(List<T> items, Pagination pagination) {

    public record Pagination(int currentPage,
                             int totalPages,
                             long totalItems,
                             int itemsPerPage,
                             boolean hasNextPage,
                             boolean hasPreviousPage) {
    }

    public static <E, T> PagedResponse<T> from(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        Pagination pagination = new Pagination(
                page.getNumber() + 1,
                page.getTotalPages(),
                page.getTotalElements(),
                page.getSize(),
                page.hasNext(),
                page.hasPrevious());
        return new PagedResponse<>(items, pagination);
    }
}
