package com.contentdesk.backend.global.web;

import java.util.List;
import java.util.function.Function;

import org.springframework.data.domain.Page;

/**
 * 목록 응답 공통 포맷: {@code {data, meta}}.
 */
public record PageResponse<T>(List<T> data, Meta meta) {

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        List<T> items = page.getContent().stream().map(mapper).toList();
        int currentPage = page.getNumber() + 1;
        Meta meta = new Meta(
                page.getTotalElements(),
                currentPage,
                page.getSize(),
                page.getTotalPages(),
                page.hasNext(),
                page.hasPrevious()
        );
        return new PageResponse<>(items, meta);
    }

    public record Meta(
            long total,
            int page,
            int limit,
            int totalPages,
            boolean hasNext,
            boolean hasPrevious
    ) {
    }
}
