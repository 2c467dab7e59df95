package com.bookshelf.backend.modules.book.presentation.dto;

import java.util.List;

import org.springframework.data.domain.Page;

public record BookPageResponse(
        List<BookResponse> data,
        Meta meta
) {

    public static BookPageResponse from(Page<BookResponse> page, int currentPage) {
        int perPage = page.getSize();
        long total = page.getTotalElements();
        int lastPage = Math.max(page.getTotalPages(), 1);
        Long from = null;
        Long to = null;
        if (page.hasContent()) {
            from = (long) (currentPage - 1) * perPage + 1;
            to = from + page.getNumberOfElements() - 1;
        }
        return new BookPageResponse(
                List.copyOf(page.getContent()),
                new Meta(currentPage, from, lastPage, perPage, to, total)
        );
    }

    /**
     * {@code from} and {@code to} are 1-based item positions, null for an empty page.
     */
    public record Meta(
            int currentPage,
            Long from,
            int lastPage,
            int perPage,
            Long to,
            long total
    ) {
    }
}
