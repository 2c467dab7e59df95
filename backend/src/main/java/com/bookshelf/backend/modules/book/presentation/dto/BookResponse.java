package com.bookshelf.backend.modules.book.presentation.dto;

import java.time.OffsetDateTime;

import com.bookshelf.backend.modules.book.domain.Book;

public record BookResponse(
        Long id,
        String title,
        String description,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static BookResponse from(Book book) {
        return new BookResponse(
                book.getId(),
                book.getTitle(),
                book.getDescription(),
                book.getCreatedAt(),
                book.getUpdatedAt()
        );
    }
}
