package com.bookshelf.backend.modules.book.presentation.dto;

import com.bookshelf.backend.modules.book.domain.Book;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateBookRequest(
        @Size(max = Book.TITLE_MAX_LENGTH)
        String title,

        String description
) {
}
