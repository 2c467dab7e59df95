package com.bookshelf.backend.modules.book.presentation.dto;

import com.bookshelf.backend.modules.book.domain.Book;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBookRequest(
        @NotBlank
        @Size(max = Book.TITLE_MAX_LENGTH)
        String title,

        @NotBlank
        String description
) {
}
