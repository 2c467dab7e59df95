package com.bookshelf.backend.modules.book.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookEnvelope(
        BookResponse data,
        String message
) {

    public static BookEnvelope of(BookResponse data) {
        return new BookEnvelope(data, null);
    }

    public static BookEnvelope of(BookResponse data, String message) {
        return new BookEnvelope(data, message);
    }
}
