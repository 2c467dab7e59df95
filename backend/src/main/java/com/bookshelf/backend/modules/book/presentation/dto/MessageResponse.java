package com.bookshelf.backend.modules.book.presentation.dto;

public record MessageResponse(String message) {
}
