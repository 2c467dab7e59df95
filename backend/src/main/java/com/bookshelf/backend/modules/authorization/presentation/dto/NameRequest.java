package com.bookshelf.backend.modules.authorization.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record NameRequest(
        @NotBlank
        @Size(max = 255)
        String name
) {
}
