package com.bookshelf.backend.modules.authorization.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RoleSyncRequest(
        @NotNull
        List<@NotBlank String> roles
) {
}
