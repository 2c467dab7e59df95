package com.bookshelf.backend.modules.authorization.presentation.dto;

import java.util.List;

public record NameListResponse(List<String> items) {

    public static NameListResponse of(List<String> names) {
        return new NameListResponse(List.copyOf(names));
    }
}
