package com.bookshelf.backend.global.security;

public record JwtAuthenticationPrincipal(Long userId, String email) {
}
