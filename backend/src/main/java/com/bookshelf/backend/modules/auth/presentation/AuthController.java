package com.bookshelf.backend.modules.auth.presentation;

import com.bookshelf.backend.modules.auth.application.AuthService;
import com.bookshelf.backend.modules.auth.presentation.dto.LoginRequest;
import com.bookshelf.backend.modules.auth.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Exchange email and password for a bearer token")
    @PostMapping("/api/v1/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
