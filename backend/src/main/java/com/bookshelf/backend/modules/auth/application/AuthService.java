package com.bookshelf.backend.modules.auth.application;

import com.bookshelf.backend.global.error.ProblemException;
import com.bookshelf.backend.modules.auth.domain.UserAccount;
import com.bookshelf.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.bookshelf.backend.modules.auth.presentation.dto.LoginRequest;
import com.bookshelf.backend.modules.auth.presentation.dto.TokenResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        // Unknown email and wrong password produce the same response.
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(request.email().trim())
                .filter(account -> passwordEncoder.matches(request.password(), account.getPasswordHash()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid credentials"));

        return jwtTokenService.issueAccessToken(user.getId(), user.getEmail());
    }
}
