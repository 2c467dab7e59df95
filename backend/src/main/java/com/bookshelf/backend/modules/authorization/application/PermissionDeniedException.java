package com.bookshelf.backend.modules.authorization.application;

import com.bookshelf.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Denial raised by {@link AuthorizationGate#require}. The message is fixed and
 * says nothing about which role or permission would have been accepted.
 */
public class PermissionDeniedException extends ProblemException {

    public static final String CODE = "forbidden";
    public static final String MESSAGE = "This action is unauthorized.";

    public PermissionDeniedException() {
        super(HttpStatus.FORBIDDEN, CODE, MESSAGE);
    }
}
