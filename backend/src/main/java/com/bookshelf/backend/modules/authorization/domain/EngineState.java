package com.bookshelf.backend.modules.authorization.domain;

public enum EngineState {
    /** No catalog loaded yet; only the system actor passes. */
    UNINITIALIZED,
    /** A catalog snapshot is published. */
    READY
}
