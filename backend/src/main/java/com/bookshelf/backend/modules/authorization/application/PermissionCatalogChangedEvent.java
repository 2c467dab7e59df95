package com.bookshelf.backend.modules.authorization.application;

/**
 * Published when a permission is defined or removed.
 */
public record PermissionCatalogChangedEvent(String permissionName, Change change) {

    public enum Change {
        DEFINED,
        REMOVED
    }
}
