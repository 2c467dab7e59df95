package com.bookshelf.backend.modules.authorization.application;

import java.util.List;

import com.bookshelf.backend.modules.authorization.infrastructure.persistence.PermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Read-only view of the permission names currently defined in storage.
 */
@Component
public class PermissionCatalog {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalog.class);

    private final PermissionRepository permissionRepository;

    public PermissionCatalog(PermissionRepository permissionRepository) {
        this.permissionRepository = permissionRepository;
    }

    /**
     * Returns every distinct permission name. An unreachable store or a schema
     * that has not been migrated yet yields an empty list, never an exception.
     */
    public List<String> listNames() {
        try {
            return List.copyOf(permissionRepository.findAllNames());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Permission catalog unavailable, continuing with an empty catalog: {}", ex.getMessage());
            return List.of();
        }
    }
}
