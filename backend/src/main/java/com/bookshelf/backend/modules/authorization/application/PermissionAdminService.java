package com.bookshelf.backend.modules.authorization.application;

import java.util.List;

import com.bookshelf.backend.global.error.ProblemException;
import com.bookshelf.backend.modules.authorization.application.PermissionCatalogChangedEvent.Change;
import com.bookshelf.backend.modules.authorization.domain.Permission;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.PermissionRepository;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.RolePermissionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Defines and removes permission names. The engine reloads its catalog once
 * the surrounding transaction commits.
 */
@Service
@Transactional
public class PermissionAdminService {

    private static final Logger log = LoggerFactory.getLogger(PermissionAdminService.class);

    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final ApplicationEventPublisher eventPublisher;

    public PermissionAdminService(
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            ApplicationEventPublisher eventPublisher
    ) {
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(readOnly = true)
    public List<String> listNames() {
        return permissionRepository.findAllNames();
    }

    public Permission define(String name) {
        String normalized = name.trim();
        if (permissionRepository.existsByName(normalized)) {
            throw new ProblemException(HttpStatus.CONFLICT, "PERMISSION_EXISTS", "Permission already exists: " + normalized);
        }
        Permission saved;
        try {
            saved = permissionRepository.saveAndFlush(new Permission(normalized));
        } catch (DataIntegrityViolationException ex) {
            // lost a race with a concurrent define of the same name
            throw new ProblemException(HttpStatus.CONFLICT, "PERMISSION_EXISTS", "Permission already exists: " + normalized);
        }
        eventPublisher.publishEvent(new PermissionCatalogChangedEvent(normalized, Change.DEFINED));
        log.info("Permission defined: {}", normalized);
        return saved;
    }

    public void remove(String name) {
        String normalized = name.trim();
        Permission permission = permissionRepository.findByName(normalized)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PERMISSION_NOT_FOUND", "Permission not found: " + normalized));
        int detached = rolePermissionRepository.deleteByPermissionId(permission.getId());
        permissionRepository.delete(permission);
        eventPublisher.publishEvent(new PermissionCatalogChangedEvent(normalized, Change.REMOVED));
        log.info("Permission removed: {} (detached from {} role(s))", normalized, detached);
    }
}
