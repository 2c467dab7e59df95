package com.bookshelf.backend.modules.authorization.application;

import com.bookshelf.backend.modules.authorization.infrastructure.persistence.UserRoleRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Live lookup of role-derived permissions. Nothing is cached: every call is a
 * single existence query, so role and permission changes apply to the next check.
 */
@Component
public class RoleAssignment {

    private final UserRoleRepository userRoleRepository;

    public RoleAssignment(UserRoleRepository userRoleRepository) {
        this.userRoleRepository = userRoleRepository;
    }

    /**
     * True iff at least one role of the actor carries the named permission.
     * Joins the caller's transaction when one is active, so its timeout
     * applies to this query too.
     */
    @Transactional(readOnly = true)
    public boolean actorHasPermission(long actorId, String permissionName) {
        return userRoleRepository.existsPermissionViaRoles(actorId, permissionName);
    }
}
