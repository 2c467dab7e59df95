package com.bookshelf.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.bookshelf.backend.global.error.ProblemException;
import com.bookshelf.backend.modules.auth.domain.UserAccount;
import com.bookshelf.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.bookshelf.backend.modules.authorization.domain.Permission;
import com.bookshelf.backend.modules.authorization.domain.Role;
import com.bookshelf.backend.modules.authorization.domain.RolePermission;
import com.bookshelf.backend.modules.authorization.domain.UserRole;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.PermissionRepository;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.RolePermissionRepository;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.RoleRepository;
import com.bookshelf.backend.modules.authorization.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains roles and the two join relations (role-permission, user-role).
 * Attach and assign are idempotent; both relations are sets.
 */
@Service
@Transactional
public class RoleAdminService {

    private static final Logger log = LoggerFactory.getLogger(RoleAdminService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final UserAccountRepository userAccountRepository;
    private final Clock clock;

    public RoleAdminService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            RolePermissionRepository rolePermissionRepository,
            UserRoleRepository userRoleRepository,
            UserAccountRepository userAccountRepository,
            Clock clock
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.userRoleRepository = userRoleRepository;
        this.userAccountRepository = userAccountRepository;
        this.clock = clock;
    }

    public Role create(String name) {
        String normalized = name.trim();
        if (roleRepository.existsByName(normalized)) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_EXISTS", "Role already exists: " + normalized);
        }
        Role saved;
        try {
            saved = roleRepository.saveAndFlush(new Role(normalized));
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_EXISTS", "Role already exists: " + normalized);
        }
        log.info("Role created: {}", normalized);
        return saved;
    }

    public void delete(String roleName) {
        Role role = findRole(roleName);
        userRoleRepository.deleteByRoleId(role.getId());
        rolePermissionRepository.deleteByRoleId(role.getId());
        roleRepository.delete(role);
        log.info("Role deleted: {}", roleName);
    }

    @Transactional(readOnly = true)
    public List<String> permissionsOf(String roleName) {
        return rolePermissionRepository.findPermissionNamesByRoleId(findRole(roleName).getId());
    }

    public void attachPermission(String roleName, String permissionName) {
        Role role = findRole(roleName);
        Permission permission = findPermission(permissionName);
        if (!rolePermissionRepository.existsByRoleIdAndPermissionId(role.getId(), permission.getId())) {
            rolePermissionRepository.save(new RolePermission(role, permission));
            log.info("Permission {} attached to role {}", permissionName, roleName);
        }
    }

    public void detachPermission(String roleName, String permissionName) {
        Role role = findRole(roleName);
        Permission permission = findPermission(permissionName);
        if (rolePermissionRepository.deleteByRoleIdAndPermissionId(role.getId(), permission.getId()) > 0) {
            log.info("Permission {} detached from role {}", permissionName, roleName);
        }
    }

    /**
     * Makes the role's permission set exactly {@code permissionNames}. Unknown
     * names fail the whole call before anything changes.
     */
    public void syncPermissions(String roleName, Collection<String> permissionNames) {
        Role role = findRole(roleName);
        Set<String> target = new LinkedHashSet<>(permissionNames);
        List<Permission> resolved = target.stream().map(this::findPermission).toList();
        Set<String> current = Set.copyOf(rolePermissionRepository.findPermissionNamesByRoleId(role.getId()));

        for (String existing : current) {
            if (!target.contains(existing)) {
                findPermissionIfPresent(existing).ifPresent(permission ->
                        rolePermissionRepository.deleteByRoleIdAndPermissionId(role.getId(), permission.getId()));
            }
        }
        for (Permission permission : resolved) {
            if (!current.contains(permission.getName())) {
                rolePermissionRepository.save(new RolePermission(role, permission));
            }
        }
        log.info("Role {} permissions synced to {}", roleName, target);
    }

    @Transactional(readOnly = true)
    public List<String> rolesOf(Long userId) {
        findUser(userId);
        return userRoleRepository.findRoleNamesByUserId(userId);
    }

    public void assignRole(Long userId, String roleName) {
        UserAccount user = findUser(userId);
        Role role = findRole(roleName);
        if (!userRoleRepository.existsByUserIdAndRoleId(userId, role.getId())) {
            userRoleRepository.save(new UserRole(user, role, OffsetDateTime.now(clock)));
            log.info("Role {} assigned to user {}", roleName, userId);
        }
    }

    public void revokeRole(Long userId, String roleName) {
        findUser(userId);
        Role role = findRole(roleName);
        if (userRoleRepository.deleteByUserIdAndRoleId(userId, role.getId()) > 0) {
            log.info("Role {} revoked from user {}", roleName, userId);
        }
    }

    public void syncRoles(Long userId, Collection<String> roleNames) {
        UserAccount user = findUser(userId);
        Set<String> target = new LinkedHashSet<>(roleNames);
        List<Role> resolved = target.stream().map(this::findRole).toList();
        Set<String> current = Set.copyOf(userRoleRepository.findRoleNamesByUserId(userId));

        for (String existing : current) {
            if (!target.contains(existing)) {
                roleRepository.findByName(existing).ifPresent(role ->
                        userRoleRepository.deleteByUserIdAndRoleId(userId, role.getId()));
            }
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (Role role : resolved) {
            if (!current.contains(role.getName())) {
                userRoleRepository.save(new UserRole(user, role, now));
            }
        }
        log.info("User {} roles synced to {}", userId, target);
    }

    private Role findRole(String name) {
        return roleRepository.findByName(name)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_FOUND", "Role not found: " + name));
    }

    private Permission findPermission(String name) {
        return findPermissionIfPresent(name)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PERMISSION_NOT_FOUND", "Permission not found: " + name));
    }

    private Optional<Permission> findPermissionIfPresent(String name) {
        return permissionRepository.findByName(name);
    }

    private UserAccount findUser(Long userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found: " + userId));
    }
}
