package com.bookshelf.backend.modules.authorization.presentation;

import com.bookshelf.backend.modules.authorization.application.PermissionAdminService;
import com.bookshelf.backend.modules.authorization.application.RoleAdminService;
import com.bookshelf.backend.modules.authorization.presentation.dto.NameListResponse;
import com.bookshelf.backend.modules.authorization.presentation.dto.NameRequest;
import com.bookshelf.backend.modules.authorization.presentation.dto.PermissionSyncRequest;
import com.bookshelf.backend.modules.authorization.presentation.dto.RoleSyncRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin")
public class AuthorizationAdminController {

    static final String MANAGE_PERMISSIONS = "permissions.manage";
    static final String MANAGE_ROLES = "roles.manage";

    private final PermissionAdminService permissionAdminService;
    private final RoleAdminService roleAdminService;

    public AuthorizationAdminController(
            PermissionAdminService permissionAdminService,
            RoleAdminService roleAdminService
    ) {
        this.permissionAdminService = permissionAdminService;
        this.roleAdminService = roleAdminService;
    }

    @Operation(summary = "List registered permission names")
    @RequiresPermission(MANAGE_PERMISSIONS)
    @GetMapping("/permissions")
    public ResponseEntity<NameListResponse> listPermissions() {
        return ResponseEntity.ok(NameListResponse.of(permissionAdminService.listNames()));
    }

    @Operation(summary = "Define a permission")
    @RequiresPermission(MANAGE_PERMISSIONS)
    @PostMapping("/permissions")
    public ResponseEntity<Void> definePermission(@Valid @RequestBody NameRequest request) {
        permissionAdminService.define(request.name());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @Operation(summary = "Remove a permission and detach it from every role")
    @RequiresPermission(MANAGE_PERMISSIONS)
    @DeleteMapping("/permissions/{name}")
    public ResponseEntity<Void> removePermission(@PathVariable("name") String name) {
        permissionAdminService.remove(name);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Create a role")
    @RequiresPermission(MANAGE_ROLES)
    @PostMapping("/roles")
    public ResponseEntity<Void> createRole(@Valid @RequestBody NameRequest request) {
        roleAdminService.create(request.name());
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @Operation(summary = "Delete a role with its grants and memberships")
    @RequiresPermission(MANAGE_ROLES)
    @DeleteMapping("/roles/{role}")
    public ResponseEntity<Void> deleteRole(@PathVariable("role") String role) {
        roleAdminService.delete(role);
        return ResponseEntity.noContent().build();
    }

    @RequiresPermission(MANAGE_ROLES)
    @GetMapping("/roles/{role}/permissions")
    public ResponseEntity<NameListResponse> rolePermissions(@PathVariable("role") String role) {
        return ResponseEntity.ok(NameListResponse.of(roleAdminService.permissionsOf(role)));
    }

    @Operation(summary = "Replace the permission set of a role")
    @RequiresPermission(MANAGE_ROLES)
    @PutMapping("/roles/{role}/permissions")
    public ResponseEntity<NameListResponse> syncRolePermissions(
            @PathVariable("role") String role,
            @Valid @RequestBody PermissionSyncRequest request
    ) {
        roleAdminService.syncPermissions(role, request.permissions());
        return ResponseEntity.ok(NameListResponse.of(roleAdminService.permissionsOf(role)));
    }

    @RequiresPermission(MANAGE_ROLES)
    @PostMapping("/roles/{role}/permissions/{permission}")
    public ResponseEntity<Void> attachPermission(
            @PathVariable("role") String role,
            @PathVariable("permission") String permission
    ) {
        roleAdminService.attachPermission(role, permission);
        return ResponseEntity.noContent().build();
    }

    @RequiresPermission(MANAGE_ROLES)
    @DeleteMapping("/roles/{role}/permissions/{permission}")
    public ResponseEntity<Void> detachPermission(
            @PathVariable("role") String role,
            @PathVariable("permission") String permission
    ) {
        roleAdminService.detachPermission(role, permission);
        return ResponseEntity.noContent().build();
    }

    @RequiresPermission(MANAGE_ROLES)
    @GetMapping("/users/{userId}/roles")
    public ResponseEntity<NameListResponse> userRoles(@PathVariable("userId") Long userId) {
        return ResponseEntity.ok(NameListResponse.of(roleAdminService.rolesOf(userId)));
    }

    @Operation(summary = "Replace the role set of a user")
    @RequiresPermission(MANAGE_ROLES)
    @PutMapping("/users/{userId}/roles")
    public ResponseEntity<NameListResponse> syncUserRoles(
            @PathVariable("userId") Long userId,
            @Valid @RequestBody RoleSyncRequest request
    ) {
        roleAdminService.syncRoles(userId, request.roles());
        return ResponseEntity.ok(NameListResponse.of(roleAdminService.rolesOf(userId)));
    }

    @RequiresPermission(MANAGE_ROLES)
    @PostMapping("/users/{userId}/roles/{role}")
    public ResponseEntity<Void> assignRole(
            @PathVariable("userId") Long userId,
            @PathVariable("role") String role
    ) {
        roleAdminService.assignRole(userId, role);
        return ResponseEntity.noContent().build();
    }

    @RequiresPermission(MANAGE_ROLES)
    @DeleteMapping("/users/{userId}/roles/{role}")
    public ResponseEntity<Void> revokeRole(
            @PathVariable("userId") Long userId,
            @PathVariable("role") String role
    ) {
        roleAdminService.revokeRole(userId, role);
        return ResponseEntity.noContent().build();
    }
}
