package com.bookshelf.backend.modules.authorization.infrastructure.persistence;

import java.util.List;

import com.bookshelf.backend.modules.authorization.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, Long> {

    /**
     * Existence check over user_role x role_permission x permission. Returns
     * false for unknown users, unknown names and users without roles.
     */
    @Query("""
            select case when count(ur) > 0 then true else false end
              from UserRole ur, RolePermission rp
             where rp.role = ur.role
               and ur.user.id = :userId
               and rp.permission.name = :permissionName
            """)
    boolean existsPermissionViaRoles(@Param("userId") Long userId, @Param("permissionName") String permissionName);

    @Query("""
            select case when count(ur) > 0 then true else false end
              from UserRole ur
             where ur.user.id = :userId
               and ur.role.id = :roleId
            """)
    boolean existsByUserIdAndRoleId(@Param("userId") Long userId, @Param("roleId") Long roleId);

    @Query("""
            select r.name
              from UserRole ur
              join ur.role r
             where ur.user.id = :userId
             order by r.name
            """)
    List<String> findRoleNamesByUserId(@Param("userId") Long userId);

    @Modifying
    @Query("delete from UserRole ur where ur.user.id = :userId and ur.role.id = :roleId")
    int deleteByUserIdAndRoleId(@Param("userId") Long userId, @Param("roleId") Long roleId);

    @Modifying
    @Query("delete from UserRole ur where ur.role.id = :roleId")
    int deleteByRoleId(@Param("roleId") Long roleId);
}
