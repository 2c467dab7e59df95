package com.bookshelf.backend.modules.authorization.infrastructure.persistence;

import java.util.List;

import com.bookshelf.backend.modules.authorization.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, Long> {

    @Query("""
            select case when count(rp) > 0 then true else false end
              from RolePermission rp
             where rp.role.id = :roleId
               and rp.permission.id = :permissionId
            """)
    boolean existsByRoleIdAndPermissionId(@Param("roleId") Long roleId, @Param("permissionId") Long permissionId);

    @Query("""
            select p.name
              from RolePermission rp
              join rp.permission p
             where rp.role.id = :roleId
             order by p.name
            """)
    List<String> findPermissionNamesByRoleId(@Param("roleId") Long roleId);

    @Modifying
    @Query("delete from RolePermission rp where rp.role.id = :roleId and rp.permission.id = :permissionId")
    int deleteByRoleIdAndPermissionId(@Param("roleId") Long roleId, @Param("permissionId") Long permissionId);

    @Modifying
    @Query("delete from RolePermission rp where rp.role.id = :roleId")
    int deleteByRoleId(@Param("roleId") Long roleId);

    @Modifying
    @Query("delete from RolePermission rp where rp.permission.id = :permissionId")
    int deleteByPermissionId(@Param("permissionId") Long permissionId);
}
