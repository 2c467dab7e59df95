package com.bookshelf.backend.modules.authorization.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.bookshelf.backend.modules.authorization.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    @Query("select distinct p.name from Permission p order by p.name")
    List<String> findAllNames();

    Optional<Permission> findByName(String name);

    boolean existsByName(String name);
}
