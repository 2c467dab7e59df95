package com.bookshelf.backend.modules.authorization.infrastructure.persistence;

import java.util.Optional;

import com.bookshelf.backend.modules.authorization.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, Long> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);
}
