package com.bookshelf.backend.modules.authorization.domain;

import com.bookshelf.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Named, atomic authorizable action such as {@code books.create}.
 *
 * <p>Renaming a permission that routes already reference silently changes what
 * those routes require, so the name has no setter.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, updatable = false, length = 255)
    private String name;

    protected Permission() {
    }

    public Permission(String name) {
        this.name = name;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
