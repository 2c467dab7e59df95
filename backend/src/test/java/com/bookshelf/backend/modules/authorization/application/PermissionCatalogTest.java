package com.bookshelf.backend.modules.authorization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import com.bookshelf.backend.modules.authorization.infrastructure.persistence.PermissionRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class PermissionCatalogTest {

    @Mock
    private PermissionRepository permissionRepository;

    private PermissionCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new PermissionCatalog(permissionRepository);
    }

    @Test
    void listsStoredNames() {
        when(permissionRepository.findAllNames()).thenReturn(List.of("books.create", "books.list"));

        assertThat(catalog.listNames()).containsExactly("books.create", "books.list");
    }

    @Test
    void missingTableYieldsEmptyCatalog() {
        when(permissionRepository.findAllNames())
                .thenThrow(new InvalidDataAccessResourceUsageException("relation \"permission\" does not exist"));

        assertThat(catalog.listNames()).isEmpty();
    }

    @Test
    void unreachableStoreYieldsEmptyCatalog() {
        when(permissionRepository.findAllNames())
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThat(catalog.listNames()).isEmpty();
    }

    @Test
    void transactionFailureYieldsEmptyCatalog() {
        when(permissionRepository.findAllNames())
                .thenThrow(new CannotCreateTransactionException("no connection"));

        assertThat(catalog.listNames()).isEmpty();
    }
}
