package com.bookshelf.backend.modules.authorization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.bookshelf.backend.modules.authorization.application.PermissionCatalogChangedEvent.Change;
import com.bookshelf.backend.modules.authorization.domain.EngineState;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class AuthorizationEngineTest {

    private static final long SYSTEM_ACTOR = 1L;
    private static final long EDITOR = 7L;
    private static final long STRANGER = 99L;

    @Mock
    private PermissionCatalog permissionCatalog;

    @Mock
    private RoleAssignment roleAssignment;

    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AuthorizationEngine(permissionCatalog, roleAssignment);
    }

    @Test
    @DisplayName("before initialize only the system actor is allowed")
    void uninitializedEngineDeniesEveryoneButSystemActor() {
        assertThat(engine.state()).isEqualTo(EngineState.UNINITIALIZED);
        assertThat(engine.registeredPermissions()).isEmpty();

        assertThat(engine.evaluate(EDITOR, "books.create")).isFalse();
        assertThat(engine.evaluate(SYSTEM_ACTOR, "books.create")).isTrue();
        verifyNoInteractions(roleAssignment);
    }

    @Test
    void initializeMovesToReadyAndSnapshotsCatalog() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create", "books.delete"));

        engine.initialize();

        assertThat(engine.state()).isEqualTo(EngineState.READY);
        assertThat(engine.registeredPermissions()).containsExactlyInAnyOrder("books.create", "books.delete");
    }

    @Test
    void systemActorBypassesEveryCheckWithoutLookup() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.delete"));
        engine.initialize();

        assertThat(engine.evaluate(SYSTEM_ACTOR, "books.delete")).isTrue();
        assertThat(engine.evaluate(SYSTEM_ACTOR, "nonexistent.permission")).isTrue();
        assertThat(engine.evaluate(SYSTEM_ACTOR, null)).isTrue();
        verifyNoInteractions(roleAssignment);
    }

    @Test
    void unregisteredPermissionDeniesWithoutRoleLookup() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create"));
        engine.initialize();

        assertThat(engine.evaluate(EDITOR, "nonexistent.permission")).isFalse();
        assertThat(engine.evaluate(EDITOR, null)).isFalse();
        verify(roleAssignment, never()).actorHasPermission(anyLong(), anyString());
    }

    @Test
    void editorScenarioAllowsOnlyWhatRolesGrant() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create", "books.delete"));
        when(roleAssignment.actorHasPermission(EDITOR, "books.create")).thenReturn(true);
        when(roleAssignment.actorHasPermission(EDITOR, "books.delete")).thenReturn(false);
        when(roleAssignment.actorHasPermission(STRANGER, "books.create")).thenReturn(false);
        engine.initialize();

        assertThat(engine.evaluate(EDITOR, "books.create")).isTrue();
        assertThat(engine.evaluate(EDITOR, "books.delete")).isFalse();
        assertThat(engine.evaluate(STRANGER, "books.create")).isFalse();
        assertThat(engine.evaluate(SYSTEM_ACTOR, "books.delete")).isTrue();
    }

    @Test
    void roleMembershipIsQueriedOnEveryCall() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create"));
        when(roleAssignment.actorHasPermission(EDITOR, "books.create")).thenReturn(true, false);
        engine.initialize();

        assertThat(engine.evaluate(EDITOR, "books.create")).isTrue();
        // role detached between the two calls
        assertThat(engine.evaluate(EDITOR, "books.create")).isFalse();
        verify(roleAssignment, times(2)).actorHasPermission(EDITOR, "books.create");
    }

    @Test
    void reinitializeIsIdempotent() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create", "books.view"));
        when(roleAssignment.actorHasPermission(EDITOR, "books.view")).thenReturn(true);

        engine.initialize();
        boolean first = engine.evaluate(EDITOR, "books.view");
        Set<String> firstSnapshot = engine.registeredPermissions();

        engine.initialize();
        engine.initialize();

        assertThat(engine.state()).isEqualTo(EngineState.READY);
        assertThat(engine.registeredPermissions()).isEqualTo(firstSnapshot);
        assertThat(engine.evaluate(EDITOR, "books.view")).isEqualTo(first).isTrue();
    }

    @Test
    void reinitializeReplacesRatherThanMerges() {
        when(permissionCatalog.listNames())
                .thenReturn(List.of("books.create", "books.delete"))
                .thenReturn(List.of("books.create"));

        engine.initialize();
        engine.initialize();

        assertThat(engine.registeredPermissions()).containsExactly("books.create");
        assertThat(engine.evaluate(EDITOR, "books.delete")).isFalse();
        verify(roleAssignment, never()).actorHasPermission(EDITOR, "books.delete");
    }

    @Test
    void emptyCatalogDeniesEveryoneButSystemActor() {
        when(permissionCatalog.listNames()).thenReturn(List.of());

        engine.initialize();

        assertThat(engine.state()).isEqualTo(EngineState.READY);
        assertThat(engine.evaluate(EDITOR, "books.create")).isFalse();
        assertThat(engine.evaluate(STRANGER, "books.list")).isFalse();
        assertThat(engine.evaluate(SYSTEM_ACTOR, "books.create")).isTrue();
        verifyNoInteractions(roleAssignment);
    }

    @Test
    void snapshotIsImmutable() {
        when(permissionCatalog.listNames()).thenReturn(new ArrayList<>(List.of("books.create")));
        engine.initialize();

        assertThatThrownBy(() -> engine.registeredPermissions().add("books.delete"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void roleLookupFailurePropagatesInsteadOfAllowing() {
        when(permissionCatalog.listNames()).thenReturn(List.of("books.create"));
        when(roleAssignment.actorHasPermission(EDITOR, "books.create"))
                .thenThrow(new QueryTimeoutException("statement timeout"));
        engine.initialize();

        assertThatThrownBy(() -> engine.evaluate(EDITOR, "books.create"))
                .isInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void catalogChangeEventReloadsSnapshot() {
        when(permissionCatalog.listNames())
                .thenReturn(List.of("books.create"))
                .thenReturn(List.of("books.create", "reports.export"));
        engine.initialize();

        engine.onCatalogChanged(new PermissionCatalogChangedEvent("reports.export", Change.DEFINED));

        assertThat(engine.registeredPermissions()).contains("reports.export");
    }

    @Test
    void concurrentInitializeAlwaysPublishesCompleteSnapshots() throws Exception {
        List<String> small = List.of("a");
        List<String> large = List.of("a", "b", "c", "d", "e");
        when(permissionCatalog.listNames()).thenAnswer(invocation ->
                Thread.currentThread().getName().hashCode() % 2 == 0 ? small : large);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < 50; j++) {
                        engine.initialize();
                        Set<String> seen = engine.registeredPermissions();
                        assertThat(seen.size()).isIn(1, 5);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(engine.state()).isEqualTo(EngineState.READY);
    }
}
