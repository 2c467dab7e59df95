package com.bookshelf.backend.modules.authorization.application;

import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import com.bookshelf.backend.modules.authorization.domain.EngineState;
import com.bookshelf.backend.modules.authorization.domain.SystemActor;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Decides whether an actor holds a permission.
 *
 * <p>The engine keeps one piece of state: an immutable snapshot of the
 * permission names known at the last {@link #initialize()}. Role memberships
 * are never cached and are looked up on every evaluation. A snapshot is always
 * published whole, so concurrent readers see either the previous or the new
 * catalog, never a partial one.
 */
@Service
public class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final PermissionCatalog permissionCatalog;
    private final RoleAssignment roleAssignment;
    private final AtomicReference<CatalogSnapshot> snapshot = new AtomicReference<>(CatalogSnapshot.UNINITIALIZED);

    public AuthorizationEngine(PermissionCatalog permissionCatalog, RoleAssignment roleAssignment) {
        this.permissionCatalog = permissionCatalog;
        this.roleAssignment = roleAssignment;
    }

    @PostConstruct
    void loadOnStartup() {
        initialize();
    }

    /**
     * Replaces the catalog snapshot with the names currently in storage.
     * Calls are serialized so a slower load cannot overwrite a newer one.
     */
    public synchronized void initialize() {
        Set<String> names = Set.copyOf(permissionCatalog.listNames());
        CatalogSnapshot previous = snapshot.getAndSet(new CatalogSnapshot(EngineState.READY, names));
        log.info("Authorization catalog loaded: {} permission(s), previously {} ({})",
                names.size(), previous.names().size(), previous.state());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCatalogChanged(PermissionCatalogChangedEvent event) {
        log.debug("Permission '{}' {}, reloading catalog", event.permissionName(), event.change());
        initialize();
    }

    public boolean evaluate(long actorId, String permissionName) {
        // Checked before any lookup so it cannot be affected by data.
        if (SystemActor.is(actorId)) {
            return true;
        }
        if (permissionName == null) {
            return false;
        }
        if (!snapshot.get().names().contains(permissionName)) {
            log.debug("Permission '{}' is not registered; denying actor {}", permissionName, actorId);
            return false;
        }
        return roleAssignment.actorHasPermission(actorId, permissionName);
    }

    public EngineState state() {
        return snapshot.get().state();
    }

    public Set<String> registeredPermissions() {
        return snapshot.get().names();
    }

    private record CatalogSnapshot(EngineState state, Set<String> names) {
        static final CatalogSnapshot UNINITIALIZED = new CatalogSnapshot(EngineState.UNINITIALIZED, Set.of());
    }
}
