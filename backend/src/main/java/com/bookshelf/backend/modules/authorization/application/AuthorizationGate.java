package com.bookshelf.backend.modules.authorization.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for callers that need an authorization decision.
 */
@Component
public class AuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

    private final AuthorizationEngine authorizationEngine;

    public AuthorizationGate(AuthorizationEngine authorizationEngine) {
        this.authorizationEngine = authorizationEngine;
    }

    /**
     * A missing actor is never allowed.
     */
    public boolean allow(Long actorId, String permissionName) {
        if (actorId == null) {
            return false;
        }
        return authorizationEngine.evaluate(actorId, permissionName);
    }

    /**
     * Returns normally when allowed, otherwise throws
     * {@link PermissionDeniedException}. Storage failures propagate unchanged.
     */
    public void require(Long actorId, String permissionName) {
        if (!allow(actorId, permissionName)) {
            log.debug("Denied actor {} for permission '{}'", actorId, permissionName);
            throw new PermissionDeniedException();
        }
    }
}
