package com.bookshelf.backend.modules.authorization.domain;

/**
 * The distinguished actor that passes every authorization check.
 *
 * <p>The id is a structural constant rather than configuration: it is not read
 * from data and no role or permission row can grant or revoke the bypass. The
 * {@code app_user} identity column starts at 2 and a trigger rejects deleting
 * row 1, so no other account can ever carry this id.
 */
public final class SystemActor {

    public static final long ID = 1L;

    private SystemActor() {
    }

    public static boolean is(long actorId) {
        return actorId == ID;
    }
}
