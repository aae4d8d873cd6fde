// file: src/main/java/io/strata/engine/security/SessionContext.java
package io.strata.engine.security;

import java.util.Locale;
import java.util.Objects;

/**
 * Who is calling and under which role ({@code USE ROLE}). Passed explicitly to
 * every access check; nothing is held in thread-local state.
 */
public record SessionContext(String user, String role) {
    public SessionContext {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(role, "role");
        user = user.toUpperCase(Locale.ROOT);
        role = role.toUpperCase(Locale.ROOT);
    }

    /** Same user, different active role. */
    public SessionContext useRole(String newRole) {
        return new SessionContext(user, newRole);
    }
}
