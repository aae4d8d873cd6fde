// file: src/main/java/io/strata/engine/security/Grant.java
package io.strata.engine.security;

import java.util.Locale;
import java.util.Objects;

/** One privilege on one object, held by a role. */
public record Grant(String role, Privilege privilege, ObjectRef object) {
    public Grant {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(privilege, "privilege");
        Objects.requireNonNull(object, "object");
        role = role.toUpperCase(Locale.ROOT);
    }
}
