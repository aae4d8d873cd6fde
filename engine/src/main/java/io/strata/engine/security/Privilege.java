// file: src/main/java/io/strata/engine/security/Privilege.java
package io.strata.engine.security;

/**
 * Privileges a role can hold on an object.
 * <p>
 * OWNERSHIP and the table DML privileges also apply to every object contained in
 * the one they were granted on (e.g. SELECT on a schema covers its tables).
 * USAGE, CREATE and MANAGE_GRANTS apply to the named object only.
 */
public enum Privilege {
    OWNERSHIP(true),
    SELECT(true),
    INSERT(true),
    UPDATE(true),
    DELETE(true),
    USAGE(false),
    CREATE(false),
    MANAGE_GRANTS(false);

    private final boolean coversContained;

    Privilege(boolean coversContained) {
        this.coversContained = coversContained;
    }

    public boolean coversContained() {
        return coversContained;
    }

    /** True when a grant of this privilege on {@code granted} authorizes {@code wanted} on {@code target}. */
    boolean authorizes(ObjectRef granted, Privilege wanted, ObjectRef target) {
        if (this != wanted && this != OWNERSHIP) return false;
        if (granted.equals(target)) return true;
        return coversContained && granted.contains(target);
    }
}
