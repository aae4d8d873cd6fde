// file: src/main/java/io/strata/engine/security/ObjectRef.java
package io.strata.engine.security;

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to a securable object by kind and upper-cased, dot-qualified name.
 * <p>
 * Containment: ACCOUNT contains everything; a DATABASE contains its schemas, a
 * SCHEMA its tables. Warehouses and unqualified table names hang directly off the
 * account. Names: {@code DB} for databases, {@code DB.S} for schemas, {@code T} or
 * {@code DB.S.T} for tables.
 */
public record ObjectRef(ObjectKind kind, String name) {

    private static final ObjectRef ACCOUNT = new ObjectRef(ObjectKind.ACCOUNT, "ACCOUNT");

    public ObjectRef {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("object name must not be blank");
        name = name.toUpperCase(Locale.ROOT);
    }

    public static ObjectRef account() {
        return ACCOUNT;
    }

    public static ObjectRef warehouse(String name) {
        return new ObjectRef(ObjectKind.WAREHOUSE, name);
    }

    public static ObjectRef database(String name) {
        return new ObjectRef(ObjectKind.DATABASE, name);
    }

    public static ObjectRef schema(String qualifiedName) {
        if (qualifiedName.split("\\.", -1).length != 2) {
            throw new IllegalArgumentException("schema name must be DB.SCHEMA: " + qualifiedName);
        }
        return new ObjectRef(ObjectKind.SCHEMA, qualifiedName);
    }

    public static ObjectRef table(String name) {
        int parts = name.split("\\.", -1).length;
        if (parts != 1 && parts != 3) {
            throw new IllegalArgumentException("table name must be T or DB.SCHEMA.T: " + name);
        }
        return new ObjectRef(ObjectKind.TABLE, name);
    }

    /** Directly enclosing object, or null for the account. */
    public ObjectRef parent() {
        switch (kind) {
            case ACCOUNT:
                return null;
            case SCHEMA:
                return database(name.substring(0, name.indexOf('.')));
            case TABLE: {
                int dot = name.lastIndexOf('.');
                return dot < 0 ? ACCOUNT : schema(name.substring(0, dot));
            }
            default:
                return ACCOUNT;
        }
    }

    /** True when {@code other} is strictly inside this object. */
    public boolean contains(ObjectRef other) {
        for (ObjectRef p = other.parent(); p != null; p = p.parent()) {
            if (p.equals(this)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
