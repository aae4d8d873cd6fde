// file: src/main/java/io/strata/engine/security/ObjectKind.java
package io.strata.engine.security;

/** Securable object kinds. */
public enum ObjectKind {
    ACCOUNT, WAREHOUSE, DATABASE, SCHEMA, TABLE
}
