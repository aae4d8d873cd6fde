// file: src/main/java/io/strata/core/OperationKind.java
package io.strata.core;

/**
 * What kind of write produced a {@link TableState}.
 * <p>
 * INSERT, UPDATE and DELETE build on their parent's segments. DDL and CLONE
 * redefine the table's content outright (create, restore, clone root).
 */
public enum OperationKind {
    INSERT, UPDATE, DELETE, DDL, CLONE;

    public boolean buildsOnParent() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }
}
