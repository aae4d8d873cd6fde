package io.strata.core;

/** A role-to-role grant was rejected because it would make the role graph cyclic. */
public class CycleException extends StrataException {
    public CycleException(String message) {
        super(message);
    }
}
