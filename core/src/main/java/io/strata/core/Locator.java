// file: src/main/java/io/strata/core/Locator.java
package io.strata.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Which version of a table a read or clone refers to.
 * <p>
 *  - {@link Current}:         the head.
 *  - {@link AtTime}:          the most recent state committed at or before the instant.
 *  - {@link AtStatement}:     the state the statement produced.
 *  - {@link BeforeStatement}: the state the statement was applied to (its parent).
 */
public sealed interface Locator
        permits Locator.Current, Locator.AtTime, Locator.AtStatement, Locator.BeforeStatement {

    static Locator current() {
        return Current.INSTANCE;
    }

    static Locator atTime(Instant instant) {
        return new AtTime(instant);
    }

    static Locator atStatement(String statementRef) {
        return new AtStatement(statementRef);
    }

    static Locator beforeStatement(String statementRef) {
        return new BeforeStatement(statementRef);
    }

    final class Current implements Locator {
        static final Current INSTANCE = new Current();

        private Current() {
        }

        @Override
        public String toString() {
            return "CURRENT";
        }
    }

    record AtTime(Instant instant) implements Locator {
        public AtTime {
            Objects.requireNonNull(instant, "instant");
        }
    }

    record AtStatement(String statementRef) implements Locator {
        public AtStatement {
            Objects.requireNonNull(statementRef, "statementRef");
        }
    }

    record BeforeStatement(String statementRef) implements Locator {
        public BeforeStatement {
            Objects.requireNonNull(statementRef, "statementRef");
        }
    }
}
