// file: src/main/java/io/strata/storage/VersionChain.java
package io.strata.storage;

import io.strata.core.TableState;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * The retained states of one table, linked by parent pointer.
 * <p>
 * Appends only ever build on the head, so the chain is linear and ordering by
 * state id is the same as walking parent pointers from the head. Readers may
 * traverse concurrently with the single writer (the catalog).
 */
public final class VersionChain {
    private final NavigableMap<Long, TableState> states = new ConcurrentSkipListMap<>();

    VersionChain() {
    }

    void add(TableState state) {
        if (!states.isEmpty()) {
            TableState head = states.lastEntry().getValue();
            if (state.parentStateId() == null || state.parentStateId() != head.stateId()) {
                throw new IllegalStateException("state " + state.stateId() + " does not extend head " + head.stateId());
            }
        }
        states.put(state.stateId(), state);
    }

    TableState remove(long stateId) {
        return states.remove(stateId);
    }

    /** The state with this id, or null when unknown or pruned. */
    public TableState get(long stateId) {
        return states.get(stateId);
    }

    public TableState head() {
        var last = states.lastEntry();
        if (last == null) throw new IllegalStateException("empty version chain");
        return last.getValue();
    }

    /** Oldest retained state. */
    public TableState oldest() {
        return states.firstEntry().getValue();
    }

    /** True once older history has been pruned, i.e. the oldest retained state still names a parent. */
    public boolean isTruncated() {
        return !oldest().isRoot();
    }

    /** Retained states from head back to the oldest. */
    public List<TableState> newestFirst() {
        return new ArrayList<>(states.descendingMap().values());
    }

    public List<TableState> oldestFirst() {
        return new ArrayList<>(states.values());
    }

    public int size() {
        return states.size();
    }
}
