// file: src/main/java/io/strata/storage/CloneRecord.java
package io.strata.storage;

import io.strata.core.TableId;

import java.time.Instant;

/** Lineage of a zero-copy clone: which table and state it was forked from. */
public record CloneRecord(TableId newTableId, TableId sourceTableId, long sourceStateId, Instant createdAt) {}
