// file: src/main/java/io/strata/storage/CatalogRecords.java
package io.strata.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.strata.core.OperationKind;
import io.strata.core.RowId;
import io.strata.core.SegmentId;
import io.strata.core.TableId;
import io.strata.core.TableState;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON bodies of catalog journal records and of the catalog snapshot image.
 * <p>
 * Every record carries the complete outcome of the operation (ids, timestamps,
 * resulting segment sets), so replay never recomputes anything and is
 * deterministic.
 */
final class CatalogRecords {
    static final String CREATE_TABLE = "create-table";
    static final String APPEND_STATE = "append-state";
    static final String CLONE = "clone";
    static final String DROP = "drop";
    static final String UNDROP = "undrop";
    static final String RENAME = "rename";
    static final String PURGE = "purge";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CatalogRecords() {
    }

    /** create-table and clone: a new entry with its root state. */
    static class CreateDto {
        public EntryDto entry;
        public StateDto root;
        public CloneDto clone; // only for clones
    }

    static class AppendDto {
        public String tableId;
        public StateDto state;
    }

    /** drop, undrop and rename. */
    static class EntryChangeDto {
        public String tableId;
        public String droppedAt;
        public String name;
    }

    static class PurgeDto {
        public List<String> tables = new ArrayList<>();
        public Map<String, List<Long>> prunedStates;
    }

    static class EntryDto {
        public String tableId;
        public String name;
        public String schemaId;
        public long headStateId;
        public String retention;
        public String createdAt;
        public String droppedAt;
        public List<StateDto> states; // snapshot image only
    }

    static class StateDto {
        public long stateId;
        public Long parentStateId;
        public List<String> segments;
        public List<String> addedSegments;
        public List<String> tombstones;
        public String operation;
        public String createdAt;
        public String statementRef;
    }

    static class CloneDto {
        public String newTableId;
        public String sourceTableId;
        public long sourceStateId;
        public String createdAt;
    }

    static class ImageDto {
        public long lastStateId;
        public List<EntryDto> tables = new ArrayList<>();
        public List<CloneDto> clones = new ArrayList<>();
    }

    // ----------------- conversions -----------------

    static EntryDto toDto(TableEntry e) {
        EntryDto d = new EntryDto();
        d.tableId = e.tableId().value();
        d.name = e.name();
        d.schemaId = e.schemaId();
        d.headStateId = e.headStateId();
        d.retention = e.retention().toString();
        d.createdAt = e.createdAt().toString();
        d.droppedAt = e.droppedAt() == null ? null : e.droppedAt().toString();
        return d;
    }

    static TableEntry fromDto(EntryDto d) {
        return new TableEntry(new TableId(d.tableId), d.name, d.schemaId, d.headStateId,
                Duration.parse(d.retention), Instant.parse(d.createdAt),
                d.droppedAt == null ? null : Instant.parse(d.droppedAt));
    }

    static StateDto toDto(TableState s) {
        StateDto d = new StateDto();
        d.stateId = s.stateId();
        d.parentStateId = s.parentStateId();
        d.segments = s.segments().stream().map(SegmentId::hex).toList();
        d.addedSegments = s.addedSegments().stream().map(SegmentId::hex).toList();
        d.tombstones = s.tombstones().stream().map(RowId::toString).toList();
        d.operation = s.operation().name();
        d.createdAt = s.createdAt().toString();
        d.statementRef = s.statementRef();
        return d;
    }

    static TableState fromDto(StateDto d) {
        Set<SegmentId> segs = new LinkedHashSet<>();
        for (String h : d.segments) segs.add(new SegmentId(h));
        Set<SegmentId> added = new LinkedHashSet<>();
        for (String h : d.addedSegments) added.add(new SegmentId(h));
        Set<RowId> tombs = new LinkedHashSet<>();
        for (String t : d.tombstones) tombs.add(RowId.parse(t));
        return new TableState(d.stateId, d.parentStateId, segs, added, tombs,
                OperationKind.valueOf(d.operation), Instant.parse(d.createdAt), d.statementRef);
    }

    static CloneDto toDto(CloneRecord c) {
        CloneDto d = new CloneDto();
        d.newTableId = c.newTableId().value();
        d.sourceTableId = c.sourceTableId().value();
        d.sourceStateId = c.sourceStateId();
        d.createdAt = c.createdAt().toString();
        return d;
    }

    static CloneRecord fromDto(CloneDto d) {
        return new CloneRecord(new TableId(d.newTableId), new TableId(d.sourceTableId),
                d.sourceStateId, Instant.parse(d.createdAt));
    }

    static byte[] write(Object dto) {
        try {
            return MAPPER.writeValueAsBytes(dto);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + dto.getClass().getSimpleName(), e);
        }
    }

    static <T> T read(byte[] body, Class<T> type) {
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new UncheckedIOException("corrupt " + type.getSimpleName() + " record", e);
        }
    }
}
