// file: src/main/java/io/strata/storage/TableCatalog.java
package io.strata.storage;

import io.strata.core.ConflictException;
import io.strata.core.NotFoundException;
import io.strata.core.OperationKind;
import io.strata.core.Row;
import io.strata.core.RowId;
import io.strata.core.SegmentId;
import io.strata.core.TableId;
import io.strata.core.TableState;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.strata.storage.CatalogRecords.*;

/**
 * Durable catalog of tables and their version chains.
 * <p>
 * Responsibilities:
 *  - Maintain in memory: table id -> entry, table id -> chain, visible name -> table id.
 *  - On every mutation (all serialized on this object's monitor):
 *      1) Validate against current state; nothing is written when validation fails.
 *      2) Build the complete outcome as a journal record and append+fsync it.
 *      3) Apply the record to memory (the same code path replay uses).
 *      4) Adjust segment reference counts.
 *  - On startup:
 *      1) Recover memory from the latest snapshot plus the WAL tail.
 *      2) Re-derive segment reference counts from every retained state.
 * <p>
 * Reads go straight to the concurrent maps and the immutable states they hold;
 * they never take the writer lock.
 */
public final class TableCatalog implements Journal.Replica, AutoCloseable {
    private static final Logger log = Logger.getLogger(TableCatalog.class.getName());

    private final Journal journal;
    private final SegmentStore segments;
    private final Clock clock;

    private final Map<TableId, TableEntry> entries = new ConcurrentHashMap<>();
    private final Map<TableId, VersionChain> chains = new ConcurrentHashMap<>();
    private final Map<String, TableId> byName = new ConcurrentHashMap<>();
    private final Map<TableId, CloneRecord> clones = new ConcurrentHashMap<>();
    private volatile long lastStateId;

    public TableCatalog(Journal journal, SegmentStore segments, Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.segments = Objects.requireNonNull(segments, "segments");
        this.clock = Objects.requireNonNull(clock, "clock");
        journal.recover(this);
        retainAll();
        log.log(Level.INFO, "Catalog ready: {0} tables ({1} dropped), last state id {2}",
                new Object[]{entries.size(), listDropped().size(), lastStateId});
    }

    /** Catalog journaled under {@code dir/wal} and {@code dir/snapshots}. */
    public static TableCatalog open(Path dir, SegmentStore segments, int snapshotEvery, Clock clock) {
        Journal journal = new Journal(
                new FileWal(dir.resolve("wal"), 64L << 20),
                new FileSnapshotter(dir.resolve("snapshots")),
                new SnapshotPolicy(snapshotEvery));
        return new TableCatalog(journal, segments, clock);
    }

    // ----------------- mutations -----------------

    /**
     * Create a table whose chain starts with an empty DDL root state.
     *
     * @throws ConflictException if a visible table already has the name
     */
    public synchronized TableEntry createTable(String name, String schemaId, Duration retention, String statementRef) {
        requireName(name);
        Objects.requireNonNull(schemaId, "schemaId");
        Objects.requireNonNull(statementRef, "statementRef");
        if (byName.containsKey(key(name))) throw new ConflictException("table " + name + " already exists");

        Instant now = clock.instant();
        TableState root = new TableState(lastStateId + 1, null, Set.of(), Set.of(), Set.of(),
                OperationKind.DDL, now, statementRef);
        TableEntry entry = new TableEntry(TableId.random(), name, schemaId, root.stateId(), retention, now, null);

        CreateDto dto = new CreateDto();
        dto.entry = toDto(entry);
        dto.root = toDto(root);
        commit(CREATE_TABLE, dto);
        log.log(Level.INFO, "Created table {0} ({1})", new Object[]{name, entry.tableId()});
        return entry;
    }

    /**
     * Append a state on top of {@code parentStateId}, which must still be the head.
     * <p>
     * INSERT/UPDATE/DELETE build on the parent: the parent's segments stay visible
     * except those holding a tombstoned row, whose surviving rows are rewritten together
     * with the new rows into one new segment. DDL/CLONE replace the segment set with
     * {@code newSegments} and carry no tombstones.
     *
     * @throws NotFoundException        if the table is unknown or dropped, or a segment is unknown
     * @throws ConflictException        if {@code parentStateId} is no longer the head
     * @throws IllegalArgumentException if a tombstone does not name a row visible in the parent
     */
    public synchronized TableState appendState(TableId tableId, long parentStateId, List<SegmentId> newSegments,
                                               Set<RowId> tombstones, OperationKind operation, String statementRef) {
        Objects.requireNonNull(newSegments, "newSegments");
        Objects.requireNonNull(tombstones, "tombstones");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(statementRef, "statementRef");

        TableEntry entry = liveEntry(tableId);
        if (entry.headStateId() != parentStateId) {
            throw new ConflictException("table " + entry.name() + " moved from state " + parentStateId
                    + " to " + entry.headStateId());
        }
        TableState parent = chains.get(tableId).head();
        for (SegmentId s : newSegments) {
            if (!segments.contains(s)) throw new NotFoundException("segment " + s.shortHex() + " not found");
        }

        Set<SegmentId> resultSegments;
        Set<SegmentId> added;
        if (operation.buildsOnParent()) {
            for (RowId r : tombstones) {
                if (!parent.segments().contains(r.segment()) || r.ordinal() >= segments.get(r.segment()).size()) {
                    throw new IllegalArgumentException("row " + r + " is not visible in state " + parentStateId);
                }
            }
            Layout layout = layout(parent, newSegments, tombstones);
            resultSegments = layout.segments;
            added = layout.added;
        } else {
            if (!tombstones.isEmpty()) throw new IllegalArgumentException(operation + " states carry no tombstones");
            resultSegments = new LinkedHashSet<>(newSegments);
            if (resultSegments.size() != newSegments.size()) {
                throw new IllegalArgumentException("duplicate segment in " + operation + " state");
            }
            added = new LinkedHashSet<>(resultSegments);
            added.removeAll(parent.segments());
        }

        Instant now = clock.instant();
        Instant createdAt = now.isBefore(parent.createdAt()) ? parent.createdAt() : now;
        TableState state = new TableState(lastStateId + 1, parentStateId, resultSegments, added, tombstones,
                operation, createdAt, statementRef);

        AppendDto dto = new AppendDto();
        dto.tableId = tableId.value();
        dto.state = toDto(state);
        commit(APPEND_STATE, dto);
        state.segments().forEach(segments::retain);
        log.log(Level.FINE, "Appended state {0} ({1}) to {2}", new Object[]{state.stateId(), operation, entry.name()});
        return state;
    }

    /**
     * Create {@code newName} as a zero-copy fork of {@code sourceTableId} at {@code sourceStateId}.
     * The new chain's root shares every segment of the source state.
     */
    public synchronized TableEntry cloneTable(TableId sourceTableId, long sourceStateId, String newName,
                                              String statementRef) {
        requireName(newName);
        Objects.requireNonNull(statementRef, "statementRef");
        TableEntry source = entry(sourceTableId);
        TableState at = chains.get(sourceTableId).get(sourceStateId);
        if (at == null) throw new NotFoundException("state " + sourceStateId + " of " + source.name() + " not found");
        if (byName.containsKey(key(newName))) throw new ConflictException("table " + newName + " already exists");

        Instant now = clock.instant();
        TableState root = new TableState(lastStateId + 1, null, at.segments(), Set.of(), Set.of(),
                OperationKind.CLONE, now, statementRef);
        TableEntry entry = new TableEntry(TableId.random(), newName, source.schemaId(), root.stateId(),
                source.retention(), now, null);

        CreateDto dto = new CreateDto();
        dto.entry = toDto(entry);
        dto.root = toDto(root);
        dto.clone = toDto(new CloneRecord(entry.tableId(), sourceTableId, sourceStateId, now));
        commit(CLONE, dto);
        root.segments().forEach(segments::retain);
        log.log(Level.INFO, "Cloned {0}@{1} as {2}", new Object[]{source.name(), sourceStateId, newName});
        return entry;
    }

    /** Hide the table from name lookup; its chain stays resolvable by id until retention expires. */
    public synchronized TableEntry drop(TableId tableId) {
        TableEntry entry = liveEntry(tableId);
        EntryChangeDto dto = new EntryChangeDto();
        dto.tableId = tableId.value();
        dto.droppedAt = clock.instant().toString();
        commit(DROP, dto);
        log.log(Level.INFO, "Dropped table {0} ({1})", new Object[]{entry.name(), tableId});
        return entries.get(tableId);
    }

    /**
     * Make a dropped table visible again with its head unchanged.
     *
     * @throws NotFoundException if not dropped, or dropped longer ago than its retention
     * @throws ConflictException if a visible table already has its name
     */
    public synchronized TableEntry undrop(TableId tableId) {
        TableEntry entry = entries.get(tableId);
        if (entry == null || !entry.isDropped()) throw new NotFoundException("no dropped table " + tableId);
        if (entry.droppedAt().plus(entry.retention()).isBefore(clock.instant())) {
            throw new NotFoundException("table " + entry.name() + " was dropped outside its retention window");
        }
        if (byName.containsKey(key(entry.name()))) {
            throw new ConflictException("table " + entry.name() + " already exists; rename it before undrop");
        }
        EntryChangeDto dto = new EntryChangeDto();
        dto.tableId = tableId.value();
        commit(UNDROP, dto);
        log.log(Level.INFO, "Undropped table {0} ({1})", new Object[]{entry.name(), tableId});
        return entries.get(tableId);
    }

    /** Rename a table. Dropped tables may be renamed too; the name only has to be free among visible ones. */
    public synchronized TableEntry rename(TableId tableId, String newName) {
        requireName(newName);
        TableEntry entry = entry(tableId);
        TableId holder = byName.get(key(newName));
        if (!entry.isDropped() && holder != null && !holder.equals(tableId)) {
            throw new ConflictException("table " + newName + " already exists");
        }
        EntryChangeDto dto = new EntryChangeDto();
        dto.tableId = tableId.value();
        dto.name = newName;
        commit(RENAME, dto);
        return entries.get(tableId);
    }

    /**
     * Retire history that fell out of its retention window:
     *  1) dropped tables whose window has passed are removed with their whole chain;
     *  2) on every other table, states older than the state valid at the window
     *     boundary are pruned (that state itself is kept);
     *  3) released segments with no remaining reference are reclaimed.
     */
    public synchronized PurgeReport purgeExpired() {
        Instant now = clock.instant();
        PurgeDto dto = new PurgeDto();
        dto.prunedStates = new LinkedHashMap<>();
        List<TableId> purged = new ArrayList<>();
        List<TableState> released = new ArrayList<>();
        int pruned = 0;

        for (TableEntry e : entries.values()) {
            VersionChain chain = chains.get(e.tableId());
            if (e.isDropped() && e.droppedAt().plus(e.retention()).isBefore(now)) {
                purged.add(e.tableId());
                dto.tables.add(e.tableId().value());
                released.addAll(chain.oldestFirst());
                continue;
            }
            List<TableState> old = prunable(chain, now.minus(e.retention()));
            if (!old.isEmpty()) {
                dto.prunedStates.put(e.tableId().value(), old.stream().map(TableState::stateId).toList());
                released.addAll(old);
                pruned += old.size();
            }
        }

        if (!released.isEmpty()) {
            commit(PURGE, dto);
            for (TableState s : released) s.segments().forEach(segments::release);
        }
        int reclaimed = segments.reclaim();
        PurgeReport report = new PurgeReport(purged, pruned, reclaimed);
        if (!report.isEmpty()) {
            log.log(Level.INFO, "Purge: {0} tables removed, {1} states pruned, {2} segments reclaimed",
                    new Object[]{purged.size(), pruned, reclaimed});
        }
        return report;
    }

    // ----------------- lookups -----------------

    /** Entry by id, dropped tables included. */
    public TableEntry entry(TableId tableId) {
        TableEntry e = entries.get(tableId);
        if (e == null) throw new NotFoundException("table " + tableId + " not found");
        return e;
    }

    public Optional<TableEntry> findEntry(TableId tableId) {
        return Optional.ofNullable(entries.get(tableId));
    }

    /** Visible table by name (case-insensitive). */
    public TableEntry entryByName(String name) {
        return findByName(name).orElseThrow(() -> new NotFoundException("table " + name + " not found"));
    }

    public Optional<TableEntry> findByName(String name) {
        TableId id = byName.get(key(name));
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public List<TableEntry> listTables() {
        return entries.values().stream()
                .filter(e -> !e.isDropped())
                .sorted(Comparator.comparing(TableEntry::name))
                .toList();
    }

    public List<TableEntry> listDropped() {
        return entries.values().stream()
                .filter(TableEntry::isDropped)
                .sorted(Comparator.comparing(TableEntry::droppedAt))
                .toList();
    }

    public VersionChain chain(TableId tableId) {
        VersionChain c = chains.get(tableId);
        if (c == null) throw new NotFoundException("table " + tableId + " not found");
        return c;
    }

    public TableState head(TableId tableId) {
        return chain(tableId).head();
    }

    /** Retained states, head first. */
    public List<TableState> history(TableId tableId) {
        return chain(tableId).newestFirst();
    }

    public Optional<CloneRecord> cloneOrigin(TableId tableId) {
        return Optional.ofNullable(clones.get(tableId));
    }

    public SegmentStore segments() {
        return segments;
    }

    public Clock clock() {
        return clock;
    }

    public long lastStateId() {
        return lastStateId;
    }

    /** Force a snapshot now, e.g. on shutdown. */
    public synchronized void snapshot() {
        journal.snapshot(this);
    }

    @Override
    public void close() {
        journal.close();
    }

    // ----------------- journal replica -----------------

    @Override
    public void apply(String kind, byte[] body) {
        switch (kind) {
            case CREATE_TABLE, CLONE -> {
                CreateDto dto = read(body, CreateDto.class);
                TableEntry entry = fromDto(dto.entry);
                TableState root = fromDto(dto.root);
                VersionChain chain = new VersionChain();
                chain.add(root);
                chains.put(entry.tableId(), chain);
                entries.put(entry.tableId(), entry);
                byName.put(key(entry.name()), entry.tableId());
                if (dto.clone != null) clones.put(entry.tableId(), fromDto(dto.clone));
                advanceClock(root.stateId());
            }
            case APPEND_STATE -> {
                AppendDto dto = read(body, AppendDto.class);
                TableId id = new TableId(dto.tableId);
                TableState state = fromDto(dto.state);
                chains.get(id).add(state);
                entries.computeIfPresent(id, (k, e) -> e.withHead(state.stateId()));
                advanceClock(state.stateId());
            }
            case DROP -> {
                EntryChangeDto dto = read(body, EntryChangeDto.class);
                TableEntry e = entries.get(new TableId(dto.tableId));
                hide(e);
                entries.put(e.tableId(), e.withDroppedAt(Instant.parse(dto.droppedAt)));
            }
            case UNDROP -> {
                EntryChangeDto dto = read(body, EntryChangeDto.class);
                TableEntry e = entries.get(new TableId(dto.tableId)).withDroppedAt(null);
                entries.put(e.tableId(), e);
                byName.put(key(e.name()), e.tableId());
            }
            case RENAME -> {
                EntryChangeDto dto = read(body, EntryChangeDto.class);
                TableEntry old = entries.get(new TableId(dto.tableId));
                hide(old);
                TableEntry e = old.withName(dto.name);
                entries.put(e.tableId(), e);
                if (!e.isDropped()) byName.put(key(e.name()), e.tableId());
            }
            case PURGE -> {
                PurgeDto dto = read(body, PurgeDto.class);
                for (String t : dto.tables) {
                    TableId id = new TableId(t);
                    TableEntry e = entries.remove(id);
                    if (e != null) hide(e);
                    chains.remove(id);
                    clones.remove(id);
                }
                if (dto.prunedStates != null) {
                    dto.prunedStates.forEach((t, ids) -> {
                        VersionChain chain = chains.get(new TableId(t));
                        if (chain != null) ids.forEach(chain::remove);
                    });
                }
            }
            default -> throw new IllegalStateException("unknown catalog record kind " + kind);
        }
    }

    @Override
    public byte[] image() {
        ImageDto img = new ImageDto();
        img.lastStateId = lastStateId;
        for (TableEntry e : entries.values()) {
            EntryDto d = toDto(e);
            d.states = chains.get(e.tableId()).oldestFirst().stream().map(CatalogRecords::toDto).toList();
            img.tables.add(d);
        }
        for (CloneRecord c : clones.values()) img.clones.add(toDto(c));
        return write(img);
    }

    @Override
    public void restore(byte[] image) {
        ImageDto img = read(image, ImageDto.class);
        entries.clear();
        chains.clear();
        byName.clear();
        clones.clear();
        for (EntryDto d : img.tables) {
            TableEntry e = fromDto(d);
            VersionChain chain = new VersionChain();
            for (StateDto s : d.states) chain.add(fromDto(s));
            entries.put(e.tableId(), e);
            chains.put(e.tableId(), chain);
            if (!e.isDropped()) byName.put(key(e.name()), e.tableId());
        }
        for (CloneDto c : img.clones) clones.put(new TableId(c.newTableId), fromDto(c));
        lastStateId = img.lastStateId;
    }

    // ----------------- helpers -----------------

    private record Layout(Set<SegmentId> segments, Set<SegmentId> added) {}

    /**
     * Segment set of a write that builds on {@code parent}. Touched segments (holding a
     * tombstoned row) leave the set; their survivors and the new rows become one new segment.
     */
    private Layout layout(TableState parent, List<SegmentId> newSegments, Set<RowId> tombstones) {
        Set<SegmentId> visible = parent.segments();
        Set<SegmentId> touched = new LinkedHashSet<>();
        for (RowId r : tombstones) touched.add(r.segment());
        Set<SegmentId> distinctNew = new LinkedHashSet<>(newSegments);

        boolean plainAppend = touched.isEmpty()
                && distinctNew.size() == newSegments.size()
                && distinctNew.stream().noneMatch(visible::contains);
        if (plainAppend) {
            Set<SegmentId> segs = new LinkedHashSet<>(visible);
            segs.addAll(distinctNew);
            return new Layout(segs, distinctNew);
        }

        // A new segment equal to a visible one would collapse in the set, so it is rewritten as well.
        for (SegmentId s : newSegments) {
            if (visible.contains(s)) touched.add(s);
        }
        List<Row> rows = new ArrayList<>();
        for (SegmentId s : visible) {
            if (!touched.contains(s)) continue;
            List<Row> segRows = segments.get(s);
            for (int i = 0; i < segRows.size(); i++) {
                if (!tombstones.contains(new RowId(s, i))) rows.add(segRows.get(i));
            }
        }
        for (SegmentId s : newSegments) rows.addAll(segments.get(s));

        while (!rows.isEmpty()) {
            SegmentId merged = segments.put(rows);
            if (!visible.contains(merged) || touched.contains(merged)) {
                Set<SegmentId> segs = new LinkedHashSet<>(visible);
                segs.removeAll(touched);
                segs.add(merged);
                return new Layout(segs, Set.of(merged));
            }
            // collided with an untouched visible segment: fold it in and retry
            touched.add(merged);
            List<Row> widened = new ArrayList<>(segments.get(merged));
            widened.addAll(rows);
            rows = widened;
        }
        Set<SegmentId> segs = new LinkedHashSet<>(visible);
        segs.removeAll(touched);
        return new Layout(segs, Set.of());
    }

    /** States strictly older than the newest one created at or before {@code boundary}. */
    static List<TableState> prunable(VersionChain chain, Instant boundary) {
        List<TableState> newest = chain.newestFirst();
        for (int i = 0; i < newest.size(); i++) {
            if (!newest.get(i).createdAt().isAfter(boundary)) {
                return List.copyOf(newest.subList(i + 1, newest.size()));
            }
        }
        return List.of();
    }

    private void commit(String kind, Object dto) {
        byte[] body = write(dto);
        journal.append(kind, body);
        apply(kind, body);
        journal.afterApply(this);
    }

    private void retainAll() {
        for (VersionChain chain : chains.values()) {
            for (TableState s : chain.oldestFirst()) {
                for (SegmentId seg : s.segments()) {
                    try {
                        segments.retain(seg);
                    } catch (NotFoundException e) {
                        throw new IllegalStateException("state " + s.stateId() + " references missing segment "
                                + seg.shortHex(), e);
                    }
                }
            }
        }
    }

    private TableEntry liveEntry(TableId tableId) {
        TableEntry e = entry(tableId);
        if (e.isDropped()) throw new NotFoundException("table " + e.name() + " is dropped");
        return e;
    }

    private void hide(TableEntry e) {
        byName.remove(key(e.name()), e.tableId());
    }

    private void advanceClock(long stateId) {
        if (stateId > lastStateId) lastStateId = stateId;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name must not be blank");
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
