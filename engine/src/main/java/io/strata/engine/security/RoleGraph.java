// file: src/main/java/io/strata/engine/security/RoleGraph.java
package io.strata.engine.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.strata.core.ConflictException;
import io.strata.core.CycleException;
import io.strata.core.NotFoundException;
import io.strata.storage.FileSnapshotter;
import io.strata.storage.FileWal;
import io.strata.storage.Journal;
import io.strata.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable role hierarchy, privilege grants and user role memberships.
 * <p>
 * Model:
 *  - Each role lists the roles it inherits from ({@code GRANT ROLE a TO ROLE b}
 *    makes b inherit a). Inheritance edges form a DAG; a grant that would close a
 *    cycle is rejected before anything is written.
 *  - A role's effective privileges are its own grants plus those of every role in
 *    its closure. PUBLIC is in every closure.
 *  - Closures are memoized and invalidated on any edge change.
 * <p>
 * Mutations here are unchecked; {@link AccessController} decides who may make them.
 * Persistence follows the catalog: every mutation is a journal record, replayed on start.
 */
public final class RoleGraph implements Journal.Replica, AutoCloseable {
    private static final Logger log = Logger.getLogger(RoleGraph.class.getName());

    public static final String ACCOUNTADMIN = "ACCOUNTADMIN";
    public static final String SYSADMIN = "SYSADMIN";
    public static final String SECURITYADMIN = "SECURITYADMIN";
    public static final String PUBLIC = "PUBLIC";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Journal journal;
    private final Map<String, Set<String>> inherits = new ConcurrentHashMap<>();
    private final Map<String, Set<Grant>> grants = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userRoles = new ConcurrentHashMap<>();
    // replaced wholesale on edge changes so a reader never stores a stale closure into the live memo
    private volatile Map<String, Set<String>> closures = new ConcurrentHashMap<>();

    /** Body of every role-graph record; unused fields stay null. */
    static class RecordDto {
        public String role;
        public String other;
        public String user;
        public String privilege;
        public String kind;
        public String name;
        public String newName;
    }

    static class ImageDto {
        public Map<String, List<String>> inherits = new LinkedHashMap<>();
        public List<RecordDto> grants = new ArrayList<>();
        public Map<String, List<String>> userRoles = new LinkedHashMap<>();
    }

    /**
     * Recover from the journal; on first start, install the built-in roles and make
     * {@code adminUser} an ACCOUNTADMIN.
     */
    public RoleGraph(Journal journal, String adminUser) {
        this.journal = Objects.requireNonNull(journal, "journal");
        journal.recover(this);
        if (inherits.isEmpty()) bootstrap(adminUser);
        log.log(Level.INFO, "Role graph ready: {0} roles, {1} users", new Object[]{inherits.size(), userRoles.size()});
    }

    public static RoleGraph open(Path dir, int snapshotEvery, String adminUser) {
        Journal journal = new Journal(
                new FileWal(dir.resolve("wal"), 16L << 20),
                new FileSnapshotter(dir.resolve("snapshots")),
                new SnapshotPolicy(snapshotEvery));
        return new RoleGraph(journal, adminUser);
    }

    private void bootstrap(String adminUser) {
        for (String r : List.of(PUBLIC, SYSADMIN, SECURITYADMIN, ACCOUNTADMIN)) createRole(r);
        grantRole(SYSADMIN, ACCOUNTADMIN);
        grantRole(SECURITYADMIN, ACCOUNTADMIN);
        grant(new Grant(ACCOUNTADMIN, Privilege.OWNERSHIP, ObjectRef.account()));
        grant(new Grant(SYSADMIN, Privilege.CREATE, ObjectRef.account()));
        grant(new Grant(SECURITYADMIN, Privilege.MANAGE_GRANTS, ObjectRef.account()));
        grantRoleToUser(ACCOUNTADMIN, adminUser);
        log.log(Level.INFO, "Installed built-in roles; {0} holds ACCOUNTADMIN", key(adminUser));
    }

    // ----------------- mutations -----------------

    public synchronized void createRole(String role) {
        String r = key(role);
        if (inherits.containsKey(r)) throw new ConflictException("role " + r + " already exists");
        RecordDto dto = new RecordDto();
        dto.role = r;
        commit("create-role", dto);
    }

    /**
     * {@code GRANT ROLE granted TO ROLE grantee}: grantee inherits granted's privileges.
     *
     * @throws CycleException if granted already inherits (directly or not) from grantee
     */
    public synchronized void grantRole(String granted, String grantee) {
        String from = requireRole(granted);
        String to = requireRole(grantee);
        if (from.equals(to) || closure(from).contains(to)) {
            throw new CycleException("granting " + from + " to " + to + " would create a cycle");
        }
        if (inherits.get(to).contains(from)) return;
        RecordDto dto = new RecordDto();
        dto.role = to;
        dto.other = from;
        commit("grant-role", dto);
    }

    public synchronized void revokeRole(String granted, String grantee) {
        String from = requireRole(granted);
        String to = requireRole(grantee);
        if (!inherits.get(to).contains(from)) return;
        RecordDto dto = new RecordDto();
        dto.role = to;
        dto.other = from;
        commit("revoke-role", dto);
    }

    public synchronized void grant(Grant grant) {
        requireRole(grant.role());
        if (grants.getOrDefault(grant.role(), Set.of()).contains(grant)) return;
        commit("grant", toDto(grant));
    }

    public synchronized void revoke(Grant grant) {
        if (!grants.getOrDefault(grant.role(), Set.of()).contains(grant)) return;
        commit("revoke", toDto(grant));
    }

    public synchronized void grantRoleToUser(String role, String user) {
        String r = requireRole(role);
        if (userRoles.getOrDefault(key(user), Set.of()).contains(r)) return;
        RecordDto dto = new RecordDto();
        dto.role = r;
        dto.user = key(user);
        commit("grant-user", dto);
    }

    public synchronized void revokeRoleFromUser(String role, String user) {
        String r = key(role);
        if (!userRoles.getOrDefault(key(user), Set.of()).contains(r)) return;
        RecordDto dto = new RecordDto();
        dto.role = r;
        dto.user = key(user);
        commit("revoke-user", dto);
    }

    /** Re-point every grant on {@code from} to {@code to}, e.g. after a table rename. */
    public synchronized void renameObject(ObjectRef from, ObjectRef to) {
        if (from.kind() != to.kind()) throw new IllegalArgumentException("cannot rename " + from + " to " + to);
        if (from.equals(to)) return;
        RecordDto dto = new RecordDto();
        dto.kind = from.kind().name();
        dto.name = from.name();
        dto.newName = to.name();
        commit("rename-object", dto);
    }

    // ----------------- queries -----------------

    public boolean roleExists(String role) {
        return inherits.containsKey(key(role));
    }

    public Set<String> roles() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(inherits.keySet()));
    }

    /**
     * The role plus every role it inherits from, transitively, plus PUBLIC.
     * Traversal keeps a visited set, so shared ancestors are expanded once.
     */
    public Set<String> closure(String role) {
        String start = requireRole(role);
        Map<String, Set<String>> memo = closures;
        return memo.computeIfAbsent(start, this::computeClosure);
    }

    private Set<String> computeClosure(String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>();
        todo.push(start);
        while (!todo.isEmpty()) {
            String r = todo.pop();
            if (!visited.add(r)) continue;
            for (String p : inherits.getOrDefault(r, Set.of())) {
                if (!visited.contains(p)) todo.push(p);
            }
        }
        if (inherits.containsKey(PUBLIC)) visited.add(PUBLIC);
        return Collections.unmodifiableSet(visited);
    }

    public Set<Grant> grantsOf(String role) {
        return grants.getOrDefault(key(role), Set.of());
    }

    public Set<String> rolesOfUser(String user) {
        return userRoles.getOrDefault(key(user), Set.of());
    }

    /** A user may activate any role granted to them or inherited by one of those. */
    public boolean canUseRole(String user, String role) {
        String r = key(role);
        if (!inherits.containsKey(r)) return false;
        for (String granted : rolesOfUser(user)) {
            if (inherits.containsKey(granted) && closure(granted).contains(r)) return true;
        }
        return PUBLIC.equals(r);
    }

    @Override
    public void close() {
        journal.close();
    }

    // ----------------- journal replica -----------------

    @Override
    public void apply(String kind, byte[] body) {
        RecordDto dto = read(body, RecordDto.class);
        switch (kind) {
            case "create-role" -> inherits.put(dto.role, Set.of());
            case "grant-role" -> {
                inherits.put(dto.role, plus(inherits.get(dto.role), dto.other));
                closures = new ConcurrentHashMap<>();
            }
            case "revoke-role" -> {
                inherits.put(dto.role, minus(inherits.get(dto.role), dto.other));
                closures = new ConcurrentHashMap<>();
            }
            case "grant" -> {
                Grant g = fromDto(dto);
                grants.put(g.role(), plus(grants.getOrDefault(g.role(), Set.of()), g));
            }
            case "revoke" -> {
                Grant g = fromDto(dto);
                grants.put(g.role(), minus(grants.getOrDefault(g.role(), Set.of()), g));
            }
            case "grant-user" -> userRoles.put(dto.user, plus(userRoles.getOrDefault(dto.user, Set.of()), dto.role));
            case "revoke-user" -> userRoles.put(dto.user, minus(userRoles.getOrDefault(dto.user, Set.of()), dto.role));
            case "rename-object" -> {
                ObjectRef from = new ObjectRef(ObjectKind.valueOf(dto.kind), dto.name);
                ObjectRef to = new ObjectRef(ObjectKind.valueOf(dto.kind), dto.newName);
                grants.replaceAll((role, held) -> {
                    Set<Grant> out = new LinkedHashSet<>();
                    for (Grant g : held) out.add(g.object().equals(from) ? new Grant(g.role(), g.privilege(), to) : g);
                    return Collections.unmodifiableSet(out);
                });
            }
            default -> throw new IllegalStateException("unknown role graph record kind " + kind);
        }
    }

    @Override
    public byte[] image() {
        ImageDto img = new ImageDto();
        inherits.forEach((r, ps) -> img.inherits.put(r, new ArrayList<>(ps)));
        grants.values().forEach(gs -> gs.forEach(g -> img.grants.add(toDto(g))));
        userRoles.forEach((u, rs) -> img.userRoles.put(u, new ArrayList<>(rs)));
        return write(img);
    }

    @Override
    public void restore(byte[] image) {
        ImageDto img = read(image, ImageDto.class);
        inherits.clear();
        grants.clear();
        userRoles.clear();
        closures = new ConcurrentHashMap<>();
        img.inherits.forEach((r, ps) -> inherits.put(r, Collections.unmodifiableSet(new LinkedHashSet<>(ps))));
        for (RecordDto d : img.grants) {
            Grant g = fromDto(d);
            grants.put(g.role(), plus(grants.getOrDefault(g.role(), Set.of()), g));
        }
        img.userRoles.forEach((u, rs) -> userRoles.put(u, Collections.unmodifiableSet(new LinkedHashSet<>(rs))));
    }

    // ----------------- helpers -----------------

    private void commit(String kind, RecordDto dto) {
        byte[] body = write(dto);
        journal.append(kind, body);
        apply(kind, body);
        journal.afterApply(this);
    }

    private String requireRole(String role) {
        String r = key(role);
        if (!inherits.containsKey(r)) throw new NotFoundException("role " + r + " does not exist");
        return r;
    }

    private static RecordDto toDto(Grant g) {
        RecordDto d = new RecordDto();
        d.role = g.role();
        d.privilege = g.privilege().name();
        d.kind = g.object().kind().name();
        d.name = g.object().name();
        return d;
    }

    private static Grant fromDto(RecordDto d) {
        return new Grant(d.role, Privilege.valueOf(d.privilege), new ObjectRef(ObjectKind.valueOf(d.kind), d.name));
    }

    private static <T> Set<T> plus(Set<T> in, T item) {
        Set<T> out = new LinkedHashSet<>(in);
        out.add(item);
        return Collections.unmodifiableSet(out);
    }

    private static <T> Set<T> minus(Set<T> in, T item) {
        Set<T> out = new LinkedHashSet<>(in);
        out.remove(item);
        return Collections.unmodifiableSet(out);
    }

    private static String key(String name) {
        Objects.requireNonNull(name, "name");
        return name.toUpperCase(Locale.ROOT);
    }

    private static byte[] write(Object dto) {
        try {
            return MAPPER.writeValueAsBytes(dto);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize role graph record", e);
        }
    }

    private static <T> T read(byte[] body, Class<T> type) {
        try {
            return MAPPER.readValue(body, type);
        } catch (IOException e) {
            throw new UncheckedIOException("corrupt role graph record", e);
        }
    }
}
