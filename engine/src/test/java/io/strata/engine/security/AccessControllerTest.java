// file: src/test/java/io/strata/engine/security/AccessControllerTest.java
package io.strata.engine.security;

import io.strata.core.PrivilegeDeniedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AccessControllerTest {

    @TempDir Path dir;

    private RoleGraph roles;
    private AccessController access;
    private final SessionContext admin = new SessionContext("admin", "ACCOUNTADMIN");

    @BeforeEach
    void setUp() {
        roles = RoleGraph.open(dir, 1000, "admin");
        access = new AccessController(roles);
    }

    @AfterEach
    void tearDown() {
        roles.close();
    }

    private SessionContext junior() {
        access.createRole(admin, "JUNIOR_DBA");
        access.grantRoleToUser(admin, "JUNIOR_DBA", "TOSMITH");
        return new SessionContext("tosmith", "junior_dba");
    }

    @Test
    void account_owner_may_do_anything() {
        assertTrue(access.check(admin, Privilege.SELECT, ObjectRef.table("DB.S.T")));
        assertTrue(access.check(admin, Privilege.CREATE, ObjectRef.schema("DB.S")));
        assertTrue(access.check(admin, Privilege.MANAGE_GRANTS, ObjectRef.account()));
    }

    @Test
    void warehouse_usage_must_be_granted() {
        SessionContext s = junior();
        ObjectRef wh = ObjectRef.warehouse("COMPUTE_WH");
        assertFalse(access.check(s, Privilege.USAGE, wh));

        access.grant(admin, "JUNIOR_DBA", Privilege.USAGE, wh);
        assertTrue(access.check(s, Privilege.USAGE, wh));
        assertDoesNotThrow(() -> access.require(s, Privilege.USAGE, wh));
    }

    @Test
    void dml_privileges_cover_contained_objects() {
        SessionContext s = junior();
        access.grant(admin, "JUNIOR_DBA", Privilege.SELECT, ObjectRef.schema("SEC.FILINGS"));

        assertTrue(access.check(s, Privilege.SELECT, ObjectRef.table("SEC.FILINGS.INDEX")));
        assertFalse(access.check(s, Privilege.SELECT, ObjectRef.table("SEC.OTHER.INDEX")));
        assertFalse(access.check(s, Privilege.INSERT, ObjectRef.table("SEC.FILINGS.INDEX")));
    }

    @Test
    void usage_and_create_apply_to_the_named_object_only() {
        SessionContext s = junior();
        access.grant(admin, "JUNIOR_DBA", Privilege.USAGE, ObjectRef.database("SEC"));
        access.grant(admin, "JUNIOR_DBA", Privilege.CREATE, ObjectRef.database("SEC"));

        assertTrue(access.check(s, Privilege.USAGE, ObjectRef.database("SEC")));
        assertFalse(access.check(s, Privilege.USAGE, ObjectRef.schema("SEC.FILINGS")));
        assertFalse(access.check(s, Privilege.CREATE, ObjectRef.schema("SEC.FILINGS")));
    }

    @Test
    void ownership_covers_every_privilege_inside() {
        SessionContext s = junior();
        access.grant(admin, "JUNIOR_DBA", Privilege.OWNERSHIP, ObjectRef.database("SEC"));

        assertTrue(access.check(s, Privilege.DELETE, ObjectRef.table("SEC.FILINGS.INDEX")));
        assertTrue(access.check(s, Privilege.CREATE, ObjectRef.schema("SEC.FILINGS")));
        assertFalse(access.check(s, Privilege.SELECT, ObjectRef.table("UNQUALIFIED")));
    }

    @Test
    void privileges_flow_down_the_role_hierarchy() {
        SessionContext s = junior();
        access.createRole(admin, "READER");
        access.grant(admin, "READER", Privilege.SELECT, ObjectRef.table("T"));
        assertFalse(access.check(s, Privilege.SELECT, ObjectRef.table("T")));

        access.grantRole(admin, "READER", "JUNIOR_DBA");
        assertTrue(access.check(s, Privilege.SELECT, ObjectRef.table("T")));

        access.revokeRole(admin, "READER", "JUNIOR_DBA");
        assertFalse(access.check(s, Privilege.SELECT, ObjectRef.table("T")));
    }

    @Test
    void public_grants_reach_every_role() {
        SessionContext s = junior();
        access.grant(admin, "PUBLIC", Privilege.SELECT, ObjectRef.table("SHARED"));
        assertTrue(access.check(s, Privilege.SELECT, ObjectRef.table("SHARED")));
    }

    @Test
    void a_role_not_granted_to_the_user_grants_nothing() {
        junior();
        SessionContext spoofed = new SessionContext("tosmith", "ACCOUNTADMIN");
        assertFalse(access.check(spoofed, Privilege.SELECT, ObjectRef.table("T")));
        assertThrows(PrivilegeDeniedException.class,
                () -> access.useRole(new SessionContext("tosmith", "PUBLIC"), "ACCOUNTADMIN"));
        assertEquals("JUNIOR_DBA", access.useRole(new SessionContext("tosmith", "PUBLIC"), "junior_dba").role());
    }

    @Test
    void role_administration_needs_manage_grants() {
        SessionContext s = junior();
        assertThrows(PrivilegeDeniedException.class, () -> access.createRole(s, "SNEAKY"));
        assertFalse(roles.roleExists("SNEAKY"));
        assertThrows(PrivilegeDeniedException.class, () -> access.grantRole(s, "SYSADMIN", "JUNIOR_DBA"));

        SessionContext secAdmin = access.useRole(admin, "SECURITYADMIN");
        access.createRole(secAdmin, "ALLOWED");
        assertTrue(roles.roleExists("ALLOWED"));
    }

    @Test
    void owners_may_grant_on_what_they_own() {
        SessionContext s = junior();
        access.grant(admin, "JUNIOR_DBA", Privilege.OWNERSHIP, ObjectRef.table("MINE"));
        access.createRole(admin, "FRIEND");

        access.grant(s, "FRIEND", Privilege.SELECT, ObjectRef.table("MINE"));
        assertThrows(PrivilegeDeniedException.class,
                () -> access.grant(s, "FRIEND", Privilege.SELECT, ObjectRef.table("NOT_MINE")));
    }
}
