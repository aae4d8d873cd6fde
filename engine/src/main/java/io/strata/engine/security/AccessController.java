// file: src/main/java/io/strata/engine/security/AccessController.java
package io.strata.engine.security;

import io.strata.core.PrivilegeDeniedException;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Privilege checks for a session, and the checked front door to {@link RoleGraph} mutations.
 * <p>
 * {@link #check} answers whether the session's active role, through its closure,
 * holds a grant that authorizes the privilege on the object: either a grant on the
 * object itself, OWNERSHIP on it, or a containment-covering grant on an enclosing
 * object. A session whose user may not activate its role is denied everything.
 */
public final class AccessController {
    private static final Logger log = Logger.getLogger(AccessController.class.getName());

    private final RoleGraph roles;

    public AccessController(RoleGraph roles) {
        this.roles = Objects.requireNonNull(roles, "roles");
    }

    public boolean check(SessionContext session, Privilege privilege, ObjectRef object) {
        if (!roles.canUseRole(session.user(), session.role())) return false;
        for (String role : roles.closure(session.role())) {
            for (Grant g : roles.grantsOf(role)) {
                if (g.privilege().authorizes(g.object(), privilege, object)) return true;
            }
        }
        return false;
    }

    /** @throws PrivilegeDeniedException when {@link #check} is false */
    public void require(SessionContext session, Privilege privilege, ObjectRef object) {
        if (!check(session, privilege, object)) {
            log.log(Level.FINE, "Denied {0} on {1} to {2}", new Object[]{privilege, object, session});
            throw new PrivilegeDeniedException("role " + session.role() + " lacks " + privilege + " on " + object);
        }
    }

    /** {@code USE ROLE}: switch the session's active role. */
    public SessionContext useRole(SessionContext session, String role) {
        if (!roles.canUseRole(session.user(), role)) {
            throw new PrivilegeDeniedException("role " + role + " is not granted to user " + session.user());
        }
        return session.useRole(role);
    }

    public void createRole(SessionContext by, String role) {
        requireManageGrants(by);
        roles.createRole(role);
        roles.grantRole(role, RoleGraph.ACCOUNTADMIN); // new roles roll up to the account admin
    }

    public void grantRole(SessionContext by, String granted, String grantee) {
        requireManageGrants(by);
        roles.grantRole(granted, grantee);
    }

    public void revokeRole(SessionContext by, String granted, String grantee) {
        requireManageGrants(by);
        roles.revokeRole(granted, grantee);
    }

    public void grantRoleToUser(SessionContext by, String role, String user) {
        requireManageGrants(by);
        roles.grantRoleToUser(role, user);
    }

    /** Owners may grant on what they own; otherwise MANAGE_GRANTS on the account is needed. */
    public void grant(SessionContext by, String role, Privilege privilege, ObjectRef object) {
        requireGrantAuthority(by, object);
        roles.grant(new Grant(role, privilege, object));
    }

    public void revoke(SessionContext by, String role, Privilege privilege, ObjectRef object) {
        requireGrantAuthority(by, object);
        roles.revoke(new Grant(role, privilege, object));
    }

    public RoleGraph roles() {
        return roles;
    }

    private void requireManageGrants(SessionContext by) {
        require(by, Privilege.MANAGE_GRANTS, ObjectRef.account());
    }

    private void requireGrantAuthority(SessionContext by, ObjectRef object) {
        if (check(by, Privilege.OWNERSHIP, object)) return;
        requireManageGrants(by);
    }
}
