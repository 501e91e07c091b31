package edu.nu.tasktracker.service;

import edu.nu.tasktracker.model.Role;
import edu.nu.tasktracker.service.AccessPolicy.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Owner-or-admin access rule")
class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    private final CallerContext owner = new CallerContext(1L, Role.USER);
    private final CallerContext stranger = new CallerContext(2L, Role.USER);
    private final CallerContext admin = new CallerContext(3L, Role.ADMIN);

    @Test
    @DisplayName("Owner may read and write their own record")
    void ownerHasFullAccess() {
        assertTrue(policy.canAccess(owner, 1L, Operation.READ));
        assertTrue(policy.canAccess(owner, 1L, Operation.WRITE));
    }

    @Test
    @DisplayName("Another regular user gets neither read nor write")
    void strangerIsDeniedEverything() {
        assertFalse(policy.canAccess(stranger, 1L, Operation.READ));
        assertFalse(policy.canAccess(stranger, 1L, Operation.WRITE));
    }

    @Test
    @DisplayName("Admin may read and write anybody's record")
    void adminHasFullAccess() {
        assertTrue(policy.canAccess(admin, 1L, Operation.READ));
        assertTrue(policy.canAccess(admin, 1L, Operation.WRITE));
    }

    @Test
    @DisplayName("Missing caller or owner never grants access to a regular user")
    void nullsDeny() {
        assertFalse(policy.canAccess(null, 1L, Operation.READ));
        assertFalse(policy.canAccess(owner, null, Operation.READ));
        assertFalse(policy.canAccess(new CallerContext(null, Role.USER), null, Operation.WRITE));
    }
}
