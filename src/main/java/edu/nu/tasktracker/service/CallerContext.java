package edu.nu.tasktracker.service;

import edu.nu.tasktracker.model.Role;
import lombok.Value;

/**
 * Resolved identity of an authenticated caller. Passed explicitly into every
 * service call that needs to know who is asking.
 */
@Value
public class CallerContext {
    Long userId;
    Role role;

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }
}
