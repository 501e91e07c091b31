package edu.nu.tasktracker.service;

import org.springframework.stereotype.Component;

/**
 * Single owner-or-admin rule used by every single-record task operation.
 * Read and write are decided identically.
 */
@Component
public class AccessPolicy {

    public enum Operation {
        READ,
        WRITE
    }

    public boolean canAccess(CallerContext caller, Long resourceOwnerId, Operation operation) {
        if (caller == null || operation == null) {
            return false;
        }
        return caller.isAdmin() || (caller.getUserId() != null && caller.getUserId().equals(resourceOwnerId));
    }
}
