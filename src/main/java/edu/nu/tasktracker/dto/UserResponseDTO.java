package edu.nu.tasktracker.dto;

import edu.nu.tasktracker.model.Role;
import lombok.*;

import java.time.Instant;

/**
 * Public view of a user. The password hash is never part of it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserResponseDTO {
    private Long id;
    private String username;
    private String email;
    private Role role;
    private Instant createdAt;
    private Instant updatedAt;
}
