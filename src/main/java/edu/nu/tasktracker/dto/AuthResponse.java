package edu.nu.tasktracker.dto;

import lombok.*;

/**
 * Returned by register and login: the user plus a fresh token pair.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthResponse {
    private UserResponseDTO user;
    private String access;
    private String refresh;
}
