package edu.nu.tasktracker.dto;

import edu.nu.tasktracker.model.Role;
import jakarta.validation.constraints.*;
import lombok.*;

/**
 * Registration payload. Role is optional and defaults to "user".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegisterRequest {
    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 150, message = "Username must be between 3 and 150 characters")
    @Pattern(regexp = "^[a-zA-Z0-9_.@+-]+$", message = "Username can only contain letters, numbers and @/./+/-/_")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Valid email is required")
    private String email;

    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
    private String password;

    @NotBlank(message = "Password confirmation is required")
    private String passwordConfirm;

    private Role role;
}
