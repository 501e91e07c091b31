package edu.nu.tasktracker.dto;

import jakarta.validation.constraints.*;
import lombok.*;

/**
 * Body of task create (POST) and full update (PUT). Owner is never accepted
 * from the client; it always comes from the authenticated caller.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskRequest {
    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title cannot exceed 200 characters")
    private String title;

    @Size(max = 4000, message = "Description cannot exceed 4000 characters")
    private String description;

    private Boolean completed;
}
