package edu.nu.tasktracker.dto;

import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Partial update (PATCH). Absent fields keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskPatchRequest {
    @Size(max = 200, message = "Title cannot exceed 200 characters")
    private String title;

    @Size(max = 4000, message = "Description cannot exceed 4000 characters")
    private String description;

    private Boolean completed;
}
