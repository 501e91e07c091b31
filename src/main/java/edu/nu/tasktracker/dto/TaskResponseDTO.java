package edu.nu.tasktracker.dto;

import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResponseDTO {
    private Long id;
    private String title;
    private String description;
    private boolean completed;
    private Long ownerId;
    private Instant createdAt;
    private Instant updatedAt;
}
