package edu.nu.tasktracker.service;

import lombok.*;

/**
 * Field changes for a task. Null means "leave unchanged".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskUpdate {
    private String title;
    private String description;
    private Boolean completed;
}
