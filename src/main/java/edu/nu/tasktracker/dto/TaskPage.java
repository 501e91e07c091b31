package edu.nu.tasktracker.dto;

import lombok.*;

import java.util.List;

/**
 * One page of the caller's visible tasks.
 * {@code count} is the size of the whole filtered set, {@code next} and
 * {@code previous} are page numbers or null when there is no such page.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskPage {
    private long count;
    private Integer next;
    private Integer previous;
    private List<TaskResponseDTO> results;
}
