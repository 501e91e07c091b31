package edu.nu.tasktracker.service;

import lombok.*;

import java.time.LocalDate;

/**
 * Optional list filters. Null fields are not applied; the rest are AND-ed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskFilter {
    private Boolean completed;

    // case-insensitive substring over title or description
    private String search;

    // case-insensitive substring over title only
    private String title;

    // inclusive day bounds on createdAt, evaluated in UTC
    private LocalDate createdAfter;
    private LocalDate createdBefore;

    public static TaskFilter none() {
        return new TaskFilter();
    }
}
