package edu.nu.tasktracker.service;

import edu.nu.tasktracker.exception.ValidationException;
import org.springframework.data.domain.Sort;

import java.util.List;

/**
 * Sort order for task listings, parsed from values like {@code title} or
 * {@code -createdAt}. Ties always fall back to insertion order (id ascending).
 */
public final class TaskOrdering {

    public static final String DEFAULT = "-createdAt";

    private static final List<String> SORTABLE_FIELDS = List.of("createdAt", "updatedAt", "title");

    private final String field;
    private final Sort.Direction direction;

    private TaskOrdering(String field, Sort.Direction direction) {
        this.field = field;
        this.direction = direction;
    }

    public static TaskOrdering parse(String ordering) {
        String value = (ordering == null || ordering.isBlank()) ? DEFAULT : ordering.trim();
        Sort.Direction direction = Sort.Direction.ASC;
        if (value.startsWith("-")) {
            direction = Sort.Direction.DESC;
            value = value.substring(1);
        }
        if (!SORTABLE_FIELDS.contains(value)) {
            throw new ValidationException("ordering",
                    "Unsupported ordering '" + ordering + "', expected one of " + SORTABLE_FIELDS + " with optional '-' prefix");
        }
        return new TaskOrdering(value, direction);
    }

    public static TaskOrdering defaultOrdering() {
        return parse(DEFAULT);
    }

    public Sort toSort() {
        return Sort.by(direction, field).and(Sort.by(Sort.Direction.ASC, "id"));
    }
}
