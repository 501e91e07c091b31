package edu.nu.tasktracker.repo;

import edu.nu.tasktracker.model.Task;
import edu.nu.tasktracker.service.CallerContext;
import edu.nu.tasktracker.service.TaskFilter;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Query predicates for tasks. {@link #visibleTo} is the one place the
 * caller's scope is expressed; filters are always AND-ed on top of it.
 */
public final class TaskSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private TaskSpecifications() {
    }

    /**
     * Admins see every task, everybody else only their own.
     */
    public static Specification<Task> visibleTo(CallerContext caller) {
        if (caller.isAdmin()) {
            return (root, query, cb) -> cb.conjunction();
        }
        Long ownerId = caller.getUserId();
        return (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }

    public static Specification<Task> visibleTo(CallerContext caller, TaskFilter filter) {
        Specification<Task> spec = Specification.where(visibleTo(caller));
        if (filter == null) {
            return spec;
        }
        if (filter.getCompleted() != null) {
            spec = spec.and(hasCompleted(filter.getCompleted()));
        }
        if (hasText(filter.getSearch())) {
            spec = spec.and(titleOrDescriptionContains(filter.getSearch()));
        }
        if (hasText(filter.getTitle())) {
            spec = spec.and(titleContains(filter.getTitle()));
        }
        if (filter.getCreatedAfter() != null) {
            spec = spec.and(createdOnOrAfter(filter.getCreatedAfter()));
        }
        if (filter.getCreatedBefore() != null) {
            spec = spec.and(createdOnOrBefore(filter.getCreatedBefore()));
        }
        return spec;
    }

    public static Specification<Task> hasCompleted(boolean completed) {
        return (root, query, cb) -> cb.equal(root.get("completed"), completed);
    }

    public static Specification<Task> titleContains(String term) {
        String pattern = likePattern(term);
        return (root, query, cb) -> cb.like(cb.lower(root.<String>get("title")), pattern, LIKE_ESCAPE);
    }

    public static Specification<Task> titleOrDescriptionContains(String term) {
        String pattern = likePattern(term);
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.<String>get("title")), pattern, LIKE_ESCAPE),
                cb.like(cb.lower(cb.coalesce(root.<String>get("description"), "")), pattern, LIKE_ESCAPE));
    }

    public static Specification<Task> createdOnOrAfter(LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), from);
    }

    public static Specification<Task> createdOnOrBefore(LocalDate day) {
        Instant until = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return (root, query, cb) -> cb.lessThan(root.<Instant>get("createdAt"), until);
    }

    private static String likePattern(String term) {
        String escaped = term.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
