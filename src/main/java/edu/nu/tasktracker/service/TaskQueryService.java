package edu.nu.tasktracker.service;

import edu.nu.tasktracker.dto.DTOMapper;
import edu.nu.tasktracker.dto.TaskPage;
import edu.nu.tasktracker.dto.TaskStats;
import edu.nu.tasktracker.exception.ValidationException;
import edu.nu.tasktracker.model.Task;
import edu.nu.tasktracker.repo.TaskRepository;
import edu.nu.tasktracker.repo.TaskSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;

/**
 * Collection reads over the caller's scoped set of tasks.
 * ----------------------------------------
 * - Scope is applied first (admin: everything, user: own tasks)
 * - Filters narrow within the scope, never widen it
 * - Fixed page size, 1-indexed pages, empty result past the last page
 * - Statistics are computed over the unfiltered scope
 */
@Service
@Transactional(readOnly = true)
public class TaskQueryService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueryService.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TaskRepository tasks;
    private final int pageSize;

    public TaskQueryService(TaskRepository tasks, @Value("${app.tasks.page-size:20}") int pageSize) {
        if (pageSize < 1) {
            throw new IllegalStateException("app.tasks.page-size must be positive");
        }
        this.tasks = tasks;
        this.pageSize = pageSize;
    }

    public TaskPage listVisible(CallerContext caller, TaskFilter filter, TaskOrdering ordering, int page) {
        if (page < 1) {
            throw new ValidationException("page", "Page number must be 1 or greater");
        }
        TaskOrdering order = ordering != null ? ordering : TaskOrdering.defaultOrdering();
        Specification<Task> spec = TaskSpecifications.visibleTo(caller, filter);

        // offsets past the last row are answered without a page query; they may not fit in an int
        long offset = (long) (page - 1) * pageSize;
        long total = tasks.count(spec);
        if (offset >= total) {
            log.debug("User {} asked for page {} beyond {} matching tasks", caller.getUserId(), page, total);
            return TaskPage.builder()
                    .count(total)
                    .next(null)
                    .previous(page > 1 ? page - 1 : null)
                    .results(Collections.emptyList())
                    .build();
        }

        Page<Task> result = tasks.findAll(spec, PageRequest.of(page - 1, pageSize, order.toSort()));
        log.debug("User {} listed page {} of tasks: {} of {} matching", caller.getUserId(), page,
                result.getNumberOfElements(), result.getTotalElements());

        return TaskPage.builder()
                .count(result.getTotalElements())
                .next(result.hasNext() ? page + 1 : null)
                .previous(result.hasPrevious() ? page - 1 : null)
                .results(DTOMapper.toTaskDTOList(result.getContent()))
                .build();
    }

    public TaskStats stats(CallerContext caller) {
        Specification<Task> scope = TaskSpecifications.visibleTo(caller);
        long total = tasks.count(scope);
        long completed = tasks.count(scope.and(TaskSpecifications.hasCompleted(true)));
        return TaskStats.builder()
                .total(total)
                .completed(completed)
                .pending(total - completed)
                .completionRate(completionRate(completed, total))
                .build();
    }

    static BigDecimal completionRate(long completed, long total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        // exact ties round to even: 1 of 32 is 3.12
        return BigDecimal.valueOf(completed)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_EVEN);
    }
}
