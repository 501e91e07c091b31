package edu.nu.tasktracker.service;

import edu.nu.tasktracker.exception.ResourceNotFoundException;
import edu.nu.tasktracker.exception.ValidationException;
import edu.nu.tasktracker.model.Task;
import edu.nu.tasktracker.repo.TaskRepository;
import edu.nu.tasktracker.service.AccessPolicy.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Single-record task operations. Each one goes through {@link AccessPolicy};
 * a task the caller may not touch is reported exactly like a missing one.
 */
@Service
@Transactional
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    static final String NOT_FOUND_MESSAGE = "Task not found";

    private final TaskRepository tasks;
    private final AccessPolicy accessPolicy;

    public TaskService(TaskRepository tasks, AccessPolicy accessPolicy) {
        this.tasks = tasks;
        this.accessPolicy = accessPolicy;
    }

    /**
     * Creates a task owned by the caller.
     */
    public Task create(CallerContext caller, String title, String description, Boolean completed) {
        Task task = Task.builder()
                .title(requireTitle(title))
                .description(description != null ? description : "")
                .completed(Boolean.TRUE.equals(completed))
                .ownerId(caller.getUserId())
                .build();
        Task saved = tasks.save(task);
        log.info("User {} created task {}", caller.getUserId(), saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Task get(CallerContext caller, Long id) {
        return load(caller, id, Operation.READ);
    }

    public Task update(CallerContext caller, Long id, TaskUpdate changes) {
        Task task = load(caller, id, Operation.WRITE);
        if (changes.getTitle() != null) {
            task.setTitle(requireTitle(changes.getTitle()));
        }
        if (changes.getDescription() != null) {
            task.setDescription(changes.getDescription());
        }
        if (changes.getCompleted() != null) {
            task.setCompleted(changes.getCompleted());
        }
        // flush so the returned entity carries the new updatedAt
        Task saved = tasks.saveAndFlush(task);
        log.info("User {} updated task {}", caller.getUserId(), id);
        return saved;
    }

    public void delete(CallerContext caller, Long id) {
        Task task = load(caller, id, Operation.WRITE);
        tasks.delete(task);
        log.info("User {} deleted task {}", caller.getUserId(), id);
    }

    private Task load(CallerContext caller, Long id, Operation operation) {
        Task task = tasks.findById(id).orElseThrow(() -> new ResourceNotFoundException(NOT_FOUND_MESSAGE));
        if (!accessPolicy.canAccess(caller, task.getOwnerId(), operation)) {
            log.debug("User {} denied {} on task {}", caller.getUserId(), operation, id);
            throw new ResourceNotFoundException(NOT_FOUND_MESSAGE);
        }
        return task;
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "Title is required");
        }
        return title.trim();
    }
}
