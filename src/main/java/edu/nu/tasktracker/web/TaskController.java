package edu.nu.tasktracker.web;

import edu.nu.tasktracker.dto.*;
import edu.nu.tasktracker.service.*;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Task endpoints. The authenticated {@link CallerContext} is handed to the
 * services explicitly; scoping and ownership checks happen there.
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;
    private final TaskQueryService queryService;

    public TaskController(TaskService taskService, TaskQueryService queryService) {
        this.taskService = taskService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<TaskPage> list(
            @AuthenticationPrincipal CallerContext caller,
            @RequestParam(required = false) Boolean completed,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String title,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate createdAfter,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate createdBefore,
            @RequestParam(required = false) String ordering,
            @RequestParam(defaultValue = "1") int page) {

        TaskFilter filter = TaskFilter.builder()
                .completed(completed)
                .search(search)
                .title(title)
                .createdAfter(createdAfter)
                .createdBefore(createdBefore)
                .build();
        return ResponseEntity.ok(queryService.listVisible(caller, filter, TaskOrdering.parse(ordering), page));
    }

    @GetMapping("/stats")
    public ResponseEntity<TaskStats> stats(@AuthenticationPrincipal CallerContext caller) {
        return ResponseEntity.ok(queryService.stats(caller));
    }

    @PostMapping
    public ResponseEntity<TaskResponseDTO> create(@AuthenticationPrincipal CallerContext caller,
                                                  @Valid @RequestBody TaskRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(DTOMapper.toTaskDTO(
                taskService.create(caller, body.getTitle(), body.getDescription(), body.getCompleted())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskResponseDTO> get(@AuthenticationPrincipal CallerContext caller, @PathVariable Long id) {
        return ResponseEntity.ok(DTOMapper.toTaskDTO(taskService.get(caller, id)));
    }

    // full update: title is mandatory
    @PutMapping("/{id}")
    public ResponseEntity<TaskResponseDTO> replace(@AuthenticationPrincipal CallerContext caller,
                                                   @PathVariable Long id,
                                                   @Valid @RequestBody TaskRequest body) {
        TaskUpdate changes = TaskUpdate.builder()
                .title(body.getTitle())
                .description(body.getDescription())
                .completed(body.getCompleted())
                .build();
        return ResponseEntity.ok(DTOMapper.toTaskDTO(taskService.update(caller, id, changes)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<TaskResponseDTO> patch(@AuthenticationPrincipal CallerContext caller,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody TaskPatchRequest body) {
        TaskUpdate changes = TaskUpdate.builder()
                .title(body.getTitle())
                .description(body.getDescription())
                .completed(body.getCompleted())
                .build();
        return ResponseEntity.ok(DTOMapper.toTaskDTO(taskService.update(caller, id, changes)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal CallerContext caller, @PathVariable Long id) {
        taskService.delete(caller, id);
        return ResponseEntity.noContent().build();
    }
}
