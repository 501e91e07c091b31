package edu.nu.tasktracker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.nu.tasktracker.model.AppUser;
import edu.nu.tasktracker.model.Role;
import edu.nu.tasktracker.model.Task;
import edu.nu.tasktracker.repo.AppUserRepository;
import edu.nu.tasktracker.repo.TaskRepository;
import edu.nu.tasktracker.service.JwtService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Single-record task operations: ownership, admin override, and the
 * not-found response for tasks the caller may not see.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@DisplayName("Task Access Tests")
class TaskAccessIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AppUserRepository users;

    @Autowired
    private TaskRepository tasks;

    @Autowired
    private JwtService jwt;

    private AppUser user1;
    private AppUser user2;
    private AppUser admin;
    private Task task1;
    private Task task3;

    @BeforeEach
    void setUp() {
        user1 = createUser("user1", Role.USER);
        user2 = createUser("user2", Role.USER);
        admin = createUser("admin", Role.ADMIN);

        task1 = tasks.save(Task.builder().title("User1 Task 1").description("Task 1 for user 1")
                .ownerId(user1.getId()).build());
        tasks.save(Task.builder().title("User1 Task 2").description("Task 2 for user 1")
                .completed(true).ownerId(user1.getId()).build());
        task3 = tasks.save(Task.builder().title("User2 Task 1").description("Task 1 for user 2")
                .ownerId(user2.getId()).build());
    }

    private AppUser createUser(String name, Role role) {
        return users.save(AppUser.builder()
                .username(name)
                .email(name + "@example.com")
                .password("unused-hash")
                .role(role)
                .build());
    }

    private String bearer(AppUser user) {
        return "Bearer " + jwt.issue(user.getId()).getAccessToken();
    }

    @Test
    @DisplayName("Task endpoints require authentication")
    void requiresAuthentication() throws Exception {
        mvc.perform(get("/api/tasks"))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/tasks/" + task1.getId()))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/tasks/stats"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Created task is owned by the caller, whatever the body says")
    void createSetsOwnerFromCaller() throws Exception {
        String payload = "{\"title\":\"New Test Task\",\"description\":\"New test description\","
                + "\"completed\":false,\"ownerId\":" + user2.getId() + "}";

        mvc.perform(post("/api/tasks")
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.title").value("New Test Task"))
                .andExpect(jsonPath("$.description").value("New test description"))
                .andExpect(jsonPath("$.completed").value(false))
                .andExpect(jsonPath("$.ownerId").value(user1.getId()));
    }

    @Test
    @DisplayName("Create without a title is a validation error")
    void createWithoutTitle() throws Exception {
        mvc.perform(post("/api/tasks")
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"Task without title\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.fieldErrors.title").exists());
    }

    @Test
    @DisplayName("Owner can read their own task")
    void ownerCanRead() throws Exception {
        mvc.perform(get("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(task1.getId()))
                .andExpect(jsonPath("$.title").value("User1 Task 1"));
    }

    @Test
    @DisplayName("Another user's task is indistinguishable from a missing one")
    void foreignTaskLooksMissing() throws Exception {
        JsonNode foreign = objectMapper.readTree(mvc.perform(get("/api/tasks/" + task3.getId())
                .header("Authorization", bearer(user1)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString());

        JsonNode missing = objectMapper.readTree(mvc.perform(get("/api/tasks/" + Long.MAX_VALUE)
                .header("Authorization", bearer(user1)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString());

        assertEquals(missing.get("status"), foreign.get("status"));
        assertEquals(missing.get("error"), foreign.get("error"));
        assertEquals(missing.get("message"), foreign.get("message"));
        assertEquals(fieldNames(missing), fieldNames(foreign));
        assertEquals("Task not found", foreign.get("message").asText());
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    @DisplayName("Another user cannot update or delete, and the task is left untouched")
    void foreignTaskCannotBeModified() throws Exception {
        mvc.perform(patch("/api/tasks/" + task3.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"completed\":true}"))
                .andExpect(status().isNotFound());

        mvc.perform(put("/api/tasks/" + task3.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Hijacked\"}"))
                .andExpect(status().isNotFound());

        mvc.perform(delete("/api/tasks/" + task3.getId())
                .header("Authorization", bearer(user1)))
                .andExpect(status().isNotFound());

        Task unchanged = tasks.findById(task3.getId()).orElseThrow();
        assertEquals("User2 Task 1", unchanged.getTitle());
        assertFalse(unchanged.isCompleted());
    }

    @Test
    @DisplayName("Full update replaces the given fields")
    void putUpdates() throws Exception {
        mvc.perform(put("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Updated Task Title\",\"description\":\"Updated description\",\"completed\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Updated Task Title"))
                .andExpect(jsonPath("$.description").value("Updated description"))
                .andExpect(jsonPath("$.completed").value(true));

        Task updated = tasks.findById(task1.getId()).orElseThrow();
        assertEquals("Updated Task Title", updated.getTitle());
        assertTrue(updated.isCompleted());
        assertEquals(user1.getId(), updated.getOwnerId());
    }

    @Test
    @DisplayName("Full update without a title is rejected")
    void putRequiresTitle() throws Exception {
        mvc.perform(put("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"completed\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.title").exists());
    }

    @Test
    @DisplayName("Partial update leaves other fields alone")
    void patchIsPartial() throws Exception {
        mvc.perform(patch("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"completed\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(true))
                .andExpect(jsonPath("$.title").value("User1 Task 1"))
                .andExpect(jsonPath("$.description").value("Task 1 for user 1"));
    }

    @Test
    @DisplayName("Partial update with a blank title is rejected")
    void patchBlankTitle() throws Exception {
        mvc.perform(patch("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.title").value("Title is required"));
    }

    @Test
    @DisplayName("A body value of the wrong type is a field error")
    void patchWrongType() throws Exception {
        mvc.perform(patch("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"completed\":\"maybe\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.completed").exists());

        assertFalse(tasks.findById(task1.getId()).orElseThrow().isCompleted());
    }

    @Test
    @DisplayName("Owner can delete their task")
    void ownerCanDelete() throws Exception {
        mvc.perform(delete("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1)))
                .andExpect(status().isNoContent());

        assertFalse(tasks.existsById(task1.getId()));

        mvc.perform(get("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(user1)))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Admin can read, update and delete any task")
    void adminHasFullAccess() throws Exception {
        mvc.perform(get("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(admin)))
                .andExpect(status().isOk());

        mvc.perform(patch("/api/tasks/" + task1.getId())
                .header("Authorization", bearer(admin))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Admin Updated Title\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Admin Updated Title"))
                .andExpect(jsonPath("$.ownerId").value(user1.getId()));

        mvc.perform(delete("/api/tasks/" + task3.getId())
                .header("Authorization", bearer(admin)))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("Regular user lists only their own tasks, admin lists all")
    void listingIsScoped() throws Exception {
        mvc.perform(get("/api/tasks")
                .header("Authorization", bearer(user1)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.results", hasSize(2)))
                .andExpect(jsonPath("$.results[*].ownerId", everyItem(is(user1.getId().intValue()))))
                .andExpect(jsonPath("$.results[*].id", not(hasItem(task3.getId().intValue()))));

        mvc.perform(get("/api/tasks")
                .header("Authorization", bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.results", hasSize(3)));
    }
}
