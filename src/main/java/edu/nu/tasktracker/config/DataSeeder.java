package edu.nu.tasktracker.config;

import edu.nu.tasktracker.model.AppUser;
import edu.nu.tasktracker.model.Role;
import edu.nu.tasktracker.model.Task;
import edu.nu.tasktracker.repo.AppUserRepository;
import edu.nu.tasktracker.repo.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Demo data for local runs: one admin, one regular user, a few tasks.
 * Enabled with app.seed.enabled=true.
 */
@Configuration
@ConditionalOnProperty(name = "app.seed.enabled", havingValue = "true")
public class DataSeeder {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    CommandLineRunner seed(AppUserRepository users, TaskRepository tasks, PasswordEncoder encoder) {
        return args -> {
            if (users.count() > 0) {
                return;
            }
            AppUser alice = users.save(AppUser.builder()
                    .username("alice")
                    .email("alice@example.com")
                    .password(encoder.encode("alice-pass-123"))
                    .role(Role.USER)
                    .build());

            AppUser admin = users.save(AppUser.builder()
                    .username("admin")
                    .email("admin@example.com")
                    .password(encoder.encode("admin-pass-123"))
                    .role(Role.ADMIN)
                    .build());

            tasks.save(Task.builder().title("Buy groceries").description("Milk, eggs, bread").ownerId(alice.getId()).build());
            tasks.save(Task.builder().title("Write report").completed(true).ownerId(alice.getId()).build());
            tasks.save(Task.builder().title("Review access logs").ownerId(admin.getId()).build());
            log.info("Seeded demo users alice (user) and admin (admin)");
        };
    }
}
