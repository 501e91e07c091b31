package edu.nu.tasktracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // token issue and expiry checks read time from here
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
