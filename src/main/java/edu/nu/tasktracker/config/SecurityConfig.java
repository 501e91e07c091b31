package edu.nu.tasktracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.nu.tasktracker.dto.ErrorResponse;
import edu.nu.tasktracker.exception.UnauthenticatedException;
import edu.nu.tasktracker.service.CallerContext;
import edu.nu.tasktracker.service.IdentityResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Collections;

@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private final RateLimitingFilter rateLimitingFilter;
    private final IdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    public SecurityConfig(RateLimitingFilter rateLimitingFilter,
                          IdentityResolver identityResolver,
                          ObjectMapper objectMapper) {
        this.rateLimitingFilter = rateLimitingFilter;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    // Stateless API: every request carries its own bearer token
    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http.csrf(csrf -> csrf.disable());
        http.sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS));

        http.authorizeHttpRequests(reg -> reg
                .requestMatchers("/api/auth/register", "/api/auth/login", "/api/auth/refresh").permitAll()
                .requestMatchers("/h2-console/**", "/error").permitAll()
                .requestMatchers("/api/**").authenticated()
                .anyRequest().authenticated()
        );

        // no token at all on a protected endpoint
        http.exceptionHandling(eh -> eh.authenticationEntryPoint((request, response, ex) ->
                writeUnauthorized(request, response, "Authentication required")));

        // Allow H2 console frames
        http.headers(h -> h.frameOptions(f -> f.disable()));

        // rate limits are enforced before any token work
        http.addFilterBefore(rateLimitingFilter, UsernamePasswordAuthenticationFilter.class);
        http.addFilterBefore(new JwtFilter(identityResolver), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String message)
            throws IOException {
        log.warn("Unauthenticated request to {} from IP {}", request.getRequestURI(), request.getRemoteAddr());
        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.UNAUTHORIZED.value())
                .error("Unauthorized")
                .message(message)
                .path(request.getRequestURI())
                .build();
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), error);
    }

    /**
     * Resolves the bearer token into a {@link CallerContext} and installs it as
     * the request principal. A present but unusable token ends the request with
     * 401; the response never says why the token was rejected.
     */
    class JwtFilter extends OncePerRequestFilter {
        private final IdentityResolver resolver;

        JwtFilter(IdentityResolver resolver) {
            this.resolver = resolver;
        }

        @Override
        protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
                throws ServletException, IOException {
            String auth = request.getHeader("Authorization");
            if (auth != null && auth.startsWith("Bearer ")) {
                String token = auth.substring(7).trim();
                try {
                    CallerContext caller = resolver.resolve(token);
                    UsernamePasswordAuthenticationToken authn = new UsernamePasswordAuthenticationToken(caller, null,
                            Collections.singletonList(new SimpleGrantedAuthority("ROLE_" + caller.getRole().name())));
                    SecurityContextHolder.getContext().setAuthentication(authn);
                } catch (UnauthenticatedException e) {
                    SecurityContextHolder.clearContext();
                    writeUnauthorized(request, response, e.getMessage());
                    return;
                }
            }
            chain.doFilter(request, response);
        }
    }
}
