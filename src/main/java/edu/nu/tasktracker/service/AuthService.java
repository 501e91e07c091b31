package edu.nu.tasktracker.service;

import edu.nu.tasktracker.dto.RegisterRequest;
import edu.nu.tasktracker.dto.TokenPair;
import edu.nu.tasktracker.exception.ResourceNotFoundException;
import edu.nu.tasktracker.exception.TokenVerificationException;
import edu.nu.tasktracker.exception.UnauthenticatedException;
import edu.nu.tasktracker.exception.ValidationException;
import edu.nu.tasktracker.model.AppUser;
import edu.nu.tasktracker.model.Role;
import edu.nu.tasktracker.repo.AppUserRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Registration, login, token refresh and profile lookup.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final AppUserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwt;

    public AuthService(AppUserRepository users, PasswordEncoder passwordEncoder, JwtService jwt) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.jwt = jwt;
    }

    /**
     * A user together with the tokens just issued for them.
     */
    @Getter
    @AllArgsConstructor
    public static class AuthenticatedUser {
        private final AppUser user;
        private final TokenPair tokens;
    }

    @Transactional
    public AuthenticatedUser register(RegisterRequest req) {
        if (!req.getPassword().equals(req.getPasswordConfirm())) {
            throw new ValidationException("passwordConfirm", "Passwords don't match");
        }
        if (req.getPassword().chars().allMatch(Character::isDigit)) {
            throw new ValidationException("password", "Password cannot be entirely numeric");
        }
        String email = normalizeEmail(req.getEmail());
        if (users.existsByEmail(email)) {
            throw new ValidationException("email", "A user with this email already exists");
        }
        if (users.existsByUsername(req.getUsername())) {
            throw new ValidationException("username", "A user with this username already exists");
        }

        AppUser user = users.save(AppUser.builder()
                .username(req.getUsername())
                .email(email)
                .password(passwordEncoder.encode(req.getPassword()))
                .role(req.getRole() != null ? req.getRole() : Role.USER)
                .build());
        log.info("Registered user {} with role {}", user.getId(), user.getRole().getValue());
        return new AuthenticatedUser(user, jwt.issue(user.getId()));
    }

    @Transactional(readOnly = true)
    public AuthenticatedUser login(String email, String password) {
        AppUser user = users.findByEmail(normalizeEmail(email)).orElse(null);
        if (user == null || !passwordEncoder.matches(password, user.getPassword())) {
            log.warn("Failed login attempt for {}", email);
            throw new UnauthenticatedException(INVALID_CREDENTIALS);
        }
        return new AuthenticatedUser(user, jwt.issue(user.getId()));
    }

    /**
     * Exchanges a refresh token for a new pair. Every failure, whatever its
     * reason, is reported as unauthenticated.
     */
    @Transactional(readOnly = true)
    public TokenPair refresh(String refreshToken) {
        try {
            return jwt.refresh(refreshToken);
        } catch (TokenVerificationException e) {
            log.debug("Refresh rejected ({}): {}", e.getReason(), e.getMessage());
            throw new UnauthenticatedException(IdentityResolver.UNAUTHENTICATED_MESSAGE);
        }
    }

    @Transactional(readOnly = true)
    public AppUser profile(CallerContext caller) {
        return users.findById(caller.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    static String normalizeEmail(String email) {
        if (email == null) {
            return "";
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
