package edu.nu.tasktracker.service;

import edu.nu.tasktracker.exception.TokenVerificationException;
import edu.nu.tasktracker.exception.UnauthenticatedException;
import edu.nu.tasktracker.model.AppUser;
import edu.nu.tasktracker.repo.AppUserRepository;
import io.jsonwebtoken.Claims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an inbound access token into a {@link CallerContext}.
 * Every failure collapses into a single {@link UnauthenticatedException};
 * the concrete reason only reaches the log.
 */
@Service
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    static final String UNAUTHENTICATED_MESSAGE = "Authentication required";

    private final JwtService jwt;
    private final AppUserRepository users;

    public IdentityResolver(JwtService jwt, AppUserRepository users) {
        this.jwt = jwt;
        this.users = users;
    }

    public CallerContext resolve(String accessToken) {
        try {
            Claims claims = jwt.verify(accessToken, TokenType.ACCESS);
            Long userId = jwt.userIdOf(claims);
            // role is read from the user row so that it always reflects the current assignment
            AppUser user = users.findById(userId).orElseThrow(() -> new TokenVerificationException(
                    TokenVerificationException.Reason.USER_NOT_FOUND, "User " + userId + " no longer exists"));
            return new CallerContext(user.getId(), user.getRole());
        } catch (TokenVerificationException e) {
            log.debug("Rejected access token ({}): {}", e.getReason(), e.getMessage());
            throw new UnauthenticatedException(UNAUTHENTICATED_MESSAGE);
        }
    }
}
