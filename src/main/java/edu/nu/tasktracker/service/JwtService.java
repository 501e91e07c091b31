package edu.nu.tasktracker.service;

import edu.nu.tasktracker.dto.TokenPair;
import edu.nu.tasktracker.exception.TokenVerificationException;
import edu.nu.tasktracker.exception.TokenVerificationException.Reason;
import edu.nu.tasktracker.repo.AppUserRepository;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the access/refresh token pair.
 * ----------------------------------------
 * - Both tokens are HS512 JWTs signed with the process-wide secret
 * - Claims: subject (user id), token type, issuer, audience, issued-at, expiry, random id
 * - Verification is a pure computation, no store lookup
 * - Failures are reported with a distinct {@link Reason}
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    static final String ISSUER = "TASK_TRACKER_API";
    static final String AUDIENCE = "TASK_TRACKER_USERS";
    static final String TOKEN_TYPE_CLAIM = "token_type";

    // HS512 needs a 512-bit key
    private static final int MIN_SECRET_BYTES = 64;

    private final Key signingKey;
    private final long accessTtlSeconds;
    private final long refreshTtlSeconds;
    private final Clock clock;
    private final AppUserRepository users;

    public JwtService(@Value("${app.jwt.secret}") String secret,
                      @Value("${app.jwt.access-ttl-seconds:900}") long accessTtlSeconds,
                      @Value("${app.jwt.refresh-ttl-seconds:604800}") long refreshTtlSeconds,
                      Clock clock,
                      AppUserRepository users) {
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.signingKey = Keys.hmacShaKeyFor(secretBytes);
        this.accessTtlSeconds = accessTtlSeconds;
        this.refreshTtlSeconds = refreshTtlSeconds;
        this.clock = clock;
        this.users = users;
    }

    /**
     * Issues a fresh access/refresh pair bound to the given user.
     */
    public TokenPair issue(Long userId) {
        Instant now = clock.instant();
        String access = build(userId, TokenType.ACCESS, now, accessTtlSeconds);
        String refresh = build(userId, TokenType.REFRESH, now, refreshTtlSeconds);
        return new TokenPair(access, refresh);
    }

    /**
     * Checks signature, then token type, then expiry.
     *
     * @throws TokenVerificationException with INVALID_SIGNATURE, WRONG_TOKEN_TYPE or EXPIRED
     */
    public Claims verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Token is empty");
        }
        Claims claims;
        boolean expired = false;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireIssuer(ISSUER)
                    .requireAudience(AUDIENCE)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            // signature was already checked when the expiry is reported
            claims = e.getClaims();
            expired = true;
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Invalid token: " + e.getMessage(), e);
        }

        String type = claims.get(TOKEN_TYPE_CLAIM, String.class);
        if (!expectedType.claimValue().equals(type)) {
            throw new TokenVerificationException(Reason.WRONG_TOKEN_TYPE,
                    "Expected " + expectedType.claimValue() + " token but got " + type);
        }
        // jjwt only rejects once now is past exp; a token is valid strictly before it
        Date expiration = claims.getExpiration();
        if (expired || expiration == null || !expiration.toInstant().isAfter(clock.instant())) {
            throw new TokenVerificationException(Reason.EXPIRED, "Token expired at " + expiration);
        }
        return claims;
    }

    /**
     * Verifies a refresh token and issues a new pair for the same user.
     *
     * @throws TokenVerificationException with any {@link #verify} reason, or USER_NOT_FOUND
     */
    public TokenPair refresh(String refreshToken) {
        Claims claims = verify(refreshToken, TokenType.REFRESH);
        Long userId = userIdOf(claims);
        if (!users.existsById(userId)) {
            throw new TokenVerificationException(Reason.USER_NOT_FOUND, "User " + userId + " no longer exists");
        }
        log.debug("Refreshing token pair for user {}", userId);
        return issue(userId);
    }

    /**
     * Extracts the user id carried as subject of a verified token.
     */
    public Long userIdOf(Claims claims) {
        try {
            return Long.valueOf(claims.getSubject());
        } catch (NumberFormatException e) {
            throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Token subject is not a user id", e);
        }
    }

    private String build(Long userId, TokenType type, Instant now, long ttlSeconds) {
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .setId(UUID.randomUUID().toString())
                .claim(TOKEN_TYPE_CLAIM, type.claimValue())
                .setIssuer(ISSUER)
                .setAudience(AUDIENCE)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(signingKey, SignatureAlgorithm.HS512)
                .compact();
    }
}
