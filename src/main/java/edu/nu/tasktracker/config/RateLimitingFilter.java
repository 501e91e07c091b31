package edu.nu.tasktracker.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;

/**
 * Per-IP token-bucket rate limiting (Bucket4j).
 *
 * Limits per minute:
 * - /api/auth/login: 5 (brute force on passwords)
 * - /api/auth/register: 3 (spam registration)
 * - /api/auth/refresh: 10
 * - everything else: 100
 *
 * Under the "test" profile every category gets 1000 per minute so integration
 * tests never trip the limiter.
 *
 * Clients are identified by the socket address. X-Forwarded-For is honoured only
 * when app.rate-limit.trust-forwarded-for is set, i.e. behind a proxy that
 * overwrites it. Buckets of idle clients are evicted and the number held is capped.
 */
@Component
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitingFilter.class);

    // one bucket per client IP and endpoint category
    private final Cache<String, Bucket> ipBuckets;

    private final Environment environment;
    private final boolean enabled;
    private final boolean trustForwardedFor;

    public RateLimitingFilter(Environment environment,
                              @Value("${app.rate-limit.enabled:true}") boolean enabled,
                              @Value("${app.rate-limit.trust-forwarded-for:false}") boolean trustForwardedFor,
                              @Value("${app.rate-limit.max-tracked-clients:100000}") long maxTrackedClients) {
        this.environment = environment;
        this.enabled = enabled;
        this.trustForwardedFor = trustForwardedFor;
        // an entry idle past the one-minute refill holds a full bucket
        this.ipBuckets = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(2))
                .maximumSize(maxTrackedClients)
                .build();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        if (!enabled) {
            filterChain.doFilter(request, response);
            return;
        }

        String clientIp = getClientIp(request);
        String category = getBucketCategory(request.getRequestURI());
        Bucket bucket = ipBuckets.get(clientIp + ":" + category, key -> newBucket(category));

        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
        } else {
            log.warn("Rate limit exceeded for {} on {}", clientIp, category);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType("application/json");
            response.getWriter().write(
                "{\"error\":\"Too Many Requests\",\"message\":\"Too many requests. Please try again later.\",\"status\":429}"
            );
        }
    }

    private Bucket newBucket(String category) {
        boolean isTestMode = Arrays.asList(environment.getActiveProfiles()).contains("test");
        int perMinute;
        if (isTestMode) {
            perMinute = 1000;
        } else {
            switch (category) {
                case "login":
                    perMinute = 5;
                    break;
                case "register":
                    perMinute = 3;
                    break;
                case "refresh":
                    perMinute = 10;
                    break;
                default:
                    perMinute = 100;
            }
        }
        Bandwidth limit = Bandwidth.builder()
                .capacity(perMinute)
                .refillIntervally(perMinute, Duration.ofMinutes(1))
                .build();
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    /**
     * Maps a request URI to its rate-limit category.
     */
    static String getBucketCategory(String requestUri) {
        if (requestUri.startsWith("/api/auth/login")) {
            return "login";
        } else if (requestUri.startsWith("/api/auth/register")) {
            return "register";
        } else if (requestUri.startsWith("/api/auth/refresh")) {
            return "refresh";
        } else {
            return "general";
        }
    }

    /**
     * The remote address, or the first X-Forwarded-For entry when the proxy in
     * front of the service is trusted to set it.
     */
    String getClientIp(HttpServletRequest request) {
        if (trustForwardedFor) {
            String xForwardedFor = request.getHeader("X-Forwarded-For");
            if (xForwardedFor != null && !xForwardedFor.isBlank()) {
                return xForwardedFor.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }
}
