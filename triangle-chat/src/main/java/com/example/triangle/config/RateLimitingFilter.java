package com.example.triangle.config;

import com.example.triangle.domain.ParticipantRoster;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token-bucket limiter on REST calls that change channel state. Reads are never limited.
 */
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String PARTICIPANT_HEADER = "X-Participant-Id";

    private static final String API_PREFIX = "/api/";
    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final ChatSecurityProperties.WriteLimit writeLimit;
    private final ParticipantRoster roster;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitingFilter(ChatSecurityProperties securityProperties, ParticipantRoster roster) {
        this.writeLimit = securityProperties.getWriteLimit();
        this.roster = roster;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !writeLimit.isEnabled()
                || !WRITE_METHODS.contains(request.getMethod().toUpperCase(Locale.ROOT))
                || !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ConsumptionProbe consumption = buckets.computeIfAbsent(clientKey(request), key -> newBucket())
                .tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(consumption.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }
        reject(response, consumption.getNanosToWaitForRefill());
    }

    private Bucket newBucket() {
        Duration window = writeLimit.getWindow();
        if (window == null || window.isZero() || window.isNegative()) {
            window = Duration.ofMinutes(1);
        }
        long burst = Math.max(writeLimit.getBurst(), 1);
        return Bucket.builder()
                .addLimit(Bandwidth.classic(burst, Refill.greedy(burst, window)))
                .build();
    }

    private void reject(HttpServletResponse response, long nanosToWait) throws IOException {
        long retryAfterSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(nanosToWait), 1);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter().write(
                "{\"error\":\"too_many_requests\",\"message\":\"Too many writes, retry in "
                        + retryAfterSeconds + "s\"}");
    }

    // Budgets are per address; a roster participant gets its own share of that address.
    private String clientKey(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String address = StringUtils.hasText(forwardedFor)
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        String participant = request.getHeader(PARTICIPANT_HEADER);
        if (participant != null && roster.contains(participant.trim())) {
            return address + "#" + participant.trim();
        }
        return address;
    }
}
