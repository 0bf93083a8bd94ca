package uk.gegc.ergtracker.shared.rate_limit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.gegc.ergtracker.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window attempt limiter keyed by {@code operation:key}.
 * <p>
 * Every attempt is recorded, rejected ones included, so a caller hammering the endpoint keeps
 * the window full. Per-key history lives in a bounded Caffeine cache that drops keys idle for
 * longer than {@code app.rate-limit.idle-expiry}, which must be at least the longest window used.
 */
@Service
@Slf4j
public class RateLimitService {

    private final Clock clock;
    private final Cache<String, Deque<Instant>> attempts;

    @Autowired
    public RateLimitService(@Qualifier("utcClock") Clock clock,
                            @Value("${app.rate-limit.max-keys:10000}") long maxKeys,
                            @Value("${app.rate-limit.idle-expiry:PT1H}") Duration idleExpiry) {
        this.clock = clock;
        this.attempts = Caffeine.newBuilder()
                .maximumSize(maxKeys)
                .expireAfterAccess(idleExpiry)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Records an attempt and throws when the key already has {@code limit} attempts inside the window.
     *
     * @throws RateLimitExceededException with the seconds until the oldest attempt leaves the window
     */
    public void checkRateLimit(String operation, String key, int limit, Duration window) {
        String rateLimitKey = operation + ":" + key;
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        long[] retryAfterSeconds = {-1L};

        attempts.asMap().compute(rateLimitKey, (k, history) -> {
            Deque<Instant> timestamps = history != null ? history : new ArrayDeque<>();
            while (!timestamps.isEmpty() && timestamps.peekFirst().isBefore(cutoff)) {
                timestamps.pollFirst();
            }
            if (timestamps.size() >= limit) {
                Instant oldest = timestamps.peekFirst();
                retryAfterSeconds[0] = oldest == null
                        ? window.toSeconds()
                        : Duration.between(now, oldest.plus(window)).toSeconds();
            }
            timestamps.addLast(now);
            return timestamps;
        });

        if (retryAfterSeconds[0] >= 0) {
            log.debug("Rate limit exceeded for operation '{}'", operation);
            throw new RateLimitExceededException("Too many requests for " + operation, retryAfterSeconds[0]);
        }
    }

    /** Number of attempts currently remembered for the key, mainly for diagnostics. */
    public int attemptsFor(String operation, String key) {
        Deque<Instant> history = attempts.getIfPresent(operation + ":" + key);
        return history == null ? 0 : history.size();
    }
}
