package com.agentcrew.orchestrator.dedup;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

/**
 * Suppresses repeated sends of the same content to the same destination.
 *
 * Coordinators sometimes fire the same send_to_worker call several times in quick
 * succession. Each send resumes an AI process, so only the first one inside the
 * window may go through; the rest are answered as if they had succeeded.
 *
 * <p>The check-and-record step is one critical section: of N concurrent calls with
 * the same key and content, exactly one sees "not a duplicate".
 */
@Component
public class MessageDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(MessageDeduplicator.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(5);

    // Entries older than this many windows are dropped on the next write.
    private static final int EVICT_AFTER_WINDOWS = 10;

    private record Entry(String fingerprint, Instant sentAt) {}

    private final Object lock = new Object();
    private final Map<String, Entry> lastSent = new HashMap<>();

    private final Duration window;
    private final Clock    clock;
    private final Counter  suppressed;

    public MessageDeduplicator(@Value("${agentcrew.dedup.window:5s}") Duration window,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.window     = window;
        this.clock      = clock;
        this.suppressed = meterRegistry.counter("agentcrew.dedup.suppressed");
    }

    /**
     * @return true if {@code content} was already sent to {@code key} within the window
     *         (nothing is recorded); false otherwise, in which case this call is recorded
     *         as the latest send and the caller must go ahead with it
     */
    public boolean isDuplicate(String key, String content) {
        String fingerprint = fingerprint(content);
        Instant now = clock.instant();

        synchronized (lock) {
            Entry previous = lastSent.get(key);
            if (previous != null
                    && previous.fingerprint().equals(fingerprint)
                    && Duration.between(previous.sentAt(), now).compareTo(window) < 0) {
                suppressed.increment();
                log.warn("Suppressed duplicate message to '{}' (first sent {} ms ago)",
                        key, Duration.between(previous.sentAt(), now).toMillis());
                return true;
            }
            lastSent.put(key, new Entry(fingerprint, now));
            evictExpired(now);
            return false;
        }
    }

    /**
     * Forget that {@code content} was sent to {@code key}, typically because the send
     * failed. A different message recorded for the key since then is left in place.
     */
    public void forget(String key, String content) {
        String fingerprint = fingerprint(content);
        synchronized (lock) {
            Entry current = lastSent.get(key);
            if (current != null && current.fingerprint().equals(fingerprint)) {
                lastSent.remove(key);
            }
        }
    }

    public int size() {
        synchronized (lock) {
            return lastSent.size();
        }
    }

    public Duration window() { return window; }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void evictExpired(Instant now) {
        Duration maxAge = window.multipliedBy(EVICT_AFTER_WINDOWS);
        lastSent.values().removeIf(e -> Duration.between(e.sentAt(), now).compareTo(maxAge) > 0);
    }

    private static String fingerprint(String content) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
