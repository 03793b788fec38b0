package dev.flyzex.bot.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.flyzex.bot.domain.model.RateLimitResult;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sliding-window rate limiter: at most {@code bot.rate-limit.max-requests}
 * requests per key within any {@code bot.rate-limit.window}.
 *
 * <p>
 * Each key keeps the timestamps of its admitted requests; timestamps older than
 * the window are evicted lazily on the next check. Denied requests are not
 * recorded, so a flooding user regains access as soon as the oldest admitted
 * request leaves the window. Keys idle for a whole window are dropped by a
 * sweep that runs at most once per window.
 *
 * <p>
 * Can be disabled via {@code bot.rate-limit.enabled=false}.
 */
@Component
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    private final BotProperties.RateLimitProperties settings;
    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private volatile Instant nextSweep;

    public SlidingWindowRateLimiter(BotProperties properties, Clock clock) {
        this.settings = properties.getRateLimit();
        this.clock = clock;
    }

    @Override
    public RateLimitResult tryConsume(String key) {
        if (!settings.isEnabled()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        int maxRequests = Math.max(1, settings.getMaxRequests());
        Duration window = settings.getWindow();
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);

        AtomicReference<RateLimitResult> result = new AtomicReference<>();
        windows.compute(key, (k, existing) -> {
            Deque<Instant> timestamps = existing != null ? existing : new ArrayDeque<>();
            evictExpired(timestamps, windowStart);
            if (timestamps.size() < maxRequests) {
                timestamps.addLast(now);
                result.set(RateLimitResult.allowed(maxRequests - (long) timestamps.size()));
            } else {
                log.debug("[RateLimit] Rate limit exceeded for {}", key);
                result.set(RateLimitResult.denied(Duration.between(windowStart, timestamps.peekFirst()),
                        "Rate limit exceeded"));
            }
            return timestamps;
        });
        sweepIdleKeys(now, window, windowStart);
        return result.get();
    }

    int trackedKeys() {
        return windows.size();
    }

    private void sweepIdleKeys(Instant now, Duration window, Instant windowStart) {
        Instant due = nextSweep;
        if (due != null && now.isBefore(due)) {
            return;
        }
        nextSweep = now.plus(window);
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, timestamps) -> {
                evictExpired(timestamps, windowStart);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
    }

    private static void evictExpired(Deque<Instant> timestamps, Instant windowStart) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(windowStart)) {
            timestamps.pollFirst();
        }
    }
}
