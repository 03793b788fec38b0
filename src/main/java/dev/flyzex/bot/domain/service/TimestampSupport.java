package dev.flyzex.bot.domain.service;

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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonical timestamp handling for everything persisted in the state file.
 *
 * <p>
 * Canonical form is ISO-8601 in UTC with microseconds and an explicit offset,
 * e.g. {@code 2024-05-01T12:30:45.123456+00:00}. Older snapshots stored naive
 * timestamps ({@code 2024-05-01T12:30:45.123456}, sometimes with a space
 * instead of {@code T}); those are read as UTC. Values that cannot be parsed
 * are passed through so no data is lost.
 */
public final class TimestampSupport {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSxxx");

    private TimestampSupport() {
    }

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    public static String format(Instant instant) {
        return CANONICAL.format(instant.atOffset(ZoneOffset.UTC));
    }

    /**
     * Parse-or-pass-through: canonical form for anything parseable, the cleaned
     * raw value otherwise, {@code null} for {@code null}.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        return parse(raw).map(TimestampSupport::format).orElse(clean(raw));
    }

    public static Optional<Instant> parse(String raw) {
        String cleaned = clean(raw);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        for (String candidate : candidates(cleaned)) {
            try {
                return Optional.of(OffsetDateTime.parse(candidate, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .toInstant());
            } catch (DateTimeParseException e) {
                // not offset-qualified, try the naive form
            }
            try {
                return Optional.of(LocalDateTime.parse(candidate, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                // try next candidate
            }
        }
        return Optional.empty();
    }

    /**
     * Sort key for ordering records by time; unparseable values sort as oldest.
     */
    public static Instant sortKey(String raw) {
        return parse(raw).orElse(Instant.EPOCH);
    }

    private static List<String> candidates(String cleaned) {
        List<String> candidates = new ArrayList<>();
        candidates.add(cleaned);
        int space = cleaned.indexOf(' ');
        if (space > 0) {
            candidates.add(cleaned.substring(0, space) + "T" + cleaned.substring(space + 1).trim());
        }
        return candidates;
    }

    private static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace('\r', ' ').replace('\n', ' ').trim();
    }
}
