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

import dev.flyzex.bot.domain.model.Cup;
import dev.flyzex.bot.domain.model.LeaderboardEntry;
import dev.flyzex.bot.domain.service.StateStore.Mutation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chat XP ledger and cup (trophy) history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EngagementService {

    private final StateStore stateStore;
    private final Clock clock;

    /**
     * Add XP to a user in a chat.
     *
     * @return the user's new total in that chat
     * @throws IllegalArgumentException
     *             if {@code amount} is negative
     * @throws ArithmeticException
     *             if the total would overflow; nothing is changed
     */
    public long addXp(long chatId, long userId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("XP amount must not be negative: " + amount);
        }
        return stateStore.update(state -> {
            Map<Long, Long> scores = state.getXp().computeIfAbsent(chatId, id -> new LinkedHashMap<>());
            long total = Math.addExact(scores.getOrDefault(userId, 0L), amount);
            scores.put(userId, total);
            return Mutation.changed(total);
        });
    }

    /**
     * Top scores of a chat, highest first. Equal scores keep the order in which
     * users first earned XP.
     */
    public List<LeaderboardEntry> getLeaderboard(long chatId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return stateStore.read(state -> {
            Map<Long, Long> scores = state.getXp().get(chatId);
            if (scores == null) {
                return List.<LeaderboardEntry>of();
            }
            return scores.entrySet().stream()
                    .map(e -> new LeaderboardEntry(e.getKey(), e.getValue()))
                    .sorted(Comparator.comparingLong(LeaderboardEntry::score).reversed())
                    .limit(limit)
                    .toList();
        });
    }

    /**
     * Append a cup to the chat's history.
     *
     * @throws IllegalArgumentException
     *             if the title is blank
     */
    public Cup addCup(long chatId, String title, String description, List<String> podium) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Cup title must not be blank");
        }
        List<String> places = new ArrayList<>();
        if (podium != null) {
            for (String place : podium) {
                if (place != null && !place.isBlank()) {
                    places.add(place.trim());
                }
            }
        }
        Cup cup = Cup.builder()
                .title(title.trim())
                .description(description != null ? description.trim() : "")
                .podium(places)
                .createdAt(TimestampSupport.now(clock))
                .build();
        stateStore.update(state -> {
            state.getCups().computeIfAbsent(chatId, id -> new ArrayList<>()).add(cup.copy());
            return Mutation.changed(null);
        });
        log.info("[Engagement] Cup '{}' added in chat {}", cup.getTitle(), chatId);
        return cup;
    }

    /**
     * Most recent cups of a chat, newest first.
     */
    public List<Cup> getCups(long chatId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return stateStore.read(state -> {
            List<Cup> cups = state.getCups().get(chatId);
            if (cups == null) {
                return List.<Cup>of();
            }
            return cups.stream()
                    .sorted(Comparator.comparing((Cup cup) -> TimestampSupport.sortKey(cup.getCreatedAt()))
                            .reversed())
                    .limit(limit)
                    .map(Cup::copy)
                    .toList();
        });
    }
}
