package dev.flyzex.bot.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over pending applications and the history, computed on
 * demand.
 */
@Data
@Builder
public class ApplicationStatistics {

    private int pending;
    private int total;
    private Map<String, Integer> statusCounts;
    private Map<String, Integer> languages;
    private double averagePendingAnswerLength;
    private List<RecentUpdate> recentUpdates;

    public record RecentUpdate(long userId, ApplicationStatus status, String updatedAt, String note) {
    }
}
