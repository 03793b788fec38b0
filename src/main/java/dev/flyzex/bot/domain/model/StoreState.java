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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete in-memory state, serialized as one snapshot document. Integer keys
 * (user ids, chat ids) are written as JSON object keys, i.e. strings.
 *
 * <p>
 * Not thread-safe; only {@code StateStore} touches it, under its lock.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreState {

    private List<Long> admins = new ArrayList<>();
    private Map<Long, AdminProfile> adminProfiles = new LinkedHashMap<>();
    private Map<Long, Application> applications = new LinkedHashMap<>();
    private Map<Long, ApplicationHistoryEntry> applicationHistory = new LinkedHashMap<>();
    private Map<Long, Map<Long, Long>> xp = new LinkedHashMap<>();
    private Map<Long, List<Cup>> cups = new LinkedHashMap<>();
}
