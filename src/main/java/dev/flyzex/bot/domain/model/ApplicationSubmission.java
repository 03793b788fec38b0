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
import lombok.Value;

import java.util.List;

/**
 * Input of {@code ApplicationService#submit}. Either {@code answer} (legacy
 * free-text intake) or {@code responses} (structured multi-step intake) is
 * set.
 */
@Value
@Builder
public class ApplicationSubmission {

    long userId;
    String fullName;
    String username;
    String answer;
    List<ApplicationResponse> responses;
    String languageCode;

    public static ApplicationSubmission freeText(long userId, String fullName, String username, String answer,
            String languageCode) {
        return ApplicationSubmission.builder()
                .userId(userId)
                .fullName(fullName)
                .username(username)
                .answer(answer)
                .languageCode(languageCode)
                .build();
    }

    public static ApplicationSubmission structured(long userId, String fullName, String username,
            List<ApplicationResponse> responses, String languageCode) {
        return ApplicationSubmission.builder()
                .userId(userId)
                .fullName(fullName)
                .username(username)
                .responses(responses)
                .languageCode(languageCode)
                .build();
    }

    public boolean isStructured() {
        return responses != null && !responses.isEmpty();
    }
}
