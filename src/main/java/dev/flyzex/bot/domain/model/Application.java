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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A pending guild application, keyed by the applicant's user id.
 *
 * <p>
 * {@code answer} always holds a displayable text: the free-text answer of a
 * legacy submission, or the flattened question/answer summary of a structured
 * one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Application {

    private long userId;
    private String fullName;
    private String username;
    private String answer;

    @Builder.Default
    @JsonAlias("answers")
    private List<ApplicationResponse> responses = new ArrayList<>();

    @JsonAlias("submitted_at")
    private String createdAt;

    private String languageCode;

    public Application copy() {
        List<ApplicationResponse> copied = new ArrayList<>();
        if (responses != null) {
            for (ApplicationResponse response : responses) {
                copied.add(new ApplicationResponse(response.getQuestionId(), response.getQuestion(),
                        response.getAnswer()));
            }
        }
        return toBuilder().responses(copied).build();
    }
}
