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

import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationHistoryEntry;
import dev.flyzex.bot.domain.model.ApplicationResponse;
import dev.flyzex.bot.domain.model.ApplicationStatistics;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import dev.flyzex.bot.domain.model.ApplicationSubmission;
import dev.flyzex.bot.domain.model.Decision;
import dev.flyzex.bot.domain.model.DecisionResult;
import dev.flyzex.bot.domain.model.StoreState;
import dev.flyzex.bot.domain.model.SubmissionResult;
import dev.flyzex.bot.domain.service.StateStore.Mutation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle of guild applications: submission, withdrawal and the admin review.
 *
 * <p>
 * A user has at most one pending application. The history keeps exactly one
 * entry per user that ever applied and is overwritten on every transition.
 * Approved users cannot apply again.
 *
 * <p>
 * Review is either one step ({@link #decide}) or two steps
 * ({@link #popApplication} followed by {@link #recordDecision}) when the admin
 * is asked for a moderation note in between.
 */
@Service
@Slf4j
public class ApplicationService {

    private static final int RECENT_UPDATES_LIMIT = 5;

    private final StateStore stateStore;
    private final Clock clock;

    public ApplicationService(StateStore stateStore, Clock clock) {
        this.stateStore = stateStore;
        this.clock = clock;
    }

    public SubmissionResult submit(ApplicationSubmission submission) {
        long userId = submission.getUserId();
        SubmissionResult result = stateStore.update(state -> {
            if (state.getApplications().containsKey(userId)) {
                return Mutation.unchanged(SubmissionResult.DUPLICATE);
            }
            ApplicationHistoryEntry previous = state.getApplicationHistory().get(userId);
            if (previous != null && previous.getStatus() == ApplicationStatus.APPROVED) {
                return Mutation.unchanged(SubmissionResult.ALREADY_APPROVED);
            }

            String timestamp = TimestampSupport.now(clock);
            String languageCode = submission.getLanguageCode() != null
                    ? submission.getLanguageCode()
                    : previous != null ? previous.getLanguageCode() : null;

            List<ApplicationResponse> responses = new ArrayList<>();
            String answer;
            if (submission.isStructured()) {
                int index = 1;
                for (ApplicationResponse response : submission.getResponses()) {
                    String questionId = response.getQuestionId() != null && !response.getQuestionId().isBlank()
                            ? response.getQuestionId()
                            : "q" + index;
                    responses.add(new ApplicationResponse(questionId, response.getQuestion(),
                            response.getAnswer()));
                    index++;
                }
                answer = summarize(responses);
            } else {
                answer = submission.getAnswer() != null ? submission.getAnswer().trim() : "";
            }

            state.getApplications().put(userId, Application.builder()
                    .userId(userId)
                    .fullName(submission.getFullName())
                    .username(submission.getUsername())
                    .answer(answer)
                    .responses(responses)
                    .createdAt(timestamp)
                    .languageCode(languageCode)
                    .build());
            state.getApplicationHistory().put(userId, ApplicationHistoryEntry.builder()
                    .status(ApplicationStatus.PENDING)
                    .updatedAt(timestamp)
                    .languageCode(languageCode)
                    .build());
            return Mutation.changed(SubmissionResult.SUBMITTED);
        });
        log.info("[Applications] Submission from {}: {}", userId, result);
        return result;
    }

    /**
     * Withdraw the user's pending application.
     *
     * @return false if nothing was pending
     */
    public boolean withdraw(long userId) {
        boolean withdrawn = stateStore.update(state -> {
            Application removed = state.getApplications().remove(userId);
            if (removed == null) {
                return Mutation.unchanged(false);
            }
            writeHistory(state, userId, ApplicationStatus.WITHDRAWN, null, null);
            return Mutation.changed(true);
        });
        if (withdrawn) {
            log.info("[Applications] Application of {} withdrawn", userId);
        }
        return withdrawn;
    }

    /**
     * First phase of a two-step review: removes and returns the pending
     * application. The history is not touched until
     * {@link #recordDecision} is called.
     */
    public Optional<Application> popApplication(long userId) {
        return stateStore.update(state -> {
            Application removed = state.getApplications().remove(userId);
            return removed != null
                    ? Mutation.changed(Optional.of(removed.copy()))
                    : Mutation.unchanged(Optional.<Application>empty());
        });
    }

    /**
     * Second phase of a two-step review: writes the status to the history. The
     * language code of the previous entry is kept unless one is given.
     *
     * <p>
     * Recording an approval also drops a pending application the user may have
     * submitted in the meantime, so an approved user never has one.
     */
    public void recordDecision(long userId, ApplicationStatus status, String note, String languageCode) {
        stateStore.update(state -> {
            if (status == ApplicationStatus.APPROVED) {
                state.getApplications().remove(userId);
            }
            writeHistory(state, userId, status, note, languageCode);
            return Mutation.changed(null);
        });
        log.info("[Applications] Decision for {} recorded: {}", userId, status.getValue());
    }

    /**
     * Pop and record in one critical section.
     */
    public DecisionResult decide(long userId, Decision decision, String note) {
        DecisionResult result = stateStore.update(state -> {
            if (state.getApplications().remove(userId) == null) {
                return Mutation.unchanged(DecisionResult.NOT_FOUND);
            }
            writeHistory(state, userId, decision.toStatus(), note, null);
            return Mutation.changed(DecisionResult.DECIDED);
        });
        log.info("[Applications] Decision {} for {}: {}", decision, userId, result);
        return result;
    }

    public Optional<ApplicationHistoryEntry> getStatus(long userId) {
        return stateStore.read(state -> Optional.ofNullable(state.getApplicationHistory().get(userId))
                .map(ApplicationHistoryEntry::copy));
    }

    public boolean hasPending(long userId) {
        return stateStore.read(state -> state.getApplications().containsKey(userId));
    }

    public Optional<Application> getPending(long userId) {
        return stateStore.read(state -> Optional.ofNullable(state.getApplications().get(userId))
                .map(Application::copy));
    }

    /**
     * Pending applications in submission order.
     */
    public List<Application> listPending() {
        return stateStore.read(state -> state.getApplications().values().stream()
                .map(Application::copy)
                .toList());
    }

    public ApplicationStatistics getStatistics() {
        return stateStore.read(this::computeStatistics);
    }

    private ApplicationStatistics computeStatistics(StoreState state) {
        Map<String, Integer> statusCounts = new LinkedHashMap<>();
        Map<String, Integer> languages = new LinkedHashMap<>();
        for (ApplicationHistoryEntry entry : state.getApplicationHistory().values()) {
            String status = entry.getStatus() != null ? entry.getStatus().getValue() : "unknown";
            statusCounts.merge(status, 1, Integer::sum);
            if (entry.getLanguageCode() != null && !entry.getLanguageCode().isBlank()) {
                languages.merge(entry.getLanguageCode(), 1, Integer::sum);
            }
        }

        double averageLength = 0.0;
        if (!state.getApplications().isEmpty()) {
            long totalLength = 0;
            for (Application application : state.getApplications().values()) {
                totalLength += application.getAnswer() != null ? application.getAnswer().length() : 0;
            }
            averageLength = BigDecimal.valueOf(totalLength)
                    .divide(BigDecimal.valueOf(state.getApplications().size()), 2, RoundingMode.HALF_UP)
                    .doubleValue();
        }

        List<ApplicationStatistics.RecentUpdate> recent = state.getApplicationHistory().entrySet().stream()
                .sorted(Comparator.comparing(
                        (Map.Entry<Long, ApplicationHistoryEntry> e) -> TimestampSupport
                                .sortKey(e.getValue().getUpdatedAt()))
                        .reversed())
                .limit(RECENT_UPDATES_LIMIT)
                .map(e -> new ApplicationStatistics.RecentUpdate(e.getKey(), e.getValue().getStatus(),
                        e.getValue().getUpdatedAt(), e.getValue().getNote()))
                .toList();

        return ApplicationStatistics.builder()
                .pending(state.getApplications().size())
                .total(state.getApplicationHistory().size())
                .statusCounts(statusCounts)
                .languages(languages)
                .averagePendingAnswerLength(averageLength)
                .recentUpdates(recent)
                .build();
    }

    private void writeHistory(StoreState state, long userId, ApplicationStatus status, String note,
            String languageCode) {
        ApplicationHistoryEntry previous = state.getApplicationHistory().get(userId);
        String language = languageCode != null
                ? languageCode
                : previous != null ? previous.getLanguageCode() : null;
        state.getApplicationHistory().put(userId, ApplicationHistoryEntry.builder()
                .status(status)
                .updatedAt(TimestampSupport.now(clock))
                .note(note != null && !note.isBlank() ? note.trim() : null)
                .languageCode(language)
                .build());
    }

    /**
     * Flattens structured responses into the displayable {@code answer} text.
     */
    static String summarize(List<ApplicationResponse> responses) {
        List<String> blocks = new ArrayList<>();
        for (ApplicationResponse response : responses) {
            String question = response.getQuestion() != null ? response.getQuestion().trim() : "";
            String answer = response.getAnswer() != null ? response.getAnswer().trim() : "";
            blocks.add("Q: " + question + "\nA: " + answer);
        }
        return String.join("\n\n", blocks);
    }
}
