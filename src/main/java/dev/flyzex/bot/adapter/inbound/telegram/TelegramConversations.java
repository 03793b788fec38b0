package dev.flyzex.bot.adapter.inbound.telegram;

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
import dev.flyzex.bot.domain.model.ApplicationResponse;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory conversation state of chat users: application intakes in progress
 * and admins asked for a moderation note. Lost on restart; only the persisted
 * state store is durable.
 */
@Component
public class TelegramConversations {

    private final Map<Long, Intake> intakes = new ConcurrentHashMap<>();
    private final Map<Long, NotePrompt> notePrompts = new ConcurrentHashMap<>();

    public Intake startIntake(long userId, List<String> questions, String languageCode) {
        Intake intake = new Intake(questions, languageCode);
        intakes.put(userId, intake);
        return intake;
    }

    public Optional<Intake> findIntake(long userId) {
        return Optional.ofNullable(intakes.get(userId));
    }

    public boolean cancelIntake(long userId) {
        return intakes.remove(userId) != null;
    }

    public void promptForNote(long adminId, NotePrompt prompt) {
        notePrompts.put(adminId, prompt);
    }

    /**
     * The note prompt of an admin, if it was issued in the given chat.
     */
    public Optional<NotePrompt> findNotePrompt(long adminId, String chatId) {
        NotePrompt prompt = notePrompts.get(adminId);
        return prompt != null && prompt.chatId().equals(chatId) ? Optional.of(prompt) : Optional.empty();
    }

    public Optional<NotePrompt> findNotePrompt(long adminId) {
        return Optional.ofNullable(notePrompts.get(adminId));
    }

    /**
     * Drops the note prompt once its decision is recorded. A prompt issued in
     * the meantime is left alone.
     */
    public boolean clearNotePrompt(long adminId, NotePrompt prompt) {
        return notePrompts.remove(adminId, prompt);
    }

    /**
     * An application intake walking through the configured questions. With no
     * questions configured a single free-text answer is collected.
     */
    public static final class Intake {

        private final List<String> questions;
        @Getter
        private final String languageCode;
        private final List<ApplicationResponse> responses = new ArrayList<>();

        Intake(List<String> questions, String languageCode) {
            this.questions = List.copyOf(questions);
            this.languageCode = languageCode;
        }

        public boolean isStructured() {
            return !questions.isEmpty();
        }

        public synchronized Optional<String> currentQuestion() {
            int index = responses.size();
            return index < questions.size() ? Optional.of(questions.get(index)) : Optional.empty();
        }

        public synchronized void answer(String text) {
            int index = responses.size();
            if (index >= questions.size()) {
                throw new IllegalStateException("All questions already answered");
            }
            responses.add(new ApplicationResponse("q" + (index + 1), questions.get(index), text));
        }

        public synchronized boolean isComplete() {
            return responses.size() >= questions.size();
        }

        public synchronized List<ApplicationResponse> getResponses() {
            return List.copyOf(responses);
        }
    }

    /**
     * A reviewed application waiting for the admin's moderation note.
     */
    public record NotePrompt(String chatId, Application application, ApplicationStatus status) {
    }
}
