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

import dev.flyzex.bot.adapter.inbound.telegram.TelegramConversations.NotePrompt;
import dev.flyzex.bot.domain.model.Application;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import dev.flyzex.bot.domain.service.ApplicationService;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;

import java.util.List;
import java.util.Optional;

/**
 * Admin side of the application flow: announcing new applications to the
 * review chat, listing pending ones and the approve/deny buttons.
 *
 * <p>
 * Review is two-phase. Pressing a button pops the application and asks the
 * admin for a moderation note; the admin's next message in that chat (or
 * {@code /skip}) records the decision and notifies the applicant.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class ApplicationReviewHandler {

    static final String CALLBACK_PREFIX = "application:";
    static final String CALLBACK_SKIP = CALLBACK_PREFIX + "skip";
    private static final String ACTION_APPROVE = "approve";
    private static final String ACTION_DENY = "deny";
    private static final int CALLBACK_DATA_PARTS_COUNT = 3;

    private final ApplicationService applicationService;
    private final TelegramAccessPolicy accessPolicy;
    private final TelegramConversations conversations;
    private final TelegramMessenger messenger;
    private final MessageService messageService;
    private final BotProperties properties;

    /**
     * Post a freshly submitted application to the review chat, if one is
     * configured.
     */
    public void announce(Application application) {
        Long reviewChatId = properties.getTelegram().getReviewChatId();
        if (reviewChatId == null) {
            return;
        }
        String lang = messageService.getDefaultLanguage();
        String text = messageService.getMessage("review.new", lang) + "\n\n" + renderApplication(application, lang);
        messenger.send(reviewChatId.toString(), text, reviewKeyboard(application.getUserId(), lang));
    }

    /**
     * Send the oldest pending applications, one message each, with review
     * buttons.
     */
    public void sendPending(String chatId, String lang) {
        List<Application> pending = applicationService.listPending();
        if (pending.isEmpty()) {
            messenger.send(chatId, msg(lang, "pending.none"));
            return;
        }
        int pageSize = Math.max(1, properties.getApplications().getPendingPageSize());
        for (Application application : pending.subList(0, Math.min(pageSize, pending.size()))) {
            messenger.send(chatId, renderApplication(application, lang),
                    reviewKeyboard(application.getUserId(), lang));
        }
        if (pending.size() > pageSize) {
            messenger.send(chatId, msg(lang, "pending.more", String.valueOf(pending.size() - pageSize)));
        }
    }

    public void handleCallback(CallbackQuery callback) {
        User admin = callback.getFrom();
        String chatId = callback.getMessage().getChatId().toString();
        Integer messageId = callback.getMessage().getMessageId();
        String lang = messageService.resolveLanguage(admin.getLanguageCode());

        if (!accessPolicy.isAdmin(admin.getId())) {
            messenger.edit(chatId, messageId, msg(lang, "admin.only"));
            return;
        }

        String data = callback.getData();
        if (CALLBACK_SKIP.equals(data)) {
            messenger.clearKeyboard(chatId, messageId);
            return;
        }

        // Format: application:<userId>:approve or application:<userId>:deny
        String[] parts = data.split(":");
        if (parts.length != CALLBACK_DATA_PARTS_COUNT) {
            log.warn("[Telegram] Invalid review callback data: {}", data);
            return;
        }
        Optional<Long> applicantId = TelegramTextFormatter.parseUserId(parts[1]);
        ApplicationStatus status = switch (parts[2]) {
        case ACTION_APPROVE -> ApplicationStatus.APPROVED;
        case ACTION_DENY -> ApplicationStatus.DENIED;
        default -> null;
        };
        if (applicantId.isEmpty() || status == null) {
            log.warn("[Telegram] Invalid review callback data: {}", data);
            return;
        }

        // an unanswered earlier prompt is recorded without a note
        conversations.findNotePrompt(admin.getId()).ifPresent(previous -> finishDecision(admin, previous, null));

        Optional<Application> popped = applicationService.popApplication(applicantId.get());
        if (popped.isEmpty()) {
            messenger.edit(chatId, messageId, msg(lang, "review.not-found"));
            return;
        }

        Application application = popped.get();
        conversations.promptForNote(admin.getId(), new NotePrompt(chatId, application, status));
        String statusLabel = msg(lang, "status." + status.getValue());
        messenger.edit(chatId, messageId, msg(lang, "review.note.prompt", statusLabel,
                TelegramTextFormatter.escape(application.getFullName()), String.valueOf(application.getUserId())));
        log.info("[Telegram] Admin {} reviewing application of {}: {}", admin.getId(), application.getUserId(),
                status.getValue());
    }

    /**
     * Record the pending decision of an admin with the given note (or none) and
     * notify the applicant.
     *
     * The prompt stays open until the decision is persisted, so a failed save
     * can be answered again.
     *
     * @return false if the admin had no decision waiting for a note
     */
    public boolean completeDecision(User admin, String note) {
        Optional<NotePrompt> prompt = conversations.findNotePrompt(admin.getId());
        prompt.ifPresent(pending -> finishDecision(admin, pending, note));
        return prompt.isPresent();
    }

    private void finishDecision(User admin, NotePrompt prompt, String note) {
        Application application = prompt.application();
        String lang = messageService.resolveLanguage(admin.getLanguageCode());

        applicationService.recordDecision(application.getUserId(), prompt.status(), note, null);
        conversations.clearNotePrompt(admin.getId(), prompt);

        String adminKey = prompt.status() == ApplicationStatus.APPROVED ? "review.approved.admin"
                : "review.denied.admin";
        messenger.send(prompt.chatId(), msg(lang, adminKey, TelegramTextFormatter.escape(application.getFullName())));
        notifyApplicant(application, prompt.status(), note);
    }

    private void notifyApplicant(Application application, ApplicationStatus status, String note) {
        String lang = messageService.resolveLanguage(application.getLanguageCode());
        String key = status == ApplicationStatus.APPROVED ? "review.approved.user" : "review.denied.user";
        StringBuilder text = new StringBuilder(msg(lang, key));
        if (note != null && !note.isBlank()) {
            text.append("\n\n").append(msg(lang, "review.note.user", TelegramTextFormatter.escape(note.trim())));
        }
        if (!messenger.send(String.valueOf(application.getUserId()), text.toString())) {
            log.warn("[Telegram] Could not notify applicant {} about the decision", application.getUserId());
        }
    }

    String renderApplication(Application application, String lang) {
        return msg(lang, "pending.item",
                TelegramTextFormatter.escape(application.getFullName()),
                String.valueOf(application.getUserId()),
                TelegramTextFormatter.escape(application.getAnswer()),
                TelegramTextFormatter.escape(application.getCreatedAt()));
    }

    private InlineKeyboardMarkup reviewKeyboard(long userId, String lang) {
        InlineKeyboardRow decisions = new InlineKeyboardRow(
                button(msg(lang, "review.button.approve"), CALLBACK_PREFIX + userId + ":" + ACTION_APPROVE),
                button(msg(lang, "review.button.deny"), CALLBACK_PREFIX + userId + ":" + ACTION_DENY));
        InlineKeyboardRow skip = new InlineKeyboardRow(button(msg(lang, "review.button.skip"), CALLBACK_SKIP));
        return InlineKeyboardMarkup.builder().keyboard(List.of(decisions, skip)).build();
    }

    private InlineKeyboardButton button(String text, String callbackData) {
        return InlineKeyboardButton.builder()
                .text(text)
                .callbackData(callbackData)
                .build();
    }

    private String msg(String lang, String key, Object... args) {
        return messageService.getMessage(key, lang, args);
    }
}
