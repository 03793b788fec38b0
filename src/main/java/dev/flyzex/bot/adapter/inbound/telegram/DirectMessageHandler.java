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

import dev.flyzex.bot.adapter.inbound.telegram.TelegramConversations.Intake;
import dev.flyzex.bot.domain.model.AdminProfile;
import dev.flyzex.bot.domain.model.ApplicationHistoryEntry;
import dev.flyzex.bot.domain.model.ApplicationStatus;
import dev.flyzex.bot.domain.model.ApplicationSubmission;
import dev.flyzex.bot.domain.model.SubmissionResult;
import dev.flyzex.bot.domain.service.AdminService;
import dev.flyzex.bot.domain.service.ApplicationService;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardRow;

import java.util.List;
import java.util.Optional;

/**
 * Private-chat commands: the applicant flow ({@code /start}, apply button,
 * intake, {@code /status}, {@code /withdraw}, {@code /cancel}) and the admin
 * commands ({@code /pending}, {@code /admins}, {@code /promote},
 * {@code /demote}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
@SuppressWarnings("PMD.LooseCoupling") // InlineKeyboardRow is required by Telegram API, no interface available
public class DirectMessageHandler {

    static final String CALLBACK_APPLY = "apply_for_guild";

    private final ApplicationService applicationService;
    private final AdminService adminService;
    private final ApplicationReviewHandler reviewHandler;
    private final TelegramAccessPolicy accessPolicy;
    private final TelegramConversations conversations;
    private final TelegramMessenger messenger;
    private final MessageService messageService;
    private final BotProperties properties;

    public void handleMessage(Message message) {
        User user = message.getFrom();
        String chatId = message.getChatId().toString();
        String lang = messageService.resolveLanguage(user.getLanguageCode());
        String text = message.getText().trim();

        Optional<TelegramCommand> command = TelegramCommand.parse(text);
        if (command.isEmpty()) {
            receiveAnswer(user, chatId, text, lang);
            return;
        }

        switch (command.get().name()) {
        case "start" -> sendWelcome(user, chatId, lang);
        case "cancel" -> cancel(user, chatId, lang);
        case "status" -> sendStatus(user, chatId, lang);
        case "withdraw" -> withdraw(user, chatId, lang);
        case "pending" -> {
            if (requireAdmin(user, chatId, lang)) {
                reviewHandler.sendPending(chatId, lang);
            }
        }
        case "admins" -> sendAdmins(chatId, lang);
        case "promote" -> promote(user, chatId, command.get().firstArgument(), lang);
        case "demote" -> demote(user, chatId, command.get().firstArgument(), lang);
        default -> messenger.send(chatId, msg(lang, "command.unknown"));
        }
    }

    /**
     * The apply button under the welcome message.
     */
    public void handleApplyCallback(CallbackQuery callback) {
        User user = callback.getFrom();
        String chatId = callback.getMessage().getChatId().toString();
        Integer messageId = callback.getMessage().getMessageId();
        String lang = messageService.resolveLanguage(user.getLanguageCode());

        if (accessPolicy.isAdmin(user.getId())) {
            messenger.edit(chatId, messageId, msg(lang, "apply.admin"));
            return;
        }
        if (applicationService.hasPending(user.getId())) {
            messenger.edit(chatId, messageId, msg(lang, "apply.duplicate"));
            return;
        }
        Optional<ApplicationHistoryEntry> status = applicationService.getStatus(user.getId());
        if (status.isPresent() && status.get().getStatus() == ApplicationStatus.APPROVED) {
            messenger.edit(chatId, messageId, msg(lang, "apply.already-approved"));
            return;
        }

        Intake intake = conversations.startIntake(user.getId(), properties.getApplications().getQuestions(),
                user.getLanguageCode());
        messenger.edit(chatId, messageId, msg(lang, "apply.started"));
        askNext(intake, chatId, lang);
        log.info("[Telegram] Intake started for user {}", user.getId());
    }

    private void sendWelcome(User user, String chatId, String lang) {
        InlineKeyboardMarkup keyboard = InlineKeyboardMarkup.builder()
                .keyboard(List.of(new InlineKeyboardRow(InlineKeyboardButton.builder()
                        .text(msg(lang, "apply.button"))
                        .callbackData(CALLBACK_APPLY)
                        .build())))
                .build();
        String text = msg(lang, "welcome");
        if (accessPolicy.isAdmin(user.getId())) {
            text = text + "\n\n" + msg(lang, "welcome.admin");
        }
        messenger.send(chatId, text, keyboard);
    }

    private void receiveAnswer(User user, String chatId, String text, String lang) {
        Optional<Intake> found = conversations.findIntake(user.getId());
        if (found.isEmpty()) {
            messenger.send(chatId, msg(lang, "start.hint"));
            return;
        }
        if (text.isEmpty()) {
            return;
        }

        Intake intake = found.get();
        if (intake.isStructured()) {
            intake.answer(text);
            if (!intake.isComplete()) {
                askNext(intake, chatId, lang);
                return;
            }
        }
        conversations.cancelIntake(user.getId());

        String fullName = TelegramTextFormatter.displayName(user);
        ApplicationSubmission submission = intake.isStructured()
                ? ApplicationSubmission.structured(user.getId(), fullName, user.getUserName(),
                        intake.getResponses(), intake.getLanguageCode())
                : ApplicationSubmission.freeText(user.getId(), fullName, user.getUserName(), text,
                        intake.getLanguageCode());

        SubmissionResult result = applicationService.submit(submission);
        switch (result) {
        case SUBMITTED -> {
            messenger.send(chatId, msg(lang, "apply.received"));
            applicationService.getPending(user.getId()).ifPresent(reviewHandler::announce);
        }
        case DUPLICATE -> {
            log.warn("[Telegram] Duplicate application prevented for user {}", user.getId());
            messenger.send(chatId, msg(lang, "apply.duplicate"));
        }
        case ALREADY_APPROVED -> messenger.send(chatId, msg(lang, "apply.already-approved"));
        }
    }

    private void askNext(Intake intake, String chatId, String lang) {
        if (!intake.isStructured()) {
            messenger.send(chatId, msg(lang, "apply.question"));
            return;
        }
        int total = properties.getApplications().getQuestions().size();
        int number = intake.getResponses().size() + 1;
        intake.currentQuestion().ifPresent(question -> messenger.send(chatId,
                msg(lang, "apply.question.step", String.valueOf(number), String.valueOf(total),
                        TelegramTextFormatter.escape(question))));
    }

    private void cancel(User user, String chatId, String lang) {
        if (conversations.cancelIntake(user.getId())) {
            messenger.send(chatId, msg(lang, "apply.cancelled"));
        } else {
            messenger.send(chatId, msg(lang, "cancel.nothing"));
        }
    }

    private void sendStatus(User user, String chatId, String lang) {
        Optional<ApplicationHistoryEntry> entry = applicationService.getStatus(user.getId());
        if (entry.isEmpty() || entry.get().getStatus() == null) {
            messenger.send(chatId, msg(lang, "status.none"));
            return;
        }
        StringBuilder text = new StringBuilder(msg(lang, "status.current",
                msg(lang, "status." + entry.get().getStatus().getValue()),
                TelegramTextFormatter.escape(entry.get().getUpdatedAt())));
        if (entry.get().getNote() != null && !entry.get().getNote().isBlank()) {
            text.append('\n').append(msg(lang, "status.note", TelegramTextFormatter.escape(entry.get().getNote())));
        }
        messenger.send(chatId, text.toString());
    }

    private void withdraw(User user, String chatId, String lang) {
        conversations.cancelIntake(user.getId());
        if (applicationService.withdraw(user.getId())) {
            messenger.send(chatId, msg(lang, "withdraw.done"));
        } else {
            messenger.send(chatId, msg(lang, "withdraw.none"));
        }
    }

    private void sendAdmins(String chatId, String lang) {
        List<AdminProfile> admins = adminService.getAdminDetails();
        if (admins.isEmpty()) {
            messenger.send(chatId, msg(lang, "admins.none"));
            return;
        }
        StringBuilder text = new StringBuilder(msg(lang, "admins.header"));
        for (AdminProfile admin : admins) {
            text.append('\n').append(formatAdmin(admin));
        }
        messenger.send(chatId, text.toString());
    }

    private String formatAdmin(AdminProfile admin) {
        StringBuilder line = new StringBuilder("• <code>").append(admin.getUserId()).append("</code>");
        if (admin.getFullName() != null) {
            line.append(' ').append(TelegramTextFormatter.escape(admin.getFullName()));
        }
        if (admin.getUsername() != null) {
            line.append(" @").append(TelegramTextFormatter.escape(admin.getUsername()));
        }
        return line.toString();
    }

    private void promote(User user, String chatId, String argument, String lang) {
        Optional<Long> target = requireOwnerAndTarget(user, chatId, argument, lang);
        if (target.isEmpty()) {
            return;
        }
        // without profile data addAdmin only reports a change when the admin is new
        if (adminService.addAdmin(target.get(), null, null)) {
            messenger.send(chatId, msg(lang, "admins.added", String.valueOf(target.get())));
        } else {
            messenger.send(chatId, msg(lang, "admins.already", String.valueOf(target.get())));
        }
    }

    private void demote(User user, String chatId, String argument, String lang) {
        Optional<Long> target = requireOwnerAndTarget(user, chatId, argument, lang);
        if (target.isEmpty()) {
            return;
        }
        if (adminService.removeAdmin(target.get())) {
            messenger.send(chatId, msg(lang, "admins.removed", String.valueOf(target.get())));
        } else {
            messenger.send(chatId, msg(lang, "admins.not-admin", String.valueOf(target.get())));
        }
    }

    private Optional<Long> requireOwnerAndTarget(User user, String chatId, String argument, String lang) {
        if (!accessPolicy.isOwner(user.getId())) {
            messenger.send(chatId, msg(lang, "owner.only"));
            return Optional.empty();
        }
        if (argument.isEmpty()) {
            messenger.send(chatId, msg(lang, "admins.usage"));
            return Optional.empty();
        }
        Optional<Long> target = TelegramTextFormatter.parseUserId(argument);
        if (target.isEmpty()) {
            messenger.send(chatId, msg(lang, "admins.invalid-id", TelegramTextFormatter.escape(argument)));
        }
        return target;
    }

    private boolean requireAdmin(User user, String chatId, String lang) {
        if (accessPolicy.isAdmin(user.getId())) {
            return true;
        }
        messenger.send(chatId, msg(lang, "admin.only"));
        return false;
    }

    private String msg(String lang, String key, Object... args) {
        return messageService.getMessage(key, lang, args);
    }
}
