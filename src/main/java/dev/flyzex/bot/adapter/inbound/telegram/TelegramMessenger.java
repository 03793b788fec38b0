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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageReplyMarkup;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thin wrapper over the Telegram client shared by the update handlers. All
 * texts are sent with HTML parse mode; callers escape user-provided content
 * through {@link TelegramTextFormatter}.
 *
 * <p>
 * Delivery failures are logged and reported as {@code false}; a failed
 * notification never undoes a state change that has already been persisted.
 */
@Component
@Slf4j
public class TelegramMessenger {

    private static final String PARSE_MODE = "HTML";
    private static final Set<String> CHAT_ADMIN_STATUSES = Set.of("administrator", "creator");

    private final AtomicReference<TelegramClient> telegramClient = new AtomicReference<>();

    void setTelegramClient(TelegramClient client) {
        this.telegramClient.set(client);
    }

    TelegramClient getTelegramClient() {
        return telegramClient.get();
    }

    public boolean send(String chatId, String text) {
        return send(chatId, text, null);
    }

    public boolean send(String chatId, String text, InlineKeyboardMarkup keyboard) {
        TelegramClient client = telegramClient.get();
        if (client == null) {
            log.warn("[Telegram] Client not initialized, dropping message to {}", chatId);
            return false;
        }
        try {
            client.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .replyMarkup(keyboard)
                    .build());
            return true;
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
            return false;
        }
    }

    public void edit(String chatId, Integer messageId, String text) {
        TelegramClient client = telegramClient.get();
        if (client == null || messageId == null) {
            return;
        }
        try {
            client.execute(EditMessageText.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .text(text)
                    .parseMode(PARSE_MODE)
                    .build());
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to edit message {} in chat: {}", messageId, chatId, e);
        }
    }

    public void clearKeyboard(String chatId, Integer messageId) {
        TelegramClient client = telegramClient.get();
        if (client == null || messageId == null) {
            return;
        }
        try {
            client.execute(EditMessageReplyMarkup.builder()
                    .chatId(chatId)
                    .messageId(messageId)
                    .replyMarkup(InlineKeyboardMarkup.builder().keyboard(List.of()).build())
                    .build());
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to clear keyboard of message {} in chat: {}", messageId, chatId, e);
        }
    }

    public void answerCallback(String callbackQueryId) {
        TelegramClient client = telegramClient.get();
        if (client == null) {
            return;
        }
        try {
            client.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Failed to answer callback {}", callbackQueryId, e);
        }
    }

    /**
     * Whether the user is an administrator or the creator of the chat. Lookup
     * failures count as "no".
     */
    public boolean isChatAdmin(String chatId, long userId) {
        TelegramClient client = telegramClient.get();
        if (client == null) {
            return false;
        }
        try {
            ChatMember member = client.execute(GetChatMember.builder()
                    .chatId(chatId)
                    .userId(userId)
                    .build());
            return member != null && CHAT_ADMIN_STATUSES.contains(member.getStatus());
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to fetch chat member {} of chat {}", userId, chatId, e);
            return false;
        }
    }

    /**
     * Display name of a chat member, if Telegram still knows it.
     */
    public Optional<String> findDisplayName(String chatId, long userId) {
        TelegramClient client = telegramClient.get();
        if (client == null) {
            return Optional.empty();
        }
        try {
            ChatMember member = client.execute(GetChatMember.builder()
                    .chatId(chatId)
                    .userId(userId)
                    .build());
            if (member == null || member.getUser() == null) {
                return Optional.empty();
            }
            return Optional.of(TelegramTextFormatter.displayName(member.getUser()));
        } catch (TelegramApiException e) {
            log.debug("[Telegram] Could not resolve member {} of chat {}", userId, chatId, e);
            return Optional.empty();
        }
    }
}
