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

import dev.flyzex.bot.domain.model.RateLimitResult;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.infrastructure.i18n.MessageService;
import dev.flyzex.bot.port.inbound.ChannelPort;
import dev.flyzex.bot.ratelimit.RateLimiter;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.Optional;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * This adapter implements both {@link ChannelPort} for its lifecycle and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound updates. Every
 * update passes the per-user rate limiter and is then routed:
 * <ul>
 * <li>callback queries to the apply button or the review buttons
 * <li>an admin's reply to a pending moderation note prompt to
 * {@link ApplicationReviewHandler}
 * <li>private-chat text to {@link DirectMessageHandler}
 * <li>group text to {@link GroupChatHandler}
 * </ul>
 *
 * <p>
 * Handler failures are logged and answered with a generic localized apology.
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.telegram.enabled=true} and the token environment variable is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final List<String> MENU_COMMANDS = List.of("start", "pending", "admins", "xp", "cups");

    private final BotProperties properties;
    private final Environment environment;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final TelegramMessenger messenger;
    private final TelegramConversations conversations;
    private final DirectMessageHandler directMessageHandler;
    private final GroupChatHandler groupChatHandler;
    private final ApplicationReviewHandler reviewHandler;
    private final RateLimiter rateLimiter;
    private final MessageService messageService;

    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing: allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        messenger.setTelegramClient(client);
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            Optional<String> token = resolveToken();
            if (token.isEmpty()) {
                log.warn("[Telegram] Token not configured (environment variable '{}'), adapter will not start",
                        properties.getTelegram().getTokenEnv());
                return;
            }
            if (messenger.getTelegramClient() == null) {
                messenger.setTelegramClient(new OkHttpTelegramClient(token.get()));
            }

            try {
                botsApplication.registerBot(token.get(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
                return;
            }
            registerCommandMenu();
        }
    }

    private void registerCommandMenu() {
        String lang = messageService.getDefaultLanguage();
        List<BotCommand> commands = MENU_COMMANDS.stream()
                .map(name -> new BotCommand(name, messageService.getMessage("command.menu." + name, lang)))
                .toList();
        try {
            messenger.getTelegramClient().execute(SetMyCommands.builder().commands(commands).build());
            log.debug("[Telegram] Registered {} menu commands", commands.size());
        } catch (TelegramApiException e) {
            log.warn("[Telegram] Failed to register command menu", e);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasCallbackQuery()) {
            handleCallback(update.getCallbackQuery());
        } else if (update.hasMessage() && update.getMessage().hasText() && update.getMessage().getFrom() != null) {
            handleMessage(update.getMessage());
        }
    }

    private void handleCallback(CallbackQuery callback) {
        messenger.answerCallback(callback.getId());
        if (callback.getMessage() == null || callback.getData() == null) {
            log.warn("[Telegram] Callback query without associated message, ignoring");
            return;
        }
        if (!admit(callback.getFrom())) {
            return;
        }

        String data = callback.getData();
        log.debug("[Telegram] Callback: {}", data);
        String chatId = callback.getMessage().getChatId().toString();
        try {
            if (DirectMessageHandler.CALLBACK_APPLY.equals(data)) {
                directMessageHandler.handleApplyCallback(callback);
            } else if (data.startsWith(ApplicationReviewHandler.CALLBACK_PREFIX)) {
                reviewHandler.handleCallback(callback);
            } else {
                log.debug("[Telegram] Unknown callback data: {}", data);
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to handle callback {} from {}", data, callback.getFrom().getId(), e);
            sendApology(chatId, callback.getFrom());
        }
    }

    private void handleMessage(Message message) {
        User user = message.getFrom();
        if (!admit(user)) {
            return;
        }
        String chatId = message.getChatId().toString();
        try {
            if (completesNotePrompt(message)) {
                return;
            }
            if (message.isUserMessage()) {
                directMessageHandler.handleMessage(message);
            } else if (message.isGroupMessage() || message.isSuperGroupMessage()) {
                groupChatHandler.handleMessage(message);
            }
        } catch (RuntimeException e) {
            log.error("[Telegram] Failed to handle message from {} in chat {}", user.getId(), chatId, e);
            sendApology(chatId, user);
        }
    }

    /**
     * An admin's plain text (or {@code /skip}, {@code /cancel}) in the chat
     * where a moderation note was requested completes that decision.
     */
    private boolean completesNotePrompt(Message message) {
        User user = message.getFrom();
        String chatId = message.getChatId().toString();
        if (conversations.findNotePrompt(user.getId(), chatId).isEmpty()) {
            return false;
        }
        Optional<TelegramCommand> command = TelegramCommand.parse(message.getText().trim());
        if (command.isEmpty()) {
            return reviewHandler.completeDecision(user, message.getText().trim());
        }
        if (command.get().is("skip") || command.get().is("cancel")) {
            return reviewHandler.completeDecision(user, null);
        }
        return false;
    }

    private boolean admit(User user) {
        if (user == null) {
            return false;
        }
        RateLimitResult result = rateLimiter.tryConsume(CHANNEL_TYPE + ":" + user.getId());
        if (!result.isAllowed()) {
            log.debug("[Telegram] Dropping update from {}: {}", user.getId(), result.getReason());
            return false;
        }
        return true;
    }

    private void sendApology(String chatId, User user) {
        String lang = messageService.resolveLanguage(user != null ? user.getLanguageCode() : null);
        messenger.send(chatId, messageService.getMessage("error.generic", lang));
    }

    private Optional<String> resolveToken() {
        String token = environment.getProperty(properties.getTelegram().getTokenEnv());
        return token == null || token.isBlank() ? Optional.empty() : Optional.of(token.trim());
    }
}
