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

import dev.flyzex.bot.domain.model.Cup;
import dev.flyzex.bot.domain.model.LeaderboardEntry;
import dev.flyzex.bot.domain.service.EngagementService;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import dev.flyzex.bot.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Group-chat engagement: XP for activity, the XP and cup leaderboards and
 * {@code /add_cup}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupChatHandler {

    private static final int CUP_FIELDS_COUNT = 3;

    private final EngagementService engagementService;
    private final TelegramAccessPolicy accessPolicy;
    private final TelegramMessenger messenger;
    private final MessageService messageService;
    private final BotProperties properties;

    public void handleMessage(Message message) {
        String chatId = message.getChatId().toString();
        String lang = messageService.getDefaultLanguage();
        String text = message.getText();

        Optional<TelegramCommand> command = TelegramCommand.parse(text);
        if (command.isEmpty()) {
            trackActivity(message.getChatId(), message.getFrom(), chatId, lang);
            return;
        }

        switch (command.get().name()) {
        case "xp" -> sendXpLeaderboard(chatId, lang);
        case "cups" -> sendCups(chatId, lang);
        case "add_cup" -> addCup(message.getFrom(), chatId, command.get().arguments(), lang);
        default -> log.debug("[Telegram] Ignoring command /{} in group {}", command.get().name(), chatId);
        }
    }

    private void trackActivity(long chatId, User user, String chatIdText, String lang) {
        int reward = properties.getXp().getMessageReward();
        if (reward <= 0) {
            return;
        }
        long total = engagementService.addXp(chatId, user.getId(), reward);
        int interval = properties.getXp().getMilestoneInterval();
        if (interval > 0 && total % ((long) reward * interval) == 0) {
            messenger.send(chatIdText, msg(lang, "group.xp.updated",
                    TelegramTextFormatter.escape(TelegramTextFormatter.displayName(user)), String.valueOf(total)));
        }
    }

    private void sendXpLeaderboard(String chatId, String lang) {
        List<LeaderboardEntry> leaderboard = engagementService.getLeaderboard(Long.parseLong(chatId),
                properties.getXp().getLeaderboardSize());
        if (leaderboard.isEmpty()) {
            messenger.send(chatId, msg(lang, "group.no-data"));
            return;
        }
        StringBuilder text = new StringBuilder(msg(lang, "group.xp.title"));
        int rank = 1;
        for (LeaderboardEntry entry : leaderboard) {
            String name = messenger.findDisplayName(chatId, entry.userId())
                    .orElseGet(() -> msg(lang, "group.unknown-user", String.valueOf(entry.userId())));
            text.append('\n').append(msg(lang, "group.xp.item", String.valueOf(rank),
                    TelegramTextFormatter.escape(name), String.valueOf(entry.score())));
            rank++;
        }
        messenger.send(chatId, text.toString());
    }

    private void sendCups(String chatId, String lang) {
        List<Cup> cups = engagementService.getCups(Long.parseLong(chatId), properties.getCups().getLeaderboardSize());
        if (cups.isEmpty()) {
            messenger.send(chatId, msg(lang, "group.no-data"));
            return;
        }
        List<String> blocks = new ArrayList<>();
        blocks.add(msg(lang, "group.cups.title"));
        for (Cup cup : cups) {
            String podium = cup.getPodium().isEmpty()
                    ? TelegramTextFormatter.escape(null)
                    : String.join(msg(lang, "group.cups.separator"),
                            cup.getPodium().stream().map(TelegramTextFormatter::escape).toList());
            blocks.add(msg(lang, "group.cups.item", TelegramTextFormatter.escape(cup.getTitle()),
                    TelegramTextFormatter.escape(cup.getDescription()), podium));
        }
        messenger.send(chatId, String.join("\n\n", blocks));
    }

    private void addCup(User user, String chatId, String arguments, String lang) {
        if (!accessPolicy.isAdmin(user.getId()) && !messenger.isChatAdmin(chatId, user.getId())) {
            messenger.send(chatId, msg(lang, "admin.only"));
            return;
        }
        if (arguments.isBlank()) {
            messenger.send(chatId, msg(lang, "group.cup.usage"));
            return;
        }

        String[] fields = arguments.split("\\|", -1);
        if (fields.length != CUP_FIELDS_COUNT || fields[0].isBlank()) {
            messenger.send(chatId, msg(lang, "group.cup.invalid"));
            return;
        }
        List<String> podium = Arrays.asList(fields[2].split(","));

        Cup cup = engagementService.addCup(Long.parseLong(chatId), fields[0], fields[1], podium);
        messenger.send(chatId, msg(lang, "group.cup.added", TelegramTextFormatter.escape(cup.getTitle())));
    }

    private String msg(String lang, String key, Object... args) {
        return messageService.getMessage(key, lang, args);
    }
}
