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

import org.telegram.telegrambots.meta.api.objects.User;

import java.util.Optional;

/**
 * Helpers for rendering user-provided values into Telegram HTML messages.
 */
public final class TelegramTextFormatter {

    private static final String EMPTY_PLACEHOLDER = "—";

    private TelegramTextFormatter() {
    }

    /**
     * Escape text for Telegram's HTML parse mode.
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY_PLACEHOLDER;
        }
        return value
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /**
     * Full name of the user, falling back to the username and then the id.
     */
    public static String displayName(User user) {
        StringBuilder name = new StringBuilder();
        if (user.getFirstName() != null) {
            name.append(user.getFirstName().trim());
        }
        if (user.getLastName() != null && !user.getLastName().isBlank()) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(user.getLastName().trim());
        }
        if (name.length() > 0) {
            return name.toString();
        }
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        return String.valueOf(user.getId());
    }

    /**
     * Parse a positive numeric user id as typed by an admin.
     */
    public static Optional<Long> parseUserId(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            long userId = Long.parseLong(raw.trim());
            return userId > 0 ? Optional.of(userId) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
