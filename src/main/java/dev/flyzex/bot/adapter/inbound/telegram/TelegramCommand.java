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

import java.util.Locale;
import java.util.Optional;

/**
 * A slash command parsed from message text: {@code /name@bot arguments}.
 */
public record TelegramCommand(String name, String arguments) {

    public static Optional<TelegramCommand> parse(String text) {
        if (text == null || !text.startsWith("/")) {
            return Optional.empty();
        }
        String[] parts = text.trim().split("\\s+", 2);
        String name = parts[0].substring(1).split("@")[0].toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        String arguments = parts.length > 1 ? parts[1].trim() : "";
        return Optional.of(new TelegramCommand(name, arguments));
    }

    public boolean is(String commandName) {
        return name.equals(commandName);
    }

    public String firstArgument() {
        if (arguments.isEmpty()) {
            return "";
        }
        return arguments.split("\\s+")[0];
    }
}
