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

import dev.flyzex.bot.domain.service.AdminService;
import dev.flyzex.bot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Who may do what in chats. The configured owner is always an admin, even
 * when not present in the stored admin set.
 */
@Component
@RequiredArgsConstructor
public class TelegramAccessPolicy {

    private final BotProperties properties;
    private final AdminService adminService;

    public boolean isOwner(long userId) {
        Long ownerId = properties.getTelegram().getOwnerId();
        return ownerId != null && ownerId == userId;
    }

    public boolean isAdmin(long userId) {
        return isOwner(userId) || adminService.isAdmin(userId);
    }
}
