package dev.flyzex.bot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - Telegram channel, owner and review chat</li>
 * <li>{@link SecurityProperties} - where the state encryption key comes
 * from</li>
 * <li>{@link StorageProperties} - location of the encrypted state file</li>
 * <li>{@link XpProperties} and {@link CupProperties} - engagement
 * settings</li>
 * <li>{@link ApplicationsProperties} - intake questions</li>
 * <li>{@link RateLimitProperties} - per-user sliding window</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private String language = "en";
    private TelegramProperties telegram = new TelegramProperties();
    private SecurityProperties security = new SecurityProperties();
    private StorageProperties storage = new StorageProperties();
    private XpProperties xp = new XpProperties();
    private CupProperties cups = new CupProperties();
    private ApplicationsProperties applications = new ApplicationsProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String tokenEnv = "BOT_TOKEN";
        private Long ownerId;
        private Long reviewChatId;
    }

    @Data
    public static class SecurityProperties {
        private String secretKeyEnv = "BOT_SECRET_KEY";
    }

    @Data
    public static class StorageProperties {
        private String path = "data/storage.enc";
        private boolean backup = false;
    }

    @Data
    public static class XpProperties {
        private int messageReward = 5;
        private int leaderboardSize = 10;
        private int milestoneInterval = 5;
    }

    @Data
    public static class CupProperties {
        private int leaderboardSize = 5;
    }

    @Data
    public static class ApplicationsProperties {
        private List<String> questions = new ArrayList<>();
        private int pendingPageSize = 5;
    }

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int maxRequests = 5;
        private Duration window = Duration.ofSeconds(10);
    }
}
