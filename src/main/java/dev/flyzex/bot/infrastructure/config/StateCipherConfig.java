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

import dev.flyzex.bot.security.StateCipher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Builds the state cipher from the secret key supplied out-of-band. The key is
 * read from the environment variable named by
 * {@code bot.security.secret-key-env}; there is no default key and no
 * unencrypted fallback.
 */
@Configuration
@Slf4j
public class StateCipherConfig {

    @Bean
    public StateCipher stateCipher(BotProperties properties, Environment environment) {
        String envName = properties.getSecurity().getSecretKeyEnv();
        String key = environment.getProperty(envName);
        if (key == null || key.isBlank()) {
            throw new IllegalStateException(
                    "Secret key for encrypting storage is missing. Set environment variable '" + envName + "'.");
        }
        StateCipher cipher = new StateCipher(key.trim());
        log.info("[Security] State cipher initialized from {}", envName);
        return cipher;
    }
}
