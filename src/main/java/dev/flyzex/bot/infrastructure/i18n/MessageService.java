package dev.flyzex.bot.infrastructure.i18n;

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

import dev.flyzex.bot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Internationalization service for localized bot messages.
 *
 * <p>
 * Supports multiple languages with resource bundles:
 * <ul>
 * <li>English (en) - default fallback</li>
 * <li>Persian (fa)</li>
 * </ul>
 *
 * <p>
 * Message bundles are loaded from {@code messages_<lang>.properties} resources.
 * Supports parametric messages using {@link MessageFormat} syntax. A key missing
 * from the requested bundle falls back to English; a key missing entirely is
 * returned as is.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_FA = "fa";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_FA);
    private static final ResourceBundle.Control NO_FALLBACK = ResourceBundle.Control
            .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private final String defaultLanguage;

    public MessageService(BotProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
        this.defaultLanguage = isSupported(properties.getLanguage()) ? properties.getLanguage() : DEFAULT_LANG;
    }

    private void loadBundle(String lang) {
        try {
            ResourceBundle bundle = ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang), NO_FALLBACK);
            bundles.put(lang, bundle);
            log.info("Loaded message bundle for language: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
        }
    }

    /**
     * Get message in the configured default language.
     */
    public String getMessage(String key, Object... args) {
        return getMessage(key, defaultLanguage, args);
    }

    /**
     * Get message for specific language.
     */
    public String getMessage(String key, String lang, Object... args) {
        String message = lookup(key, lang);
        if (message == null) {
            log.warn("Missing message key: {} for language: {}", key, lang);
            return key;
        }
        if (args != null && args.length > 0) {
            return new MessageFormat(message, Locale.forLanguageTag(resolveLanguage(lang))).format(args);
        }
        return message;
    }

    /**
     * Map a client language code (e.g. Telegram's {@code fa-IR}) to a supported
     * bundle, falling back to the configured default.
     */
    public String resolveLanguage(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            return defaultLanguage;
        }
        String primary = languageCode.trim().toLowerCase(Locale.ROOT).split("[-_]")[0];
        return isSupported(primary) ? primary : defaultLanguage;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    public boolean isSupported(String lang) {
        return lang != null && SUPPORTED_LANGUAGES.contains(lang);
    }

    private String lookup(String key, String lang) {
        ResourceBundle bundle = bundles.get(resolveLanguage(lang));
        if (bundle != null && bundle.containsKey(key)) {
            return bundle.getString(key);
        }
        ResourceBundle fallback = bundles.get(DEFAULT_LANG);
        if (fallback != null && fallback.containsKey(key)) {
            return fallback.getString(key);
        }
        return null;
    }
}
