package me.golemcore.persona.infrastructure.i18n;

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
import me.golemcore.persona.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Localized user-facing texts, such as the notice sent when no reply could be
 * produced.
 *
 * <p>
 * Bundles are loaded from {@code messages_<lang>.properties}. Missing keys fall
 * back to English, and a key missing everywhere is returned as-is.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_ZH = "zh";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final Set<String> SUPPORTED_LANGUAGES = Set.of(LANG_EN, LANG_ZH);

    private final Map<String, ResourceBundle> bundles = new ConcurrentHashMap<>();
    private volatile String language = DEFAULT_LANG;

    public MessageService(BotProperties properties) {
        for (String lang : SUPPORTED_LANGUAGES) {
            loadBundle(lang);
        }
        setLanguage(properties.getPersona().getLanguage());
    }

    private void loadBundle(String lang) {
        try {
            ResourceBundle bundle = ResourceBundle.getBundle("messages", Locale.forLanguageTag(lang));
            bundles.put(lang, bundle);
            log.debug("Loaded message bundle for language: {}", lang);
        } catch (MissingResourceException e) {
            log.warn("Failed to load message bundle for language: {}", lang);
        }
    }

    /**
     * Get message in the configured language.
     */
    public String getMessage(String key, Object... args) {
        return getMessage(key, language, args);
    }

    /**
     * Get message for specific language.
     */
    public String getMessage(String key, String lang, Object... args) {
        String message = lookup(key, lang);
        if (message == null && !DEFAULT_LANG.equals(lang)) {
            message = lookup(key, DEFAULT_LANG);
        }
        if (message == null) {
            log.warn("Missing message key: {} for language: {}", key, lang);
            return key;
        }
        if (args != null && args.length > 0) {
            return MessageFormat.format(message, args);
        }
        return message;
    }

    private String lookup(String key, String lang) {
        ResourceBundle bundle = bundles.get(lang);
        if (bundle == null) {
            return null;
        }
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return null;
        }
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String lang) {
        if (lang != null && SUPPORTED_LANGUAGES.contains(lang)) {
            language = lang;
        } else {
            log.warn("Unsupported language: {}, using default", lang);
            language = DEFAULT_LANG;
        }
    }
}
