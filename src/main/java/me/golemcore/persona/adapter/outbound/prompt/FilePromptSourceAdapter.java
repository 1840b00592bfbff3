package me.golemcore.persona.adapter.outbound.prompt;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConfigurationException;
import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.PromptSourcePort;
import me.golemcore.persona.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads persona prompts from YAML files in the {@code prompts/} storage
 * directory.
 *
 * <p>
 * System prompt files carry a {@code system} key. The character file carries
 * {@code name}, {@code alias} (string or list) and {@code character_info}. The
 * masks {@code {name}}, {@code {alias}}, {@code {character_info}} and
 * {@code {time}} are substituted in both prompts.
 *
 * <p>
 * Files are read on every request, so edits take effect without a restart.
 */
@Component
@Slf4j
public class FilePromptSourceAdapter implements PromptSourcePort {

    static final String PROMPTS_DIR = "prompts";

    private static final String KEY_SYSTEM = "system";
    private static final String KEY_NAME = "name";
    private static final String KEY_ALIAS = "alias";
    private static final String KEY_CHARACTER_INFO = "character_info";
    private static final String ALIAS_SEPARATOR = ", ";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String DEFAULT_GROUP_SYSTEM = """
            system: |
              You are {name} (also known as {alias}), chatting in a group conversation.
              Several people may talk at once; every message starts with the sender's name, id and time.
              Reply only as {name}, in one short message, in the language of the conversation.
              Current time: {time}
            """;

    private static final String DEFAULT_PRIVATE_SYSTEM = """
            system: |
              You are {name} (also known as {alias}), chatting privately with one person.
              Every message starts with the sender's name, id and time.
              Stay in character as {name} and answer naturally in the language of the conversation.
              Current time: {time}
            """;

    private static final String DEFAULT_CHARACTER = """
            name: Assistant
            alias:
              - Asst
            character_info: |
              A friendly and curious companion who keeps answers short and warm.
            """;

    private final StoragePort storagePort;
    private final BotProperties properties;
    private final PromptTemplateEngine templateEngine;
    private final Clock clock;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public FilePromptSourceAdapter(StoragePort storagePort, BotProperties properties,
            PromptTemplateEngine templateEngine, Clock clock) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.templateEngine = templateEngine;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (properties.getPrompts().isWriteDefaults()) {
            ensureDefaults();
        }
    }

    @Override
    public String systemPrompt(ConversationType type, ResponderConfig.PromptFiles files) {
        String file = files.systemFor(type);
        Map<String, Object> data = readYaml(file);
        String template = requireString(data, KEY_SYSTEM, file);
        return templateEngine.render(template, buildMasks(files));
    }

    @Override
    public String characterPrompt(ResponderConfig.PromptFiles files) {
        Map<String, Object> character = readYaml(files.character());
        String info = requireString(character, KEY_CHARACTER_INFO, files.character());
        return templateEngine.render(info, buildMasks(files, character));
    }

    Map<String, String> buildMasks(ResponderConfig.PromptFiles files) {
        return buildMasks(files, readYaml(files.character()));
    }

    private Map<String, String> buildMasks(ResponderConfig.PromptFiles files, Map<String, Object> character) {
        Map<String, String> masks = new HashMap<>();
        masks.put(KEY_NAME, requireString(character, KEY_NAME, files.character()));
        masks.put(KEY_ALIAS, aliasText(character.get(KEY_ALIAS)));
        Object info = character.get(KEY_CHARACTER_INFO);
        masks.put(KEY_CHARACTER_INFO, info != null ? info.toString().trim() : "");
        masks.put("time", TIME_FORMAT.format(clock.instant().atZone(clock.getZone())));
        return masks;
    }

    private static String aliasText(Object alias) {
        if (alias instanceof Collection<?> aliases && !aliases.isEmpty()) {
            return aliases.stream().map(String::valueOf).collect(Collectors.joining(ALIAS_SEPARATOR));
        }
        if (alias instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return "-";
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readYaml(String file) {
        String content;
        try {
            content = storagePort.read(PROMPTS_DIR, file).join();
        } catch (RuntimeException e) { // NOSONAR
            throw new ConfigurationException("Failed to read prompt file: " + file, e);
        }
        if (content == null) {
            throw new ConfigurationException("Prompt file not found: " + PROMPTS_DIR + "/" + file);
        }
        try {
            Map<String, Object> data = yamlMapper.readValue(content, Map.class);
            if (data == null) {
                throw new ConfigurationException("Prompt file is empty: " + file);
            }
            return data;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid YAML in prompt file: " + file, e);
        }
    }

    private static String requireString(Map<String, Object> data, String key, String file) {
        Object value = data.get(key);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ConfigurationException("Prompt file " + file + " has no '" + key + "' text");
        }
        return text;
    }

    void ensureDefaults() {
        BotProperties.PromptsProperties prompts = properties.getPrompts();
        ensureDefault(prompts.getSystemGroup(), DEFAULT_GROUP_SYSTEM);
        ensureDefault(prompts.getSystemPrivate(), DEFAULT_PRIVATE_SYSTEM);
        ensureDefault(prompts.getCharacter(), DEFAULT_CHARACTER);
    }

    private void ensureDefault(String file, String content) {
        try {
            if (storagePort.writeIfAbsent(PROMPTS_DIR, file, content).join()) {
                log.info("[Prompts] Created default prompt file: {}", file);
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Prompts] Failed to create default prompt file: {}", file, e);
        }
    }
}
