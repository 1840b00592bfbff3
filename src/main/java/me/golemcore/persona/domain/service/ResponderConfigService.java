package me.golemcore.persona.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConfigurationException;
import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns the current {@link ResponderConfig} snapshot.
 *
 * <p>
 * The snapshot is seeded from {@link BotProperties} and overlaid with runtime
 * overrides (access lists, history bound) persisted in
 * {@code preferences/responder-config.json}. Every change builds a complete new
 * snapshot and swaps it in one step.
 */
@Service
@Slf4j
public class ResponderConfigService {

    public static final int MAX_HISTORY_LIMIT = 30;

    private static final String PREFERENCES_DIR = "preferences";
    private static final String CONFIG_FILE = "responder-config.json";
    private static final String CHAT_COMPLETIONS_SUFFIX = "/chat/completions";

    private final BotProperties properties;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final AtomicReference<ResponderConfig> configRef = new AtomicReference<>();

    public ResponderConfigService(BotProperties properties, StoragePort storagePort, ObjectMapper objectMapper) {
        this.properties = properties;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    /**
     * Current snapshot (lazy-loaded, cached).
     *
     * @throws ConfigurationException
     *             if the configured values are invalid
     */
    public ResponderConfig getConfig() {
        ResponderConfig current = configRef.get();
        if (current == null) {
            synchronized (this) {
                current = configRef.get();
                if (current == null) {
                    current = applyOverrides(buildFromProperties(), loadOverrides());
                    configRef.set(current);
                    log.info("[Config] Responder config loaded: maxHistory={}, kinds={}, model={}",
                            current.maxHistory(), current.validMessageKinds(), current.llmApi().model());
                }
            }
        }
        return current;
    }

    /**
     * Drops the cached snapshot and rebuilds it from properties and stored
     * overrides.
     */
    public synchronized ResponderConfig reload() {
        ResponderConfig rebuilt = applyOverrides(buildFromProperties(), loadOverrides());
        configRef.set(rebuilt);
        log.info("[Config] Responder config reloaded");
        return rebuilt;
    }

    // ==================== Access lists ====================

    public boolean addAdmin(long userId) {
        return updateAdmins(userId, true);
    }

    public boolean removeAdmin(long userId) {
        return updateAdmins(userId, false);
    }

    public boolean addToWhitelist(ConversationType type, long id) {
        return updateList(type, id, true, true);
    }

    public boolean removeFromWhitelist(ConversationType type, long id) {
        return updateList(type, id, true, false);
    }

    public boolean addToBlacklist(ConversationType type, long id) {
        return updateList(type, id, false, true);
    }

    public boolean removeFromBlacklist(ConversationType type, long id) {
        return updateList(type, id, false, false);
    }

    public void setWhitelistEnabled(ConversationType type, boolean enabled) {
        update(cfg -> {
            ResponderConfig.AccessControlConfig access = cfg.accessControl();
            return cfg.withAccessControl(
                    access.withList(type, access.forType(type).withWhitelistEnabled(enabled)));
        });
        log.info("[Config] Whitelist for {} {}", type.getValue(), enabled ? "enabled" : "disabled");
    }

    // ==================== History ====================

    /**
     * Changes the history bound for sessions created or mutated from now on.
     *
     * @return the effective value after clamping
     */
    public int setMaxHistory(int maxHistory) {
        int effective = clampMaxHistory(maxHistory);
        update(cfg -> cfg.withMaxHistory(effective));
        log.info("[Config] Max history set to {}", effective);
        return effective;
    }

    // ==================== Snapshot building ====================

    ResponderConfig buildFromProperties() {
        BotProperties.AccessProperties access = properties.getAccess();
        ResponderConfig.AccessControlConfig accessControl = new ResponderConfig.AccessControlConfig(
                new HashSet<>(access.getAdminIds()),
                toListConfig(access.getGroup()),
                toListConfig(access.getUser()));

        Set<MessageKind> kinds = MessageKind.parseAll(properties.getSession().getValidMessageTypes());
        if (kinds.isEmpty()) {
            throw new ConfigurationException("bot.session.valid-message-types must name at least one known kind");
        }

        BotProperties.PromptsProperties prompts = properties.getPrompts();
        ResponderConfig.PromptFiles promptFiles = new ResponderConfig.PromptFiles(
                requireText(prompts.getSystemGroup(), "bot.prompts.system-group"),
                requireText(prompts.getSystemPrivate(), "bot.prompts.system-private"),
                requireText(prompts.getCharacter(), "bot.prompts.character"));

        return new ResponderConfig(
                accessControl,
                kinds,
                clampMaxHistory(properties.getSession().getMaxHistory()),
                promptFiles,
                buildLlmApiSettings(properties.getLlm()),
                buildHyperparameters(properties.getModelHyperparameters()));
    }

    private ResponderConfig.LlmApiSettings buildLlmApiSettings(BotProperties.LlmProperties llm) {
        String url = normalizeApiUrl(requireText(llm.getApiUrl(), "bot.llm.api-url"));
        String model = requireText(llm.getModel(), "bot.llm.model");
        Duration timeout = requirePositive(llm.getTimeout(), "bot.llm.timeout");
        if (llm.getMaxRetries() < 0) {
            throw new ConfigurationException("bot.llm.max-retries must not be negative");
        }
        if (llm.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("bot.llm.backoff-multiplier must be at least 1.0");
        }
        Duration initialBackoff = requireNotNegative(llm.getInitialBackoff(), "bot.llm.initial-backoff");
        Duration maxBackoff = requireNotNegative(llm.getMaxBackoff(), "bot.llm.max-backoff");
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new ConfigurationException("bot.llm.max-backoff must not be shorter than initial-backoff");
        }
        return new ResponderConfig.LlmApiSettings(url, llm.getApiKey(), model, timeout, llm.getMaxRetries(),
                initialBackoff, llm.getBackoffMultiplier(), maxBackoff);
    }

    /**
     * Builds the pass-through parameter map in wire order. Unset optional values
     * are omitted.
     */
    static Map<String, Object> buildHyperparameters(BotProperties.ModelHyperparameters hp) {
        if (hp.getTemperature() == null || hp.getMaxTokens() == null) {
            throw new ConfigurationException("bot.model-hyperparameters.temperature and max-tokens are required");
        }
        checkRange("temperature", hp.getTemperature(), 0.0, 2.0);
        if (hp.getMaxTokens() < 1) {
            throw new ConfigurationException("bot.model-hyperparameters.max-tokens must be positive");
        }
        if (hp.getTopP() != null && (hp.getTopP() <= 0.0 || hp.getTopP() > 1.0)) {
            throw new ConfigurationException("bot.model-hyperparameters.top-p must be in (0, 1]");
        }
        if (hp.getTopK() != null && hp.getTopK() < 1) {
            throw new ConfigurationException("bot.model-hyperparameters.top-k must be positive");
        }
        checkRange("frequency-penalty", hp.getFrequencyPenalty(), -2.0, 2.0);
        checkRange("presence-penalty", hp.getPresencePenalty(), -2.0, 2.0);
        if (hp.getRepetitionPenalty() != null
                && (hp.getRepetitionPenalty() <= 0.0 || hp.getRepetitionPenalty() > 2.0)) {
            throw new ConfigurationException("bot.model-hyperparameters.repetition-penalty must be in (0, 2]");
        }
        checkRange("min-p", hp.getMinP(), 0.0, 1.0);
        checkRange("top-a", hp.getTopA(), 0.0, 1.0);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("temperature", hp.getTemperature());
        params.put("max_tokens", hp.getMaxTokens());
        putIfSet(params, "seed", hp.getSeed());
        putIfSet(params, "top_p", hp.getTopP());
        putIfSet(params, "top_k", hp.getTopK());
        putIfSet(params, "frequency_penalty", hp.getFrequencyPenalty());
        putIfSet(params, "presence_penalty", hp.getPresencePenalty());
        putIfSet(params, "repetition_penalty", hp.getRepetitionPenalty());
        putIfSet(params, "min_p", hp.getMinP());
        putIfSet(params, "top_a", hp.getTopA());
        return params;
    }

    static String normalizeApiUrl(String url) {
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith(CHAT_COMPLETIONS_SUFFIX)) {
            normalized = normalized.substring(0, normalized.length() - CHAT_COMPLETIONS_SUFFIX.length());
        }
        return normalized;
    }

    private int clampMaxHistory(int maxHistory) {
        if (maxHistory < 1) {
            throw new ConfigurationException("max history must be positive: " + maxHistory);
        }
        if (maxHistory > MAX_HISTORY_LIMIT) {
            log.warn("[Config] Max history {} exceeds limit, using {}", maxHistory, MAX_HISTORY_LIMIT);
            return MAX_HISTORY_LIMIT;
        }
        return maxHistory;
    }

    private static ResponderConfig.AccessListConfig toListConfig(BotProperties.AccessListProperties list) {
        return new ResponderConfig.AccessListConfig(list.isEnableWhitelist(),
                new HashSet<>(list.getWhitelist()), new HashSet<>(list.getBlacklist()));
    }

    private static void checkRange(String name, Double value, double min, double max) {
        if (value != null && (value < min || value > max)) {
            throw new ConfigurationException(
                    "bot.model-hyperparameters." + name + " must be in [" + min + ", " + max + "]: " + value);
        }
    }

    private static void putIfSet(Map<String, Object> params, String name, Object value) {
        if (value != null) {
            params.put(name, value);
        }
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(property + " is not configured");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String property) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(property + " must be a positive duration");
        }
        return value;
    }

    private static Duration requireNotNegative(Duration value, String property) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(property + " must not be negative");
        }
        return value;
    }

    // ==================== Updates ====================

    private boolean updateAdmins(long userId, boolean add) {
        boolean[] changed = new boolean[1];
        update(cfg -> {
            Set<Long> admins = new HashSet<>(cfg.accessControl().adminIds());
            changed[0] = add ? admins.add(userId) : admins.remove(userId);
            return cfg.withAccessControl(cfg.accessControl().withAdminIds(admins));
        });
        if (changed[0]) {
            log.info("[Config] Admin {} {}", userId, add ? "added" : "removed");
        }
        return changed[0];
    }

    private boolean updateList(ConversationType type, long id, boolean whitelist, boolean add) {
        boolean[] changed = new boolean[1];
        update(cfg -> {
            ResponderConfig.AccessControlConfig access = cfg.accessControl();
            ResponderConfig.AccessListConfig list = access.forType(type);
            Set<Long> ids = new HashSet<>(whitelist ? list.whitelist() : list.blacklist());
            changed[0] = add ? ids.add(id) : ids.remove(id);
            ResponderConfig.AccessListConfig updated = whitelist ? list.withWhitelist(ids) : list.withBlacklist(ids);
            return cfg.withAccessControl(access.withList(type, updated));
        });
        if (changed[0]) {
            log.info("[Config] {} {} {} {} list", id, add ? "added to" : "removed from", type.getValue(),
                    whitelist ? "white" : "black");
        }
        return changed[0];
    }

    /**
     * Applies a runtime change. The new snapshot becomes visible only after the
     * overrides are on disk, so a failed write leaves both unchanged.
     *
     * @throws ConfigurationException
     *             if the overrides cannot be persisted
     */
    private synchronized void update(UnaryOperator<ResponderConfig> change) {
        ResponderConfig updated = change.apply(getConfig());
        persist(new RuntimeOverrides(updated.accessControl(), updated.maxHistory()));
        configRef.set(updated);
    }

    // ==================== Persistence ====================

    private void persist(RuntimeOverrides overrides) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(overrides);
            storagePort.replace(PREFERENCES_DIR, CONFIG_FILE, json, true).join();
            log.debug("[Config] Persisted runtime overrides");
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.error("[Config] Failed to persist runtime overrides, change discarded: {}", e.getMessage());
            throw new ConfigurationException("Failed to persist runtime overrides", e);
        }
    }

    private RuntimeOverrides loadOverrides() {
        try {
            String json = storagePort.read(PREFERENCES_DIR, CONFIG_FILE).join();
            if (json != null && !json.isBlank()) {
                RuntimeOverrides loaded = objectMapper.readValue(json, RuntimeOverrides.class);
                log.info("[Config] Loaded runtime overrides from storage");
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[Config] Ignoring unreadable runtime overrides: {}", e.getMessage());
        }
        return null;
    }

    private ResponderConfig applyOverrides(ResponderConfig base, RuntimeOverrides overrides) {
        if (overrides == null) {
            return base;
        }
        ResponderConfig result = base;
        if (overrides.accessControl() != null) {
            result = result.withAccessControl(overrides.accessControl());
        }
        if (overrides.maxHistory() != null) {
            result = result.withMaxHistory(clampMaxHistory(overrides.maxHistory()));
        }
        return result;
    }

    /**
     * Part of the snapshot that can be changed at runtime and survives restarts.
     */
    public record RuntimeOverrides(ResponderConfig.AccessControlConfig accessControl, Integer maxHistory) {
    }
}
