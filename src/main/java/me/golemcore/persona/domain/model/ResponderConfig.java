package me.golemcore.persona.domain.model;

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

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration snapshot read by the responder core.
 *
 * <p>
 * A snapshot is never modified; updates produce a new instance that replaces
 * the previous one as a whole, so readers never see a half-applied change.
 * Every component receives the snapshot it should use as an explicit
 * argument.
 */
public record ResponderConfig(
        AccessControlConfig accessControl,
        Set<MessageKind> validMessageKinds,
        int maxHistory,
        PromptFiles prompts,
        LlmApiSettings llmApi,
        Map<String, Object> hyperparameters) {

    public ResponderConfig {
        Objects.requireNonNull(accessControl, "accessControl");
        Objects.requireNonNull(prompts, "prompts");
        Objects.requireNonNull(llmApi, "llmApi");
        validMessageKinds = validMessageKinds == null || validMessageKinds.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(MessageKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(validMessageKinds));
        hyperparameters = hyperparameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));
    }

    public ResponderConfig withAccessControl(AccessControlConfig newAccessControl) {
        return new ResponderConfig(newAccessControl, validMessageKinds, maxHistory, prompts, llmApi,
                hyperparameters);
    }

    public ResponderConfig withMaxHistory(int newMaxHistory) {
        return new ResponderConfig(accessControl, validMessageKinds, newMaxHistory, prompts, llmApi,
                hyperparameters);
    }

    /**
     * Admin ids plus per-conversation-type list rules.
     */
    public record AccessControlConfig(Set<Long> adminIds, AccessListConfig group, AccessListConfig user) {

        public AccessControlConfig {
            adminIds = adminIds == null ? Set.of() : Set.copyOf(adminIds);
            group = group == null ? AccessListConfig.denyAll() : group;
            user = user == null ? AccessListConfig.allowAll() : user;
        }

        public AccessListConfig forType(ConversationType type) {
            return type == ConversationType.GROUP ? group : user;
        }

        public AccessControlConfig withList(ConversationType type, AccessListConfig list) {
            return type == ConversationType.GROUP
                    ? new AccessControlConfig(adminIds, list, user)
                    : new AccessControlConfig(adminIds, group, list);
        }

        public AccessControlConfig withAdminIds(Set<Long> newAdminIds) {
            return new AccessControlConfig(newAdminIds, group, user);
        }
    }

    /**
     * Whitelist/blacklist rules for one conversation type.
     */
    public record AccessListConfig(boolean enableWhitelist, Set<Long> whitelist, Set<Long> blacklist) {

        public AccessListConfig {
            whitelist = whitelist == null ? Set.of() : Set.copyOf(whitelist);
            blacklist = blacklist == null ? Set.of() : Set.copyOf(blacklist);
        }

        static AccessListConfig denyAll() {
            return new AccessListConfig(true, Set.of(), Set.of());
        }

        static AccessListConfig allowAll() {
            return new AccessListConfig(false, Set.of(), Set.of());
        }

        public AccessListConfig withWhitelistEnabled(boolean enabled) {
            return new AccessListConfig(enabled, whitelist, blacklist);
        }

        public AccessListConfig withWhitelist(Set<Long> ids) {
            return new AccessListConfig(enableWhitelist, ids, blacklist);
        }

        public AccessListConfig withBlacklist(Set<Long> ids) {
            return new AccessListConfig(enableWhitelist, whitelist, ids);
        }
    }

    /**
     * Prompt file locations, relative to the prompts directory.
     */
    public record PromptFiles(String systemGroup, String systemPrivate, String character) {

        public String systemFor(ConversationType type) {
            return type == ConversationType.GROUP ? systemGroup : systemPrivate;
        }
    }

    /**
     * Remote endpoint and resilience settings.
     */
    public record LlmApiSettings(
            String url,
            String apiKey,
            String model,
            Duration timeout,
            int maxRetries,
            Duration initialBackoff,
            double backoffMultiplier,
            Duration maxBackoff) {
    }
}
