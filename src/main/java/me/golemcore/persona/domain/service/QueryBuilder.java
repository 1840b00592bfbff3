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

import me.golemcore.persona.domain.model.ConversationSession;
import me.golemcore.persona.domain.model.Message;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.QueryPayload;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a session snapshot and the prompt texts into a {@link QueryPayload}.
 *
 * <p>
 * History entries whose kind is not allowed are left out; the rest keep their
 * order. The builder has no state and does not read the clock, so equal inputs
 * produce equal payloads.
 */
@Component
public class QueryBuilder {

    public QueryPayload build(ConversationSession session, String systemPrompt, String characterPrompt,
            Set<MessageKind> allowedKinds, Map<String, Object> hyperparameters) {
        List<Message> filtered = session.getHistory().stream()
                .filter(message -> allowedKinds.contains(message.resolveKind()))
                .toList();

        Map<String, Object> params = hyperparameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));

        return QueryPayload.builder()
                .conversation(session.getKey())
                .systemPrompt(systemPrompt)
                .characterPrompt(characterPrompt)
                .history(filtered)
                .modelParams(params)
                .build();
    }
}
