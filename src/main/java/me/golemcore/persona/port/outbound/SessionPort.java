package me.golemcore.persona.port.outbound;

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

import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.ConversationSession;
import me.golemcore.persona.domain.model.Message;

import java.util.List;

/**
 * Port for per-conversation session state. Mutations on one key are applied
 * one at a time and are durable once the call returns; returned sessions are
 * immutable snapshots.
 *
 * <p>
 * Mutating operations throw
 * {@link me.golemcore.persona.domain.model.StorageFailureException} when the
 * change could not be persisted. The visible state is then unchanged.
 */
public interface SessionPort {

    /**
     * Returns the stored session or creates an empty one. This is the only
     * place a session is created.
     */
    ConversationSession load(ConversationKey key, int maxHistory);

    /**
     * Appends a message, evicts the oldest entries beyond {@code maxHistory},
     * persists, and returns the resulting state.
     */
    ConversationSession append(ConversationKey key, Message message, int maxHistory);

    /**
     * Overwrites the history, re-applies the bound and persists.
     */
    ConversationSession replaceHistory(ConversationKey key, List<Message> messages, int maxHistory);

    void clearHistory(ConversationKey key);

    void delete(ConversationKey key);

    List<ConversationSession> listAll();
}
