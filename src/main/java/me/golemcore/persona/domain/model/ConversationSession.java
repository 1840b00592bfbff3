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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent conversation state for one {@link ConversationKey}: the bounded,
 * ordered history of past turns. Sessions are owned by the session store;
 * everything outside of it works on {@link #snapshot()} copies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession {

    private ConversationKey key;

    @Builder.Default
    private List<Message> history = new ArrayList<>();

    private int maxHistory;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Appends a message and evicts the oldest entries until the history fits
     * within {@code maxHistory}.
     *
     * @return number of evicted messages
     */
    public int append(Message message) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(message);
        return enforceBound();
    }

    /**
     * Drops the oldest messages while the history exceeds {@code maxHistory}.
     *
     * @return number of evicted messages
     */
    public int enforceBound() {
        if (history == null || maxHistory <= 0) {
            return 0;
        }
        int overflow = history.size() - maxHistory;
        if (overflow <= 0) {
            return 0;
        }
        history.subList(0, overflow).clear();
        return overflow;
    }

    public Message lastMessage() {
        if (history == null || history.isEmpty()) {
            return null;
        }
        return history.get(history.size() - 1);
    }

    /**
     * Detached copy with an unmodifiable history list.
     */
    public ConversationSession snapshot() {
        return ConversationSession.builder()
                .key(key)
                .history(history != null ? List.copyOf(history) : List.of())
                .maxHistory(maxHistory)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Detached copy with a mutable history list, used for rollback points.
     */
    public ConversationSession mutableCopy() {
        return ConversationSession.builder()
                .key(key)
                .history(history != null ? new ArrayList<>(history) : new ArrayList<>())
                .maxHistory(maxHistory)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
