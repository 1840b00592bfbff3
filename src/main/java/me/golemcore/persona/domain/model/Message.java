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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One turn in a conversation. Immutable once built, so history snapshots can
 * be shared freely.
 *
 * <p>
 * {@code kind} is the raw kind string as received from the platform. It is
 * never normalized on storage; use {@link #resolveKind()} for typed checks.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String id;
    String role; // user, assistant
    String kind;
    String content;
    Long senderId;
    String senderName;
    Instant timestamp;

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Typed view of the raw kind; unknown kinds map to {@link MessageKind#OTHER}.
     */
    public MessageKind resolveKind() {
        return MessageKind.fromValue(kind);
    }
}
