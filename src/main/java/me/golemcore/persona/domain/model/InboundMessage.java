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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A chat message as handed over by the transport layer, before any access
 * or kind checks.
 */
@Value
@Builder
public class InboundMessage {

    ConversationType conversationType;
    long conversationId;
    long senderId;
    String senderName;
    String messageKind;
    String content;
    Instant timestamp;

    public ConversationKey conversationKey() {
        return new ConversationKey(conversationType, conversationId);
    }

    /**
     * Converts this inbound event into a user history entry.
     */
    public Message toUserMessage() {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .kind(messageKind)
                .content(content)
                .senderId(senderId)
                .senderName(senderName)
                .timestamp(timestamp)
                .build();
    }
}
