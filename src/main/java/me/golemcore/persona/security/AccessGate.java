package me.golemcore.persona.security;

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
import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.ResponderConfig;
import org.springframework.stereotype.Component;

/**
 * Decides whether an inbound message may be answered.
 *
 * <p>
 * Rules, in order:
 * <ul>
 * <li>An admin writing in a private chat is always allowed.</li>
 * <li>The subject is the conversation id for groups and the sender id for
 * private chats.</li>
 * <li>With the whitelist enabled, the subject must be whitelisted and not
 * blacklisted.</li>
 * <li>With the whitelist disabled, the subject must not be blacklisted.</li>
 * </ul>
 *
 * <p>
 * The gate holds no state; it only reads the access snapshot it is given.
 * Denials are logged, never reported to the sender.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class AccessGate {

    public boolean isAllowed(ConversationType type, long conversationId, long senderId,
            ResponderConfig.AccessControlConfig access) {
        log.trace("[Security] Access check: type={}, conversation={}, sender={}", type, conversationId, senderId);

        if (type == ConversationType.PRIVATE && access.adminIds().contains(senderId)) {
            return true;
        }

        long subjectId = type == ConversationType.GROUP ? conversationId : senderId;
        ResponderConfig.AccessListConfig list = access.forType(type);

        if (list.blacklist().contains(subjectId)) {
            log.warn("[Security] Blacklisted: type={}, conversation={}, sender={}",
                    type.getValue(), conversationId, senderId);
            return false;
        }
        if (list.enableWhitelist() && !list.whitelist().contains(subjectId)) {
            log.warn("[Security] Not whitelisted: type={}, conversation={}, sender={}",
                    type.getValue(), conversationId, senderId);
            return false;
        }
        return true;
    }
}
