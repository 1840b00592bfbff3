package me.golemcore.persona.domain.loop;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.InboundMessage;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Listens for inbound messages and delegates processing to
 * {@link InboundDispatcher}.
 *
 * <p>
 * This listener exists so that
 * {@link me.golemcore.persona.domain.service.ConversationOrchestrator} remains
 * a single-exchange pipeline and does not manage concurrency or queueing.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageListener {

    private final InboundDispatcher dispatcher;

    @EventListener
    public void onInboundMessage(InboundMessageEvent event) {
        InboundMessage message = event.message();
        log.debug("[Inbound] enqueue message (type={}, conversation={}, sender={})",
                message.getConversationType(), message.getConversationId(), message.getSenderId());
        dispatcher.enqueue(message);
    }
}
