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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConfigurationException;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.ConversationSession;
import me.golemcore.persona.domain.model.ExchangeOutcome;
import me.golemcore.persona.domain.model.InboundMessage;
import me.golemcore.persona.domain.model.LlmResult;
import me.golemcore.persona.domain.model.Message;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.domain.model.StorageFailureException;
import me.golemcore.persona.infrastructure.i18n.MessageService;
import me.golemcore.persona.port.inbound.CommandPort;
import me.golemcore.persona.port.outbound.DeliveryPort;
import me.golemcore.persona.port.outbound.PromptSourcePort;
import me.golemcore.persona.port.outbound.SessionPort;
import me.golemcore.persona.security.AccessGate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one exchange for one inbound message.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>Take the configuration snapshot used for the whole exchange</li>
 * <li>Access gate (denied senders are ignored silently)</li>
 * <li>Chat commands are executed or ignored, never stored</li>
 * <li>Kind filter (unsupported kinds are ignored, nothing is stored)</li>
 * <li>Append the inbound message to the session history</li>
 * <li>Resolve prompts and build the query</li>
 * <li>Call the LLM with retries</li>
 * <li>Append the reply and deliver it, or deliver the failure notice</li>
 * </ol>
 *
 * <p>
 * The inbound message stays in history when the exchange fails after step 4.
 * Callers must serialize calls per conversation; see
 * {@link me.golemcore.persona.domain.loop.InboundDispatcher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationOrchestrator {

    static final String FAILURE_MESSAGE_KEY = "responder.failure";
    private static final String REPLY_KIND = "text";

    private final ResponderConfigService configService;
    private final AccessGate accessGate;
    private final CommandPort commandPort;
    private final SessionPort sessionPort;
    private final PromptSourcePort promptSource;
    private final QueryBuilder queryBuilder;
    private final QueryAuditWriter queryAuditWriter;
    private final LlmClient llmClient;
    private final DeliveryPort deliveryPort;
    private final MessageService messageService;
    private final Clock clock;

    public ExchangeOutcome handle(InboundMessage inbound) {
        return process(inbound, true);
    }

    /**
     * Screens and stores an inbound message like {@link #handle} but does not
     * ask the LLM for a reply. Used when a conversation has more messages
     * waiting than it is allowed to answer.
     */
    public ExchangeOutcome store(InboundMessage inbound) {
        return process(inbound, false);
    }

    private ExchangeOutcome process(InboundMessage inbound, boolean reply) {
        ConversationKey key = inbound.conversationKey();

        ResponderConfig config;
        try {
            config = configService.getConfig();
        } catch (ConfigurationException e) {
            log.error("[Orchestrator] Invalid configuration, cannot answer {}: {}", key, e.getMessage());
            return fail(key);
        }

        if (!accessGate.isAllowed(key.type(), key.id(), inbound.getSenderId(), config.accessControl())) {
            return ExchangeOutcome.DENIED;
        }

        if (commandPort.isCommand(inbound.getContent())) {
            return handleCommand(key, inbound);
        }

        MessageKind kind = MessageKind.fromValue(inbound.getMessageKind());
        if (!config.validMessageKinds().contains(kind)) {
            log.debug("[Orchestrator] Ignoring {} message in {}", inbound.getMessageKind(), key);
            return ExchangeOutcome.UNSUPPORTED_KIND;
        }

        try {
            return reply ? exchange(key, inbound, config) : storeOnly(key, inbound, config);
        } catch (StorageFailureException e) {
            log.error("[Orchestrator] Storage failure for {}: {}", key, e.getMessage(), e);
            return fail(key);
        } catch (ConfigurationException e) {
            log.error("[Orchestrator] Prompt configuration error for {}: {}", key, e.getMessage());
            return fail(key);
        }
    }

    private ExchangeOutcome exchange(ConversationKey key, InboundMessage inbound, ResponderConfig config) {
        ConversationSession session = sessionPort.append(key, inbound.toUserMessage(), config.maxHistory());

        String systemPrompt = promptSource.systemPrompt(key.type(), config.prompts());
        String characterPrompt = promptSource.characterPrompt(config.prompts());
        QueryPayload payload = queryBuilder.build(session, systemPrompt, characterPrompt,
                config.validMessageKinds(), config.hyperparameters());
        queryAuditWriter.record(payload);

        LlmResult result = llmClient.send(payload, config.llmApi());
        if (!result.isSuccess()) {
            log.error("[Orchestrator] No reply for {} after {} attempt(s): {}", key, result.getAttempts(),
                    result.getFailureKind());
            return fail(key);
        }

        Message reply = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .kind(REPLY_KIND)
                .content(result.getReplyText())
                .timestamp(clock.instant())
                .build();
        try {
            sessionPort.append(key, reply, config.maxHistory());
        } catch (StorageFailureException e) {
            log.error("[Orchestrator] Reply for {} not stored, delivering anyway: {}", key, e.getMessage());
        }

        deliveryPort.deliver(key, result.getReplyText());
        log.info("[Orchestrator] Replied in {} ({} attempt(s), {} messages in query)", key, result.getAttempts(),
                payload.getHistory().size());
        return ExchangeOutcome.REPLIED;
    }

    private ExchangeOutcome storeOnly(ConversationKey key, InboundMessage inbound, ResponderConfig config) {
        sessionPort.append(key, inbound.toUserMessage(), config.maxHistory());
        log.info("[Orchestrator] Stored message without reply in {}", key);
        return ExchangeOutcome.STORED;
    }

    private ExchangeOutcome handleCommand(ConversationKey key, InboundMessage inbound) {
        Optional<CommandPort.CommandResult> result = commandPort.route(inbound.getContent(), key);
        if (result.isEmpty()) {
            log.debug("[Orchestrator] Ignoring command message in {}", key);
            return ExchangeOutcome.IGNORED_COMMAND;
        }
        deliveryPort.deliver(key, result.get().output());
        return ExchangeOutcome.COMMAND;
    }

    private ExchangeOutcome fail(ConversationKey key) {
        try {
            deliveryPort.deliver(key, messageService.getMessage(FAILURE_MESSAGE_KEY));
        } catch (RuntimeException e) { // NOSONAR - notice delivery is best effort
            log.warn("[Orchestrator] Failed to deliver failure notice to {}: {}", key, e.getMessage());
        }
        return ExchangeOutcome.FAILED;
    }
}
