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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.ExchangeOutcome;
import me.golemcore.persona.domain.model.InboundMessage;
import me.golemcore.persona.domain.service.ConversationOrchestrator;
import me.golemcore.persona.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs {@link ConversationOrchestrator} exchanges on an executor, one at a time
 * per conversation and concurrently across conversations.
 *
 * <p>
 * Messages arriving while an exchange for the same conversation is running are
 * queued in arrival order. At most {@code max-queued-per-conversation} of them
 * wait for a reply; beyond that the oldest waiting message is downgraded to
 * store-only, so it still lands in history in order but gets no LLM call.
 * Idle runners are evicted.
 */
@Service
@Slf4j
public class InboundDispatcher {

    private final ConversationOrchestrator orchestrator;
    private final ExecutorService inboundExecutor;
    private final int maxQueuedPerConversation;

    private final Map<ConversationKey, ConversationRunner> runners = new ConcurrentHashMap<>();

    public InboundDispatcher(ConversationOrchestrator orchestrator, ExecutorService inboundExecutor,
            BotProperties properties) {
        this.orchestrator = orchestrator;
        this.inboundExecutor = inboundExecutor;
        this.maxQueuedPerConversation = Math.max(1, properties.getDispatcher().getMaxQueuedPerConversation());
    }

    public void enqueue(InboundMessage inbound) {
        Objects.requireNonNull(inbound, "inbound");
        ConversationKey key = inbound.conversationKey();
        while (true) {
            ConversationRunner runner = runners.computeIfAbsent(key, ConversationRunner::new);
            if (runner.enqueue(inbound)) {
                return;
            }
            // runner was evicted between lookup and enqueue
            runners.remove(key, runner);
        }
    }

    int activeRunners() {
        return runners.size();
    }

    private record PendingInbound(InboundMessage message, boolean reply) {
    }

    private final class ConversationRunner {

        private final ConversationKey key;
        private final Object lock = new Object();
        // store-only entries always precede the ones awaiting a reply
        private final List<PendingInbound> queued = new ArrayList<>();

        private int awaitingReply;
        private Future<?> runningTask;
        private boolean retired;

        private ConversationRunner(ConversationKey key) {
            this.key = key;
        }

        boolean enqueue(InboundMessage inbound) {
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                PendingInbound pending = new PendingInbound(inbound, true);
                if (runningTask != null) {
                    enqueueWithBound(pending);
                    return true;
                }
                startRunLocked(pending);
                return true;
            }
        }

        private void enqueueWithBound(PendingInbound pending) {
            if (awaitingReply >= maxQueuedPerConversation) {
                int oldestAwaiting = queued.size() - awaitingReply;
                PendingInbound oldest = queued.get(oldestAwaiting);
                queued.set(oldestAwaiting, new PendingInbound(oldest.message(), false));
                awaitingReply--;
                log.warn("[Dispatcher] queue limit reached ({}), oldest waiting message will be stored "
                        + "without reply: conversation={}", maxQueuedPerConversation, key);
            }
            queued.add(pending);
            awaitingReply++;
        }

        private void startRunLocked(PendingInbound pending) {
            try {
                runningTask = inboundExecutor.submit(() -> run(pending));
            } catch (RejectedExecutionException e) {
                log.error("[Dispatcher] executor rejected exchange, dropping {} message(s): conversation={}",
                        queued.size() + 1, key);
                queued.clear();
                awaitingReply = 0;
                runningTask = null;
                retired = true;
                runners.remove(key, this);
            }
        }

        private void run(PendingInbound pending) {
            try {
                ExchangeOutcome outcome = pending.reply()
                        ? orchestrator.handle(pending.message())
                        : orchestrator.store(pending.message());
                log.debug("[Dispatcher] exchange finished: conversation={}, outcome={}", key, outcome);
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                log.error("[Dispatcher] exchange failed: conversation={}: {}", key, e.getMessage(), e);
            } finally {
                onRunComplete();
            }
        }

        private void onRunComplete() {
            synchronized (lock) {
                if (!queued.isEmpty()) {
                    PendingInbound next = queued.remove(0);
                    if (next.reply()) {
                        awaitingReply--;
                    }
                    startRunLocked(next);
                    return;
                }
                runningTask = null;
                retired = true;
            }
            if (runners.remove(key, this)) {
                log.debug("[Dispatcher] evicted idle runner: conversation={}", key);
            }
        }
    }
}
