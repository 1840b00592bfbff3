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
import me.golemcore.persona.domain.model.LlmResult;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Resilient LLM call: one {@link LlmPort} attempt after another, as decided by
 * {@link RetryPolicy}, with the same payload every time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmClient {

    private final LlmPort llmPort;

    public LlmResult send(QueryPayload payload, ResponderConfig.LlmApiSettings api) {
        return send(payload, api, api.timeout(), api.maxRetries());
    }

    /**
     * Sends the payload, retrying transient failures up to {@code maxRetries}
     * extra times. The returned result carries the number of attempts made.
     */
    public LlmResult send(QueryPayload payload, ResponderConfig.LlmApiSettings api, Duration timeout,
            int maxRetries) {
        RetryPolicy policy = RetryPolicy.of(api, maxRetries);
        int attempt = 0;
        while (true) {
            attempt++;
            LlmResult result = llmPort.complete(payload, api, timeout);
            RetryPolicy.RetryDecision decision = policy.next(attempt, result);

            switch (decision.action()) {
            case DONE -> {
                return result.withAttempts(attempt);
            }
            case GIVE_UP -> {
                log.error("[LLM] Giving up after {} attempt(s): {} {}", attempt, result.getFailureKind(),
                        result.getDetail());
                return result.withAttempts(attempt);
            }
            case RETRY -> {
                log.warn("[LLM] {} (attempt {}/{}), retrying in {}ms...", result.getFailureKind(), attempt,
                        maxRetries + 1, decision.delay().toMillis());
                if (!pause(decision.delay())) {
                    return LlmResult.failure(result.getFailureKind(), "interrupted during retry backoff")
                            .withAttempts(attempt);
                }
            }
            default -> throw new IllegalStateException("Unexpected retry action: " + decision.action());
            }
        }
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[LLM] Interrupted during retry backoff");
            return false;
        }
    }
}
