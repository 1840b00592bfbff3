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

import me.golemcore.persona.domain.model.LlmResult;
import me.golemcore.persona.domain.model.ResponderConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides what happens after each LLM attempt.
 *
 * <p>
 * A success ends the call. A non-transient failure gives up at once. A
 * transient failure is retried until {@code maxRetries} additional attempts
 * have been made, waiting {@code initial * multiplier^(n-1)} before retry
 * {@code n}, capped at {@code maxBackoff}. The delay sequence never decreases.
 *
 * <p>
 * The policy only computes decisions; it does not sleep or call anything.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.multiplier = multiplier;
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
    }

    public static RetryPolicy of(ResponderConfig.LlmApiSettings api, int maxRetries) {
        return new RetryPolicy(maxRetries, api.initialBackoff(), api.backoffMultiplier(), api.maxBackoff());
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * @param attemptsMade
     *            attempts completed so far, including the one that produced
     *            {@code result}
     * @param result
     *            outcome of the latest attempt
     */
    public RetryDecision next(int attemptsMade, LlmResult result) {
        if (result.isSuccess()) {
            return new RetryDecision(Action.DONE, Duration.ZERO);
        }
        if (!result.getFailureKind().isTransient() || attemptsMade > maxRetries) {
            return new RetryDecision(Action.GIVE_UP, Duration.ZERO);
        }
        return new RetryDecision(Action.RETRY, backoff(attemptsMade));
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public Duration backoff(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retry - 1.0);
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    public enum Action {
        DONE, RETRY, GIVE_UP
    }

    public record RetryDecision(Action action, Duration delay) {
    }
}
