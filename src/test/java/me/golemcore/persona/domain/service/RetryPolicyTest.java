package me.golemcore.persona.domain.service;

import me.golemcore.persona.domain.model.LlmFailureKind;
import me.golemcore.persona.domain.model.LlmResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(2, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));

    @Test
    void shouldFinishOnSuccess() {
        RetryPolicy.RetryDecision decision = policy.next(1, LlmResult.success("hi"));

        assertEquals(RetryPolicy.Action.DONE, decision.action());
    }

    @Test
    void shouldRetryTransientFailuresUntilRetriesExhausted() {
        LlmResult timeout = LlmResult.failure(LlmFailureKind.TIMEOUT, "read timed out");

        assertEquals(RetryPolicy.Action.RETRY, policy.next(1, timeout).action());
        assertEquals(RetryPolicy.Action.RETRY, policy.next(2, timeout).action());
        assertEquals(RetryPolicy.Action.GIVE_UP, policy.next(3, timeout).action());
    }

    @Test
    void shouldGiveUpImmediatelyOnNonTransientFailures() {
        assertEquals(RetryPolicy.Action.GIVE_UP,
                policy.next(1, LlmResult.failure(LlmFailureKind.CLIENT_ERROR, "401")).action());
        assertEquals(RetryPolicy.Action.GIVE_UP,
                policy.next(1, LlmResult.failure(LlmFailureKind.MALFORMED_RESPONSE, "no choices")).action());
    }

    @Test
    void shouldNotRetryWhenMaxRetriesIsZero() {
        RetryPolicy none = new RetryPolicy(0, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10));

        assertEquals(RetryPolicy.Action.GIVE_UP,
                none.next(1, LlmResult.failure(LlmFailureKind.SERVER_ERROR, "503")).action());
    }

    @Test
    void shouldGrowBackoffExponentiallyUpToCap() {
        assertEquals(Duration.ofSeconds(2), policy.backoff(1));
        assertEquals(Duration.ofSeconds(4), policy.backoff(2));
        assertEquals(Duration.ofSeconds(8), policy.backoff(3));
        assertEquals(Duration.ofSeconds(10), policy.backoff(4));
        assertEquals(Duration.ofSeconds(10), policy.backoff(60));
    }

    @Test
    void shouldNeverDecreaseBackoff() {
        Duration previous = Duration.ZERO;
        for (int retry = 1; retry <= 20; retry++) {
            Duration current = policy.backoff(retry);
            assertTrue(current.compareTo(previous) >= 0, "retry " + retry);
            previous = current;
        }
    }

    @Test
    void shouldAttachBackoffToRetryDecision() {
        RetryPolicy.RetryDecision decision = policy.next(2,
                LlmResult.failure(LlmFailureKind.RATE_LIMITED, "429"));

        assertEquals(Duration.ofSeconds(4), decision.delay());
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(-1, Duration.ZERO, 2.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO));
    }
}
