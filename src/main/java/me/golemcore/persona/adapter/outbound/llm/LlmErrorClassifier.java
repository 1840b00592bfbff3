package me.golemcore.persona.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import feign.FeignException;
import feign.codec.DecodeException;
import me.golemcore.persona.domain.model.LlmFailureKind;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.HashSet;
import java.util.Set;

/**
 * Maps HTTP statuses and transport exceptions of a chat-completion call to
 * {@link LlmFailureKind}.
 */
public final class LlmErrorClassifier {

    private static final int STATUS_REQUEST_TIMEOUT = 408;
    private static final int STATUS_TOO_MANY_REQUESTS = 429;

    private LlmErrorClassifier() {
    }

    /**
     * Classify an HTTP error status.
     */
    public static LlmFailureKind classifyStatus(int status) {
        if (status == STATUS_TOO_MANY_REQUESTS) {
            return LlmFailureKind.RATE_LIMITED;
        }
        if (status == STATUS_REQUEST_TIMEOUT) {
            return LlmFailureKind.TIMEOUT;
        }
        if (status >= 500) {
            return LlmFailureKind.SERVER_ERROR;
        }
        return LlmFailureKind.CLIENT_ERROR;
    }

    /**
     * Classify a failure thrown by the Feign client, walking the cause chain
     * for transport errors.
     */
    public static LlmFailureKind classifyThrowable(Throwable throwable) {
        if (throwable instanceof DecodeException) {
            return LlmFailureKind.MALFORMED_RESPONSE;
        }
        if (throwable instanceof FeignException feignException && feignException.status() >= 400) {
            return classifyStatus(feignException.status());
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof JsonProcessingException) {
                return LlmFailureKind.MALFORMED_RESPONSE;
            }
            // SocketTimeoutException and OkHttp call timeouts both land here
            if (current instanceof InterruptedIOException) {
                return LlmFailureKind.TIMEOUT;
            }
            if (current instanceof IOException) {
                return LlmFailureKind.NETWORK_ERROR;
            }
            current = current.getCause();
        }
        return LlmFailureKind.CLIENT_ERROR;
    }
}
