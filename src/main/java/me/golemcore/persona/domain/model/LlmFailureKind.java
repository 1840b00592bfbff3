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

/**
 * Failure classes for a remote LLM call.
 */
public enum LlmFailureKind {

    TIMEOUT(true), RATE_LIMITED(true), SERVER_ERROR(true), NETWORK_ERROR(true),

    MALFORMED_RESPONSE(false),

    /** Bad request, authentication failure, unknown model. */
    CLIENT_ERROR(false);

    private final boolean transientFailure;

    LlmFailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether a retry with the same payload may succeed.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
