package me.golemcore.persona.port.outbound;

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
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.domain.model.ResponderConfig;

import java.time.Duration;

/**
 * Port for a remote chat-completion endpoint. One call is one attempt; retries
 * are decided by the caller.
 */
public interface LlmPort {

    /**
     * Performs a single request bounded by {@code timeout}. Never throws for
     * remote failures: they come back as a classified {@link LlmResult}.
     */
    LlmResult complete(QueryPayload payload, ResponderConfig.LlmApiSettings api, Duration timeout);
}
