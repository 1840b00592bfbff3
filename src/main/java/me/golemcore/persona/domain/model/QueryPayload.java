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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything needed for one LLM call: the leading prompt context, the
 * filtered history (current inbound message last) and pass-through model
 * parameters. Built fresh per request.
 */
@Value
@Builder
@JsonPropertyOrder({ "conversation", "systemPrompt", "characterPrompt", "history", "modelParams" })
public class QueryPayload {

    ConversationKey conversation;
    String systemPrompt;
    String characterPrompt;
    List<Message> history;

    /** Hyperparameters in insertion order, passed through unmodified. */
    Map<String, Object> modelParams;
}
