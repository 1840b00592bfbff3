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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Normalized outcome of an LLM call: either the reply text or a classified
 * failure. Exactly one of {@code replyText} and {@code failureKind} is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LlmResult {

    String replyText;
    LlmFailureKind failureKind;
    String detail;
    int attempts;

    public static LlmResult success(String replyText) {
        return new LlmResult(replyText, null, null, 1);
    }

    public static LlmResult failure(LlmFailureKind kind, String detail) {
        return new LlmResult(null, kind, detail, 1);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * Same result, annotated with the number of attempts it took.
     */
    public LlmResult withAttempts(int attempts) {
        return new LlmResult(replyText, failureKind, detail, attempts);
    }
}
