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
 * Terminal state of one inbound message exchange.
 */
public enum ExchangeOutcome {

    /** Sender or conversation rejected by the access gate. Nothing stored. */
    DENIED,

    /** Message kind not in the valid set. Nothing stored. */
    UNSUPPORTED_KIND,

    /** Chat command executed and its answer delivered. Nothing stored. */
    COMMAND,

    /** Command message for another bot or an unknown command. Nothing stored. */
    IGNORED_COMMAND,

    /** Reply generated, stored and delivered. */
    REPLIED,

    /** Inbound turn stored without a reply; too many messages were waiting. */
    STORED,

    /** Failure notice delivered; the inbound turn may still be stored. */
    FAILED
}
