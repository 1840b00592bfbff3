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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of message kinds the responder understands.
 *
 * <p>
 * Anything the platform sends that is not listed here resolves to
 * {@link #OTHER}. Messages keep their raw kind string, so an {@code OTHER}
 * message is stored as-is and only excluded at prompt-construction time.
 */
public enum MessageKind {

    TEXT("text"), MFACE("mface"), IMAGE("image"), OTHER(null);

    private final String value;

    MessageKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MessageKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (MessageKind kind : values()) {
            if (normalized.equals(kind.value)) {
                return kind;
            }
        }
        return OTHER;
    }

    /**
     * Parses a configured list of kind names. Unknown names are dropped so that
     * {@link #OTHER} can never be allowed by configuration.
     */
    public static Set<MessageKind> parseAll(Collection<String> rawKinds) {
        EnumSet<MessageKind> kinds = EnumSet.noneOf(MessageKind.class);
        if (rawKinds == null) {
            return kinds;
        }
        for (String raw : rawKinds) {
            MessageKind kind = fromValue(raw);
            if (kind != OTHER) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public boolean isVisual() {
        return this == IMAGE || this == MFACE;
    }
}
