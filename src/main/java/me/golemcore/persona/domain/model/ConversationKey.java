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

import java.util.Objects;

/**
 * Identifies one conversation: a group chat or a private chat with one user.
 * Used as the session key and as the unit of per-conversation serialization.
 */
public record ConversationKey(ConversationType type, long id) {

    private static final String STORAGE_SEPARATOR = "_";

    public ConversationKey {
        Objects.requireNonNull(type, "type");
        if (id <= 0) {
            throw new IllegalArgumentException("Conversation id must be positive: " + id);
        }
    }

    public static ConversationKey group(long id) {
        return new ConversationKey(ConversationType.GROUP, id);
    }

    public static ConversationKey direct(long id) {
        return new ConversationKey(ConversationType.PRIVATE, id);
    }

    /**
     * Storage name used for persisted records, e.g. {@code group_216295809}.
     */
    public String storageName() {
        return type.getValue() + STORAGE_SEPARATOR + id;
    }

    /**
     * Inverse of {@link #storageName()}. Accepts an optional {@code .json}
     * extension.
     */
    public static ConversationKey fromStorageName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Storage name must not be blank");
        }
        String base = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
        int separator = base.lastIndexOf(STORAGE_SEPARATOR);
        if (separator <= 0 || separator == base.length() - 1) {
            throw new IllegalArgumentException("Malformed storage name: " + name);
        }
        ConversationType type = ConversationType.fromValue(base.substring(0, separator));
        try {
            return new ConversationKey(type, Long.parseLong(base.substring(separator + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed conversation id in storage name: " + name, e);
        }
    }

    @Override
    public String toString() {
        return storageName();
    }
}
