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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.ConversationSession;
import me.golemcore.persona.domain.model.Message;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.StorageFailureException;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.SessionPort;
import me.golemcore.persona.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Session store backed by {@link StoragePort}.
 *
 * <p>
 * Sessions are cached in memory and persisted as one JSON record per
 * conversation under {@code sessions/{type}_{id}.json}. Every mutation for a
 * key runs under that key's lock and follows the same steps: take a rollback
 * copy, apply the change, enforce the history bound, write the record
 * atomically. If the write fails the cached session is restored from the
 * rollback copy and {@link StorageFailureException} is thrown, so the visible
 * state always matches what is on disk.
 *
 * <p>
 * A record that cannot be parsed fails {@code load} and {@code append}. The
 * history-resetting operations {@link #replaceHistory} and
 * {@link #clearHistory} do not need the old content: they copy the bad record
 * to {@code .corrupt} and write a fresh one in its place.
 */
@Service
@Slf4j
public class SessionService implements SessionPort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration mergeWindow;

    private final Map<ConversationKey, ConversationSession> sessionCache = new ConcurrentHashMap<>();
    private final Map<ConversationKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public SessionService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        Duration configured = properties.getSession().getMergeWindow();
        this.mergeWindow = configured != null && !configured.isNegative() ? configured : Duration.ZERO;
    }

    @Override
    public ConversationSession load(ConversationKey key, int maxHistory) {
        requireBound(maxHistory);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ConversationSession session = getOrCreate(key, maxHistory);
            if (session.getMaxHistory() == maxHistory) {
                return session.snapshot();
            }
            if (session.getHistory().size() > maxHistory) {
                // a lowered bound trims the stored record as well
                return mutate(key, maxHistory, false, s -> {
                });
            }
            session.setMaxHistory(maxHistory);
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ConversationSession append(ConversationKey key, Message message, int maxHistory) {
        Objects.requireNonNull(message, "message");
        requireBound(maxHistory);
        return mutate(key, maxHistory, false, session -> {
            if (!mergeIntoLast(session, message)) {
                session.getHistory().add(message);
            }
        });
    }

    @Override
    public ConversationSession replaceHistory(ConversationKey key, List<Message> messages, int maxHistory) {
        Objects.requireNonNull(messages, "messages");
        requireBound(maxHistory);
        List<Message> replacement = new ArrayList<>(messages);
        ConversationSession result = mutate(key, maxHistory, true, session -> session.setHistory(replacement));
        log.info("[Session] Replaced history of {}: {} messages kept", key, result.getHistory().size());
        return result;
    }

    @Override
    public void clearHistory(ConversationKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Optional<ConversationSession> existing;
            try {
                existing = find(key);
            } catch (CorruptRecordException e) {
                quarantine(key, e);
                deleteRecord(key);
                log.info("[Session] Cleared corrupt history of {}", key);
                return;
            }
            if (existing.isEmpty()) {
                return;
            }
            mutate(key, existing.get().getMaxHistory(), false, session -> session.getHistory().clear());
            log.info("[Session] Cleared history of {}", key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(ConversationKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            deleteRecord(key);
            log.info("[Session] Deleted session: {}", key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ConversationSession> listAll() {
        List<ConversationKey> keys = new ArrayList<>(sessionCache.keySet());
        try {
            List<String> files = storagePort.list(SESSIONS_DIR, JSON_EXTENSION).join();
            for (String file : files) {
                try {
                    ConversationKey key = ConversationKey.fromStorageName(file);
                    if (!keys.contains(key)) {
                        keys.add(key);
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("[Session] Skipping foreign file {}: {}", file, e.getMessage());
                }
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Session] Failed to scan sessions directory: {}", e.getMessage());
        }

        List<ConversationSession> sessions = new ArrayList<>();
        for (ConversationKey key : keys) {
            ReentrantLock lock = lockFor(key);
            lock.lock();
            try {
                find(key).ifPresent(session -> sessions.add(session.snapshot()));
            } catch (StorageFailureException e) {
                log.warn("[Session] Skipping unreadable session {}: {}", key, e.getMessage());
            } finally {
                lock.unlock();
            }
        }
        sessions.sort(Comparator.comparing(ConversationSession::getKey, Comparator.comparing(ConversationKey::storageName)));
        return sessions;
    }

    // ==================== Internals ====================

    /**
     * @param replacesCorrupt
     *            quarantine an unreadable record and start from an empty
     *            session instead of failing
     */
    private ConversationSession mutate(ConversationKey key, int maxHistory, boolean replacesCorrupt,
            Consumer<ConversationSession> change) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            ConversationSession session;
            ConversationSession rollback;
            try {
                session = getOrCreate(key, maxHistory);
                rollback = session.mutableCopy();
            } catch (CorruptRecordException e) {
                if (!replacesCorrupt) {
                    throw e;
                }
                quarantine(key, e);
                session = newSession(key, maxHistory);
                sessionCache.put(key, session);
                // on failure the corrupt record is still on disk, so nothing may stay cached
                rollback = null;
            }

            session.setMaxHistory(maxHistory);
            change.accept(session);
            int evicted = session.enforceBound();
            session.setUpdatedAt(clock.instant());

            try {
                persist(session);
            } catch (IOException | RuntimeException e) { // NOSONAR - any write failure rolls back
                if (rollback != null) {
                    sessionCache.put(key, rollback);
                } else {
                    sessionCache.remove(key);
                }
                log.error("[Session] Failed to persist {}, rolled back: {}", key, e.getMessage());
                throw new StorageFailureException(key, "Failed to persist session " + key, e);
            }

            if (evicted > 0) {
                log.debug("[Session] Evicted {} oldest messages from {}", evicted, key);
            }
            return session.snapshot();
        } finally {
            lock.unlock();
        }
    }

    private ConversationSession getOrCreate(ConversationKey key, int maxHistory) {
        Optional<ConversationSession> existing = find(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        ConversationSession session = newSession(key, maxHistory);
        sessionCache.put(key, session);
        log.info("[Session] Created new session: {}", key);
        return session;
    }

    private ConversationSession newSession(ConversationKey key, int maxHistory) {
        return ConversationSession.builder()
                .key(key)
                .history(new ArrayList<>())
                .maxHistory(maxHistory)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private Optional<ConversationSession> find(ConversationKey key) {
        ConversationSession cached = sessionCache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ConversationSession> stored = readFromStorage(key);
        stored.ifPresent(session -> {
            sessionCache.put(key, session);
            log.debug("[Session] Loaded existing session: {}", key);
        });
        return stored;
    }

    private Optional<ConversationSession> readFromStorage(ConversationKey key) {
        String json;
        try {
            json = storagePort.read(SESSIONS_DIR, fileName(key)).join();
        } catch (RuntimeException e) { // NOSONAR
            throw new StorageFailureException(key, "Failed to read session " + key, e);
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            ConversationSession session = objectMapper.readValue(json, ConversationSession.class);
            session.setKey(key);
            if (session.getHistory() == null) {
                session.setHistory(new ArrayList<>());
            } else {
                session.setHistory(new ArrayList<>(session.getHistory()));
            }
            return Optional.of(session);
        } catch (IOException e) {
            // the record is kept untouched on disk for manual recovery
            throw new CorruptRecordException(key, e);
        }
    }

    private void quarantine(ConversationKey key, CorruptRecordException cause) {
        try {
            String copy = storagePort.quarantine(SESSIONS_DIR, fileName(key)).join();
            log.warn("[Session] Replacing corrupt record of {}, original kept as {}: {}", key, copy,
                    cause.getCause().getMessage());
        } catch (RuntimeException e) { // NOSONAR
            throw new StorageFailureException(key, "Failed to quarantine corrupt session " + key, e);
        }
    }

    private void deleteRecord(ConversationKey key) {
        try {
            storagePort.delete(SESSIONS_DIR, fileName(key)).join();
            sessionCache.remove(key);
        } catch (RuntimeException e) { // NOSONAR
            throw new StorageFailureException(key, "Failed to delete session " + key, e);
        }
    }

    private void persist(ConversationSession session) throws IOException {
        String json = objectMapper.writeValueAsString(session);
        storagePort.replace(SESSIONS_DIR, fileName(session.getKey()), json, false).join();
        log.debug("[Session] Saved session: {}", session.getKey());
    }

    /**
     * Folds a user text message into the previous one when the same sender
     * writes again within the merge window.
     */
    private boolean mergeIntoLast(ConversationSession session, Message message) {
        if (mergeWindow.isZero() || !message.isUserMessage() || message.resolveKind() != MessageKind.TEXT) {
            return false;
        }
        Message last = session.lastMessage();
        if (last == null || !last.isUserMessage() || last.resolveKind() != MessageKind.TEXT
                || !Objects.equals(last.getSenderId(), message.getSenderId())
                || last.getTimestamp() == null || message.getTimestamp() == null) {
            return false;
        }
        Duration gap = Duration.between(last.getTimestamp(), message.getTimestamp());
        if (gap.isNegative() || gap.compareTo(mergeWindow) > 0) {
            return false;
        }
        Message merged = last.toBuilder()
                .content(last.getContent() + "\n" + message.getContent())
                .timestamp(message.getTimestamp())
                .build();
        List<Message> history = session.getHistory();
        history.set(history.size() - 1, merged);
        return true;
    }

    private ReentrantLock lockFor(ConversationKey key) {
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private static String fileName(ConversationKey key) {
        return key.storageName() + JSON_EXTENSION;
    }

    private static void requireBound(int maxHistory) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
        }
    }

    private static final class CorruptRecordException extends StorageFailureException {

        private CorruptRecordException(ConversationKey key, Throwable cause) {
            super(key, "Corrupt session record " + key, cause);
        }
    }
}
