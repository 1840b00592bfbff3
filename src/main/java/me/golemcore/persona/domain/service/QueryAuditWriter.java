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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Keeps the last payload sent for each conversation under
 * {@code queries/{type}_{id}.json} for inspection. Best effort: failures are
 * logged and never affect the exchange.
 */
@Service
@Slf4j
public class QueryAuditWriter {

    private static final String QUERIES_DIR = "queries";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public QueryAuditWriter(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.enabled = properties.getPrompts().isAuditQueries();
    }

    public CompletableFuture<Void> record(QueryPayload payload) {
        if (!enabled || payload.getConversation() == null) {
            return CompletableFuture.completedFuture(null);
        }
        String path = payload.getConversation().storageName() + ".json";
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Query] Failed to serialize payload for {}: {}", path, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return storagePort.write(QUERIES_DIR, path, json)
                .exceptionally(e -> {
                    log.warn("[Query] Failed to store last query {}: {}", path, e.getMessage());
                    return null;
                });
    }
}
