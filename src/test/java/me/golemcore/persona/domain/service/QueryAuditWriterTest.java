package me.golemcore.persona.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.infrastructure.config.AutoConfiguration;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class QueryAuditWriterTest {

    private StoragePort storagePort;
    private BotProperties properties;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        properties = new BotProperties();
        objectMapper = AutoConfiguration.objectMapper();
    }

    @Test
    void shouldStoreLastPayloadPerConversation() throws IOException {
        // Arrange
        when(storagePort.write(eq("queries"), eq("group_5.json"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        QueryAuditWriter writer = new QueryAuditWriter(storagePort, objectMapper, properties);

        // Act
        writer.record(payload()).join();

        // Assert
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).write(eq("queries"), eq("group_5.json"), json.capture());
        JsonNode stored = objectMapper.readTree(json.getValue());
        assertEquals("system", stored.get("systemPrompt").asText());
        assertEquals("group", stored.get("conversation").get("type").asText());
    }

    @Test
    void shouldSwallowStorageFailures() {
        when(storagePort.write(eq("queries"), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("disk full"))));
        QueryAuditWriter writer = new QueryAuditWriter(storagePort, objectMapper, properties);

        writer.record(payload()).join();
    }

    @Test
    void shouldSkipWhenDisabled() {
        properties.getPrompts().setAuditQueries(false);
        QueryAuditWriter writer = new QueryAuditWriter(storagePort, objectMapper, properties);

        writer.record(payload()).join();

        verifyNoInteractions(storagePort);
    }

    private static QueryPayload payload() {
        return QueryPayload.builder()
                .conversation(ConversationKey.group(5L))
                .systemPrompt("system")
                .characterPrompt("character")
                .history(List.of())
                .modelParams(Map.of("temperature", 0.7))
                .build();
    }
}
