package me.golemcore.persona.domain.service;

import me.golemcore.persona.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.persona.domain.model.ConfigurationException;
import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.infrastructure.config.AutoConfiguration;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponderConfigServiceTest {

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private ResponderConfigService service;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getLlm().setModel("test-model");
        service = newService();
    }

    private ResponderConfigService newService() {
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        return new ResponderConfigService(properties, storage, AutoConfiguration.objectMapper());
    }

    // ==================== Building ====================

    @Test
    void shouldBuildSnapshotFromProperties() {
        // Arrange
        properties.getSession().setValidMessageTypes(List.of("text", "image", "video"));
        properties.getAccess().setAdminIds(List.of(1L));
        properties.getLlm().setApiUrl("https://llm.test/v1/chat/completions/");

        // Act
        ResponderConfig config = service.getConfig();

        // Assert
        assertEquals(EnumSet.of(MessageKind.TEXT, MessageKind.IMAGE), config.validMessageKinds());
        assertEquals(10, config.maxHistory());
        assertEquals(Set.of(1L), config.accessControl().adminIds());
        assertTrue(config.accessControl().group().enableWhitelist());
        assertFalse(config.accessControl().user().enableWhitelist());
        assertEquals("https://llm.test/v1", config.llmApi().url());
        assertEquals(Duration.ofSeconds(60), config.llmApi().timeout());
        assertEquals(2, config.llmApi().maxRetries());
    }

    @Test
    void shouldReturnSameSnapshotUntilChanged() {
        ResponderConfig first = service.getConfig();

        assertSame(first, service.getConfig());

        service.addAdmin(5L);
        assertNotSame(first, service.getConfig());
        assertFalse(first.accessControl().adminIds().contains(5L));
    }

    @Test
    void shouldEmitHyperparametersInWireOrderWithoutUnsetValues() {
        properties.getModelHyperparameters().setTopP(0.9);
        properties.getModelHyperparameters().setSeed(42L);

        ResponderConfig config = service.getConfig();

        assertEquals(List.of("temperature", "max_tokens", "seed", "top_p"),
                List.copyOf(config.hyperparameters().keySet()));
    }

    @Test
    void shouldClampMaxHistoryToLimit() {
        properties.getSession().setMaxHistory(100);

        assertEquals(ResponderConfigService.MAX_HISTORY_LIMIT, service.getConfig().maxHistory());
    }

    @Test
    void shouldRejectMissingModel() {
        properties.getLlm().setModel(" ");

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void shouldRejectConfigurationWithoutKnownKinds() {
        properties.getSession().setValidMessageTypes(List.of("video"));

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void shouldRejectOutOfRangeTemperature() {
        properties.getModelHyperparameters().setTemperature(3.5);

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void shouldRejectMissingMaxTokens() {
        properties.getModelHyperparameters().setMaxTokens(null);

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        properties.getLlm().setTimeout(Duration.ZERO);

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    @Test
    void shouldRejectMaxBackoffShorterThanInitial() {
        properties.getLlm().setMaxBackoff(Duration.ofSeconds(1));

        assertThrows(ConfigurationException.class, () -> service.getConfig());
    }

    // ==================== Runtime updates ====================

    @Test
    void shouldReportWhetherListUpdateChangedAnything() {
        assertTrue(service.addToWhitelist(ConversationType.GROUP, 100L));
        assertFalse(service.addToWhitelist(ConversationType.GROUP, 100L));
        assertTrue(service.removeFromWhitelist(ConversationType.GROUP, 100L));
        assertFalse(service.removeFromWhitelist(ConversationType.GROUP, 100L));
    }

    @Test
    void shouldPersistOverridesAcrossRestart() {
        // Arrange
        service.addToWhitelist(ConversationType.GROUP, 216295809L);
        service.addToBlacklist(ConversationType.PRIVATE, 666L);
        service.setWhitelistEnabled(ConversationType.PRIVATE, true);
        service.setMaxHistory(20);

        // Act
        ResponderConfig restored = newService().getConfig();

        // Assert
        assertTrue(Files.exists(tempDir.resolve("preferences").resolve("responder-config.json")));
        assertEquals(Set.of(216295809L), restored.accessControl().group().whitelist());
        assertEquals(Set.of(666L), restored.accessControl().user().blacklist());
        assertTrue(restored.accessControl().user().enableWhitelist());
        assertEquals(20, restored.maxHistory());
    }

    @Test
    void shouldKeepPreviousSnapshotWhenOverridesCannotBePersisted() {
        // Arrange
        StoragePort storage = mock(StoragePort.class);
        when(storage.read(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storage.replace(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("read-only"))));
        ResponderConfigService failing = new ResponderConfigService(properties, storage,
                AutoConfiguration.objectMapper());
        ResponderConfig before = failing.getConfig();

        // Act
        assertThrows(ConfigurationException.class, () -> failing.addAdmin(99L));

        // Assert
        assertSame(before, failing.getConfig());
        assertFalse(failing.getConfig().accessControl().adminIds().contains(99L));
    }

    @Test
    void shouldClampRuntimeMaxHistory() {
        assertEquals(30, service.setMaxHistory(45));
        assertThrows(ConfigurationException.class, () -> service.setMaxHistory(0));
    }

    @Test
    void shouldKeepOtherListUntouchedWhenUpdatingOne() {
        service.addToBlacklist(ConversationType.GROUP, 9L);

        ResponderConfig config = service.getConfig();

        assertEquals(Set.of(9L), config.accessControl().group().blacklist());
        assertTrue(config.accessControl().user().blacklist().isEmpty());
    }

    @Test
    void shouldRemoveAdmin() {
        service.addAdmin(1L);

        assertTrue(service.removeAdmin(1L));
        assertTrue(service.getConfig().accessControl().adminIds().isEmpty());
    }

    @Test
    void shouldReloadFromPropertiesAndOverrides() {
        service.getConfig();
        properties.getModelHyperparameters().setTemperature(1.1);

        ResponderConfig reloaded = service.reload();

        assertEquals(1.1, reloaded.hyperparameters().get("temperature"));
    }

    @Test
    void shouldNormalizeApiUrls() {
        assertEquals("https://a.test/v1", ResponderConfigService.normalizeApiUrl("https://a.test/v1/"));
        assertEquals("https://a.test/v1", ResponderConfigService.normalizeApiUrl("https://a.test/v1/chat/completions"));
        assertEquals("https://a.test", ResponderConfigService.normalizeApiUrl(" https://a.test "));
    }
}
