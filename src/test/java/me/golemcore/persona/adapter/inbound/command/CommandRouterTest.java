package me.golemcore.persona.adapter.inbound.command;

import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.StorageFailureException;
import me.golemcore.persona.infrastructure.config.BotProperties;
import me.golemcore.persona.infrastructure.i18n.MessageService;
import me.golemcore.persona.port.inbound.CommandPort.CommandResult;
import me.golemcore.persona.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class CommandRouterTest {

    private static final ConversationKey KEY = ConversationKey.direct(42L);

    private SessionPort sessionPort;
    private BotProperties properties;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        properties = new BotProperties();
        router = new CommandRouter(sessionPort, new MessageService(properties));
    }

    // ==================== isCommand() ====================

    @Test
    void shouldRecognizeCommandPrefixes() {
        assertTrue(router.isCommand("/clear"));
        assertTrue(router.isCommand("  !roll"));
        assertTrue(router.isCommand(".help"));
        assertFalse(router.isCommand("hello /clear"));
        assertFalse(router.isCommand("https://img.test/cat.png"));
        assertFalse(router.isCommand(null));
    }

    // ==================== route() ====================

    @Test
    void shouldClearHistoryOnClear() {
        // Act
        Optional<CommandResult> result = router.route("/clear", KEY);

        // Assert
        assertTrue(result.isPresent());
        assertTrue(result.get().success());
        assertEquals("Chat history cleared.", result.get().output());
        verify(sessionPort).clearHistory(KEY);
    }

    @Test
    void shouldAcceptChineseAliasAndReplyInConfiguredLanguage() {
        properties.getPersona().setLanguage("zh");
        CommandRouter chinese = new CommandRouter(sessionPort, new MessageService(properties));

        Optional<CommandResult> result = chinese.route("/清除记录", KEY);

        assertEquals("聊天记录已清除", result.orElseThrow().output());
        verify(sessionPort).clearHistory(KEY);
    }

    @Test
    void shouldMatchCommandNameCaseInsensitively() {
        assertTrue(router.route("  /CLEAR  now", KEY).isPresent());
        verify(sessionPort).clearHistory(KEY);
    }

    @Test
    void shouldIgnoreUnknownAndForeignCommands() {
        for (String content : List.of("/weather", "!clear", ".clear", "/", "hello")) {
            assertTrue(router.route(content, KEY).isEmpty(), content);
        }
        verifyNoInteractions(sessionPort);
    }

    @Test
    void shouldReportFailureWhenHistoryCannotBeCleared() {
        doThrow(new StorageFailureException(KEY, "disk full", null)).when(sessionPort).clearHistory(KEY);

        CommandResult result = router.route("/clear", KEY).orElseThrow();

        assertFalse(result.success());
        assertEquals("Could not clear the chat history. Please try again later.", result.output());
    }

    // ==================== execute() ====================

    @Test
    void shouldFailUnknownCommandByName() {
        CommandResult result = router.execute("weather", List.of(), KEY);

        assertFalse(result.success());
        assertEquals("Unknown command: /weather", result.output());
        verifyNoInteractions(sessionPort);
    }
}
