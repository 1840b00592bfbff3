package me.golemcore.persona.domain.service;

import me.golemcore.persona.adapter.inbound.command.CommandRouter;
import me.golemcore.persona.domain.model.ConfigurationException;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.ConversationSession;
import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.ExchangeOutcome;
import me.golemcore.persona.domain.model.InboundMessage;
import me.golemcore.persona.domain.model.LlmFailureKind;
import me.golemcore.persona.domain.model.LlmResult;
import me.golemcore.persona.domain.model.Message;
import me.golemcore.persona.domain.model.MessageKind;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.domain.model.StorageFailureException;
import me.golemcore.persona.infrastructure.i18n.MessageService;
import me.golemcore.persona.port.outbound.DeliveryPort;
import me.golemcore.persona.port.outbound.PromptSourcePort;
import me.golemcore.persona.port.outbound.SessionPort;
import me.golemcore.persona.security.AccessGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConversationOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final long GROUP_ID = 216295809L;
    private static final long SENDER_ID = 7L;
    private static final ConversationKey GROUP_KEY = ConversationKey.group(GROUP_ID);
    private static final String FAILURE_NOTICE = "Sorry, try later.";
    private static final String CLEARED_NOTICE = "History cleared.";

    private ResponderConfigService configService;
    private SessionPort sessionPort;
    private PromptSourcePort promptSource;
    private QueryAuditWriter queryAuditWriter;
    private LlmClient llmClient;
    private DeliveryPort deliveryPort;
    private MessageService messageService;
    private ConversationOrchestrator orchestrator;

    private final List<Message> stored = new ArrayList<>();

    @BeforeEach
    void setUp() {
        configService = mock(ResponderConfigService.class);
        sessionPort = mock(SessionPort.class);
        promptSource = mock(PromptSourcePort.class);
        queryAuditWriter = mock(QueryAuditWriter.class);
        llmClient = mock(LlmClient.class);
        deliveryPort = mock(DeliveryPort.class);
        messageService = mock(MessageService.class);

        when(configService.getConfig()).thenReturn(config(Set.of(GROUP_ID)));
        when(messageService.getMessage(ConversationOrchestrator.FAILURE_MESSAGE_KEY)).thenReturn(FAILURE_NOTICE);
        when(messageService.getMessage("command.clear.done")).thenReturn(CLEARED_NOTICE);
        when(promptSource.systemPrompt(eq(ConversationType.GROUP), any())).thenReturn("system prompt");
        when(promptSource.characterPrompt(any())).thenReturn("character prompt");
        when(sessionPort.append(eq(GROUP_KEY), any(Message.class), anyInt())).thenAnswer(invocation -> {
            stored.add(invocation.getArgument(1));
            return ConversationSession.builder()
                    .key(GROUP_KEY)
                    .history(List.copyOf(stored))
                    .maxHistory(invocation.getArgument(2))
                    .build();
        });

        orchestrator = new ConversationOrchestrator(configService, new AccessGate(),
                new CommandRouter(sessionPort, messageService), sessionPort, promptSource,
                new QueryBuilder(), queryAuditWriter, llmClient, deliveryPort, messageService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Rejections ====================

    @Test
    void shouldIgnoreDeniedSenderSilently() {
        // Arrange
        when(configService.getConfig()).thenReturn(config(Set.of()));

        // Act
        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        // Assert
        assertEquals(ExchangeOutcome.DENIED, outcome);
        verifyNoInteractions(sessionPort, llmClient, deliveryPort);
    }

    @Test
    void shouldIgnoreUnsupportedKindWithoutTouchingHistory() {
        ExchangeOutcome outcome = orchestrator.handle(inbound("image", "https://img.test/cat.png"));

        assertEquals(ExchangeOutcome.UNSUPPORTED_KIND, outcome);
        verifyNoInteractions(sessionPort, llmClient, deliveryPort);
    }

    @Test
    void shouldIgnoreUnknownKind() {
        assertEquals(ExchangeOutcome.UNSUPPORTED_KIND, orchestrator.handle(inbound("record", "voice.amr")));
        verifyNoInteractions(sessionPort);
    }

    // ==================== Commands ====================

    @Test
    void shouldClearHistoryOnClearCommandWithoutCallingLlm() {
        // Act
        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "/clear"));

        // Assert
        assertEquals(ExchangeOutcome.COMMAND, outcome);
        verify(sessionPort).clearHistory(GROUP_KEY);
        verify(sessionPort, never()).append(any(), any(), anyInt());
        verify(deliveryPort).deliver(GROUP_KEY, CLEARED_NOTICE);
        verifyNoInteractions(llmClient);
    }

    @Test
    void shouldIgnoreCommandsMeantForOtherBots() {
        for (String content : List.of("!roll d20", ".help", "/weather Tokyo", "  /")) {
            assertEquals(ExchangeOutcome.IGNORED_COMMAND, orchestrator.handle(inbound("text", content)), content);
        }

        verifyNoInteractions(sessionPort, llmClient, deliveryPort);
    }

    @Test
    void shouldNotRunCommandsForDeniedSender() {
        when(configService.getConfig()).thenReturn(config(Set.of()));

        assertEquals(ExchangeOutcome.DENIED, orchestrator.handle(inbound("text", "/clear")));

        verifyNoInteractions(sessionPort, deliveryPort);
    }

    // ==================== Successful exchange ====================

    @Test
    void shouldStoreInboundAndReplyThenDeliver() {
        // Arrange
        when(llmClient.send(any(), any())).thenReturn(LlmResult.success("Hello Alice!").withAttempts(1));

        // Act
        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hi there"));

        // Assert
        assertEquals(ExchangeOutcome.REPLIED, outcome);
        assertEquals(2, stored.size());
        assertTrue(stored.get(0).isUserMessage());
        assertEquals("hi there", stored.get(0).getContent());
        assertEquals(SENDER_ID, stored.get(0).getSenderId());
        assertTrue(stored.get(1).isAssistantMessage());
        assertEquals("Hello Alice!", stored.get(1).getContent());
        assertEquals(NOW, stored.get(1).getTimestamp());
        verify(deliveryPort).deliver(GROUP_KEY, "Hello Alice!");
    }

    @Test
    void shouldSendQueryWithCurrentMessageLastAndPrompts() {
        when(llmClient.send(any(), any())).thenReturn(LlmResult.success("ok"));

        orchestrator.handle(inbound("text", "question"));

        ArgumentCaptor<QueryPayload> captor = ArgumentCaptor.forClass(QueryPayload.class);
        verify(llmClient).send(captor.capture(), any());
        QueryPayload payload = captor.getValue();
        assertEquals("system prompt", payload.getSystemPrompt());
        assertEquals("character prompt", payload.getCharacterPrompt());
        assertEquals("question", payload.getHistory().get(payload.getHistory().size() - 1).getContent());
        assertEquals(0.7, payload.getModelParams().get("temperature"));
        verify(queryAuditWriter).record(payload);
    }

    @Test
    void shouldUseConfiguredHistoryBound() {
        when(llmClient.send(any(), any())).thenReturn(LlmResult.success("ok"));

        orchestrator.handle(inbound("text", "hello"));

        verify(sessionPort, times(2)).append(eq(GROUP_KEY), any(Message.class), eq(4));
    }

    // ==================== store() ====================

    @Test
    void shouldStoreWithoutCallingLlmWhenAskedToStoreOnly() {
        // Act
        ExchangeOutcome outcome = orchestrator.store(inbound("text", "while you were busy"));

        // Assert
        assertEquals(ExchangeOutcome.STORED, outcome);
        assertEquals(1, stored.size());
        assertEquals("while you were busy", stored.get(0).getContent());
        verifyNoInteractions(llmClient, deliveryPort, promptSource);
    }

    @Test
    void shouldApplyGateAndKindFilterWhenStoringOnly() {
        assertEquals(ExchangeOutcome.UNSUPPORTED_KIND, orchestrator.store(inbound("record", "voice.amr")));

        when(configService.getConfig()).thenReturn(config(Set.of()));
        assertEquals(ExchangeOutcome.DENIED, orchestrator.store(inbound("text", "hello")));

        verifyNoInteractions(sessionPort, llmClient);
    }

    // ==================== Failures ====================

    @Test
    void shouldKeepInboundAndDeliverNoticeWhenLlmFails() {
        // Arrange
        when(llmClient.send(any(), any()))
                .thenReturn(LlmResult.failure(LlmFailureKind.TIMEOUT, "timeout").withAttempts(3));

        // Act
        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        // Assert
        assertEquals(ExchangeOutcome.FAILED, outcome);
        assertEquals(1, stored.size());
        assertEquals("hello", stored.get(0).getContent());
        verify(deliveryPort).deliver(GROUP_KEY, FAILURE_NOTICE);
    }

    @Test
    void shouldFailWithoutCallingLlmWhenInboundCannotBeStored() {
        doThrow(new StorageFailureException(GROUP_KEY, "disk full", null))
                .when(sessionPort).append(eq(GROUP_KEY), any(Message.class), anyInt());

        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        assertEquals(ExchangeOutcome.FAILED, outcome);
        verify(llmClient, never()).send(any(), any());
        verify(deliveryPort).deliver(GROUP_KEY, FAILURE_NOTICE);
    }

    @Test
    void shouldDeliverReplyEvenWhenStoringItFails() {
        when(llmClient.send(any(), any())).thenReturn(LlmResult.success("reply"));
        doReturn(ConversationSession.builder().key(GROUP_KEY).history(List.of()).maxHistory(4).build())
                .doThrow(new StorageFailureException(GROUP_KEY, "disk full", null))
                .when(sessionPort).append(eq(GROUP_KEY), any(Message.class), anyInt());

        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        assertEquals(ExchangeOutcome.REPLIED, outcome);
        verify(deliveryPort).deliver(GROUP_KEY, "reply");
    }

    @Test
    void shouldFailWhenPromptFileIsBrokenButKeepInbound() {
        when(promptSource.systemPrompt(eq(ConversationType.GROUP), any()))
                .thenThrow(new ConfigurationException("Prompt file not found: prompts/system/group.yaml"));

        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        assertEquals(ExchangeOutcome.FAILED, outcome);
        assertEquals(1, stored.size());
        verify(llmClient, never()).send(any(), any());
        verify(deliveryPort).deliver(GROUP_KEY, FAILURE_NOTICE);
    }

    @Test
    void shouldFailWhenConfigurationInvalid() {
        when(configService.getConfig()).thenThrow(new ConfigurationException("bot.llm.model is not configured"));

        ExchangeOutcome outcome = orchestrator.handle(inbound("text", "hello"));

        assertEquals(ExchangeOutcome.FAILED, outcome);
        verifyNoInteractions(sessionPort);
        verify(deliveryPort).deliver(GROUP_KEY, FAILURE_NOTICE);
    }

    private static InboundMessage inbound(String kind, String content) {
        return InboundMessage.builder()
                .conversationType(ConversationType.GROUP)
                .conversationId(GROUP_ID)
                .senderId(SENDER_ID)
                .senderName("Alice")
                .messageKind(kind)
                .content(content)
                .timestamp(NOW)
                .build();
    }

    private static ResponderConfig config(Set<Long> groupWhitelist) {
        ResponderConfig.AccessControlConfig access = new ResponderConfig.AccessControlConfig(Set.of(),
                new ResponderConfig.AccessListConfig(true, groupWhitelist, Set.of()), null);
        ResponderConfig.LlmApiSettings api = new ResponderConfig.LlmApiSettings("https://llm.test/v1", "key",
                "test-model", Duration.ofSeconds(5), 2, Duration.ZERO, 2.0, Duration.ZERO);
        return new ResponderConfig(access, EnumSet.of(MessageKind.TEXT), 4,
                new ResponderConfig.PromptFiles("system/group.yaml", "system/private.yaml", "character/a.yaml"),
                api, Map.of("temperature", 0.7, "max_tokens", 128));
    }
}
