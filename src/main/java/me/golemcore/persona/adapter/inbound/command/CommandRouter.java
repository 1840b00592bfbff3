package me.golemcore.persona.adapter.inbound.command;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.domain.model.StorageFailureException;
import me.golemcore.persona.infrastructure.i18n.MessageService;
import me.golemcore.persona.port.inbound.CommandPort;
import me.golemcore.persona.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes chat commands to their handlers.
 *
 * <p>
 * Available commands:
 * <ul>
 * <li>/clear (alias /清除记录) - clear the conversation history</li>
 * </ul>
 *
 * <p>
 * Only {@code /} starts an executable command. Messages starting with
 * {@code !} or {@code .} are commands meant for other bots in the chat and are
 * always ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String COMMAND_START = "/";
    private static final List<String> COMMAND_PREFIXES = List.of(COMMAND_START, "!", ".");

    private static final String CMD_CLEAR = "clear";
    private static final Map<String, String> ALIASES = Map.of("清除记录", CMD_CLEAR);

    private final SessionPort sessionPort;
    private final MessageService messageService;

    @Override
    public boolean isCommand(String content) {
        if (content == null) {
            return false;
        }
        String text = content.strip();
        return COMMAND_PREFIXES.stream().anyMatch(text::startsWith);
    }

    @Override
    public Optional<CommandResult> route(String content, ConversationKey conversation) {
        if (!isCommand(content)) {
            return Optional.empty();
        }
        String text = content.strip();
        if (!text.startsWith(COMMAND_START)) {
            return Optional.empty();
        }
        List<String> tokens = Arrays.stream(text.substring(COMMAND_START.length()).strip().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .toList();
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        String command = tokens.get(0).toLowerCase(Locale.ROOT);
        if (!hasCommand(command)) {
            return Optional.empty();
        }
        return Optional.of(execute(command, tokens.subList(1, tokens.size()), conversation));
    }

    @Override
    public CommandResult execute(String command, List<String> args, ConversationKey conversation) {
        String name = ALIASES.getOrDefault(command, command);
        log.debug("[Command] Executing /{} in {}", name, conversation);
        return switch (name) {
        case CMD_CLEAR -> handleClear(conversation);
        default -> CommandResult.failure(messageService.getMessage("command.unknown", (Object) command));
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return CMD_CLEAR.equals(command) || ALIASES.containsKey(command);
    }

    private CommandResult handleClear(ConversationKey conversation) {
        try {
            sessionPort.clearHistory(conversation);
            log.info("[Command] History cleared for {}", conversation);
            return CommandResult.success(messageService.getMessage("command.clear.done"));
        } catch (StorageFailureException e) {
            log.error("[Command] Failed to clear history for {}: {}", conversation, e.getMessage());
            return CommandResult.failure(messageService.getMessage("command.clear.failed"));
        }
    }
}
