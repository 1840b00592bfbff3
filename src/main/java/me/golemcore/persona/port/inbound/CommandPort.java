package me.golemcore.persona.port.inbound;

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

import me.golemcore.persona.domain.model.ConversationKey;

import java.util.List;
import java.util.Optional;

/**
 * Chat commands typed by users, such as {@code /clear}.
 *
 * <p>
 * Any message starting with a command prefix ({@code /}, {@code !} or
 * {@code .}) is a command message. Command messages are never stored or sent
 * to the LLM; the ones that name no known command are ignored.
 */
public interface CommandPort {

    /**
     * Checks whether the text is a command message.
     */
    boolean isCommand(String content);

    /**
     * Parses and executes a command message.
     *
     * @return the result to send back, or empty when the message names no
     *         known command
     */
    Optional<CommandResult> route(String content, ConversationKey conversation);

    /**
     * Executes a command by name.
     *
     * @param command
     *            command name without the leading slash
     * @param args
     *            whitespace-separated arguments after the name
     */
    CommandResult execute(String command, List<String> args, ConversationKey conversation);

    /**
     * Checks if a command with the given name (or alias) is registered.
     */
    boolean hasCommand(String command);

    /**
     * Result of a command execution with the text to deliver to the chat.
     */
    record CommandResult(boolean success, String output) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output);
        }

        public static CommandResult failure(String error) {
            return new CommandResult(false, error);
        }
    }
}
