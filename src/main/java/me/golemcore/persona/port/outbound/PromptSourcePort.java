package me.golemcore.persona.port.outbound;

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

import me.golemcore.persona.domain.model.ConversationType;
import me.golemcore.persona.domain.model.ResponderConfig;

/**
 * Port for persona prompt text. Implementations throw
 * {@link me.golemcore.persona.domain.model.ConfigurationException} when a
 * prompt file or required key is missing.
 */
public interface PromptSourcePort {

    /**
     * System prompt for the conversation type, with template masks resolved.
     */
    String systemPrompt(ConversationType type, ResponderConfig.PromptFiles files);

    /**
     * Global character prompt.
     */
    String characterPrompt(ResponderConfig.PromptFiles files);
}
