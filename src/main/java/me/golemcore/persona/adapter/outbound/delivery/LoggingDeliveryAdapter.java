package me.golemcore.persona.adapter.outbound.delivery;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.ConversationKey;
import me.golemcore.persona.port.outbound.DeliveryPort;
import org.springframework.stereotype.Component;

/**
 * Delivery that writes replies to the log. The chat transport is outside this
 * service; a transport module swaps this bean for its own {@link DeliveryPort}.
 */
@Component
@Slf4j
public class LoggingDeliveryAdapter implements DeliveryPort {

    @Override
    public void deliver(ConversationKey key, String text) {
        log.info("[Delivery] -> {}: {}", key, text);
    }
}
