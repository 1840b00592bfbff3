package me.golemcore.persona.adapter.outbound.prompt;

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

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {mask}} placeholders in prompt text. Only word characters
 * are accepted inside the braces, so JSON snippets in a prompt are left alone.
 * Unknown masks stay as they are.
 */
@Component
public class PromptTemplateEngine {

    private static final Pattern MASK_PATTERN = Pattern.compile("\\{(\\w+)}");

    public String render(String content, Map<String, String> masks) {
        if (content == null) {
            return null;
        }
        if (masks == null || masks.isEmpty()) {
            return content;
        }

        Matcher matcher = MASK_PATTERN.matcher(content);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = masks.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
