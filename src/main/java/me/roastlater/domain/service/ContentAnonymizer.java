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

package me.roastlater.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.roastlater.infrastructure.config.RoastLaterProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Best-effort redaction of identifying fragments in content text. Matches of
 * the configured rules are replaced by their token, rules applied in order.
 * Free text can still identify people after this pass.
 */
@Component
@Slf4j
public class ContentAnonymizer {

    private final List<CompiledRule> rules;

    public ContentAnonymizer(RoastLaterProperties properties) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (RoastLaterProperties.AnonymizationRule rule : properties.getTransfer().getAnonymizationRules()) {
            try {
                compiled.add(new CompiledRule(Pattern.compile(rule.getPattern()), rule.getReplacement()));
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Invalid anonymization pattern: " + rule.getPattern(), e);
            }
        }
        this.rules = List.copyOf(compiled);
        log.debug("[Export] Anonymizer loaded with {} rules", rules.size());
    }

    public String anonymize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (CompiledRule rule : rules) {
            result = rule.pattern().matcher(result).replaceAll(Matcher.quoteReplacement(rule.replacement()));
        }
        return result;
    }

    private record CompiledRule(Pattern pattern, String replacement) {
    }
}
