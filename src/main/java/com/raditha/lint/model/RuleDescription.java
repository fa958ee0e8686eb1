package com.raditha.lint.model;

import java.util.List;

/**
 * Identity and documentation of a lint rule.
 *
 * @param identifier             Stable rule identifier used by reporting sinks
 * @param name                   Human readable name
 * @param description            One sentence explaining what the rule checks
 * @param nonTriggeringExamples  Snippets the rule must accept
 * @param triggeringExamples     Snippets the rule must flag
 */
public record RuleDescription(
        String identifier,
        String name,
        String description,
        List<String> nonTriggeringExamples,
        List<String> triggeringExamples) {

    public RuleDescription {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("identifier cannot be blank");
        }
        nonTriggeringExamples = nonTriggeringExamples == null ? List.of() : List.copyOf(nonTriggeringExamples);
        triggeringExamples = triggeringExamples == null ? List.of() : List.copyOf(triggeringExamples);
    }
}
