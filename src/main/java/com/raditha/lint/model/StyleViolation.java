package com.raditha.lint.model;

/**
 * A flagged literal as handed to the reporting sink.
 *
 * @param rule       Description of the rule that fired
 * @param severity   Configured severity
 * @param byteOffset Byte offset of the literal
 * @param reason     Classification reason behind the violation
 */
public record StyleViolation(
        RuleDescription rule,
        Severity severity,
        int byteOffset,
        ClassificationReason reason) {

    public String ruleIdentifier() {
        return rule.identifier();
    }
}
