package com.raditha.lint.config;

import com.raditha.lint.model.Severity;

/**
 * Configuration for the string literal rule.
 *
 * @param whitelist          Call names whose arguments are exempt
 * @param severity           Severity of reported violations
 * @param minimumTokenLength Shortest token, delimiters included, that is
 *                           examined at all
 */
public record StringLiteralConfig(
        CallWhitelist whitelist,
        Severity severity,
        int minimumTokenLength) {

    public static final int DEFAULT_MINIMUM_TOKEN_LENGTH = 3;

    /**
     * Validate configuration.
     */
    public StringLiteralConfig {
        if (whitelist == null) {
            throw new IllegalArgumentException("whitelist cannot be null");
        }
        if (severity == null) {
            severity = Severity.WARNING;
        }
        if (minimumTokenLength < 1) {
            throw new IllegalArgumentException("minimumTokenLength must be >= 1");
        }
    }

    /**
     * Default preset: built-in call whitelist, warnings, tokens longer than two
     * bytes.
     */
    public static StringLiteralConfig defaults() {
        return new StringLiteralConfig(CallWhitelist.defaults(), Severity.WARNING, DEFAULT_MINIMUM_TOKEN_LENGTH);
    }

    /**
     * Java preset: same thresholds with the Java call whitelist.
     */
    public static StringLiteralConfig java() {
        return new StringLiteralConfig(CallWhitelist.java(), Severity.WARNING, DEFAULT_MINIMUM_TOKEN_LENGTH);
    }

    public StringLiteralConfig withWhitelist(CallWhitelist other) {
        return new StringLiteralConfig(other, severity, minimumTokenLength);
    }

    public StringLiteralConfig withSeverity(Severity other) {
        return new StringLiteralConfig(whitelist, other, minimumTokenLength);
    }

    public StringLiteralConfig withMinimumTokenLength(int other) {
        return new StringLiteralConfig(whitelist, severity, other);
    }
}
