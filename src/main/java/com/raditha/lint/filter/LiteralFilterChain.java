package com.raditha.lint.filter;

import com.raditha.lint.config.StringLiteralConfig;
import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.LiteralToken;

import java.util.Optional;

/**
 * Combines the length and content filters.
 * Applies filters in order of cost: length first, then content.
 */
public class LiteralFilterChain {

    private final LiteralLengthFilter lengthFilter;
    private final LiteralContentFilter contentFilter;

    /**
     * Create filter chain with default thresholds.
     */
    public LiteralFilterChain() {
        this(new LiteralLengthFilter(), new LiteralContentFilter());
    }

    /**
     * Create filter chain from rule configuration.
     */
    public LiteralFilterChain(StringLiteralConfig config) {
        this(new LiteralLengthFilter(config.minimumTokenLength()), new LiteralContentFilter());
    }

    public LiteralFilterChain(LiteralLengthFilter lengthFilter, LiteralContentFilter contentFilter) {
        this.lengthFilter = lengthFilter;
        this.contentFilter = contentFilter;
    }

    /**
     * Decide whether a token needs contextual classification.
     *
     * @param token literal token
     * @return the reason the token is skipped, or empty if it must be classified
     */
    public Optional<ClassificationReason> skipReason(LiteralToken token) {
        if (!lengthFilter.shouldExamine(token)) {
            return Optional.of(ClassificationReason.TOO_SHORT);
        }
        if (!contentFilter.shouldExamine(token)) {
            return Optional.of(ClassificationReason.NOT_TEXT);
        }
        return Optional.empty();
    }

    public boolean shouldExamine(LiteralToken token) {
        return skipReason(token).isEmpty();
    }

    public LiteralLengthFilter getLengthFilter() {
        return lengthFilter;
    }
}
