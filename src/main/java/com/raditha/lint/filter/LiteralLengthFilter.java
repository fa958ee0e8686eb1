package com.raditha.lint.filter;

import com.raditha.lint.config.StringLiteralConfig;
import com.raditha.lint.model.LiteralToken;

/**
 * Skips literal tokens too short to hold meaningful text.
 * Lengths count the delimiters, so with the default minimum of 3 the empty
 * literal {@code ""} is skipped while {@code "a"} is examined.
 */
public class LiteralLengthFilter {

    private final int minimumTokenLength;

    /**
     * Create filter with the default minimum token length (3).
     */
    public LiteralLengthFilter() {
        this(StringLiteralConfig.DEFAULT_MINIMUM_TOKEN_LENGTH);
    }

    /**
     * Create filter with a custom minimum token length.
     *
     * @param minimumTokenLength shortest token length, in bytes, that is examined
     */
    public LiteralLengthFilter(int minimumTokenLength) {
        if (minimumTokenLength < 1) {
            throw new IllegalArgumentException("Minimum token length must be at least 1");
        }
        this.minimumTokenLength = minimumTokenLength;
    }

    /**
     * @return true if the token is long enough to be examined
     */
    public boolean shouldExamine(LiteralToken token) {
        return shouldExamine(token.length());
    }

    public boolean shouldExamine(int tokenLength) {
        return tokenLength >= minimumTokenLength;
    }

    public int getMinimumTokenLength() {
        return minimumTokenLength;
    }
}
