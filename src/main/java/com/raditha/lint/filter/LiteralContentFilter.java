package com.raditha.lint.filter;

import com.raditha.lint.model.LiteralToken;

/**
 * Skips literals whose content does not look like text.
 * Content looks like text when it has at least one letter or underscore;
 * digits, punctuation, symbols and whitespace alone do not count, so
 * {@code "223"}, {@code " "} and {@code "- 23 - 23"} are skipped.
 */
public class LiteralContentFilter {

    /**
     * @return true if the token content contains a word character that is not a
     *         digit
     */
    public boolean shouldExamine(LiteralToken token) {
        return looksLikeText(token.content());
    }

    /**
     * Check a piece of literal content.
     *
     * @param content text between the literal's delimiters
     * @return true if it contains a letter or connector character such as '_'
     */
    public static boolean looksLikeText(CharSequence content) {
        return content.codePoints().anyMatch(LiteralContentFilter::isWordLetter);
    }

    private static boolean isWordLetter(int codePoint) {
        if (Character.isDigit(codePoint)) {
            return false;
        }
        return Character.isLetter(codePoint)
                || Character.getType(codePoint) == Character.CONNECTOR_PUNCTUATION;
    }
}
