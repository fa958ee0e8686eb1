package com.raditha.lint.model;

/**
 * A string literal occurrence found in a source file.
 *
 * @param range   Byte range of the whole token, delimiters included
 * @param content Source text between the delimiters
 */
public record LiteralToken(ByteRange range, String content) {

    public LiteralToken {
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        if (content == null) {
            content = "";
        }
    }

    public int offset() {
        return range.offset();
    }

    public int length() {
        return range.length();
    }
}
