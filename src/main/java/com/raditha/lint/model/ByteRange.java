package com.raditha.lint.model;

/**
 * Half-open byte interval {@code [offset, offset + length)} in a source file.
 *
 * @param offset Starting byte offset (0-indexed)
 * @param length Number of bytes covered
 */
public record ByteRange(int offset, int length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
    }

    /**
     * Exclusive end offset.
     */
    public int end() {
        return offset + length;
    }

    /**
     * Check whether a byte offset falls inside this range.
     * An empty range contains nothing.
     *
     * @param byteOffset offset to test
     * @return true if {@code offset <= byteOffset < end()}
     */
    public boolean contains(int byteOffset) {
        return byteOffset >= offset && byteOffset - offset < length;
    }

    /**
     * Check whether another range lies entirely within this one.
     */
    public boolean encloses(ByteRange other) {
        return other.offset >= offset && other.end() <= end();
    }

    /**
     * Format as "[12, 20)" for display.
     */
    @Override
    public String toString() {
        return "[" + offset + ", " + end() + ")";
    }
}
