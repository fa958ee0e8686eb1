package com.raditha.lint.parser;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.raditha.lint.model.ByteRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JavaParser line/column positions into UTF-8 byte offsets.
 * Columns are 1-indexed and count UTF-16 chars; a tab counts as one column.
 */
class SourcePositions {

    private final int[] lineStarts;
    private final int[] bytePrefix;
    private final int length;

    SourcePositions(String source) {
        this.length = source.length();
        this.lineStarts = computeLineStarts(source);
        this.bytePrefix = computeBytePrefix(source);
    }

    /**
     * Byte range covered by a JavaParser range, both ends inclusive there.
     */
    ByteRange toByteRange(Range range) {
        int begin = charIndex(range.begin);
        int end = charIndex(range.end) + 1;
        return new ByteRange(bytePrefix[begin], bytePrefix[end] - bytePrefix[begin]);
    }

    /**
     * Byte range of the whole source.
     */
    ByteRange whole() {
        return new ByteRange(0, bytePrefix[length]);
    }

    int charIndex(Position position) {
        int line = position.line;
        if (line < 1 || line > lineStarts.length) {
            throw new IllegalStateException("Line " + line + " outside source");
        }
        int index = lineStarts[line - 1] + position.column - 1;
        return Math.max(0, Math.min(index, length - 1));
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int[] computeBytePrefix(String source) {
        int[] prefix = new int[source.length() + 1];
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            int bytes;
            if (c < 0x80) {
                bytes = 1;
            } else if (c < 0x800) {
                bytes = 2;
            } else if (Character.isHighSurrogate(c)) {
                // the pair takes 4 bytes, counted on the high half
                bytes = 4;
            } else if (Character.isLowSurrogate(c)) {
                bytes = i > 0 && Character.isHighSurrogate(source.charAt(i - 1)) ? 0 : 3;
            } else {
                bytes = 3;
            }
            prefix[i + 1] = prefix[i] + bytes;
        }
        return prefix;
    }
}
