package com.raditha.lint.model;

import java.util.List;

/**
 * Parsed form of one source file: its structure tree and its string literals
 * in source order.
 *
 * @param root     Root of the structure tree
 * @param literals String literal tokens ordered by offset
 */
public record SourceFile(SyntaxNode root, List<LiteralToken> literals) {

    public SourceFile {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        literals = literals == null ? List.of() : List.copyOf(literals);
    }
}
