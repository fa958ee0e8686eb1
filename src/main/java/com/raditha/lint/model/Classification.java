package com.raditha.lint.model;

import java.util.Optional;

/**
 * Verdict for one literal occurrence.
 *
 * @param offset       Byte offset of the literal
 * @param reason       Reason for the verdict
 * @param decidingNode Structure node that decided the verdict, null when no
 *                     single node did
 */
public record Classification(int offset, ClassificationReason reason, SyntaxNode decidingNode) {

    public Classification {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
    }

    public static Classification of(int offset, ClassificationReason reason) {
        return new Classification(offset, reason, null);
    }

    public boolean isPermitted() {
        return reason.isPermitted();
    }

    public boolean isFlagged() {
        return !reason.isPermitted();
    }

    public Optional<SyntaxNode> optionalDecidingNode() {
        return Optional.ofNullable(decidingNode);
    }
}
