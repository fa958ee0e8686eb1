package com.raditha.lint.analysis;

import com.raditha.lint.model.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Walks a leaf-to-root ancestor chain with a per-node classifier.
 * <p>
 * {@link Verdict#ACCEPT_HERE} returns the current node at once.
 * {@link Verdict#REJECT_HERE} returns the last node that got
 * {@link Verdict#CONTINUE}, which may be none, without looking further up.
 * An exhausted chain also yields the last continued node.
 */
public final class ChainWalker {

    private ChainWalker() {
    }

    /**
     * @param chain    enclosing nodes, innermost first
     * @param classify classifier applied to each node in order
     * @return the accepted node, or the last continued node, or empty
     */
    public static Optional<SyntaxNode> walk(List<SyntaxNode> chain, Function<SyntaxNode, Verdict> classify) {
        SyntaxNode lastAccepted = null;
        for (SyntaxNode node : chain) {
            switch (classify.apply(node)) {
                case CONTINUE -> lastAccepted = node;
                case ACCEPT_HERE -> {
                    return Optional.of(node);
                }
                case REJECT_HERE -> {
                    return Optional.ofNullable(lastAccepted);
                }
            }
        }
        return Optional.ofNullable(lastAccepted);
    }
}
