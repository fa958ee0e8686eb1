package com.raditha.lint.analysis;

import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * One contextual exemption check applied to a literal's ancestor chain.
 */
public interface ExemptionPass {

    /**
     * Evaluate the pass.
     *
     * @param chainFromLeaf enclosing nodes, innermost first; never empty
     * @return the outcome if this pass decides the literal, empty to fall through
     *         to the next pass
     */
    Optional<Outcome> evaluate(List<SyntaxNode> chainFromLeaf);

    /**
     * Decision reached by a pass.
     *
     * @param reason Why the literal is permitted or flagged
     * @param node   Node the decision rests on
     */
    record Outcome(ClassificationReason reason, SyntaxNode node) {
    }
}
