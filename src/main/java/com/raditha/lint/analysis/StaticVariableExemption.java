package com.raditha.lint.analysis;

import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Permits literals on the value side of immutable global, class or static
 * variables.
 * <p>
 * Array and dictionary literals are transparent while climbing, so
 * {@code static let names = ["a", "b"]} is judged by the declaration. The
 * node the walk settles on is then re-checked with collections disallowed:
 * a walk that stopped on a bare collection does not qualify.
 * <p>
 * A qualifying declaration that can be reassigned is flagged rather than
 * handed to the next pass.
 */
public class StaticVariableExemption implements ExemptionPass {

    static Verdict classify(SyntaxNode node, boolean acceptCollections) {
        if (node.kind() == null) {
            return Verdict.REJECT_HERE;
        }
        if (node.kind().isCollectionLiteral()) {
            return acceptCollections ? Verdict.CONTINUE : Verdict.REJECT_HERE;
        }
        if (node.kind().isTypeLevelVariable()) {
            return Verdict.CONTINUE;
        }
        return Verdict.REJECT_HERE;
    }

    @Override
    public Optional<Outcome> evaluate(List<SyntaxNode> chainFromLeaf) {
        Optional<SyntaxNode> candidate = ChainWalker.walk(chainFromLeaf, node -> classify(node, true));
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        SyntaxNode declaration = candidate.get();
        if (classify(declaration, false) == Verdict.REJECT_HERE) {
            return Optional.empty();
        }
        if (declaration.isMutable()) {
            return Optional.of(new Outcome(ClassificationReason.MUTABLE_STATIC_VARIABLE, declaration));
        }
        return Optional.of(new Outcome(ClassificationReason.IMMUTABLE_STATIC_VARIABLE, declaration));
    }
}
