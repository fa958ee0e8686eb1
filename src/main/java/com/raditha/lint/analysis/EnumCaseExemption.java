package com.raditha.lint.analysis;

import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.SyntaxKind;
import com.raditha.lint.model.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Permits literals used as the raw or associated value of an enum case.
 * Only the innermost enclosing node is considered: anything else rejects
 * before any node is remembered.
 */
public class EnumCaseExemption implements ExemptionPass {

    static Verdict classify(SyntaxNode node) {
        return node.is(SyntaxKind.ENUM_CASE_ELEMENT) ? Verdict.ACCEPT_HERE : Verdict.REJECT_HERE;
    }

    @Override
    public Optional<Outcome> evaluate(List<SyntaxNode> chainFromLeaf) {
        return ChainWalker.walk(chainFromLeaf, EnumCaseExemption::classify)
                .map(node -> new Outcome(ClassificationReason.ENUM_CASE_VALUE, node));
    }
}
