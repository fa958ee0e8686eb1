package com.raditha.lint.analysis;

import com.raditha.lint.config.CallWhitelist;
import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.SyntaxKind;
import com.raditha.lint.model.SyntaxNode;

import java.util.List;
import java.util.Optional;

/**
 * Permits literals passed to a whitelisted call.
 * Parameter bindings between the literal and the call are skipped over.
 */
public class WhitelistedCallExemption implements ExemptionPass {

    private final CallWhitelist whitelist;

    public WhitelistedCallExemption(CallWhitelist whitelist) {
        if (whitelist == null) {
            throw new IllegalArgumentException("whitelist cannot be null");
        }
        this.whitelist = whitelist;
    }

    Verdict classify(SyntaxNode node) {
        if (node.is(SyntaxKind.VAR_PARAMETER)) {
            return Verdict.CONTINUE;
        }
        if (node.is(SyntaxKind.CALL_EXPRESSION)) {
            return node.optionalName()
                    .filter(whitelist::matches)
                    .map(name -> Verdict.ACCEPT_HERE)
                    .orElse(Verdict.REJECT_HERE);
        }
        return Verdict.REJECT_HERE;
    }

    @Override
    public Optional<Outcome> evaluate(List<SyntaxNode> chainFromLeaf) {
        // a walk ending on a parameter binding is not a call
        return ChainWalker.walk(chainFromLeaf, this::classify)
                .filter(node -> node.is(SyntaxKind.CALL_EXPRESSION))
                .map(node -> new Outcome(ClassificationReason.WHITELISTED_CALL, node));
    }

    public CallWhitelist getWhitelist() {
        return whitelist;
    }
}
