package com.raditha.lint.analysis;

import com.raditha.lint.config.CallWhitelist;
import com.raditha.lint.extraction.AncestorChainExtractor;
import com.raditha.lint.model.Classification;
import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a literal at a given offset is covered by a contextual
 * exemption.
 * <p>
 * Passes run in a fixed order against the same leaf-to-root chain: enum case
 * value, global/class/static variable, whitelisted call. The first pass that
 * reaches a decision wins. A literal with no enclosing structure is permitted.
 */
public class LiteralExemptionEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(LiteralExemptionEvaluator.class);

    private final AncestorChainExtractor extractor;
    private final List<ExemptionPass> passes;

    /**
     * Create evaluator with the default call whitelist.
     */
    public LiteralExemptionEvaluator() {
        this(CallWhitelist.defaults());
    }

    /**
     * Create evaluator with a custom call whitelist.
     */
    public LiteralExemptionEvaluator(CallWhitelist whitelist) {
        this(new AncestorChainExtractor(), List.of(
                new EnumCaseExemption(),
                new StaticVariableExemption(),
                new WhitelistedCallExemption(whitelist)));
    }

    /**
     * Create evaluator with an explicit pass order.
     *
     * @param extractor chain extractor
     * @param passes    exemption passes in priority order
     */
    public LiteralExemptionEvaluator(AncestorChainExtractor extractor, List<ExemptionPass> passes) {
        this.extractor = extractor;
        this.passes = List.copyOf(passes);
    }

    /**
     * Classify the literal starting at {@code offset}.
     *
     * @param root   Root of the file's structure tree
     * @param offset Byte offset of the literal token
     * @return verdict with its reason
     */
    public Classification evaluate(SyntaxNode root, int offset) {
        List<SyntaxNode> chain = extractor.chainFromLeaf(root, offset);
        if (chain.isEmpty()) {
            logger.debug("No structure encloses offset {}, permitting", offset);
            return Classification.of(offset, ClassificationReason.NO_ENCLOSING_STRUCTURE);
        }

        for (ExemptionPass pass : passes) {
            Optional<ExemptionPass.Outcome> outcome = pass.evaluate(chain);
            if (outcome.isPresent()) {
                ExemptionPass.Outcome decided = outcome.get();
                logger.debug("Literal at {} decided by {}: {} on {}",
                        offset, pass.getClass().getSimpleName(), decided.reason(), decided.node());
                return new Classification(offset, decided.reason(), decided.node());
            }
        }

        logger.debug("Literal at {} is not exempt, innermost node {}", offset, chain.get(0));
        return new Classification(offset, ClassificationReason.NOT_EXEMPT, chain.get(0));
    }
}
