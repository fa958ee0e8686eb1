package com.raditha.lint.extraction;

import com.raditha.lint.model.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the structure nodes enclosing a byte offset.
 * Subtrees whose root does not contain the offset are skipped entirely, since
 * no descendant can contain it either.
 */
public class AncestorChainExtractor {

    /**
     * Nodes containing {@code offset} in traversal order, outermost first.
     * Nodes without a kind are descended into but not collected.
     *
     * @param root   Root of the structure tree
     * @param offset Byte offset to locate
     * @return enclosing nodes root-to-leaf, empty if none contains the offset
     */
    public List<SyntaxNode> chainAt(SyntaxNode root, int offset) {
        List<SyntaxNode> results = new ArrayList<>();
        collect(root, offset, results);
        return results;
    }

    /**
     * Same nodes as {@link #chainAt(SyntaxNode, int)}, innermost first. This is
     * the order exemption passes consume.
     */
    public List<SyntaxNode> chainFromLeaf(SyntaxNode root, int offset) {
        List<SyntaxNode> chain = chainAt(root, offset);
        Collections.reverse(chain);
        return chain;
    }

    private void collect(SyntaxNode node, int offset, List<SyntaxNode> results) {
        if (!node.range().contains(offset)) {
            return;
        }
        if (node.hasKind()) {
            results.add(node);
        }
        for (SyntaxNode child : node.children()) {
            collect(child, offset, results);
        }
    }
}
