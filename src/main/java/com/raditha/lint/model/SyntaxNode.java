package com.raditha.lint.model;

import java.util.List;
import java.util.Optional;

/**
 * One parsed construct in a file's syntax tree.
 * Nodes are immutable; a child's range always lies within its parent's range.
 *
 * @param kind                Syntax category, or null for synthetic/unidentified
 *                            nodes such as the file root
 * @param name                Identifier (declared variable, called function), may
 *                            be null
 * @param range               Byte range covered by the construct
 * @param setterAccessibility Only present on variable declarations; non-empty
 *                            when the variable can be reassigned
 * @param children            Child nodes in parse order
 */
public record SyntaxNode(
        SyntaxKind kind,
        String name,
        ByteRange range,
        String setterAccessibility,
        List<SyntaxNode> children) {

    public SyntaxNode {
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        children = children == null ? List.of() : List.copyOf(children);
        for (SyntaxNode child : children) {
            if (!range.encloses(child.range())) {
                throw new IllegalArgumentException(
                        "child range " + child.range() + " escapes parent range " + range);
            }
        }
    }

    /**
     * Create a node without kind, name or setter information (e.g. a file root).
     */
    public static SyntaxNode root(ByteRange range, List<SyntaxNode> children) {
        return new SyntaxNode(null, null, range, null, children);
    }

    /**
     * Create a node with a kind and optional name.
     */
    public static SyntaxNode of(SyntaxKind kind, String name, ByteRange range, List<SyntaxNode> children) {
        return new SyntaxNode(kind, name, range, null, children);
    }

    /**
     * Create a variable declaration node.
     *
     * @param setterAccessibility null or empty for immutable variables
     */
    public static SyntaxNode variable(SyntaxKind kind, String name, ByteRange range,
            String setterAccessibility, List<SyntaxNode> children) {
        return new SyntaxNode(kind, name, range, setterAccessibility, children);
    }

    public boolean hasKind() {
        return kind != null;
    }

    public boolean is(SyntaxKind other) {
        return kind == other;
    }

    public Optional<String> optionalName() {
        return Optional.ofNullable(name);
    }

    /**
     * A variable is mutable when it exposes a non-empty setter accessibility.
     */
    public boolean isMutable() {
        return setterAccessibility != null && !setterAccessibility.isEmpty();
    }

    @Override
    public String toString() {
        return (kind == null ? "<root>" : kind.name())
                + (name == null ? "" : "(" + name + ")")
                + range;
    }
}
