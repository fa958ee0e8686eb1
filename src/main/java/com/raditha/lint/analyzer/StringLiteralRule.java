package com.raditha.lint.analyzer;

import com.raditha.lint.analysis.LiteralExemptionEvaluator;
import com.raditha.lint.config.StringLiteralConfig;
import com.raditha.lint.filter.LiteralFilterChain;
import com.raditha.lint.model.Classification;
import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.LiteralToken;
import com.raditha.lint.model.RuleDescription;
import com.raditha.lint.model.SourceFile;
import com.raditha.lint.model.StyleViolation;
import com.raditha.lint.model.SyntaxNode;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Flags string literals that are not covered by a contextual exemption.
 * <p>
 * The rule holds no per-file state: every call works only on its arguments,
 * so one instance may serve many files and threads.
 */
public class StringLiteralRule {

    public static final RuleDescription DESCRIPTION = new RuleDescription(
            "string_literal",
            "String Literals",
            "Should avoid using string literals.",
            List.of(
                    "enum Color { RED(\"Red\") }",
                    "class A { static final String A = \"String\"; }",
                    "class A { static final String[] A = {\"String1\", \"String2\"}; }",
                    "interface A { String A = \"String\"; }",
                    "class A { void f() { System.out.println(\"String\"); } }",
                    "class A { void f() { log.info(\"String\"); } }",
                    "class A { void f() { assertEquals(\"String\", s); } }",
                    "class A { String s = \"\"; }",
                    "class A { String s = \"223\"; }",
                    "class A { String s = \" \"; }",
                    "class A { String s = \"- 23 - 23\"; }",
                    "class A { String s = bundle.getString(\"STRING_ID\"); }"),
            List.of(
                    "class A { static String A = \"String\"; }",
                    "class A { String a = \"String\"; }",
                    "class A { void f() { someFun(\"String\"); } }",
                    "class A { void f() { someFun(2, \"String\", 3, 4); } }",
                    "class A { void f() { String a = \"String\"; } }",
                    "class A { void f() { String[] a = {\"String1\", \"2\"}; } }",
                    "class A { static final Path P = Path.of(\"String\"); }"));

    private final StringLiteralConfig config;
    private final LiteralFilterChain filterChain;
    private final LiteralExemptionEvaluator evaluator;

    /**
     * Create rule with default configuration.
     */
    public StringLiteralRule() {
        this(StringLiteralConfig.defaults());
    }

    /**
     * Create rule with custom configuration.
     */
    public StringLiteralRule(StringLiteralConfig config) {
        this.config = config;
        this.filterChain = new LiteralFilterChain(config);
        this.evaluator = new LiteralExemptionEvaluator(config.whitelist());
    }

    /**
     * Classify one literal occurrence.
     *
     * @param root    Root of the file's structure tree
     * @param literal Literal token
     * @return verdict with the reason behind it
     */
    public Classification classify(SyntaxNode root, LiteralToken literal) {
        Optional<ClassificationReason> skipped = filterChain.skipReason(literal);
        if (skipped.isPresent()) {
            return Classification.of(literal.offset(), skipped.get());
        }
        return evaluator.evaluate(root, literal.offset());
    }

    /**
     * Offsets of all flagged literals in a file.
     *
     * @param root     Root of the file's structure tree
     * @param literals Literal tokens of the file
     * @return flagged offsets in ascending order
     */
    public List<Integer> findViolations(SyntaxNode root, List<LiteralToken> literals) {
        return classifyAll(root, literals).stream()
                .filter(Classification::isFlagged)
                .map(Classification::offset)
                .sorted()
                .toList();
    }

    /**
     * Violations for a parsed file, carrying the configured severity.
     */
    public List<StyleViolation> validate(SourceFile file) {
        return classifyAll(file.root(), file.literals()).stream()
                .filter(Classification::isFlagged)
                .sorted(Comparator.comparingInt(Classification::offset))
                .map(c -> new StyleViolation(DESCRIPTION, config.severity(), c.offset(), c.reason()))
                .toList();
    }

    private List<Classification> classifyAll(SyntaxNode root, List<LiteralToken> literals) {
        return literals.stream()
                .map(literal -> classify(root, literal))
                .toList();
    }

    public StringLiteralConfig getConfig() {
        return config;
    }
}
