package com.raditha.lint.analyzer;

import com.raditha.lint.config.CallWhitelist;
import com.raditha.lint.config.StringLiteralConfig;
import com.raditha.lint.model.ByteRange;
import com.raditha.lint.model.Classification;
import com.raditha.lint.model.ClassificationReason;
import com.raditha.lint.model.LiteralToken;
import com.raditha.lint.model.SyntaxKind;
import com.raditha.lint.model.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.raditha.lint.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification over hand-built structure trees shaped like the ones a Swift
 * structure parser produces.
 */
class StringLiteralRuleTest {

    private final StringLiteralRule rule = new StringLiteralRule();

    @Test
    void testEnumCaseValueIsPermitted() {
        String source = "enum SwiftEnum: String { case SomeType = \"String\" }";
        SyntaxNode tree = root(source,
                node(SyntaxKind.TYPE_DECLARATION, "SwiftEnum", span(source, source),
                        node(SyntaxKind.OTHER, null, span(source, "case SomeType = \"String\""),
                                node(SyntaxKind.ENUM_CASE_ELEMENT, "SomeType", span(source, "SomeType = \"String\"")))));

        Classification result = rule.classify(tree, literal(source, "\"String\""));

        assertEquals(ClassificationReason.ENUM_CASE_VALUE, result.reason());
    }

    @Test
    void testGlobalLetIsPermitted() {
        String source = "let some = \"String\"";
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "some", null, span(source, source)));

        assertTrue(rule.findViolations(tree, List.of(literal(source, "\"String\""))).isEmpty());
    }

    @Test
    void testGlobalVarIsFlagged() {
        String source = "var some = \"String\"";
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "some", "internal", span(source, source)));

        assertEquals(List.of(source.indexOf('"')), rule.findViolations(tree, List.of(literal(source, "\"String\""))));
    }

    @Test
    void testGlobalArrayIsJudgedByDeclaration() {
        String source = "let a = [\"String1\", \"String2\"]";
        SyntaxNode declaration = variable(SyntaxKind.VAR_GLOBAL, "a", null, span(source, source),
                node(SyntaxKind.ARRAY_LITERAL, null, span(source, "[\"String1\", \"String2\"]")));
        SyntaxNode tree = root(source, declaration);

        Classification first = rule.classify(tree, literal(source, "\"String1\""));
        Classification second = rule.classify(tree, literal(source, "\"String2\""));

        assertEquals(ClassificationReason.IMMUTABLE_STATIC_VARIABLE, first.reason());
        assertSame(declaration, first.decidingNode());
        assertTrue(second.isPermitted());
    }

    @Test
    void testGlobalDictionaryKeyIsPermitted() {
        String source = "let some = [\"String\": 2]";
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "some", null, span(source, source),
                node(SyntaxKind.DICTIONARY_LITERAL, null, span(source, "[\"String\": 2]"))));

        assertTrue(rule.classify(tree, literal(source, "\"String\"")).isPermitted());
    }

    @Test
    void testDictionaryOfDictionariesInsideGlobalIsPermitted() {
        String source = "let d = [\"k\": [\"inner\": [\"String\"]]]";
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "d", null, span(source, source),
                node(SyntaxKind.DICTIONARY_LITERAL, null, span(source, "[\"k\": [\"inner\": [\"String\"]]]"),
                        node(SyntaxKind.DICTIONARY_LITERAL, null, span(source, "[\"inner\": [\"String\"]]"),
                                node(SyntaxKind.ARRAY_LITERAL, null, span(source, "[\"String\"]"))))));

        Classification result = rule.classify(tree, literal(source, "\"String\""));

        assertEquals(ClassificationReason.IMMUTABLE_STATIC_VARIABLE, result.reason());
        assertEquals("d", result.decidingNode().name());
    }

    @Test
    void testStaticAndClassLetArePermitted() {
        String staticSource = "class A { static let a = \"String\" }";
        SyntaxNode staticTree = root(staticSource, node(SyntaxKind.TYPE_DECLARATION, "A", span(staticSource, staticSource),
                variable(SyntaxKind.VAR_STATIC, "a", null, span(staticSource, "static let a = \"String\""))));
        String classSource = "class A { class let a = \"String\" }";
        SyntaxNode classTree = root(classSource, node(SyntaxKind.TYPE_DECLARATION, "A", span(classSource, classSource),
                variable(SyntaxKind.VAR_CLASS, "a", null, span(classSource, "class let a = \"String\""))));

        assertTrue(rule.classify(staticTree, literal(staticSource, "\"String\"")).isPermitted());
        assertTrue(rule.classify(classTree, literal(classSource, "\"String\"")).isPermitted());
    }

    @Test
    void testStaticAndClassVarAreFlagged() {
        String staticSource = "class A { static var a = \"String\" }";
        SyntaxNode staticTree = root(staticSource, node(SyntaxKind.TYPE_DECLARATION, "A", span(staticSource, staticSource),
                variable(SyntaxKind.VAR_STATIC, "a", "internal", span(staticSource, "static var a = \"String\""))));
        String classSource = "class A { class var a = \"String\" }";
        SyntaxNode classTree = root(classSource, node(SyntaxKind.TYPE_DECLARATION, "A", span(classSource, classSource),
                variable(SyntaxKind.VAR_CLASS, "a", "public", span(classSource, "class var a = \"String\""))));

        assertEquals(ClassificationReason.MUTABLE_STATIC_VARIABLE,
                rule.classify(staticTree, literal(staticSource, "\"String\"")).reason());
        assertEquals(ClassificationReason.MUTABLE_STATIC_VARIABLE,
                rule.classify(classTree, literal(classSource, "\"String\"")).reason());
    }

    @Test
    void testUnlistedCallIsFlagged() {
        String source = "someFun(2, \"String\", 3, 4)";
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, "someFun", span(source, source)));

        Classification result = rule.classify(tree, literal(source, "\"String\""));

        assertEquals(ClassificationReason.NOT_EXEMPT, result.reason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"print", "NSLog", "XCTAssertTrue", "obj.localizedStringForKey", "NSLocalizedString"})
    void testWhitelistedCallIsPermitted(String callee) {
        String source = callee + "(\"String\")";
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, callee, span(source, source)));

        Classification result = rule.classify(tree, literal(source, "\"String\""));

        assertEquals(ClassificationReason.WHITELISTED_CALL, result.reason());
    }

    @Test
    void testArgumentOfNestedWhitelistedCall() {
        String source = "showMessage(NSLocalizedString(\"STRING_ID\", comment: \"\"), completion: nil)";
        SyntaxNode inner = node(SyntaxKind.CALL_EXPRESSION, "NSLocalizedString",
                span(source, "NSLocalizedString(\"STRING_ID\", comment: \"\")"));
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, "showMessage", span(source, source), inner));

        assertTrue(rule.findViolations(tree, List.of(
                literal(source, "\"STRING_ID\""),
                new LiteralToken(span(source, "\"\""), ""))).isEmpty());
    }

    @Test
    void testCallInsideGlobalIsFlagged() {
        String source = "let some = obj.pathForResource(\"String\", ofType: 2)";
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "some", null, span(source, source),
                node(SyntaxKind.CALL_EXPRESSION, "obj.pathForResource",
                        span(source, "obj.pathForResource(\"String\", ofType: 2)"))));

        assertTrue(rule.classify(tree, literal(source, "\"String\"")).isFlagged());
    }

    @Test
    void testLocalLetIsFlagged() {
        String source = "func someFunc() { let a = \"String\"}";
        SyntaxNode tree = root(source, node(SyntaxKind.FUNCTION, "someFunc()", span(source, source),
                variable(SyntaxKind.VAR_LOCAL, "a", null, span(source, "let a = \"String\""))));

        assertEquals(List.of(source.indexOf('"')), rule.findViolations(tree, List.of(literal(source, "\"String\""))));
    }

    @Test
    void testLocalCollectionsAreFlagged() {
        String arraySource = "func someFunc() { let a = [\"String1\", 2]}";
        SyntaxNode arrayTree = root(arraySource, node(SyntaxKind.FUNCTION, "someFunc()", span(arraySource, arraySource),
                variable(SyntaxKind.VAR_LOCAL, "a", null, span(arraySource, "let a = [\"String1\", 2]"),
                        node(SyntaxKind.ARRAY_LITERAL, null, span(arraySource, "[\"String1\", 2]")))));
        String dictSource = "func someFunc() { let a = [[\"String1\": 2]]}";
        SyntaxNode dictTree = root(dictSource, node(SyntaxKind.FUNCTION, "someFunc()", span(dictSource, dictSource),
                variable(SyntaxKind.VAR_LOCAL, "a", null, span(dictSource, "let a = [[\"String1\": 2]]"),
                        node(SyntaxKind.ARRAY_LITERAL, null, span(dictSource, "[[\"String1\": 2]]"),
                                node(SyntaxKind.DICTIONARY_LITERAL, null, span(dictSource, "[\"String1\": 2]"))))));

        assertTrue(rule.classify(arrayTree, literal(arraySource, "\"String1\"")).isFlagged());
        assertTrue(rule.classify(dictTree, literal(dictSource, "\"String1\"")).isFlagged());
    }

    @Test
    void testCollectionPassedToWhitelistedCallIsFlagged() {
        String source = "print([\"String\"])";
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, "print", span(source, source),
                node(SyntaxKind.ARRAY_LITERAL, null, span(source, "[\"String\"]"))));

        assertTrue(rule.classify(tree, literal(source, "\"String\"")).isFlagged());
    }

    @Test
    void testLiteralOutsideEveryNodeIsPermitted() {
        String source = "\"String\"";

        Classification result = rule.classify(root(source), literal(source, "\"String\""));

        assertEquals(ClassificationReason.NO_ENCLOSING_STRUCTURE, result.reason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"\"", "\"223\"", "\" \"", "\"- 23 - 23\""})
    void testNonTextLiteralsAreNeverFlagged(String quoted) {
        String source = "var some = " + quoted;
        SyntaxNode tree = root(source, variable(SyntaxKind.VAR_GLOBAL, "some", "internal", span(source, source)));

        assertTrue(rule.findViolations(tree, List.of(literal(source, quoted))).isEmpty());
    }

    @Test
    void testTwoByteTokensAreNeverFlagged() {
        String source = "someFun(xy)";
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, "someFun", span(source, source)));
        LiteralToken token = new LiteralToken(new ByteRange(source.indexOf("xy"), 2), "xy");

        assertEquals(ClassificationReason.TOO_SHORT, rule.classify(tree, token).reason());
    }

    @Test
    void testViolationsAreSortedAndIndependent() {
        String source = "func f() { g(\"Alpha\"); print(\"Beta\"); g(\"Gamma\") }";
        SyntaxNode tree = root(source, node(SyntaxKind.FUNCTION, "f()", span(source, source),
                node(SyntaxKind.CALL_EXPRESSION, "g", span(source, "g(\"Alpha\")")),
                node(SyntaxKind.CALL_EXPRESSION, "print", span(source, "print(\"Beta\")")),
                node(SyntaxKind.CALL_EXPRESSION, "g", span(source, "g(\"Gamma\")"))));
        LiteralToken alpha = literal(source, "\"Alpha\"");
        LiteralToken beta = literal(source, "\"Beta\"");
        LiteralToken gamma = literal(source, "\"Gamma\"");

        List<Integer> forward = rule.findViolations(tree, List.of(alpha, beta, gamma));
        List<Integer> backward = rule.findViolations(tree, List.of(gamma, beta, alpha));
        List<Integer> alone = rule.findViolations(tree, List.of(gamma));

        assertEquals(List.of(alpha.offset(), gamma.offset()), forward);
        assertEquals(forward, backward);
        assertEquals(List.of(gamma.offset()), alone);
        assertEquals(forward, rule.findViolations(tree, List.of(alpha, beta, gamma)));
    }

    @Test
    void testCustomWhitelistChangesVerdict() {
        String source = "someFun(\"String\")";
        SyntaxNode tree = root(source, node(SyntaxKind.CALL_EXPRESSION, "someFun", span(source, source)));
        StringLiteralRule lenient = new StringLiteralRule(StringLiteralConfig.defaults()
                .withWhitelist(new CallWhitelist(List.of("someFun"), List.of(), List.of())));

        assertTrue(lenient.classify(tree, literal(source, "\"String\"")).isPermitted());
        assertTrue(rule.classify(tree, literal(source, "\"String\"")).isFlagged());
    }
}
