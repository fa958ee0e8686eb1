package com.raditha.lint.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.AccessSpecifier;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.raditha.lint.model.ByteRange;
import com.raditha.lint.model.LiteralToken;
import com.raditha.lint.model.SourceFile;
import com.raditha.lint.model.SyntaxKind;
import com.raditha.lint.model.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds structure trees from Java compilation units.
 * <p>
 * Only constructs that matter to literal classification become nodes:
 * declarations, parameters, calls, annotations and array literals. Every
 * other JavaParser node is transparent and its mapped descendants attach to
 * the nearest mapped ancestor. The compilation unit itself becomes a root
 * without a kind.
 * <p>
 * All offsets are UTF-8 byte offsets into the source text.
 */
public class JavaSyntaxTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(JavaSyntaxTreeBuilder.class);

    private static final String TEXT_BLOCK_DELIMITER = "\"\"\"";

    private final JavaParser parser;

    /**
     * Create builder parsing at the Java 17 language level.
     */
    public JavaSyntaxTreeBuilder() {
        this(new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public JavaSyntaxTreeBuilder(ParserConfiguration configuration) {
        this.parser = new JavaParser(configuration);
    }

    /**
     * Parse Java source text and build its structure tree.
     *
     * @param source Java source text
     * @return structure tree and string literals
     * @throws IllegalArgumentException if the source cannot be parsed
     */
    public SourceFile parse(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("Unparseable source: " + result.getProblems());
        }
        return build(result.getResult().get(), source);
    }

    /**
     * Build the structure tree of an already parsed compilation unit.
     *
     * @param cu     Compilation unit parsed from {@code source}
     * @param source Exact text the unit was parsed from
     * @return structure tree and string literals
     */
    public SourceFile build(CompilationUnit cu, String source) {
        SourcePositions positions = new SourcePositions(source);

        List<SyntaxNode> topLevel = new ArrayList<>();
        for (Node child : cu.getChildNodes()) {
            topLevel.addAll(collect(child, positions));
        }
        SyntaxNode root = SyntaxNode.root(positions.whole(), topLevel);

        List<LiteralToken> literals = new ArrayList<>();
        for (StringLiteralExpr literal : cu.findAll(StringLiteralExpr.class)) {
            literals.add(toToken(literal, 1, source, positions));
        }
        for (TextBlockLiteralExpr literal : cu.findAll(TextBlockLiteralExpr.class)) {
            literals.add(toToken(literal, TEXT_BLOCK_DELIMITER.length(), source, positions));
        }
        literals.sort(Comparator.comparingInt(LiteralToken::offset));

        logger.debug("Built structure tree with {} top level nodes and {} literals", topLevel.size(), literals.size());
        return new SourceFile(root, literals);
    }

    /**
     * Mapped nodes for a JavaParser subtree: one node if the subtree root is
     * mapped, otherwise the mapped nodes of its children.
     */
    private List<SyntaxNode> collect(Node node, SourcePositions positions) {
        List<SyntaxNode> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            children.addAll(collect(child, positions));
        }

        SyntaxKind kind = kindOf(node);
        if (kind == null) {
            return children;
        }
        ByteRange range = positions.toByteRange(node.getRange()
                .orElseThrow(() -> new IllegalStateException(node.getClass().getSimpleName() + " missing range")));
        return List.of(new SyntaxNode(kind, nameOf(node), range, setterAccessibilityOf(node), children));
    }

    static SyntaxKind kindOf(Node node) {
        if (node instanceof EnumConstantDeclaration) {
            return SyntaxKind.ENUM_CASE_ELEMENT;
        }
        if (node instanceof VariableDeclarator declarator) {
            return variableKind(declarator);
        }
        if (node instanceof Parameter) {
            return SyntaxKind.VAR_PARAMETER;
        }
        if (node instanceof ArrayInitializerExpr || node instanceof ArrayCreationExpr) {
            return SyntaxKind.ARRAY_LITERAL;
        }
        if (node instanceof MethodCallExpr
                || node instanceof ObjectCreationExpr
                || node instanceof ExplicitConstructorInvocationStmt
                || node instanceof AnnotationExpr) {
            return SyntaxKind.CALL_EXPRESSION;
        }
        if (node instanceof TypeDeclaration) {
            return SyntaxKind.TYPE_DECLARATION;
        }
        if (node instanceof CallableDeclaration
                || node instanceof CompactConstructorDeclaration
                || node instanceof LambdaExpr) {
            return SyntaxKind.FUNCTION;
        }
        return null;
    }

    private static SyntaxKind variableKind(VariableDeclarator declarator) {
        Node parent = declarator.getParentNode().orElse(null);
        if (parent instanceof FieldDeclaration field) {
            return field.isStatic() || isInterfaceMember(field) ? SyntaxKind.VAR_STATIC : SyntaxKind.VAR_INSTANCE;
        }
        if (parent instanceof VariableDeclarationExpr) {
            return SyntaxKind.VAR_LOCAL;
        }
        return SyntaxKind.OTHER;
    }

    static String nameOf(Node node) {
        if (node instanceof MethodCallExpr call) {
            return call.getScope()
                    .map(scope -> scope.toString() + "." + call.getNameAsString())
                    .orElse(call.getNameAsString());
        }
        if (node instanceof ObjectCreationExpr creation) {
            return creation.getType().getNameWithScope();
        }
        if (node instanceof ExplicitConstructorInvocationStmt invocation) {
            return invocation.isThis() ? "this" : "super";
        }
        if (node instanceof AnnotationExpr annotation) {
            return "@" + annotation.getNameAsString();
        }
        if (node instanceof EnumConstantDeclaration constant) {
            return constant.getNameAsString();
        }
        if (node instanceof VariableDeclarator declarator) {
            return declarator.getNameAsString();
        }
        if (node instanceof Parameter parameter) {
            return parameter.getNameAsString();
        }
        if (node instanceof TypeDeclaration<?> type) {
            return type.getNameAsString();
        }
        if (node instanceof CallableDeclaration<?> callable) {
            return callable.getNameAsString();
        }
        if (node instanceof CompactConstructorDeclaration constructor) {
            return constructor.getNameAsString();
        }
        return null;
    }

    /**
     * Access level of a reassignable field; null for final fields, interface
     * constants and anything that is not a field.
     */
    static String setterAccessibilityOf(Node node) {
        if (!(node instanceof VariableDeclarator declarator)) {
            return null;
        }
        Node parent = declarator.getParentNode().orElse(null);
        if (!(parent instanceof FieldDeclaration field)) {
            return null;
        }
        if (field.isFinal() || isInterfaceMember(field)) {
            return null;
        }
        AccessSpecifier access = field.getAccessSpecifier();
        String keyword = access.asString();
        return keyword.isEmpty() ? "package" : keyword;
    }

    private static boolean isInterfaceMember(FieldDeclaration field) {
        Node owner = field.getParentNode().orElse(null);
        return (owner instanceof ClassOrInterfaceDeclaration type && type.isInterface())
                || owner instanceof AnnotationDeclaration;
    }

    private static LiteralToken toToken(Node literal, int delimiterLength, String source, SourcePositions positions) {
        com.github.javaparser.Range range = literal.getRange()
                .orElseThrow(() -> new IllegalStateException("Literal missing range"));
        int begin = positions.charIndex(range.begin);
        int end = positions.charIndex(range.end) + 1;
        String content = end - begin >= 2 * delimiterLength
                ? source.substring(begin + delimiterLength, end - delimiterLength)
                : "";
        return new LiteralToken(positions.toByteRange(range), content);
    }
}
