package com.raditha.lint.model;

/**
 * Closed set of syntax categories a structure node can carry.
 * Parser-specific kind representations are mapped onto these once, when the
 * tree is built, so that classification never looks at raw parser tags.
 */
public enum SyntaxKind {
    /** Enum case / enum constant whose value or arguments may hold a literal */
    ENUM_CASE_ELEMENT,

    /** Variable declared at file scope */
    VAR_GLOBAL,

    /** Type-level variable that subclasses may override ({@code class var}) */
    VAR_CLASS,

    /** Static variable / constant owned by a type */
    VAR_STATIC,

    /** Instance field */
    VAR_INSTANCE,

    /** Local variable inside a function body */
    VAR_LOCAL,

    /** Parameter binding of a function, constructor or closure */
    VAR_PARAMETER,

    /** Array literal or array creation */
    ARRAY_LITERAL,

    /** Dictionary / map literal */
    DICTIONARY_LITERAL,

    /** Call expression; the node name holds the callee text (e.g. "obj.method") */
    CALL_EXPRESSION,

    /** Class, interface, enum, record or struct declaration */
    TYPE_DECLARATION,

    /** Function, method or constructor declaration */
    FUNCTION,

    /** Any other construct */
    OTHER;

    /**
     * Global, class or static variable: the declarations whose values are exempt
     * when they are immutable.
     */
    public boolean isTypeLevelVariable() {
        return this == VAR_GLOBAL || this == VAR_CLASS || this == VAR_STATIC;
    }

    /**
     * Array or dictionary literal.
     */
    public boolean isCollectionLiteral() {
        return this == ARRAY_LITERAL || this == DICTIONARY_LITERAL;
    }
}
