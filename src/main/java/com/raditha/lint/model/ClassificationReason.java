package com.raditha.lint.model;

/**
 * Why a literal occurrence was permitted or flagged.
 */
public enum ClassificationReason {
    /** Token is too short to carry text */
    TOO_SHORT(true),

    /** Content has no letter; numbers, punctuation and blanks only */
    NOT_TEXT(true),

    /** No structure node encloses the literal */
    NO_ENCLOSING_STRUCTURE(true),

    /** Raw or associated value of an enum case */
    ENUM_CASE_VALUE(true),

    /** Value of an immutable global, class or static variable */
    IMMUTABLE_STATIC_VARIABLE(true),

    /** Argument of a whitelisted call */
    WHITELISTED_CALL(true),

    /** Value of a global, class or static variable that can be reassigned */
    MUTABLE_STATIC_VARIABLE(false),

    /** No exemption applies */
    NOT_EXEMPT(false);

    private final boolean permitted;

    ClassificationReason(boolean permitted) {
        this.permitted = permitted;
    }

    public boolean isPermitted() {
        return permitted;
    }
}
