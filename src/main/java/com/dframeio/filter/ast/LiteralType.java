package com.dframeio.filter.ast;

/**
 * Lexical type of a literal, fixed at parse time.
 */
public enum LiteralType {
    STRING(TypeFamily.STRING),
    INTEGER(TypeFamily.NUMERIC),
    FLOAT(TypeFamily.NUMERIC),
    BOOLEAN(TypeFamily.BOOLEAN),
    NULL(null),
    TIMESTAMP(TypeFamily.TIMESTAMP);

    private final TypeFamily family;

    LiteralType(TypeFamily family) {
        this.family = family;
    }

    /**
     * Comparison family of this type, or {@code null} for NULL which is compatible with any family.
     */
    public TypeFamily family() {
        return family;
    }
}
