package org.kleis.verify.ast;

/**
 * 表达式树节点的种类。求解器翻译器按此分派。
 */
public enum ExpressionKind {
    CONST,
    STRING,
    OBJECT,
    OPERATION,
    PLACEHOLDER,
    QUANTIFIER,
    CONDITIONAL,
    LET,
    MATCH,
    LIST,
    ASCRIPTION,
    LAMBDA
}
