package com.grapher.query.ast;

/**
 * An expression. Only variables and literals are parsed.
 */
public sealed interface Expr permits Variable, StrLiteral, IntegerLiteral {
}
