/**
 * Immutable syntax tree of parsed queries.
 *
 * <p>{@link com.grapher.query.ast.Expr} and
 * {@link com.grapher.query.ast.PatternElement} are sealed; consumers
 * handle every permitted record. Every node renders back to query text
 * through {@code toString()}.</p>
 */
package com.grapher.query.ast;
