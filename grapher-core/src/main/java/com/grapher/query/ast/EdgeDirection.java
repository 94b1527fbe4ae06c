package com.grapher.query.ast;

/**
 * How an edge pattern is drawn.
 */
public enum EdgeDirection {
    /** {@code <-[]-}: from the right node to the left one. */
    LEFT,
    /** {@code -[]->}: from the left node to the right one. */
    RIGHT,
    /** {@code -[]-}: either way. */
    UNDIRECTED,
    /** {@code <-[]->}: either way. */
    BOTH
}
