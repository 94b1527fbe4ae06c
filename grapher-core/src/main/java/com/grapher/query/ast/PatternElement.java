package com.grapher.query.ast;

/**
 * One element of a match pattern: a node or the edge between two nodes.
 */
public sealed interface PatternElement permits NodePattern, EdgePattern {
}
