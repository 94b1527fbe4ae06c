package com.grapher.traversal;

/**
 * Which adjacency index a traversal follows.
 */
public enum Direction {
    /** Follow edges from source to target. */
    OUTGOING,
    /** Follow edges from target back to source. */
    INCOMING,
    /** Follow edges either way. */
    BOTH
}
