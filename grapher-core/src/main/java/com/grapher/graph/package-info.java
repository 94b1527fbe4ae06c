/**
 * The concurrent property graph store.
 *
 * <p>{@link com.grapher.graph.GraphStore} is the contract consumed by the
 * traversal and query layers; {@link com.grapher.graph.PropertyGraph} is
 * the in-memory implementation keeping an outgoing and an incoming
 * adjacency index in lockstep under one reader/writer lock.</p>
 */
package com.grapher.graph;
