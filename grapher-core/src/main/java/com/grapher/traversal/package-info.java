/**
 * Depth-first traversal over a {@link com.grapher.graph.GraphStore}.
 *
 * <p>{@link com.grapher.traversal.Traversal} configures a walk (direction,
 * depth bound, range window) and creates a
 * {@link com.grapher.traversal.DepthFirstTraverser}. Reported nodes come
 * wrapped in a {@link com.grapher.traversal.TraversalPath} that can
 * rebuild the branch leading to them.</p>
 */
package com.grapher.traversal;
