package com.grapher.traversal;

/**
 * Callback for {@link DepthFirstTraverser#iterate(PathVisitor)}. Throwing
 * aborts the walk.
 *
 * @param <E> the exception the visitor may throw
 */
@FunctionalInterface
public interface PathVisitor<E extends Exception> {

    /**
     * Visit one reported path.
     *
     * @param path the path to the reported node
     * @throws E to abort the walk
     */
    void visit(TraversalPath path) throws E;
}
