package com.grapher.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A directed, weighted property graph.
 *
 * <p>Implementations are safe for concurrent use. Every read accessor
 * returns an independent copy taken at the instant of the call, so a caller
 * issuing several reads observes several independent snapshots rather than
 * one consistent view. {@link #snapshot()} is the only accessor that reads
 * the whole graph consistently.</p>
 *
 * <p>Every mutator either succeeds completely or throws and leaves the
 * store untouched.</p>
 */
public interface GraphStore {

    /**
     * Adds a node without labels.
     *
     * @param id the node id
     * @param properties the initial properties, may be null
     * @throws InvalidInputException if the id is null or empty
     * @throws AlreadyExistsException if the id is taken
     */
    void addNode(String id, Map<String, Object> properties);

    /**
     * Adds a node with labels.
     *
     * @param id the node id
     * @param labels the initial labels, may be null
     * @param properties the initial properties, may be null
     * @throws InvalidInputException if the id is null or empty
     * @throws AlreadyExistsException if the id is taken
     */
    void addNode(String id, Collection<String> labels,
                 Map<String, Object> properties);

    /**
     * Merges properties into an existing node, overwriting existing keys.
     *
     * @param id the node id
     * @param properties the properties to merge
     * @throws NotFoundException if the node is absent
     */
    void updateNodeProperties(String id, Map<String, Object> properties);

    /**
     * Adds labels to an existing node.
     *
     * @param id the node id
     * @param labels the labels to add
     * @throws NotFoundException if the node is absent
     */
    void addNodeLabels(String id, Collection<String> labels);

    /**
     * Removes a node together with every edge incident to it.
     *
     * @param id the node id
     * @throws NotFoundException if the node is absent
     */
    void removeNode(String id);

    /**
     * Adds a directed edge between two existing nodes.
     *
     * @param from the source node id
     * @param to the target node id
     * @param weight the edge weight
     * @throws InvalidInputException if either id is null or empty
     * @throws NotFoundException if either endpoint is absent
     * @throws AlreadyExistsException if the edge from-&gt;to exists
     */
    void addEdge(String from, String to, double weight);

    /**
     * Changes the weight of an existing edge.
     *
     * @param from the source node id
     * @param to the target node id
     * @param weight the new weight
     * @throws NotFoundException if the edge is absent
     */
    void updateEdge(String from, String to, double weight);

    /**
     * Removes an edge.
     *
     * @param from the source node id
     * @param to the target node id
     * @throws NotFoundException if the edge is absent
     */
    void removeEdge(String from, String to);

    /**
     * Returns an edge.
     *
     * @param from the source node id
     * @param to the target node id
     * @return the edge
     * @throws NotFoundException if the edge is absent
     */
    Edge getEdge(String from, String to);

    /**
     * Returns a copy of a node.
     *
     * @param id the node id
     * @return the node
     * @throws NotFoundException if the node is absent
     */
    Node getNode(String id);

    /**
     * Checks whether a node exists.
     *
     * @param id the node id
     * @return true if present
     */
    boolean containsNode(String id);

    /**
     * Returns copies of all nodes in insertion order.
     *
     * @return the nodes
     */
    List<Node> allNodes();

    /**
     * Returns the nodes whose property {@code key} equals {@code value}.
     *
     * @param key the property key
     * @param value the expected value
     * @return the matching nodes
     */
    List<Node> findNodesByProperty(String key, Object value);

    /**
     * Returns the edges leaving a node.
     *
     * @param id the node id
     * @return the outgoing edges
     * @throws NotFoundException if the node is absent
     */
    List<Edge> getOutEdges(String id);

    /**
     * Returns the edges entering a node.
     *
     * @param id the node id
     * @return the incoming edges
     * @throws NotFoundException if the node is absent
     */
    List<Edge> getInEdges(String id);

    /**
     * Gets the number of nodes.
     *
     * @return node count
     */
    int nodeCount();

    /**
     * Gets the number of edges.
     *
     * @return edge count
     */
    int edgeCount();

    /**
     * Takes a consistent copy of the whole graph.
     *
     * @return the snapshot, nodes sorted by id and edges by (from, to)
     */
    GraphSnapshot snapshot();

    /**
     * Replaces the whole graph with the given snapshot. The snapshot is
     * validated completely before anything is discarded.
     *
     * @param snapshot the new contents
     * @throws InvalidInputException if a node id is empty or duplicated,
     *     an edge references a missing node, or an edge is duplicated
     */
    void replaceContents(GraphSnapshot snapshot);

    /**
     * Removes every node and edge.
     */
    void clear();
}
