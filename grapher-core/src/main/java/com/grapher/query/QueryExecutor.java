package com.grapher.query;

import com.grapher.graph.GraphStore;
import com.grapher.graph.Node;
import com.grapher.graph.NotFoundException;
import com.grapher.query.ast.EdgePattern;
import com.grapher.query.ast.Expr;
import com.grapher.query.ast.IntegerLiteral;
import com.grapher.query.ast.MatchPattern;
import com.grapher.query.ast.NodePattern;
import com.grapher.query.ast.OrderBy;
import com.grapher.query.ast.PatternElement;
import com.grapher.query.ast.Query;
import com.grapher.query.ast.ReadingClause;
import com.grapher.query.ast.SingleQuery;
import com.grapher.query.ast.SortDirection;
import com.grapher.query.ast.StrLiteral;
import com.grapher.query.ast.Variable;
import com.grapher.traversal.DepthFirstTraverser;
import com.grapher.traversal.Direction;
import com.grapher.traversal.PathVisitor;
import com.grapher.traversal.Traversal;
import com.grapher.traversal.TraversalPath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a parsed query against a {@link GraphStore}.
 *
 * <p>Supported queries have exactly one MATCH clause holding one linear
 * pattern {@code (n0)-[e1]-(n1)-[e2]-(n2)...}. Candidate start nodes are
 * found by scanning the store; every edge segment is then walked with a
 * depth-first {@link Traversal} from the nodes bound so far, keeping end
 * nodes whose depth lies inside the segment's hop window and that match
 * the next node pattern. Each combination of bound nodes yields at most
 * one row, using the first path found.</p>
 *
 * <p>Rows are projected from the RETURN items, then DISTINCT, ORDER BY,
 * SKIP and LIMIT are applied in that order. Any failure aborts the whole
 * query; no partial result is returned.</p>
 *
 * <p>The store is read through many separate calls, so a query racing
 * with writers may see a mix of states. Start candidates removed before
 * their walk begins are skipped.</p>
 */
public final class QueryExecutor {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QueryExecutor.class);

    private QueryExecutor() {
        throw new AssertionError("No instances");
    }

    /**
     * Executes a query.
     *
     * @param query the parsed query
     * @param store the store to read
     * @return the result rows
     * @throws QueryStructureException if the query shape is unsupported
     * @throws QueryExecutionException if an expression is unsupported or
     *     a property cannot be compared
     */
    public static List<ResultRow> execute(final Query query,
                                          final GraphStore store)
            throws QueryException {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(store, "store");

        SingleQuery root = query.root();
        ReadingClause clause = readingClause(root);
        MatchPattern pattern = matchPattern(clause);

        List<NodePattern> nodes = new ArrayList<>();
        List<EdgePattern> edges = new ArrayList<>();
        splitElements(pattern, nodes, edges);
        Map<String, Integer> nodeVariables = nodeVariables(nodes, pattern);
        List<String> columns = columns(root, nodeVariables, pattern);
        checkSupported(clause, edges);
        checkOrder(root, columns);
        long skip = count(root.skip(), "SKIP");
        long limit = count(root.limit(), "LIMIT");

        List<Binding> bindings = match(store, nodes, edges);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Pattern {} matched {} bindings", pattern,
                bindings.size());
        }

        List<ResultRow> rows = new ArrayList<>(bindings.size());
        for (Binding binding : bindings) {
            rows.add(project(root.returnItems(), columns, nodeVariables,
                binding));
        }
        if (rows.isEmpty() && clause.optional()) {
            Map<String, Object> empty = new LinkedHashMap<>();
            columns.forEach(column -> empty.put(column, null));
            rows.add(new ResultRow(empty));
        }

        if (root.distinct()) {
            rows = new ArrayList<>(new LinkedHashSet<>(rows));
        }
        Comparator<ResultRow> order = comparator(root.order());
        if (order != null) {
            rows.sort(order);
        }
        return rows.stream()
            .skip(Math.max(skip, 0))
            .limit(limit < 0 ? Long.MAX_VALUE : limit)
            .collect(Collectors.toList());
    }

    private static ReadingClause readingClause(final SingleQuery root)
            throws QueryStructureException {
        if (root.reading().isEmpty()) {
            throw new QueryStructureException("query has no MATCH clause");
        }
        if (root.reading().size() > 1) {
            throw new QueryStructureException("only one MATCH clause is "
                + "supported, found " + root.reading().size());
        }
        return root.reading().get(0);
    }

    private static MatchPattern matchPattern(final ReadingClause clause)
            throws QueryStructureException {
        if (clause.patterns().size() != 1) {
            throw new QueryStructureException("exactly one pattern per MATCH "
                + "is supported, found " + clause.patterns().size());
        }
        return clause.patterns().get(0);
    }

    private static void splitElements(final MatchPattern pattern,
                                      final List<NodePattern> nodes,
                                      final List<EdgePattern> edges)
            throws QueryStructureException {
        List<PatternElement> elements = pattern.elements();
        if (elements.isEmpty() || elements.size() % 2 == 0) {
            throw new QueryStructureException("pattern must start and end "
                + "with a node: " + pattern);
        }
        for (int i = 0; i < elements.size(); i++) {
            PatternElement element = elements.get(i);
            if (i % 2 == 0 && element instanceof NodePattern node) {
                nodes.add(node);
            } else if (i % 2 == 1 && element instanceof EdgePattern edge) {
                edges.add(edge);
            } else {
                throw new QueryStructureException("pattern elements must "
                    + "alternate node and edge: " + pattern);
            }
        }
    }

    /** Maps each node variable to the index of its node pattern. */
    private static Map<String, Integer> nodeVariables(
            final List<NodePattern> nodes, final MatchPattern pattern)
            throws QueryStructureException {
        Map<String, Integer> variables = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            Optional<Variable> variable = nodes.get(i).variable();
            if (variable.isPresent()
                    && variables.put(variable.get().name(), i) != null) {
                throw new QueryStructureException("variable "
                    + variable.get().name() + " is bound more than once");
            }
        }
        if (pattern.variable().isPresent()
                && variables.containsKey(pattern.variable().get().name())) {
            throw new QueryStructureException("variable "
                + pattern.variable().get().name()
                + " is bound more than once");
        }
        return variables;
    }

    private static List<String> columns(final SingleQuery root,
                                        final Map<String, Integer> variables,
                                        final MatchPattern pattern)
            throws QueryStructureException {
        List<String> columns = new ArrayList<>();
        for (Expr item : root.returnItems()) {
            if (item instanceof Variable variable) {
                boolean isPath = pattern.variable()
                    .map(v -> v.name().equals(variable.name()))
                    .orElse(false);
                if (!isPath && !variables.containsKey(variable.name())) {
                    throw new QueryStructureException("variable "
                        + variable.name() + " is not bound");
                }
                columns.add(variable.name());
            } else {
                columns.add(item.toString());
            }
        }
        return columns;
    }

    private static void checkSupported(final ReadingClause clause,
                                       final List<EdgePattern> edges)
            throws QueryExecutionException {
        if (clause.where().isPresent()) {
            throw new QueryExecutionException("unsupported WHERE expression: "
                + clause.where().get());
        }
        for (EdgePattern edge : edges) {
            if (!edge.relTypes().isEmpty() || !edge.properties().isEmpty()) {
                throw new QueryExecutionException("edges carry only a weight, "
                    + "relationship types and properties cannot match: "
                    + edge);
            }
        }
    }

    private static void checkOrder(final SingleQuery root,
                                   final List<String> columns)
            throws QueryStructureException {
        for (OrderBy order : root.order()) {
            if (order.item() instanceof Variable variable
                    && !columns.contains(variable.name())) {
                throw new QueryStructureException("ORDER BY " + variable
                    + " is not a returned column");
            }
        }
    }

    /** Returns the count, or -1 when absent. */
    private static long count(final Optional<Expr> expr, final String clause)
            throws QueryExecutionException {
        if (expr.isEmpty()) {
            return -1;
        }
        if (expr.get() instanceof IntegerLiteral literal
                && literal.value() >= 0) {
            return literal.value();
        }
        throw new QueryExecutionException(clause
            + " must be a non-negative integer literal, found " + expr.get());
    }

    private static List<Binding> match(final GraphStore store,
                                       final List<NodePattern> nodes,
                                       final List<EdgePattern> edges)
            throws QueryExecutionException {
        List<Binding> bindings = new ArrayList<>();
        for (Node node : store.allNodes()) {
            if (PropertyMatcher.matches(nodes.get(0), node)) {
                bindings.add(new Binding(List.of(node), List.of(node)));
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Found {} start candidates for {}", bindings.size(),
                nodes.get(0));
        }

        for (int i = 0; i < edges.size() && !bindings.isEmpty(); i++) {
            bindings = extend(store, bindings, nodes.get(i), edges.get(i),
                nodes.get(i + 1));
        }
        return bindings;
    }

    /** Walks one edge segment from the last node of every binding. */
    private static List<Binding> extend(final GraphStore store,
                                        final List<Binding> bindings,
                                        final NodePattern source,
                                        final EdgePattern edge,
                                        final NodePattern target)
            throws QueryExecutionException {
        final int minHops = edge.effectiveMinHops();
        final int maxHops = edge.effectiveMaxHops();
        Predicate<Node> startPredicate = predicate(source);
        Predicate<Node> endPredicate = predicate(target);
        Map<List<String>, Binding> results = new LinkedHashMap<>();

        for (Binding binding : bindings) {
            DepthFirstTraverser traverser;
            try {
                traverser = Traversal.from(store, binding.last().id())
                    .direction(direction(edge))
                    .maxDepth(maxHops)
                    .rangeFilter(startPredicate, endPredicate)
                    .iterator();
            } catch (NotFoundException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Start node {} removed before traversal",
                        binding.last().id());
                }
                continue;
            }

            PathVisitor<QueryExecutionException> visitor = path -> {
                int depth = path.depth();
                if (depth < minHops || (maxHops >= 0 && depth > maxHops)) {
                    return;
                }
                if (PropertyMatcher.matches(target, path.endNode())) {
                    Binding extended = binding.extend(path);
                    results.putIfAbsent(extended.key(), extended);
                }
            };
            try {
                traverser.iterate(visitor);
            } catch (MatchFailure e) {
                throw e.failure;
            }
        }
        return new ArrayList<>(results.values());
    }

    private static Direction direction(final EdgePattern edge) {
        switch (edge.direction()) {
            case RIGHT:
                return Direction.OUTGOING;
            case LEFT:
                return Direction.INCOMING;
            default:
                return Direction.BOTH;
        }
    }

    /** Adapts a node pattern to the predicate a range filter needs. */
    private static Predicate<Node> predicate(final NodePattern pattern) {
        return node -> {
            try {
                return PropertyMatcher.matches(pattern, node);
            } catch (QueryExecutionException e) {
                throw new MatchFailure(e);
            }
        };
    }

    private static ResultRow project(final List<Expr> items,
                                     final List<String> columns,
                                     final Map<String, Integer> variables,
                                     final Binding binding) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            Expr item = items.get(i);
            Object value;
            if (item instanceof Variable variable) {
                Integer index = variables.get(variable.name());
                value = index != null ? binding.nodes().get(index)
                    : binding.path();
            } else if (item instanceof StrLiteral literal) {
                value = literal.value();
            } else if (item instanceof IntegerLiteral literal) {
                value = literal.value();
            } else {
                throw new IllegalStateException("unknown expression " + item);
            }
            values.put(columns.get(i), value);
        }
        return new ResultRow(values);
    }

    private static Comparator<ResultRow> comparator(
            final List<OrderBy> order) {
        Comparator<ResultRow> result = null;
        for (OrderBy item : order) {
            if (!(item.item() instanceof Variable variable)) {
                // A literal sorts every row equally.
                continue;
            }
            Comparator<ResultRow> next = Comparator.comparing(
                row -> row.get(variable.name()), ValueOrder.INSTANCE);
            if (item.direction() == SortDirection.DESC) {
                next = next.reversed();
            }
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    /**
     * Nodes bound so far, one per node pattern, and the full path walked.
     */
    private record Binding(List<Node> nodes, List<Node> path) {

        Node last() {
            return nodes.get(nodes.size() - 1);
        }

        Binding extend(final TraversalPath traversed) {
            List<Node> boundNodes = new ArrayList<>(nodes);
            boundNodes.add(traversed.endNode());
            List<Node> walked = new ArrayList<>(path);
            List<Node> segment = traversed.nodes();
            walked.addAll(segment.subList(1, segment.size()));
            return new Binding(List.copyOf(boundNodes), List.copyOf(walked));
        }

        List<String> key() {
            return nodes.stream().map(Node::id).collect(Collectors.toList());
        }
    }

    /** Carries a comparison failure out of a range filter predicate. */
    private static final class MatchFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        /** The failure being carried. */
        private final transient QueryExecutionException failure;

        MatchFailure(final QueryExecutionException failure) {
            super(failure);
            this.failure = failure;
        }
    }
}
