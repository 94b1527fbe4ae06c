package com.grapher.query;

import com.grapher.graph.GraphStore;
import com.grapher.query.ast.Query;
import com.grapher.tracing.TracingScope;
import com.grapher.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for running query text against a store.
 *
 * <p>Each call is logged and traced with an {@code INTERNAL} span; a
 * failure is recorded on the span and rethrown unchanged.</p>
 *
 * <pre>{@code
 * List<ResultRow> rows = QueryEngine.run(
 *     "MATCH (a {k: 'v'})-[*1..3]->(b) RETURN a, b;", store);
 * }</pre>
 */
public final class QueryEngine {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        QueryEngine.class);

    /** Tracer for query spans. */
    private static final Tracer TRACER =
        TracingUtil.getTracer(TracingScope.QUERY);

    /** Attribute key for the query text. */
    private static final AttributeKey<String> ATTR_QUERY_TEXT =
        AttributeKey.stringKey("grapher.query.text");

    /** Attribute key for the number of rows returned. */
    private static final AttributeKey<Long> ATTR_ROW_COUNT =
        AttributeKey.longKey("grapher.query.row_count");

    /** Private constructor to prevent instantiation. */
    private QueryEngine() {
        throw new AssertionError("No instances");
    }

    /**
     * Parses one statement.
     *
     * @param text the query text
     * @return the query
     * @throws ParseException if the text is invalid
     */
    public static Query parse(final String text) throws ParseException {
        Span span = TRACER.spanBuilder("QueryEngine.parse")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_QUERY_TEXT, text)
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            Query query = Parser.parse(text);
            span.setStatus(StatusCode.OK);
            return query;
        } catch (ParseException e) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Failed to parse query: {}", e.getMessage());
            }
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Executes a parsed query.
     *
     * @param query the query
     * @param store the store to read
     * @return the result rows
     * @throws QueryException if the query cannot be executed
     */
    public static List<ResultRow> execute(final Query query,
                                          final GraphStore store)
            throws QueryException {
        Span span = TRACER.spanBuilder("QueryEngine.execute")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_QUERY_TEXT, query.toString())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            List<ResultRow> rows = QueryExecutor.execute(query, store);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Query {} returned {} rows in {} us", query,
                    rows.size(), (System.nanoTime() - start) / 1000);
            }
            span.setAttribute(ATTR_ROW_COUNT, (long) rows.size());
            span.setStatus(StatusCode.OK);
            return rows;
        } catch (QueryException e) {
            LOGGER.warn("Query {} failed: {}", query, e.getMessage());
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Parses and executes one statement.
     *
     * @param text the query text
     * @param store the store to read
     * @return the result rows
     * @throws QueryException if the text is invalid or cannot be executed
     */
    public static List<ResultRow> run(final String text,
                                      final GraphStore store)
            throws QueryException {
        return execute(parse(text), store);
    }
}
