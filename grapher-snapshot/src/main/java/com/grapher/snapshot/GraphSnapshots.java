package com.grapher.snapshot;

import com.grapher.graph.GraphSnapshot;
import com.grapher.graph.GraphStore;
import com.grapher.tracing.TracingScope;
import com.grapher.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves graph stores to JSON files and loads them back.
 *
 * <p>A load replaces the whole store only after the file has been read
 * and validated; a failed load leaves the store unchanged.</p>
 */
public final class GraphSnapshots {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GraphSnapshots.class);

    /** Tracer for snapshot spans. */
    private static final Tracer TRACER =
        TracingUtil.getTracer(TracingScope.SNAPSHOT);

    /** Attribute key for the snapshot file. */
    private static final AttributeKey<String> ATTR_PATH =
        AttributeKey.stringKey("grapher.snapshot.path");

    /** Attribute key for the number of nodes. */
    private static final AttributeKey<Long> ATTR_NODE_COUNT =
        AttributeKey.longKey("grapher.snapshot.node_count");

    /** Attribute key for the number of edges. */
    private static final AttributeKey<Long> ATTR_EDGE_COUNT =
        AttributeKey.longKey("grapher.snapshot.edge_count");

    /** Shared codec. */
    private static final SnapshotCodec CODEC = new SnapshotCodec();

    private GraphSnapshots() {
        throw new AssertionError("No instances");
    }

    /**
     * Writes a consistent snapshot of {@code store} to {@code file},
     * creating parent directories as needed.
     *
     * @param store the store to save
     * @param file the destination
     * @throws IOException if writing fails
     */
    public static void save(final GraphStore store, final Path file)
            throws IOException {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(file, "file");

        Span span = TRACER.spanBuilder("GraphSnapshots.save")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_PATH, file.toString())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            GraphSnapshot snapshot = store.snapshot();
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter out = Files.newBufferedWriter(file,
                    StandardCharsets.UTF_8)) {
                CODEC.write(snapshot, out);
            }
            span.setAttribute(ATTR_NODE_COUNT, (long) snapshot.nodes().size());
            span.setAttribute(ATTR_EDGE_COUNT, (long) snapshot.edges().size());
            span.setStatus(StatusCode.OK);
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Saved snapshot to {} (nodes={}, edges={})", file,
                    snapshot.nodes().size(), snapshot.edges().size());
            }
        } catch (IOException | RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Replaces the contents of {@code store} with the snapshot in
     * {@code file}.
     *
     * @param file the snapshot file
     * @param store the store to replace
     * @throws IOException if the file cannot be read or is malformed
     * @throws com.grapher.graph.InvalidInputException if the snapshot is
     *     invalid
     */
    public static void load(final Path file, final GraphStore store)
            throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(store, "store");

        Span span = TRACER.spanBuilder("GraphSnapshots.load")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_PATH, file.toString())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            GraphSnapshot snapshot;
            try (BufferedReader in = Files.newBufferedReader(file,
                    StandardCharsets.UTF_8)) {
                snapshot = CODEC.read(in);
            }
            store.replaceContents(snapshot);
            span.setAttribute(ATTR_NODE_COUNT, (long) snapshot.nodes().size());
            span.setAttribute(ATTR_EDGE_COUNT, (long) snapshot.edges().size());
            span.setStatus(StatusCode.OK);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Failed to load snapshot from {}: {}", file,
                e.getMessage());
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
