package com.grapher.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TracingUtil class.
 */
public class TracingUtilTest {

    @Test
    @DisplayName("Test every layer has its own scope name")
    public void testScopeNames() {
        assertEquals("com.grapher.graph", TracingScope.GRAPH_STORE.scopeName());
        assertEquals("com.grapher.query", TracingScope.QUERY.scopeName());
        assertEquals("com.grapher.snapshot", TracingScope.SNAPSHOT.scopeName());
    }

    @Test
    @DisplayName("Test getOpenTelemetry returns same instance on multiple calls")
    public void testGetOpenTelemetrySingleton() {
        OpenTelemetry first = TracingUtil.getOpenTelemetry();
        assertNotNull(first);
        assertSame(first, TracingUtil.getOpenTelemetry());
    }

    @Test
    @DisplayName("Test getTracer returns a tracer for every scope")
    public void testGetTracer() {
        for (TracingScope scope : TracingScope.values()) {
            Tracer tracer = TracingUtil.getTracer(scope);
            assertNotNull(tracer, scope.name());
        }
    }

    @Test
    @DisplayName("Test tracing is off unless enabled in the environment")
    public void testIsTracingEnabled() {
        assertEquals(TracingConfig.fromEnvironment().enabled(),
            TracingUtil.isTracingEnabled());
    }

    @Test
    @DisplayName("Test the instance is not registered globally")
    public void testNotGlobal() {
        assertNotSame(GlobalOpenTelemetry.get(),
            TracingUtil.getOpenTelemetry());
    }

    @Test
    @DisplayName("Test disabled settings produce non-recording spans")
    public void testCreateDisabled() {
        OpenTelemetry otel = TracingUtil.create(
            TracingConfig.from(name -> null));

        Span span = otel.getTracer("test").spanBuilder("op").startSpan();
        assertFalse(span.getSpanContext().isValid());
        assertFalse(span.isRecording());
        span.end();
    }

    @Test
    @DisplayName("Test enabled settings produce an SDK with the service name")
    public void testCreateEnabled() {
        OpenTelemetry otel = TracingUtil.create(
            new TracingConfig(true, "grapher-test", "http://localhost:4317"));
        assertInstanceOf(OpenTelemetrySdk.class, otel);
        OpenTelemetrySdk sdk = (OpenTelemetrySdk) otel;
        try {
            Span span = sdk.getTracer("test").spanBuilder("op").startSpan();
            assertTrue(span.getSpanContext().isValid());
            assertTrue(span.isRecording());
            span.end();
        } finally {
            sdk.getSdkTracerProvider().shutdown();
        }
    }

    @Test
    @DisplayName("Test shutdown succeeds while tracing is disabled")
    public void testShutdown() {
        if (!TracingUtil.isTracingEnabled()) {
            assertTrue(TracingUtil.shutdown());
        }
    }

    @Test
    @DisplayName("Test TracingUtil constructor is private")
    public void testPrivateConstructor() {
        var constructors = TracingUtil.class.getDeclaredConstructors();
        assertEquals(1, constructors.length);
        assertFalse(constructors[0].canAccess(null));
    }
}
