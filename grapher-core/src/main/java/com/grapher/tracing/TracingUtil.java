package com.grapher.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the tracers of the store, query and snapshot layers.
 *
 * <p>The OpenTelemetry instance behind them is built on first use from
 * {@link TracingConfig#fromEnvironment()}: the no-op implementation when
 * tracing is disabled, otherwise an SDK exporting over OTLP gRPC. The SDK
 * belongs to this library alone. It is not registered as the global
 * instance and installs no shutdown hook; the embedding application calls
 * {@link #shutdown()} to flush pending spans.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Upper bound on the flush performed by {@link #shutdown()}. */
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    /** Guards creation of {@link #openTelemetry}. */
    private static final Object INIT_LOCK = new Object();

    /** Settings the instance was built from; set before it is published. */
    private static TracingConfig config;

    /** The instance, null until first use. */
    private static volatile OpenTelemetry openTelemetry;

    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Gets the instance, creating it on first call.
     *
     * @return the OpenTelemetry instance
     */
    public static OpenTelemetry getOpenTelemetry() {
        OpenTelemetry current = openTelemetry;
        if (current == null) {
            synchronized (INIT_LOCK) {
                current = openTelemetry;
                if (current == null) {
                    config = TracingConfig.fromEnvironment();
                    current = create(config);
                    openTelemetry = current;
                }
            }
        }
        return current;
    }

    /**
     * Gets the tracer of one layer.
     *
     * @param scope the layer
     * @return the tracer
     */
    public static Tracer getTracer(final TracingScope scope) {
        return getOpenTelemetry().getTracer(scope.scopeName());
    }

    /**
     * Whether spans are exported.
     *
     * @return true if tracing is enabled
     */
    public static boolean isTracingEnabled() {
        getOpenTelemetry();
        return config.enabled();
    }

    /**
     * Builds an instance for the given settings.
     *
     * @param settings the settings
     * @return the no-op instance when disabled, else a new SDK
     */
    static OpenTelemetry create(final TracingConfig settings) {
        if (!settings.enabled()) {
            LOGGER.info("Tracing disabled; set {}=true to export spans",
                TracingConfig.ENV_TRACING_ENABLED);
            return OpenTelemetry.noop();
        }

        LOGGER.info("Exporting spans of service {} to {}",
            settings.serviceName(), settings.endpoint());
        Resource resource = Resource.getDefault().merge(Resource.create(
            Attributes.of(ServiceAttributes.SERVICE_NAME,
                settings.serviceName())));
        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(settings.endpoint())
            .build();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .setResource(resource)
            .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
            .build();

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }

    /**
     * Flushes pending spans and closes the exporter. Spans ended later
     * are dropped. Does nothing while tracing is disabled or unused.
     *
     * @return false if the flush did not finish in time
     */
    public static boolean shutdown() {
        if (!(openTelemetry instanceof OpenTelemetrySdk sdk)) {
            return true;
        }
        CompletableResultCode result = sdk.getSdkTracerProvider().shutdown()
            .join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
            LOGGER.warn("Span export did not finish within {} s",
                SHUTDOWN_TIMEOUT_SECONDS);
        }
        return result.isSuccess();
    }
}
