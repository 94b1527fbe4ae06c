package com.grapher.tracing;

import java.util.Objects;
import java.util.function.Function;

/**
 * Tracing settings.
 *
 * <ul>
 *   <li>{@code OTEL_TRACING_ENABLED} - export spans (default: false)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - service name (default: grapher)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - OTLP gRPC endpoint
 *       (default: http://localhost:4317)</li>
 * </ul>
 *
 * @param enabled whether spans are exported
 * @param serviceName the {@code service.name} resource attribute
 * @param endpoint the OTLP gRPC endpoint
 */
public record TracingConfig(boolean enabled, String serviceName,
                            String endpoint) {
    /** Environment variable enabling export. */
    public static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Environment variable naming the service. */
    public static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Environment variable for the collector endpoint. */
    public static final String ENV_OTLP_ENDPOINT =
        "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Service name used when none is configured. */
    public static final String DEFAULT_SERVICE_NAME = "grapher";

    /** Endpoint used when none is configured. */
    public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /**
     * Creates settings.
     *
     * @param enabled whether spans are exported
     * @param serviceName the service name
     * @param endpoint the OTLP gRPC endpoint
     */
    public TracingConfig {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(endpoint, "endpoint");
    }

    /**
     * Reads settings from the process environment.
     *
     * @return the settings
     */
    public static TracingConfig fromEnvironment() {
        return from(System::getenv);
    }

    /**
     * Reads settings through {@code lookup}. Unset or blank values take
     * the defaults.
     *
     * @param lookup maps a variable name to its value, or null
     * @return the settings
     */
    public static TracingConfig from(final Function<String, String> lookup) {
        return new TracingConfig(
            Boolean.parseBoolean(value(lookup, ENV_TRACING_ENABLED, "false")),
            value(lookup, ENV_SERVICE_NAME, DEFAULT_SERVICE_NAME),
            value(lookup, ENV_OTLP_ENDPOINT, DEFAULT_OTLP_ENDPOINT));
    }

    private static String value(final Function<String, String> lookup,
                                final String name, final String fallback) {
        String value = lookup.apply(name);
        return value == null || value.isBlank() ? fallback : value.strip();
    }
}
