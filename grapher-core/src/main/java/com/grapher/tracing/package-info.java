/**
 * OpenTelemetry tracing support.
 */
package com.grapher.tracing;
