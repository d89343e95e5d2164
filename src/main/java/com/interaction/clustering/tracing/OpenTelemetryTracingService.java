package com.interaction.clustering.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startRun(String runId, boolean resumed) {
        return start(tracer.spanBuilder(resumed ? "clustering.resume" : "clustering.run")
                .setAttribute(RUN_ID, runId)
                .setAttribute("clustering.resumed", resumed));
    }

    @Override
    public Span startStage(String runId, String stage) {
        return start(tracer.spanBuilder("clustering." + stage)
                .setAttribute(RUN_ID, runId));
    }

    @Override
    public Span startIteration(String runId, int iteration) {
        return start(tracer.spanBuilder("clustering.iteration")
                .setAttribute(RUN_ID, runId)
                .setAttribute(ITERATION, (long) iteration));
    }

    private static Span start(SpanBuilder builder) {
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;
        private boolean failed;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void setAttribute(String key, String value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            otelSpan.setAttribute(key, value);
        }

        @Override
        public void fail(Throwable cause) {
            failed = true;
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void close() {
            if (!failed) {
                otelSpan.setStatus(StatusCode.OK);
            }
            otelSpan.end();
        }
    }
}
