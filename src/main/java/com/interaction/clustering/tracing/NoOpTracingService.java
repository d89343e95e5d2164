package com.interaction.clustering.tracing;

/**
 * No-op implementation of {@link TracingService}; every span it returns ignores all calls.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startRun(String runId, boolean resumed) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startStage(String runId, String stage) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startIteration(String runId, int iteration) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    }
}
