package com.interaction.clustering.tracing;

/**
 * Tracing integration for a clustering run. Every span carries the run id, so the
 * stages and iterations of one run can be found together.
 *
 * <pre>
 * clustering.run | clustering.resume
 *   clustering.ingest, clustering.seed
 *   clustering.iteration (one per iteration)
 *   clustering.resolve, clustering.collect
 * </pre>
 *
 * The default {@link NoOpTracingService} keeps the library usable without any tracing
 * dependency on the classpath.
 */
public interface TracingService {

    String RUN_ID = "clustering.run_id";
    String ITERATION = "clustering.iteration";

    /**
     * Starts the root span of a run, or of a run resumed from a committed snapshot.
     */
    Span startRun(String runId, boolean resumed);

    /**
     * Starts the span of one pipeline stage ({@code ingest}, {@code seed}, {@code resolve}, {@code collect}).
     */
    Span startStage(String runId, String stage);

    Span startIteration(String runId, int iteration);
}
