package com.interaction.clustering.propagation;

/**
 * Reported when propagation stopped before churn fell to the tolerance.
 * The last committed assignment is still used; only the confidence in it is lower.
 *
 * @param reason     what stopped the iterations
 * @param iterations the last committed iteration
 * @param lastChurn  churn of that iteration, NaN if the store recorded none
 * @param tolerance  the configured convergence tolerance
 */
public record NonConvergenceWarning(Reason reason, int iterations, double lastChurn, double tolerance) {

    public enum Reason {
        /** {@code max_iterations} was reached. */
        ITERATION_BUDGET,
        /** The run deadline expired. */
        DEADLINE
    }

    public String message() {
        return switch (reason) {
            case ITERATION_BUDGET -> "Iteration budget of " + iterations
                    + " exhausted with churn " + lastChurn + " above tolerance " + tolerance;
            case DEADLINE -> "Deadline expired after iteration " + iterations
                    + " with churn " + lastChurn + " above tolerance " + tolerance;
        };
    }
}
