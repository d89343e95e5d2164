package com.interaction.clustering.propagation;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of the label propagation stage.
 *
 * @param finalSnapshot  id of the last committed iteration snapshot
 * @param converged      whether churn fell to the tolerance
 * @param iterations     stats of the iterations run by this call, in order
 * @param warning        set when not converged
 */
public record PropagationResult(int finalSnapshot, boolean converged, List<IterationStats> iterations,
                                NonConvergenceWarning warning) {

    public PropagationResult {
        iterations = iterations != null ? List.copyOf(iterations) : List.of();
        if (converged == (warning != null)) {
            throw new IllegalArgumentException("a warning is required exactly when the run did not converge");
        }
    }

    public Optional<NonConvergenceWarning> nonConvergence() {
        return Optional.ofNullable(warning);
    }
}
