package domain.run;

import java.util.List;

/**
 * Outcome of a run that did not fail: every model completed, or the run was cancelled between models.
 */
public final class RunSummary {

    private final List<ExecutionResult> completed;
    private final int total;
    private final boolean cancelled;

    RunSummary(List<ExecutionResult> completed, int total, boolean cancelled) {
        this.completed = List.copyOf(completed);
        this.total = total;
        this.cancelled = cancelled;
    }

    public List<ExecutionResult> getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
