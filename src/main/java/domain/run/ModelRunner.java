package domain.run;

import domain.model.Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes models one at a time in the given (topological) order.
 *
 * <p>The first failure propagates and aborts the rest of the run. Cancellation is checked
 * between models only; a statement already sent to the database is never interrupted here.</p>
 */
public final class ModelRunner {

    private static final Logger log = LoggerFactory.getLogger(ModelRunner.class);

    private final ModelExecutor executor;
    private final AtomicBoolean cancelled;

    public ModelRunner(ModelExecutor executor, AtomicBoolean cancelled) {
        this.executor = executor;
        this.cancelled = cancelled == null ? new AtomicBoolean(false) : cancelled;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public RunSummary run(List<Model> ordered, boolean fullRefresh, RunListener listener) {
        RunListener l = listener == null ? RunListener.none() : listener;
        int total = ordered.size();
        List<ExecutionResult> done = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            if (cancelled.get()) {
                log.warn("run cancelled after {}/{} models", done.size(), total);
                return new RunSummary(done, total, true);
            }
            Model model = ordered.get(i);
            l.onModelStart(model, i + 1, total);
            ExecutionResult r = executor.execute(model, fullRefresh);
            done.add(r);
            l.onModelDone(r, i + 1, total);
        }
        return new RunSummary(done, total, false);
    }
}
