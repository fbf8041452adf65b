package domain.run;

import domain.model.Model;

/**
 * Progress callbacks from {@link ModelRunner}. All methods default to no-op.
 */
public interface RunListener {

    static RunListener none() {
        return new RunListener() {
        };
    }

    default void onModelStart(Model model, int index1Based, int total) {
    }

    default void onModelDone(ExecutionResult result, int index1Based, int total) {
    }
}
