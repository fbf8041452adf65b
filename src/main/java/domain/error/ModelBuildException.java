package domain.error;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Root of all model build failures.
 *
 * <p>Context frames (file path, model id, operation) are pushed as the error bubbles up and are
 * rendered outermost-first in {@link #getMessage()}, e.g.
 * {@code load project: parse model header: models/a/b.sql: missing required header key: materialized}.</p>
 */
public class ModelBuildException extends RuntimeException {

    private final String detail;
    private final Deque<String> contexts = new ArrayDeque<>(4);

    public ModelBuildException(String detail) {
        this(detail, null);
    }

    public ModelBuildException(String detail, Throwable cause) {
        super(detail, cause);
        this.detail = detail == null ? "" : detail;
    }

    /**
     * Adds an outer context frame and returns this exception (for {@code throw e.withContext(..)}).
     */
    public ModelBuildException withContext(String context) {
        if (context != null && !context.isBlank()) {
            contexts.addFirst(context.trim());
        }
        return this;
    }

    /** Message without any context frames. */
    public String getDetail() {
        return detail;
    }

    public String getOutermostContext() {
        return contexts.isEmpty() ? "" : contexts.peekFirst();
    }

    @Override
    public String getMessage() {
        if (contexts.isEmpty()) return detail;
        StringBuilder sb = new StringBuilder(detail.length() + 64);
        for (String c : contexts) {
            sb.append(c).append(": ");
        }
        return sb.append(detail).toString();
    }
}
