package domain.run;

import domain.model.Materialized;
import domain.model.Relation;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Summary of one model execution.
 */
public final class ExecutionResult {

    private final Relation model;
    private final Materialized materialized;
    private final IncrementalAction action;
    private final Long rowsAffected;
    private final boolean schemaCreated;
    private final long elapsedMs;

    public ExecutionResult(
            Relation model,
            Materialized materialized,
            IncrementalAction action,
            Long rowsAffected,
            boolean schemaCreated,
            long elapsedMs
    ) {
        this.model = model;
        this.materialized = materialized;
        this.action = action;
        this.rowsAffected = rowsAffected;
        this.schemaCreated = schemaCreated;
        this.elapsedMs = elapsedMs;
    }

    public Relation getModel() {
        return model;
    }

    public Materialized getMaterialized() {
        return materialized;
    }

    /** Present for incremental models only. */
    public Optional<IncrementalAction> getAction() {
        return Optional.ofNullable(action);
    }

    public OptionalLong getRowsAffected() {
        return rowsAffected == null ? OptionalLong.empty() : OptionalLong.of(rowsAffected);
    }

    public boolean isSchemaCreated() {
        return schemaCreated;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    /** e.g. {@code table}, {@code incremental (merged, 12 rows)}. */
    public String describe() {
        StringBuilder sb = new StringBuilder(materialized.keyword());
        if (action != null) {
            sb.append(" (").append(action.name().toLowerCase(Locale.ROOT).replace('_', ' '));
            if (rowsAffected != null) sb.append(", ").append(rowsAffected).append(" rows");
            sb.append(')');
        }
        return sb.toString();
    }
}
