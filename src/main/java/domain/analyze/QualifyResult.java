package domain.analyze;

import java.util.List;

/**
 * Outcome of qualifying one model's unqualified table references.
 */
public final class QualifyResult {

    private final boolean changed;
    private final List<String> unqualified;
    private final List<String> ambiguous;
    private final List<String> unknown;
    private final String rewrittenSql;

    QualifyResult(boolean changed, List<String> unqualified, List<String> ambiguous, List<String> unknown, String rewrittenSql) {
        this.changed = changed;
        this.unqualified = List.copyOf(unqualified);
        this.ambiguous = List.copyOf(ambiguous);
        this.unknown = List.copyOf(unknown);
        this.rewrittenSql = rewrittenSql;
    }

    /** At least one reference was qualified. */
    public boolean isChanged() {
        return changed;
    }

    /** References left unqualified because the only candidate is the model itself. */
    public List<String> getUnqualified() {
        return unqualified;
    }

    /** {@code name (candidates: a.name, b.name)} entries. */
    public List<String> getAmbiguous() {
        return ambiguous;
    }

    public List<String> getUnknown() {
        return unknown;
    }

    /** Re-serialized SQL, only when {@link #isChanged()}. */
    public String getRewrittenSql() {
        return rewrittenSql;
    }

    public boolean hasIssues() {
        return changed || !unqualified.isEmpty() || !ambiguous.isEmpty() || !unknown.isEmpty();
    }
}
