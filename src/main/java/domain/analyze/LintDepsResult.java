package domain.analyze;

import domain.model.Relation;

import java.util.List;

/**
 * Declared vs. inferred dependencies of one model. All lists are sorted.
 */
public final class LintDepsResult {

    private final List<Relation> declared;
    private final List<Relation> inferred;
    private final List<String> unqualified;
    private final List<String> unknown;
    private final List<Relation> missing;
    private final List<Relation> extra;

    LintDepsResult(
            List<Relation> declared,
            List<Relation> inferred,
            List<String> unqualified,
            List<String> unknown,
            List<Relation> missing,
            List<Relation> extra
    ) {
        this.declared = List.copyOf(declared);
        this.inferred = List.copyOf(inferred);
        this.unqualified = List.copyOf(unqualified);
        this.unknown = List.copyOf(unknown);
        this.missing = List.copyOf(missing);
        this.extra = List.copyOf(extra);
    }

    /** Header deps that are not declared sources. */
    public List<Relation> getDeclared() {
        return declared;
    }

    /** Project models referenced by the body, self excluded. */
    public List<Relation> getInferred() {
        return inferred;
    }

    public List<String> getUnqualified() {
        return unqualified;
    }

    public List<String> getUnknown() {
        return unknown;
    }

    /** Inferred but not declared. */
    public List<Relation> getMissing() {
        return missing;
    }

    /** Declared but not inferred. */
    public List<Relation> getExtra() {
        return extra;
    }

    public boolean hasIssues() {
        return !unqualified.isEmpty() || !unknown.isEmpty() || !missing.isEmpty() || !extra.isEmpty();
    }

    /** {@code --fix} may rewrite the deps line only when nothing is left unqualified. */
    public boolean isFixable() {
        return unqualified.isEmpty() && (!missing.isEmpty() || !extra.isEmpty());
    }
}
