package domain.model;

/**
 * Kinds of issues reported by lint, qualify, check and data tests.
 */
public enum IssueKind {

    /** One-part table reference that should be schema-qualified. */
    UNQUALIFIED,

    /** Reference matching neither a model nor a declared source (or over-qualified). */
    UNKNOWN,

    /** Unqualified reference matching several relations. */
    AMBIGUOUS,

    /** Inferred model dependency missing from the {@code deps:} header. */
    MISSING_DEP,

    /** Declared dependency never referenced by the body. */
    EXTRA_DEP,

    /** Model body could not be analysed. */
    PARSE_ERROR,

    /** Data test returned violations or failed to run. */
    TEST_FAILED,

    /** {@code --fix} could not rewrite the model file. */
    FIX_FAILED
}
