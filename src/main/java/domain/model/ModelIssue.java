package domain.model;

/**
 * A single non-fatal finding about one model.
 */
public final class ModelIssue {

    private final IssueKind kind;
    private final Relation model;
    private final String path;
    private final String detail;

    public ModelIssue(IssueKind kind, Relation model, String path, String detail) {
        this.kind = kind == null ? IssueKind.PARSE_ERROR : kind;
        this.model = model;
        this.path = nullToEmpty(path);
        this.detail = nullToEmpty(detail);
    }

    public static ModelIssue of(IssueKind kind, Model model, String detail) {
        return new ModelIssue(kind, model.getId(), String.valueOf(model.getPath()), detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public IssueKind getKind() {
        return kind;
    }

    public Relation getModel() {
        return model;
    }

    public String getPath() {
        return path;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return model + " " + kind + ": " + detail;
    }
}
