package domain.error;

import java.util.List;

/**
 * A statement failed while materializing a model.
 *
 * <p>Carries the model identity, the database message and SQLSTATE, a truncated SQL preview
 * and operator hints so the CLI can print a complete failure report.</p>
 */
public class ModelExecutionException extends ModelBuildException {

    public static final int PREVIEW_LIMIT = 600;

    private final String modelId;
    private final String modelPath;
    private final String sqlState;
    private final String sqlPreview;
    private final List<String> hints;

    public ModelExecutionException(
            String modelId,
            String modelPath,
            String databaseMessage,
            String sqlState,
            String sql,
            Throwable cause
    ) {
        super("failed to execute model " + modelId + ": " + nullToEmpty(databaseMessage), cause);
        this.modelId = nullToEmpty(modelId);
        this.modelPath = nullToEmpty(modelPath);
        this.sqlState = nullToEmpty(sqlState);
        this.sqlPreview = preview(sql);
        this.hints = List.of("Edit: " + this.modelPath, "Rerun: --select " + this.modelId);
    }

    /** Truncates to {@value #PREVIEW_LIMIT} characters with a trailing {@code ...}. */
    public static String preview(String sql) {
        if (sql == null) return "";
        String s = sql.trim();
        if (s.length() <= PREVIEW_LIMIT) return s;
        return s.substring(0, PREVIEW_LIMIT) + "...";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getModelId() {
        return modelId;
    }

    public String getModelPath() {
        return modelPath;
    }

    public String getSqlState() {
        return sqlState;
    }

    public String getSqlPreview() {
        return sqlPreview;
    }

    public List<String> getHints() {
        return hints;
    }
}
