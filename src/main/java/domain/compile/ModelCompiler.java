package domain.compile;

import domain.model.Model;

/**
 * Renders materialization SQL for a model.
 */
public final class ModelCompiler {

    private ModelCompiler() {
    }

    /**
     * Content of {@code target/compiled/<schema>/<name>.sql}. Incremental models compile to a
     * commented preview; their MERGE depends on the live table and is generated at run time.
     */
    public static String compile(Model model) {
        String body = IncrementalSqlGenerator.strip(model.getBodySql());
        return switch (model.getMaterialized()) {
            case VIEW -> "CREATE OR REPLACE VIEW " + model.getId() + " AS\n" + body + ";\n";
            case TABLE -> "CREATE TABLE " + model.getId() + " AS\n" + body + ";\n";
            case INCREMENTAL -> incrementalPreview(model);
        };
    }

    /**
     * Full-rebuild SQL. Always drops both a view and a table of the same name first, so switching
     * a model between view and table does not fail on the wrong object type.
     */
    public static String runSql(Model model) {
        String drops = "DROP VIEW IF EXISTS " + model.getId() + " CASCADE;\n"
                + "DROP TABLE IF EXISTS " + model.getId() + " CASCADE;\n";
        return drops + createSql(model);
    }

    /** The create statement alone, without any preceding drop. */
    public static String createSql(Model model) {
        String body = IncrementalSqlGenerator.strip(model.firstRunSql());
        return switch (model.getMaterialized()) {
            case VIEW -> "CREATE OR REPLACE VIEW " + model.getId() + " AS\n" + body;
            case TABLE -> "CREATE TABLE " + model.getId() + " AS\n" + body;
            case INCREMENTAL -> IncrementalSqlGenerator.firstRunSql(model, body);
        };
    }

    /** What {@code run --dry-run} prints for one model. */
    public static String dryRunSql(Model model, boolean fullRefresh) {
        return switch (model.getMaterialized()) {
            case INCREMENTAL -> fullRefresh ? terminate(runSql(model)) : incrementalPreview(model);
            case VIEW, TABLE -> terminate(runSql(model));
        };
    }

    private static String incrementalPreview(Model model) {
        return "-- incremental model: " + model.getId()
                + " (unique_key: " + String.join(", ", model.getHeader().getUniqueKey()) + ")\n"
                + "-- MERGE is generated at run time from the existing table columns\n"
                + IncrementalSqlGenerator.strip(model.getBodySql()) + ";\n";
    }

    private static String terminate(String sql) {
        String s = sql.trim();
        return (s.endsWith(";") ? s : s + ";") + "\n";
    }
}
