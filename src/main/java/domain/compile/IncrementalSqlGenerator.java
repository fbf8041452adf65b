package domain.compile;

import domain.analyze.SqlStatementSplitter;
import domain.model.Model;
import domain.model.SqlIdentifierUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL for the incremental materialization lifecycle: first-run CREATE + primary key, steady-state
 * MERGE, and the INSERT ... ON CONFLICT fallback for servers without MERGE.
 *
 * <p>Key columns are treated as immutable: they are matched on and inserted, never updated.</p>
 */
public final class IncrementalSqlGenerator {

    private IncrementalSqlGenerator() {
    }

    /**
     * Source query for a steady-state run: {@code @incremental} section, else the body filtered by
     * the watermark, else by {@code incremental_filter}, else the body as is.
     */
    public static String steadyStateBody(Model model) {
        String body;
        if (model.getIncrementalSql().isPresent()) {
            body = model.incrementalRunSql();
        } else if (model.watermarkFilterSql().isPresent()) {
            body = "SELECT * FROM (" + strip(model.firstRunSql()) + ") AS __watermark_source WHERE "
                    + model.watermarkFilterSql().get();
        } else if (model.getHeader().getIncrementalFilter().isPresent()) {
            body = "SELECT * FROM (" + strip(model.firstRunSql()) + ") AS __filter_source WHERE "
                    + model.getHeader().getIncrementalFilter().get();
        } else {
            body = model.incrementalRunSql();
        }
        return strip(body);
    }

    public static String firstRunSql(Model model, String body) {
        String target = SqlIdentifierUtil.quoteRelation(model.getId());
        String constraint = SqlIdentifierUtil.quoteIdent(model.getId().getName() + "_pkey");
        return "CREATE TABLE " + target + " AS\n" + strip(body) + ";\n"
                + "ALTER TABLE " + target + " ADD CONSTRAINT " + constraint
                + " PRIMARY KEY (" + String.join(", ", quoteAll(model.getHeader().getUniqueKey())) + ");";
    }

    /**
     * @param columns current target columns in ordinal order
     */
    public static String mergeSql(Model model, List<String> columns, String body) {
        List<String> uniqueKey = model.getHeader().getUniqueKey();

        List<String> on = new ArrayList<>();
        for (String k : uniqueKey) {
            String q = SqlIdentifierUtil.quoteIdent(k);
            on.add("t." + q + " = s." + q);
        }

        List<String> updates = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (String c : columns) {
            String q = SqlIdentifierUtil.quoteIdent(c);
            if (!uniqueKey.contains(c)) updates.add(q + " = s." + q);
            values.add("s." + q);
        }

        StringBuilder sql = new StringBuilder()
                .append("MERGE INTO ").append(SqlIdentifierUtil.quoteRelation(model.getId())).append(" AS t\n")
                .append("USING (\n").append(strip(body)).append("\n) AS s\n")
                .append("ON ").append(String.join(" AND ", on)).append('\n');
        if (!updates.isEmpty()) {
            sql.append("WHEN MATCHED THEN UPDATE SET ").append(String.join(", ", updates)).append('\n');
        }
        sql.append("WHEN NOT MATCHED THEN INSERT (").append(String.join(",", quoteAll(columns)))
                .append(") VALUES (").append(String.join(",", values)).append(')');
        return sql.toString();
    }

    /**
     * Returns a single {@code bigint} row: the number of inserted or updated rows.
     */
    public static String upsertSql(Model model, List<String> columns, String body) {
        List<String> uniqueKey = model.getHeader().getUniqueKey();
        String cols = String.join(", ", quoteAll(columns));

        List<String> updates = new ArrayList<>();
        for (String c : columns) {
            if (uniqueKey.contains(c)) continue;
            String q = SqlIdentifierUtil.quoteIdent(c);
            updates.add(q + " = EXCLUDED." + q);
        }
        String action = updates.isEmpty() ? "DO NOTHING" : "DO UPDATE SET " + String.join(", ", updates);

        return "WITH source AS (\n" + strip(body) + "\n),\n"
                + "upserted AS (\n"
                + "  INSERT INTO " + SqlIdentifierUtil.quoteRelation(model.getId()) + " (" + cols + ")\n"
                + "  SELECT " + cols + " FROM source\n"
                + "  ON CONFLICT (" + String.join(", ", quoteAll(uniqueKey)) + ") " + action + "\n"
                + "  RETURNING 1\n"
                + ")\n"
                + "SELECT COUNT(*)::bigint FROM upserted";
    }

    private static List<String> quoteAll(List<String> idents) {
        List<String> out = new ArrayList<>(idents.size());
        for (String s : idents) out.add(SqlIdentifierUtil.quoteIdent(s));
        return out;
    }

    static String strip(String sql) {
        return SqlStatementSplitter.stripTrailingSemicolon(sql);
    }
}
