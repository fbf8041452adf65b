package domain.run;

import domain.compile.IncrementalSqlGenerator;
import domain.compile.ModelCompiler;
import domain.error.DatabaseException;
import domain.error.ModelExecutionException;
import domain.model.Materialized;
import domain.model.Model;
import domain.model.Relation;
import domain.model.SqlIdentifierUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Materializes one model against the database.
 *
 * <p>View and table models drop whichever object of that name exists, then run their create
 * statement. Incremental models are created (first run or full refresh) or merged into the
 * existing table.</p>
 */
public final class ModelExecutor {

    /** First PostgreSQL major version with MERGE. */
    public static final int MERGE_MIN_VERSION = 15;

    private static final Logger log = LoggerFactory.getLogger(ModelExecutor.class);

    private final ModelDatabase db;

    public ModelExecutor(ModelDatabase db) {
        this.db = db;
    }

    /**
     * @return true when the schema had to be created
     */
    public boolean ensureSchema(String schema) {
        if (db.schemaExists(schema)) return false;
        log.info("creating schema {}", schema);
        db.createSchema(schema);
        return true;
    }

    /**
     * @throws ModelExecutionException when any statement fails
     */
    public ExecutionResult execute(Model model, boolean fullRefresh) {
        long t0 = System.nanoTime();
        boolean schemaCreated = guard(model, "CREATE SCHEMA IF NOT EXISTS "
                + SqlIdentifierUtil.quoteIdent(model.getId().getSchema()), () -> ensureSchema(model.getId().getSchema()));

        Relation id = model.getId();
        boolean tableExists = guard(model, "information_schema.tables", () -> db.tableExists(id));
        boolean viewExists = guard(model, "information_schema.views", () -> db.viewExists(id));

        if (model.getMaterialized() != Materialized.INCREMENTAL) {
            dropExisting(model, viewExists, tableExists);
            String sql = ModelCompiler.createSql(model);
            guard(model, sql, () -> {
                db.executeBatch(sql);
                return null;
            });
            return new ExecutionResult(id, model.getMaterialized(), null, null, schemaCreated, ms(t0));
        }

        if (tableExists && !fullRefresh) {
            return mergeOrUpsert(model, schemaCreated, t0);
        }

        dropExisting(model, viewExists, tableExists);
        String target = SqlIdentifierUtil.quoteRelation(id);
        String create = IncrementalSqlGenerator.firstRunSql(model, model.firstRunSql());
        guard(model, create, () -> {
            db.executeBatch(create);
            return null;
        });
        String count = "SELECT COUNT(*) FROM " + target;
        long rows = guard(model, count, () -> db.queryForLong(count));
        return new ExecutionResult(id, Materialized.INCREMENTAL, IncrementalAction.CREATED_TABLE, rows, schemaCreated, ms(t0));
    }

    private void dropExisting(Model model, boolean viewExists, boolean tableExists) {
        String target = SqlIdentifierUtil.quoteRelation(model.getId());
        if (viewExists) {
            String drop = "DROP VIEW " + target + " CASCADE";
            guard(model, drop, () -> {
                db.executeBatch(drop);
                return null;
            });
        }
        if (tableExists) {
            String drop = "DROP TABLE " + target + " CASCADE";
            guard(model, drop, () -> {
                db.executeBatch(drop);
                return null;
            });
        }
    }

    private ExecutionResult mergeOrUpsert(Model model, boolean schemaCreated, long t0) {
        Relation id = model.getId();
        String body = IncrementalSqlGenerator.steadyStateBody(model);
        List<String> columns = guard(model, "information_schema.columns", () -> db.tableColumns(id));
        if (columns.isEmpty()) {
            throw new ModelExecutionException(id.toString(), String.valueOf(model.getPath()),
                    "target table has no columns", null, body, null);
        }
        int version = guard(model, "SHOW server_version_num", db::serverMajorVersion);

        if (version >= MERGE_MIN_VERSION) {
            String merge = IncrementalSqlGenerator.mergeSql(model, columns, body);
            long rows = guard(model, merge, () -> db.executeUpdate(merge));
            return new ExecutionResult(id, Materialized.INCREMENTAL, IncrementalAction.MERGED, rows, schemaCreated, ms(t0));
        }

        log.debug("server version {} has no MERGE, using INSERT ... ON CONFLICT for {}", version, id);
        String upsert = IncrementalSqlGenerator.upsertSql(model, columns, body);
        long rows = guard(model, upsert, () -> db.queryForLong(upsert));
        return new ExecutionResult(id, Materialized.INCREMENTAL, IncrementalAction.UPSERTED, rows, schemaCreated, ms(t0));
    }

    @FunctionalInterface
    private interface DbCall<T> {
        T call();
    }

    private static <T> T guard(Model model, String sql, DbCall<T> call) {
        try {
            return call.call();
        } catch (DatabaseException e) {
            throw new ModelExecutionException(
                    model.getId().toString(),
                    String.valueOf(model.getPath()),
                    e.getDetail(),
                    e.getSqlState(),
                    e.getSql().isEmpty() ? sql : e.getSql(),
                    e
            );
        }
    }

    private static long ms(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
