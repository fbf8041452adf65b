package domain.compile;

import domain.model.Model;
import org.junit.jupiter.api.Test;

import static domain.model.ModelFixtures.model;
import static domain.model.ModelFixtures.view;
import static org.junit.jupiter.api.Assertions.*;

class ModelCompilerTest {

    private static Model incremental() {
        return model("analytics.users", """
                -- materialized: incremental
                -- deps: raw.users
                -- unique_key: id

                -- @base
                SELECT id, name FROM raw.users;
                -- @incremental
                SELECT id, name FROM raw.users WHERE id > (SELECT MAX(id) FROM ${this})
                """);
    }

    @Test
    void should_compile_view_and_table() {
        assertEquals("CREATE OR REPLACE VIEW s.v AS\nSELECT 1;\n", ModelCompiler.compile(view("s.v", "SELECT 1;")));

        Model table = model("s.t", "-- materialized: table\n-- deps:\n\nSELECT 2\n");
        assertEquals("CREATE TABLE s.t AS\nSELECT 2;\n", ModelCompiler.compile(table));
    }

    @Test
    void should_drop_view_and_table_before_rebuild() {
        String sql = ModelCompiler.runSql(view("s.v", "SELECT 1"));
        assertEquals("DROP VIEW IF EXISTS s.v CASCADE;\n"
                + "DROP TABLE IF EXISTS s.v CASCADE;\n"
                + "CREATE OR REPLACE VIEW s.v AS\nSELECT 1", sql);
    }

    @Test
    void should_render_create_statement_without_drops() {
        String sql = ModelCompiler.createSql(view("s.v", "SELECT 1;"));
        assertEquals("CREATE OR REPLACE VIEW s.v AS\nSELECT 1", sql);
        assertTrue(ModelCompiler.runSql(view("s.v", "SELECT 1;")).endsWith(sql));
    }

    @Test
    void should_rebuild_incremental_from_base_section() {
        String sql = ModelCompiler.runSql(incremental());
        assertTrue(sql.startsWith("DROP VIEW IF EXISTS analytics.users CASCADE;\n"
                + "DROP TABLE IF EXISTS analytics.users CASCADE;\n"
                + "CREATE TABLE \"analytics\".\"users\" AS\nSELECT id, name FROM raw.users;\n"), sql);
        assertTrue(sql.endsWith("ADD CONSTRAINT \"users_pkey\" PRIMARY KEY (\"id\");"), sql);
        assertFalse(sql.contains("${this}"), sql);
    }

    @Test
    void should_preview_incremental_without_full_refresh() {
        String preview = ModelCompiler.dryRunSql(incremental(), false);
        assertTrue(preview.startsWith("-- incremental model: analytics.users (unique_key: id)\n"), preview);
        assertTrue(preview.endsWith(";\n"), preview);

        String full = ModelCompiler.dryRunSql(incremental(), true);
        assertTrue(full.startsWith("DROP VIEW IF EXISTS analytics.users CASCADE;"), full);
        assertTrue(full.endsWith("PRIMARY KEY (\"id\");\n"), full);
    }

    @Test
    void should_terminate_dry_run_of_view() {
        assertTrue(ModelCompiler.dryRunSql(view("s.v", "SELECT 1"), false).endsWith("SELECT 1;\n"));
    }
}
