package domain.compile;

import domain.model.Model;
import org.junit.jupiter.api.Test;

import java.util.List;

import static domain.model.ModelFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class IncrementalSqlGeneratorTest {

    private static Model users(String extraHeader) {
        return model("analytics.users", "-- materialized: incremental\n"
                + "-- deps: raw.users\n"
                + "-- unique_key: id\n"
                + extraHeader
                + "\nSELECT id, name, email, updated_at FROM raw.users;\n");
    }

    private static final List<String> COLUMNS = List.of("id", "name", "email");

    @Test
    void should_build_merge_matching_on_key_only() {
        String sql = IncrementalSqlGenerator.mergeSql(users(""), COLUMNS, "SELECT id, name, email FROM raw.users;");

        assertTrue(sql.startsWith("MERGE INTO \"analytics\".\"users\" AS t\nUSING (\n"), sql);
        assertTrue(sql.contains("\n) AS s\nON t.\"id\" = s.\"id\"\n"), sql);
        assertTrue(sql.contains("WHEN MATCHED THEN UPDATE SET \"name\" = s.\"name\", \"email\" = s.\"email\"\n"), sql);
        assertTrue(sql.endsWith("WHEN NOT MATCHED THEN INSERT (\"id\",\"name\",\"email\") "
                + "VALUES (s.\"id\",s.\"name\",s.\"email\")"), sql);
        assertFalse(sql.contains("raw.users;"), sql);
    }

    @Test
    void should_omit_update_clause_when_all_columns_are_keys() {
        String sql = IncrementalSqlGenerator.mergeSql(users(""), List.of("id"), "SELECT id FROM raw.users");
        assertFalse(sql.contains("WHEN MATCHED"), sql);
        assertTrue(sql.contains("INSERT (\"id\") VALUES (s.\"id\")"), sql);
    }

    @Test
    void should_match_on_compound_key() {
        Model m = model("s.t", "-- materialized: incremental\n-- unique_key: a, b\n\nSELECT a, b, c FROM x");
        String sql = IncrementalSqlGenerator.mergeSql(m, List.of("a", "b", "c"), m.getBodySql());
        assertTrue(sql.contains("ON t.\"a\" = s.\"a\" AND t.\"b\" = s.\"b\"\n"), sql);
        assertTrue(sql.contains("UPDATE SET \"c\" = s.\"c\"\n"), sql);
    }

    @Test
    void should_build_upsert_fallback() {
        String sql = IncrementalSqlGenerator.upsertSql(users(""), COLUMNS, "SELECT id, name, email FROM raw.users");
        assertTrue(sql.contains("INSERT INTO \"analytics\".\"users\" (\"id\", \"name\", \"email\")"), sql);
        assertTrue(sql.contains("ON CONFLICT (\"id\") DO UPDATE SET \"name\" = EXCLUDED.\"name\", "
                + "\"email\" = EXCLUDED.\"email\"\n"), sql);
        assertTrue(sql.endsWith("SELECT COUNT(*)::bigint FROM upserted"), sql);

        String keysOnly = IncrementalSqlGenerator.upsertSql(users(""), List.of("id"), "SELECT id FROM raw.users");
        assertTrue(keysOnly.contains("ON CONFLICT (\"id\") DO NOTHING\n"), keysOnly);
    }

    @Test
    void should_wrap_body_in_watermark_filter() {
        String body = IncrementalSqlGenerator.steadyStateBody(users("-- watermark: updated_at\n-- lookback: 1 hour\n"));
        assertEquals("SELECT * FROM (SELECT id, name, email, updated_at FROM raw.users) AS __watermark_source "
                + "WHERE \"updated_at\" > (SELECT MAX(\"updated_at\") - interval '1 hour' FROM analytics.users)", body);
    }

    @Test
    void should_wrap_body_in_incremental_filter() {
        String body = IncrementalSqlGenerator.steadyStateBody(
                users("-- incremental_filter: updated_at > now() - interval '1 day'\n"));
        assertTrue(body.startsWith("SELECT * FROM (SELECT id, name, email, updated_at FROM raw.users) AS __filter_source"),
                body);
        assertTrue(body.endsWith("WHERE updated_at > now() - interval '1 day'"), body);
    }

    @Test
    void should_use_incremental_section_with_this_substituted() {
        Model m = model("analytics.events", """
                -- materialized: incremental
                -- unique_key: id

                -- @base
                SELECT id FROM raw.events
                -- @incremental
                SELECT id FROM raw.events WHERE id > (SELECT MAX(id) FROM ${this});
                """);
        assertEquals("SELECT id FROM raw.events WHERE id > (SELECT MAX(id) FROM analytics.events)",
                IncrementalSqlGenerator.steadyStateBody(m));
    }

    @Test
    void should_add_primary_key_after_first_create() {
        String sql = IncrementalSqlGenerator.firstRunSql(users(""), "SELECT 1;");
        assertEquals("CREATE TABLE \"analytics\".\"users\" AS\nSELECT 1;\n"
                + "ALTER TABLE \"analytics\".\"users\" ADD CONSTRAINT \"users_pkey\" PRIMARY KEY (\"id\");", sql);
    }
}
