package domain.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelExecutionExceptionTest {

    @Test
    void should_truncate_long_sql_preview() {
        String sql = "SELECT " + "x".repeat(700);
        ModelExecutionException e = new ModelExecutionException("a.b", "models/a/b.sql", "boom", "XX000", sql, null);

        assertEquals(603, e.getSqlPreview().length());
        assertTrue(e.getSqlPreview().endsWith("..."));
        assertEquals("failed to execute model a.b: boom", e.getMessage());
        assertEquals("XX000", e.getSqlState());
    }

    @Test
    void should_keep_short_preview_and_default_nulls() {
        ModelExecutionException e = new ModelExecutionException("a.b", null, null, null, "  SELECT 1  ", null);

        assertEquals("SELECT 1", e.getSqlPreview());
        assertEquals("", e.getSqlState());
        assertEquals("", e.getModelPath());
        assertEquals("Rerun: --select a.b", e.getHints().get(1));
    }

    @Test
    void should_render_context_frames_outermost_first() {
        ModelBuildException e = new HeaderParseException("missing required header key: materialized")
                .withContext("parse model header: models/a/b.sql")
                .withContext("load project");

        assertEquals("load project: parse model header: models/a/b.sql: missing required header key: materialized",
                e.getMessage());
        assertEquals("missing required header key: materialized", e.getDetail());
        assertEquals("load project", e.getOutermostContext());
    }
}
