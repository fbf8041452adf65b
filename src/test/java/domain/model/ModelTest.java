package domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static domain.model.ModelFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    void should_filter_by_single_watermark_column() {
        Model m = model("app.events", String.join("\n",
                "-- materialized: incremental",
                "-- unique_key: id",
                "-- watermark: updated_at",
                "",
                "SELECT id, updated_at FROM raw.events"));

        assertEquals("\"updated_at\" > (SELECT MAX(\"updated_at\") FROM app.events)",
                m.watermarkFilterSql().orElseThrow());
    }

    @Test
    void should_apply_lookback_to_first_watermark_column_only() {
        Model m = model("app.events", String.join("\n",
                "-- materialized: incremental",
                "-- unique_key: id",
                "-- watermark: day, seq",
                "-- lookback: 2 days",
                "",
                "SELECT id, day, seq FROM raw.events"));

        assertEquals("(\"day\", \"seq\") > (SELECT MAX(\"day\") - interval '2 days', MAX(\"seq\") FROM app.events)",
                m.watermarkFilterSql().orElseThrow());
    }

    @Test
    void should_escape_quotes_in_lookback_literal() {
        Model m = model("app.events", String.join("\n",
                "-- materialized: incremental",
                "-- unique_key: id",
                "-- watermark: updated_at",
                "-- lookback: 1 day' OR '1'='1",
                "",
                "SELECT id, updated_at FROM raw.events"));

        assertEquals("\"updated_at\" > (SELECT MAX(\"updated_at\") - interval '1 day'' OR ''1''=''1' FROM app.events)",
                m.watermarkFilterSql().orElseThrow());
    }

    @Test
    void should_have_no_watermark_filter_without_watermark() {
        Model m = ModelFixtures.view("app.v", "SELECT 1");
        assertTrue(m.watermarkFilterSql().isEmpty());
    }

    @Test
    void should_substitute_this_in_incremental_section() {
        Model m = model("app.totals", String.join("\n",
                "-- materialized: incremental",
                "-- unique_key: id",
                "",
                "-- @base",
                "SELECT id, amount FROM raw.orders",
                "-- @incremental",
                "SELECT id, amount FROM raw.orders WHERE id > (SELECT MAX(id) FROM ${this})"));

        assertEquals("SELECT id, amount FROM raw.orders", m.firstRunSql());
        assertEquals("SELECT id, amount FROM raw.orders WHERE id > (SELECT MAX(id) FROM app.totals)",
                m.incrementalRunSql());
    }

    @Test
    void should_render_data_test_sql_and_description() {
        Relation target = Relation.parse("app.orders");

        DataTest notNull = DataTest.notNull("id");
        assertEquals("SELECT COUNT(*) as violations FROM app.orders WHERE \"id\" IS NULL", notNull.toSql(target));

        DataTest unique = DataTest.unique(List.of("a", "b"));
        assertTrue(unique.returnsRows());
        assertEquals("SELECT \"a\", \"b\", COUNT(*) as cnt FROM app.orders GROUP BY \"a\", \"b\" HAVING COUNT(*) > 1",
                unique.toSql(target));

        DataTest accepted = DataTest.acceptedValues("status", List.of("new", "it's"));
        assertEquals("SELECT COUNT(*) as violations FROM app.orders WHERE \"status\" NOT IN ('new', 'it''s')",
                accepted.toSql(target));
        assertEquals("accepted_values(status, [new, it's])", accepted.description());

        DataTest rel = DataTest.relationships("user_id", Relation.parse("app.users"), "id");
        assertTrue(rel.toSql(target).contains("NOT EXISTS (SELECT 1 FROM app.users t WHERE t.\"id\" = m.\"user_id\")"));
        assertEquals("relationships(user_id, app.users.id)", rel.description());
    }
}
