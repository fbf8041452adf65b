package domain.header;

import domain.error.HeaderParseException;
import domain.model.Materialized;
import domain.model.ModelHeader;
import domain.model.Relation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HeaderParserTest {

    private static ModelHeader parse(String... lines) {
        return HeaderParser.parse(List.of(lines));
    }

    @Test
    void should_parse_full_incremental_header() {
        ModelHeader h = parse(
                "-- materialized: incremental",
                "-- unique_key: user_id, activity_date",
                "-- deps: staging.stg_tasks, staging.stg_users",
                "-- tags: Daily, metrics",
                "-- tests: not_null(user_id), unique(user_id, activity_date)",
                "-- watermark: activity_date",
                "-- lookback: 3 days",
                "-- description: Daily user activity",
                "-- Tip: unknown keys are ignored");

        assertEquals(Materialized.INCREMENTAL, h.getMaterialized());
        assertEquals(List.of("user_id", "activity_date"), h.getUniqueKey());
        assertEquals(List.of(Relation.parse("staging.stg_tasks"), Relation.parse("staging.stg_users")), h.getDeps());
        assertEquals(List.of("daily", "metrics"), h.getTags());
        assertEquals(2, h.getTests().size());
        assertEquals(List.of("activity_date"), h.getWatermark().orElseThrow());
        assertEquals("3 days", h.getLookback().orElseThrow());
        assertEquals("Daily user activity", h.getDescription().orElseThrow());
    }

    @Test
    void should_hint_misspelled_materialized() {
        HeaderParseException e = assertThrows(HeaderParseException.class, () -> parse("-- materialize: view"));
        assertTrue(e.getMessage().contains("did you mean 'materialized'"), e.getMessage());
    }

    @Test
    void should_list_valid_materializations() {
        HeaderParseException e = assertThrows(HeaderParseException.class, () -> parse("-- materialized: ephemeral"));
        assertTrue(e.getMessage().contains("view, table, incremental"), e.getMessage());
    }

    @Test
    void should_require_unique_key_for_incremental() {
        assertThrows(HeaderParseException.class, () -> parse("-- materialized: incremental"));
    }

    @Test
    void should_reject_incremental_only_keys_on_view() {
        HeaderParseException e = assertThrows(HeaderParseException.class,
                () -> parse("-- materialized: view", "-- watermark: updated_at"));
        assertTrue(e.getMessage().contains("watermark is only valid for materialized: incremental"), e.getMessage());
        assertThrows(HeaderParseException.class, () -> parse("-- materialized: table", "-- unique_key: id"));
    }

    @Test
    void should_require_watermark_for_lookback() {
        HeaderParseException e = assertThrows(HeaderParseException.class,
                () -> parse("-- materialized: incremental", "-- unique_key: id", "-- lookback: 1 day"));
        assertEquals("lookback requires watermark", e.getMessage());
    }

    @Test
    void should_reject_watermark_with_incremental_filter() {
        assertThrows(HeaderParseException.class, () -> parse(
                "-- materialized: incremental", "-- unique_key: id",
                "-- watermark: ts", "-- incremental_filter: ts > now() - interval '1 day'"));
    }

    @Test
    void should_reject_invalid_tags() {
        HeaderParseException e = assertThrows(HeaderParseException.class,
                () -> parse("-- materialized: view", "-- tags: ok, not ok"));
        assertTrue(e.getMessage().contains("invalid tag 'not ok'"), e.getMessage());
    }

    @Test
    void should_prefix_deps_context_on_bad_relation() {
        Exception e = assertThrows(Exception.class, () -> parse("-- materialized: view", "-- deps: users"));
        assertTrue(e.getMessage().startsWith("deps: "), e.getMessage());
    }
}
