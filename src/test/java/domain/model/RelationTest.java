package domain.model;

import domain.error.RelationParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class RelationTest {

    @Test
    void should_parse_schema_and_name() {
        Relation r = Relation.parse(" staging.stg_users ");
        assertEquals("staging", r.getSchema());
        assertEquals("stg_users", r.getName());
        assertEquals("staging.stg_users", r.toString());
        assertEquals(Relation.of("staging", "stg_users"), r);
    }

    @Test
    void should_hint_schema_when_missing() {
        RelationParseException e = assertThrows(RelationParseException.class, () -> Relation.parse("users"));
        assertTrue(e.getMessage().contains("must include schema"), e.getMessage());
        assertTrue(e.getMessage().contains("public.users"), e.getMessage());
    }

    @Test
    void should_reject_extra_or_empty_parts() {
        assertThrows(RelationParseException.class, () -> Relation.parse("a.b.c"));
        assertThrows(RelationParseException.class, () -> Relation.parse("a."));
        assertThrows(RelationParseException.class, () -> Relation.parse(".b"));
        assertThrows(RelationParseException.class, () -> Relation.of("", "b"));
    }

    @Test
    void should_order_by_schema_then_name() {
        TreeSet<Relation> s = new TreeSet<>(List.of(
                Relation.parse("b.a"), Relation.parse("a.z"), Relation.parse("a.b")));
        assertEquals("[a.b, a.z, b.a]", s.toString());
    }
}
