package domain.analyze;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatementSplitterTest {

    @Test
    void should_ignore_semicolons_in_strings_comments_and_dollar_quotes() {
        List<String> s = SqlStatementSplitter.split(
                "SELECT ';' AS a -- ; comment\nFROM x.y; SELECT $$;$$; /* ; */");
        assertEquals(2, s.size());
        assertTrue(s.get(0).startsWith("SELECT ';' AS a"));
        assertEquals("SELECT $$;$$", s.get(1));
    }

    @Test
    void should_drop_comment_only_chunks() {
        assertEquals(1, SqlStatementSplitter.split("SELECT 1;\n-- trailing note\n").size());
    }

    @Test
    void should_strip_trailing_semicolons() {
        assertEquals("select 1", SqlStatementSplitter.stripTrailingSemicolon("select 1 ; ;  "));
    }
}
