package infra.project;

import domain.error.ModelBuildException;
import domain.model.Relation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelFilePatcherTest {

    @TempDir
    Path dir;

    @Test
    void should_rewrite_deps_line_sorted_and_keep_rest() throws Exception {
        Path f = dir.resolve("users.sql");
        Files.writeString(f, "-- materialized: view\n-- deps: raw.old\n-- tags: daily\n\nSELECT *\nFROM raw.b JOIN raw.a ON true;");

        ModelFilePatcher.rewriteDepsLine(f, List.of(Relation.parse("raw.b"), Relation.parse("raw.a")));

        assertEquals("-- materialized: view\n-- deps: raw.a, raw.b\n-- tags: daily\n\nSELECT *\nFROM raw.b JOIN raw.a ON true;\n",
                Files.readString(f));
        try (var files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void should_render_empty_deps_line() {
        assertEquals("-- deps:", ModelFilePatcher.renderDepsLine(List.of()));
    }

    @Test
    void should_refuse_file_without_deps_line() throws Exception {
        Path f = dir.resolve("nodeps.sql");
        String text = "-- materialized: view\n\nSELECT 1\n";
        Files.writeString(f, text);

        ModelBuildException e = assertThrows(ModelBuildException.class,
                () -> ModelFilePatcher.rewriteDepsLine(f, List.of(Relation.parse("raw.a"))));

        assertTrue(e.getMessage().startsWith("missing required '-- deps:' line in header"), e.getMessage());
        assertEquals(text, Files.readString(f));
    }

    @Test
    void should_replace_body_after_one_blank_line() throws Exception {
        Path f = dir.resolve("q.sql");
        Files.writeString(f, "-- materialized: view\n-- deps: raw.users\n\n\n\nSELECT * FROM users\n");

        ModelFilePatcher.rewriteBody(f, "SELECT * FROM raw.users\n");

        assertEquals("-- materialized: view\n-- deps: raw.users\n\nSELECT * FROM raw.users;\n", Files.readString(f));
    }
}
