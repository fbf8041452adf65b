package infra.output;

import domain.model.Relation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_sql_under_schema_directory_and_model_filename() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();

        Path out = tempDir.resolve("compiled");
        Path written = w.write(out, Relation.parse("staging.users"), "CREATE OR REPLACE VIEW staging.users AS\nSELECT 1;");

        Path expected = out.resolve("staging").resolve("users.sql");
        assertEquals(expected, written);
        assertEquals("CREATE OR REPLACE VIEW staging.users AS\nSELECT 1;\n", Files.readString(expected));
    }

    @Test
    void should_overwrite_previous_output() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();
        w.write(tempDir, Relation.parse("a.b"), "old\n");
        w.write(tempDir, Relation.parse("a.b"), "new\n");

        assertEquals("new\n", Files.readString(tempDir.resolve("a/b.sql")));
    }

    @Test
    void should_write_nothing_when_disabled() {
        assertNull(new NullSqlOutputWriter().write(tempDir, Relation.parse("a.b"), "SELECT 1"));
        assertFalse(Files.exists(tempDir.resolve("a")));
    }
}
