package cli;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    private static final Set<String> FLAGS = Set.of("fix", "full-refresh");

    @Test
    void should_parse_both_option_forms_and_merge_repeats() {
        String[] args = {"run", "--select", "a.x", "--select=tag:daily", "--exclude", "b.y", "--full-refresh", "extra"};

        Map<String, String> argv = CliArgParser.parseArgs(args, FLAGS);

        assertEquals("a.x,tag:daily", argv.get("select"));
        assertEquals(List.of("a.x", "tag:daily"), CliArgParser.list(argv, "select"));
        assertEquals(List.of("b.y"), CliArgParser.list(argv, "exclude"));
        assertTrue(CliArgParser.flag(argv, "full-refresh"));
        assertEquals(List.of("run", "extra"), CliArgParser.positionals(args, FLAGS));
    }

    @Test
    void should_not_let_flags_consume_the_command() {
        String[] args = {"--fix", "lint-deps"};

        assertTrue(CliArgParser.flag(CliArgParser.parseArgs(args, FLAGS), "fix"));
        assertEquals(List.of("lint-deps"), CliArgParser.positionals(args, FLAGS));
    }

    @Test
    void should_read_explicit_flag_values() {
        Map<String, String> argv = CliArgParser.parseArgs(new String[]{"--fix=false", "--full-refresh=yes"}, FLAGS);

        assertFalse(CliArgParser.flag(argv, "fix"));
        assertTrue(CliArgParser.flag(argv, "full-refresh"));
        assertFalse(CliArgParser.flag(argv, "dry-run"));
    }

    @Test
    void should_return_empty_list_for_missing_option() {
        assertTrue(CliArgParser.list(Map.of(), "select").isEmpty());
        assertTrue(CliArgParser.parseArgs(null, FLAGS).isEmpty());
        assertFalse(CliArgParser.parseBoolean("no", true));
        assertTrue(CliArgParser.parseBoolean(" ", true));
    }
}
