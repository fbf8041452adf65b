package infra.output;

import domain.model.IssueKind;
import domain.model.ModelIssue;
import domain.model.Relation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvIssueReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_header_and_quote_details_with_commas() throws Exception {
        Path report = tempDir.resolve("reports").resolve("lint-deps-issues.csv");
        List<ModelIssue> issues = List.of(
                new ModelIssue(IssueKind.MISSING_DEP, Relation.parse("mart.orders"), "models/mart/orders.sql", "raw.orders"),
                new ModelIssue(IssueKind.EXTRA_DEP, Relation.parse("mart.orders"), "models/mart/orders.sql", "a, b"));

        new CsvIssueReportWriter().write(report, issues);

        assertEquals("model,path,kind,detail\n"
                + "mart.orders,models/mart/orders.sql,MISSING_DEP,raw.orders\n"
                + "mart.orders,models/mart/orders.sql,EXTRA_DEP,\"a, b\"\n", Files.readString(report));
    }

    @Test
    void should_write_header_only_for_no_issues() throws Exception {
        Path report = tempDir.resolve("empty.csv");
        new CsvIssueReportWriter().write(report, List.of());
        assertEquals("model,path,kind,detail\n", Files.readString(report));
    }
}
