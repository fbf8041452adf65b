package infra.output;

import domain.model.ModelIssue;
import domain.output.IssueReportWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV issue report for CI: one row per issue, columns {@code model,path,kind,detail}.
 */
public final class CsvIssueReportWriter implements IssueReportWriter {

    static final String[] HEADERS = {"model", "path", "kind", "detail"};

    @Override
    public void write(Path reportFile, List<ModelIssue> issues) {
        if (reportFile == null) throw new IllegalArgumentException("reportFile is null");
        try {
            if (reportFile.getParent() != null) Files.createDirectories(reportFile.getParent());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create report directory: " + reportFile.getParent(), e);
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADERS)
                .setRecordSeparator('\n')
                .build();
        try (Writer w = Files.newBufferedWriter(reportFile, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, format)) {
            for (ModelIssue issue : issues) {
                printer.printRecord(
                        issue.getModel() == null ? "" : issue.getModel().toString(),
                        issue.getPath(),
                        issue.getKind().name(),
                        issue.getDetail());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write issue report: " + reportFile, e);
        }
    }
}
