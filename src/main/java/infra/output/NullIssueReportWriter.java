package infra.output;

import domain.model.ModelIssue;
import domain.output.IssueReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullIssueReportWriter implements IssueReportWriter {
    @Override
    public void write(Path reportFile, List<ModelIssue> issues) {
        // report disabled
    }
}
