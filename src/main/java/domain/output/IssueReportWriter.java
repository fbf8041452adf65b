package domain.output;

import domain.model.ModelIssue;

import java.nio.file.Path;
import java.util.List;

/** Persists the issues collected by one command run. */
public interface IssueReportWriter {

    void write(Path reportFile, List<ModelIssue> issues);
}
