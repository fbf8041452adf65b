package app;

import domain.model.Project;
import domain.output.IssueReportWriter;
import domain.output.SqlOutputWriter;
import domain.run.ModelDatabase;
import infra.db.JdbcConnector;
import infra.output.CsvIssueReportWriter;
import infra.output.FileSqlOutputWriter;
import infra.output.MarkdownDocsWriter;
import infra.output.NullIssueReportWriter;
import infra.output.NullSqlOutputWriter;
import infra.project.ProjectConfig;
import infra.project.ProjectLoader;

/**
 * Object-assembly factory for {@link ModelBuildCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration and console output; object creation and
 * external resources (files, database connection) are decided here.
 */
class ModelBuildComponentsFactory {

    Project loadProject(ProjectConfig config) {
        return ProjectLoader.load(config);
    }

    ModelDatabase openDatabase(ProjectConfig config) {
        return JdbcConnector.connect(config.getDatabaseUrl(), config.getDatabaseUser(), config.getDatabasePassword());
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    IssueReportWriter createIssueReportWriter(boolean enable) {
        if (!enable) return new NullIssueReportWriter();
        return new CsvIssueReportWriter();
    }

    MarkdownDocsWriter createDocsWriter() {
        return new MarkdownDocsWriter();
    }
}
