package domain.model;

/**
 * Sink for model issues, so analysers can report without knowing about the console or CSV report.
 */
public interface IssueSink {

    void report(ModelIssue issue);
}
