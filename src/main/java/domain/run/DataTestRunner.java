package domain.run;

import domain.error.DatabaseException;
import domain.model.DataTest;
import domain.model.IssueKind;
import domain.model.IssueSink;
import domain.model.Model;
import domain.model.ModelIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the data tests declared in model headers. A failing or erroring test never stops the others.
 */
public final class DataTestRunner {

    private static final Logger log = LoggerFactory.getLogger(DataTestRunner.class);

    private final ModelDatabase db;

    public DataTestRunner(ModelDatabase db) {
        this.db = db;
    }

    public List<DataTestResult> run(List<Model> models, IssueSink sink) {
        List<DataTestResult> out = new ArrayList<>();
        for (Model model : models) {
            for (DataTest test : model.getHeader().getTests()) {
                DataTestResult r = runOne(model, test);
                out.add(r);
                if (!r.isPassed()) {
                    String detail = r.getError() != null
                            ? test.description() + " errored: " + r.getError()
                            : test.description() + " failed: " + r.getViolations() + " violation(s)";
                    sink.report(ModelIssue.of(IssueKind.TEST_FAILED, model, detail));
                }
            }
        }
        return out;
    }

    DataTestResult runOne(Model model, DataTest test) {
        String sql = test.toSql(model.getId());
        try {
            long n = test.returnsRows() ? db.countRows(sql) : db.queryForLong(sql);
            return new DataTestResult(model.getId(), test, n == 0, n, null);
        } catch (DatabaseException e) {
            log.debug("test {} on {} errored: {}", test.description(), model.getId(), e.getMessage());
            return new DataTestResult(model.getId(), test, false, 0, e.getDetail());
        }
    }
}
