package domain.run;

import domain.model.DataTest;
import domain.model.Relation;

/**
 * Pass/fail of one data test.
 */
public final class DataTestResult {

    private final Relation model;
    private final DataTest test;
    private final boolean passed;
    private final long violations;
    private final String error;

    DataTestResult(Relation model, DataTest test, boolean passed, long violations, String error) {
        this.model = model;
        this.test = test;
        this.passed = passed;
        this.violations = violations;
        this.error = error;
    }

    public Relation getModel() {
        return model;
    }

    public DataTest getTest() {
        return test;
    }

    public boolean isPassed() {
        return passed;
    }

    /** Violation count, or duplicate-key rows for unique tests. */
    public long getViolations() {
        return violations;
    }

    /** Null unless the test query itself failed. */
    public String getError() {
        return error;
    }
}
