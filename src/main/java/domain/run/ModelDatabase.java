package domain.run;

import domain.error.DatabaseException;
import domain.model.Relation;

import java.util.List;

/**
 * Database session used by the executor and the data-test runner.
 *
 * <p>Every method throws {@link DatabaseException} on failure. Implementations hold one
 * connection; calls are sequential.</p>
 */
public interface ModelDatabase extends AutoCloseable {

    boolean schemaExists(String schema);

    void createSchema(String schema);

    boolean viewExists(Relation relation);

    boolean tableExists(Relation relation);

    /** Column names in ordinal order. */
    List<String> tableColumns(Relation relation);

    /** Runs one or more {@code ;}-separated statements. */
    void executeBatch(String sql);

    /** Runs one DML statement and returns the affected row count. */
    long executeUpdate(String sql);

    /** First column of the first row as a long; 0 when there are no rows. */
    long queryForLong(String sql);

    /** Number of rows returned by {@code sql}. */
    long countRows(String sql);

    /** e.g. 16 for PostgreSQL 16.4. */
    int serverMajorVersion();

    @Override
    void close();
}
