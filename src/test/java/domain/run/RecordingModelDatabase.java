package domain.run;

import domain.error.DatabaseException;
import domain.model.Relation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link ModelDatabase} that records every statement and answers from canned state.
 */
public class RecordingModelDatabase implements ModelDatabase {

    public final List<String> statements = new ArrayList<>();
    public final Set<String> schemas = new HashSet<>();
    public final Set<Relation> views = new HashSet<>();
    public final Set<Relation> tables = new HashSet<>();
    public final Map<Relation, List<String>> columns = new HashMap<>();
    /** Results keyed by a substring of the statement. */
    public final Map<String, Long> answers = new HashMap<>();
    /** Statements containing any of these fail. */
    public final Set<String> failOn = new HashSet<>();
    public int version = 16;
    public boolean closed;

    @Override
    public boolean schemaExists(String schema) {
        return schemas.contains(schema);
    }

    @Override
    public void createSchema(String schema) {
        record("CREATE SCHEMA " + schema);
        schemas.add(schema);
    }

    @Override
    public boolean viewExists(Relation relation) {
        return views.contains(relation);
    }

    @Override
    public boolean tableExists(Relation relation) {
        return tables.contains(relation);
    }

    @Override
    public List<String> tableColumns(Relation relation) {
        return columns.getOrDefault(relation, List.of());
    }

    @Override
    public void executeBatch(String sql) {
        record(sql);
    }

    @Override
    public long executeUpdate(String sql) {
        record(sql);
        return answer(sql);
    }

    @Override
    public long queryForLong(String sql) {
        record(sql);
        return answer(sql);
    }

    @Override
    public long countRows(String sql) {
        record(sql);
        return answer(sql);
    }

    @Override
    public int serverMajorVersion() {
        return version;
    }

    @Override
    public void close() {
        closed = true;
    }

    private void record(String sql) {
        for (String f : failOn) {
            if (sql.contains(f)) {
                throw new DatabaseException("relation \"" + f + "\" does not exist", "42P01", sql, null);
            }
        }
        statements.add(sql);
    }

    private long answer(String sql) {
        for (Map.Entry<String, Long> e : answers.entrySet()) {
            if (sql.contains(e.getKey())) return e.getValue();
        }
        return 0L;
    }
}
