package domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A data test declared in a model header.
 *
 * <p>{@link Kind#UNIQUE} renders a query returning duplicate-key rows (pass iff empty); the other
 * kinds render a single {@code violations} count (pass iff 0).</p>
 */
public final class DataTest {

    public enum Kind {
        NOT_NULL,
        UNIQUE,
        ACCEPTED_VALUES,
        RELATIONSHIPS
    }

    private final Kind kind;
    private final List<String> columns;
    private final List<String> values;
    private final Relation targetTable;
    private final String targetColumn;

    private DataTest(Kind kind, List<String> columns, List<String> values, Relation targetTable, String targetColumn) {
        this.kind = kind;
        this.columns = List.copyOf(columns);
        this.values = List.copyOf(values);
        this.targetTable = targetTable;
        this.targetColumn = targetColumn;
    }

    public static DataTest notNull(String column) {
        return new DataTest(Kind.NOT_NULL, List.of(column), List.of(), null, null);
    }

    public static DataTest unique(List<String> columns) {
        return new DataTest(Kind.UNIQUE, columns, List.of(), null, null);
    }

    public static DataTest acceptedValues(String column, List<String> values) {
        return new DataTest(Kind.ACCEPTED_VALUES, List.of(column), values, null, null);
    }

    public static DataTest relationships(String column, Relation targetTable, String targetColumn) {
        return new DataTest(Kind.RELATIONSHIPS, List.of(column), List.of(), targetTable, targetColumn);
    }

    public Kind getKind() {
        return kind;
    }

    /** First (or only) column under test. */
    public String getColumn() {
        return columns.get(0);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getValues() {
        return values;
    }

    public Relation getTargetTable() {
        return targetTable;
    }

    public String getTargetColumn() {
        return targetColumn;
    }

    /** True when the query returns rows rather than a {@code violations} count. */
    public boolean returnsRows() {
        return kind == Kind.UNIQUE;
    }

    public String toSql(Relation model) {
        return switch (kind) {
            case NOT_NULL -> "SELECT COUNT(*) as violations FROM " + model
                    + " WHERE " + SqlIdentifierUtil.quoteIdent(getColumn()) + " IS NULL";
            case UNIQUE -> {
                String cols = columns.stream()
                        .map(SqlIdentifierUtil::quoteIdent)
                        .collect(Collectors.joining(", "));
                yield "SELECT " + cols + ", COUNT(*) as cnt FROM " + model
                        + " GROUP BY " + cols + " HAVING COUNT(*) > 1";
            }
            case ACCEPTED_VALUES -> "SELECT COUNT(*) as violations FROM " + model
                    + " WHERE " + SqlIdentifierUtil.quoteIdent(getColumn()) + " NOT IN ("
                    + values.stream().map(SqlIdentifierUtil::quoteLiteral).collect(Collectors.joining(", "))
                    + ")";
            case RELATIONSHIPS -> "SELECT COUNT(*) as violations FROM " + model + " m"
                    + " WHERE m." + SqlIdentifierUtil.quoteIdent(getColumn()) + " IS NOT NULL"
                    + " AND NOT EXISTS (SELECT 1 FROM " + targetTable + " t"
                    + " WHERE t." + SqlIdentifierUtil.quoteIdent(targetColumn)
                    + " = m." + SqlIdentifierUtil.quoteIdent(getColumn()) + ")";
        };
    }

    /** Header form, e.g. {@code accepted_values(status, [a, b])}. */
    public String description() {
        return switch (kind) {
            case NOT_NULL -> "not_null(" + getColumn() + ")";
            case UNIQUE -> "unique(" + String.join(", ", columns) + ")";
            case ACCEPTED_VALUES -> "accepted_values(" + getColumn() + ", [" + String.join(", ", values) + "])";
            case RELATIONSHIPS -> "relationships(" + getColumn() + ", " + targetTable + "." + targetColumn + ")";
        };
    }

    @Override
    public String toString() {
        return description();
    }
}
