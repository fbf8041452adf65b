package domain.error;

/**
 * A database call failed. Raised by the database port so driver exceptions never leak into the engine.
 */
public class DatabaseException extends ModelBuildException {

    private final String sqlState;
    private final String sql;

    public DatabaseException(String detail, String sqlState, String sql, Throwable cause) {
        super(detail, cause);
        this.sqlState = sqlState == null ? "" : sqlState;
        this.sql = sql == null ? "" : sql;
    }

    /** Empty when the driver did not provide one. */
    public String getSqlState() {
        return sqlState;
    }

    public String getSql() {
        return sql;
    }
}
