package infra.db;

import domain.error.DatabaseException;
import domain.model.Relation;
import domain.model.SqlIdentifierUtil;
import domain.run.ModelDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ModelDatabase} over one JDBC connection (PostgreSQL).
 *
 * <p>Catalog lookups go through {@code information_schema} with bind parameters. Every
 * {@link SQLException} is rethrown as {@link DatabaseException} carrying its SQLSTATE.</p>
 */
public final class JdbcModelDatabase implements ModelDatabase {

    private static final Logger log = LoggerFactory.getLogger(JdbcModelDatabase.class);

    static final String SQL_SCHEMA_EXISTS =
            "SELECT 1 FROM information_schema.schemata WHERE schema_name = ?";
    static final String SQL_VIEW_EXISTS =
            "SELECT 1 FROM information_schema.views WHERE table_schema = ? AND table_name = ?";
    static final String SQL_TABLE_EXISTS =
            "SELECT 1 FROM information_schema.tables WHERE table_schema = ? AND table_name = ? AND table_type = 'BASE TABLE'";
    static final String SQL_TABLE_COLUMNS =
            "SELECT column_name FROM information_schema.columns WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position";

    private final Connection connection;

    public JdbcModelDatabase(Connection connection) {
        if (connection == null) throw new IllegalArgumentException("connection is null");
        this.connection = connection;
    }

    @Override
    public boolean schemaExists(String schema) {
        return exists(SQL_SCHEMA_EXISTS, schema);
    }

    @Override
    public void createSchema(String schema) {
        executeBatch("CREATE SCHEMA IF NOT EXISTS " + SqlIdentifierUtil.quoteIdent(schema));
    }

    @Override
    public boolean viewExists(Relation relation) {
        return exists(SQL_VIEW_EXISTS, relation.getSchema(), relation.getName());
    }

    @Override
    public boolean tableExists(Relation relation) {
        return exists(SQL_TABLE_EXISTS, relation.getSchema(), relation.getName());
    }

    @Override
    public List<String> tableColumns(Relation relation) {
        try (PreparedStatement ps = connection.prepareStatement(SQL_TABLE_COLUMNS)) {
            ps.setString(1, relation.getSchema());
            ps.setString(2, relation.getName());
            List<String> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw wrap(e, SQL_TABLE_COLUMNS);
        }
    }

    @Override
    public void executeBatch(String sql) {
        log.debug("execute: {}", sql);
        try (Statement st = connection.createStatement()) {
            st.execute(sql);
        } catch (SQLException e) {
            throw wrap(e, sql);
        }
    }

    @Override
    public long executeUpdate(String sql) {
        log.debug("update: {}", sql);
        try (Statement st = connection.createStatement()) {
            return st.executeLargeUpdate(sql);
        } catch (SQLException e) {
            throw wrap(e, sql);
        }
    }

    @Override
    public long queryForLong(String sql) {
        log.debug("query: {}", sql);
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw wrap(e, sql);
        }
    }

    @Override
    public long countRows(String sql) {
        log.debug("count rows: {}", sql);
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            long n = 0;
            while (rs.next()) n++;
            return n;
        } catch (SQLException e) {
            throw wrap(e, sql);
        }
    }

    @Override
    public int serverMajorVersion() {
        try {
            return connection.getMetaData().getDatabaseMajorVersion();
        } catch (SQLException e) {
            throw wrap(e, "");
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw wrap(e, "");
        }
    }

    private boolean exists(String sql, String... params) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw wrap(e, sql);
        }
    }

    static DatabaseException wrap(SQLException e, String sql) {
        String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return new DatabaseException(msg, e.getSQLState(), sql, e);
    }
}
