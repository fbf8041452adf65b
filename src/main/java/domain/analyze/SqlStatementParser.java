package domain.analyze;

import domain.error.DependencyException;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

import java.util.List;

/**
 * Parses a model body into exactly one query AST.
 */
public final class SqlStatementParser {
    private SqlStatementParser() {
    }

    public static Select parseQuery(String sql) {
        List<String> statements = SqlStatementSplitter.split(sql);
        if (statements.size() != 1) {
            throw new DependencyException("expected exactly one SQL statement, found " + statements.size());
        }

        Statement stmt;
        try {
            stmt = CCJSqlParserUtil.parse(statements.get(0));
        } catch (JSQLParserException e) {
            throw new DependencyException("parse SQL: " + firstLine(e), e);
        }

        if (stmt instanceof Select) {
            return (Select) stmt;
        }
        throw new DependencyException("unsupported statement kind in model (expected query): "
                + stmt.getClass().getSimpleName());
    }

    private static String firstLine(Exception e) {
        Throwable t = e.getCause() != null ? e.getCause() : e;
        String m = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        int nl = m.indexOf('\n');
        return nl < 0 ? m.trim() : m.substring(0, nl).trim();
    }
}
