package domain.analyze;

import java.util.ArrayList;
import java.util.List;

/** Splits SQL text on top-level {@code ;}, ignoring strings, quoted identifiers and comments. */
public final class SqlStatementSplitter {
    private SqlStatementSplitter() {
    }

    /**
     * Statements without their terminating {@code ;}. Chunks holding only whitespace and comments
     * are dropped.
     */
    public static List<String> split(String sql) {
        List<String> out = new ArrayList<>();
        if (sql == null || sql.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        boolean substantive = false;
        SqlScan st = new SqlScan(sql);

        while (st.hasNext()) {
            if (st.peekIsLineComment()) { cur.append(st.readLineComment()); continue; }
            if (st.peekIsBlockComment()) { cur.append(st.readBlockComment()); continue; }
            if (st.peekIsSingleQuotedString()) { cur.append(st.readSingleQuotedString()); substantive = true; continue; }
            if (st.peekIsDoubleQuotedString()) { cur.append(st.readDoubleQuotedString()); substantive = true; continue; }
            if (st.peekIsDollarQuote()) { cur.append(st.readDollarQuoted()); substantive = true; continue; }

            char ch = st.read();
            if (ch == ';') {
                if (substantive) out.add(cur.toString().trim());
                cur.setLength(0);
                substantive = false;
            } else {
                cur.append(ch);
                if (!Character.isWhitespace(ch)) substantive = true;
            }
        }

        if (substantive) out.add(cur.toString().trim());
        return out;
    }

    /** {@code "select 1;  "} -> {@code "select 1"}. Only the trailing terminator is removed. */
    public static String stripTrailingSemicolon(String sql) {
        String s = sql == null ? "" : sql.trim();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
