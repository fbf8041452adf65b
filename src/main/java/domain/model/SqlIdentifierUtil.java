package domain.model;

/**
 * Identifier and literal quoting for generated SQL.
 */
public final class SqlIdentifierUtil {
    private SqlIdentifierUtil() {
    }

    /** {@code name} -> {@code "name"}, embedded double quotes doubled. */
    public static String quoteIdent(String ident) {
        String s = ident == null ? "" : ident;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    /** {@code it's} -> {@code 'it''s'}. */
    public static String quoteLiteral(String value) {
        String s = value == null ? "" : value;
        return "'" + s.replace("'", "''") + "'";
    }

    /** {@code "schema"."name"} */
    public static String quoteRelation(Relation relation) {
        return quoteIdent(relation.getSchema()) + "." + quoteIdent(relation.getName());
    }
}
