package domain.model;

import domain.error.HeaderParseException;

/**
 * Physical object type a model compiles to.
 */
public enum Materialized {
    VIEW("view"),
    TABLE("table"),
    INCREMENTAL("incremental");

    private final String keyword;

    Materialized(String keyword) {
        this.keyword = keyword;
    }

    public static Materialized parse(String raw) {
        String v = raw == null ? "" : raw.trim();
        for (Materialized m : values()) {
            if (m.keyword.equals(v)) return m;
        }
        throw new HeaderParseException("invalid materialized value: " + v
                + " (expected one of: view, table, incremental)");
    }

    /** Header keyword ({@code view}, {@code table}, {@code incremental}). */
    public String keyword() {
        return keyword;
    }
}
