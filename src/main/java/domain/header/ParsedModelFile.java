package domain.header;

import domain.model.ModelHeader;

/**
 * Result of parsing one model file: validated header, trimmed body and optional incremental sections.
 */
public final class ParsedModelFile {

    private final ModelHeader header;
    private final String bodySql;
    private final String baseSql;
    private final String incrementalSql;

    ParsedModelFile(ModelHeader header, String bodySql, String baseSql, String incrementalSql) {
        this.header = header;
        this.bodySql = bodySql;
        this.baseSql = baseSql;
        this.incrementalSql = incrementalSql;
    }

    public ModelHeader getHeader() {
        return header;
    }

    public String getBodySql() {
        return bodySql;
    }

    /** Nullable. */
    public String getBaseSql() {
        return baseSql;
    }

    /** Nullable. */
    public String getIncrementalSql() {
        return incrementalSql;
    }
}
