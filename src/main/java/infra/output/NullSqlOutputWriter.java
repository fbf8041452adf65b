package infra.output;

import domain.model.Relation;
import domain.output.SqlOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (dry-run).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public Path write(Path outDir, Relation model, String sqlText) {
        return null;
    }
}
