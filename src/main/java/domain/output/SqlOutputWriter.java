package domain.output;

import domain.model.Relation;

import java.nio.file.Path;

/** Writes compiled SQL for one model. */
public interface SqlOutputWriter {

    /**
     * @return the written file, or null when nothing was written
     */
    Path write(Path outDir, Relation model, String sqlText);
}
