package infra.output;

import domain.model.Relation;
import domain.output.SqlOutputWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores compiled SQL into files.
 * <p>
 * Output layout: {@code <outDir>/<schema>/<name>.sql}
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public Path write(Path outDir, Relation model, String sqlText) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");

        Path targetDir = outDir.resolve(model.getSchema());
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + targetDir, e);
        }

        Path file = targetDir.resolve(model.getName() + ".sql");
        String text = sqlText == null ? "" : sqlText;
        if (!text.endsWith("\n")) text = text + "\n";
        try {
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write compiled SQL: " + file, e);
        }
        return file;
    }
}
