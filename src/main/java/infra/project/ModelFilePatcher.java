package infra.project;

import domain.error.ModelBuildException;
import domain.header.ModelFileParser;
import domain.model.Relation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * In-place fixes of model files on disk.
 *
 * <p>Works on the raw file text split at the header/body boundary so unrelated lines keep their
 * formatting. Each file is written to a sibling temp file and moved over the original.</p>
 */
public final class ModelFilePatcher {

    static final String DEPS_PREFIX = "-- deps:";

    private ModelFilePatcher() {
    }

    /**
     * Replaces the {@code -- deps:} header line with {@code deps}, sorted.
     */
    public static void rewriteDepsLine(Path modelFile, List<Relation> deps) {
        String text = read(modelFile);
        ModelFileParser.Split split = ModelFileParser.split(text);

        String newLine = renderDepsLine(deps);
        List<String> header = new ArrayList<>(split.getHeaderLines());
        boolean replaced = false;
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().startsWith(DEPS_PREFIX)) {
                header.set(i, newLine);
                replaced = true;
            }
        }
        if (!replaced) {
            throw new ModelBuildException("missing required '-- deps:' line in header: " + modelFile);
        }

        StringBuilder out = new StringBuilder();
        for (String line : header) {
            out.append(line).append('\n');
        }
        out.append(split.getBody());
        if (out.charAt(out.length() - 1) != '\n') out.append('\n');
        writeAtomically(modelFile, out.toString());
    }

    static String renderDepsLine(List<Relation> deps) {
        if (deps == null || deps.isEmpty()) return DEPS_PREFIX;
        List<String> parts = new ArrayList<>();
        for (Relation r : new TreeSet<>(deps)) {
            parts.add(r.toString());
        }
        return DEPS_PREFIX + " " + String.join(", ", parts);
    }

    /**
     * Keeps the header, then exactly one blank line, then {@code body} terminated by {@code ;}.
     */
    public static void rewriteBody(Path modelFile, String body) {
        String text = read(modelFile);
        List<String> header = new ArrayList<>(ModelFileParser.split(text).getHeaderLines());
        while (!header.isEmpty() && header.get(header.size() - 1).trim().isEmpty()) {
            header.remove(header.size() - 1);
        }

        String b = body == null ? "" : body.trim();
        if (!b.endsWith(";")) b = b + ";";

        StringBuilder out = new StringBuilder();
        for (String line : header) {
            out.append(line).append('\n');
        }
        out.append('\n').append(b).append('\n');
        writeAtomically(modelFile, out.toString());
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model for rewrite: " + file, e);
        }
    }

    static void writeAtomically(Path file, String content) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw new IllegalStateException("Failed to write model: " + file, e);
        }
    }

    private static void deleteQuietly(Path tmp, IOException primary) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }
}
