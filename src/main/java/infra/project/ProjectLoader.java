package infra.project;

import domain.error.DependencyException;
import domain.error.ModelBuildException;
import domain.header.ModelFileParser;
import domain.header.ParsedModelFile;
import domain.model.Model;
import domain.model.Relation;
import domain.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads every {@code <modelsDir>/<schema>/<name>.sql} file into a {@link Project}.
 *
 * <p>The model id is derived from the path; nested directories are rejected. Files are parsed
 * in path order so the first error is deterministic.</p>
 */
public final class ProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

    private static final String LAYOUT_HINT = "expected models/<schema>/<name>.sql";

    private ProjectLoader() {
    }

    public static Project load(ProjectConfig config) {
        return load(config.getRoot(), config.getModelsDir(), config.getSources());
    }

    public static Project load(Path root, Path modelsDir, Set<Relation> sources) {
        if (!Files.isDirectory(modelsDir)) {
            throw new ModelBuildException("models directory not found: " + modelsDir);
        }

        Map<Relation, Model> models = new LinkedHashMap<>();
        for (Path file : scanSqlFiles(modelsDir)) {
            Relation id = modelIdFromPath(modelsDir, file);
            Model model = readModel(id, file);
            if (models.putIfAbsent(id, model) != null) {
                throw new ModelBuildException("duplicate model: " + id);
            }
        }
        log.debug("loaded {} model(s) from {}", models.size(), modelsDir);
        return new Project(root, models, sources);
    }

    static List<Path> scanSqlFiles(Path modelsDir) {
        List<Path> out = new ArrayList<>(64);
        try (Stream<Path> s = Files.walk(modelsDir)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName()
                            .toString()
                            .toLowerCase(Locale.ROOT)
                            .endsWith(".sql"))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan models under: " + modelsDir, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }

    static Relation modelIdFromPath(Path modelsDir, Path file) {
        Path rel = modelsDir.relativize(file);
        if (rel.getNameCount() < 2) {
            throw new ModelBuildException("model path missing schema directory (" + LAYOUT_HINT + "): " + file);
        }
        if (rel.getNameCount() > 2) {
            throw new ModelBuildException("nested paths not supported (" + LAYOUT_HINT + "): " + file);
        }
        String schema = rel.getName(0).toString();
        String fileName = rel.getName(1).toString();
        String name = fileName.substring(0, fileName.length() - ".sql".length());
        try {
            return Relation.of(schema, name);
        } catch (ModelBuildException e) {
            throw e.withContext("model path " + file);
        }
    }

    private static Model readModel(Relation id, Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model file: " + file, e);
        }
        ParsedModelFile parsed = ModelFileParser.parse(text, file.toString());
        if (parsed.getHeader().getDeps().contains(id)) {
            throw new DependencyException("model depends on itself: " + id).withContext(file.toString());
        }
        return new Model(id, file, parsed.getHeader(), parsed.getBodySql(),
                parsed.getBaseSql(), parsed.getIncrementalSql());
    }
}
