package infra.project;

import domain.error.ModelBuildException;
import domain.model.Relation;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Project settings resolved from CLI options, system properties, {@code modelbuild.properties} and defaults.
 *
 * <p>Resolution order per key:
 * <ol>
 *   <li>CLI option {@code --<key>=value}</li>
 *   <li>System property <b>modelbuild.&lt;key&gt;</b></li>
 *   <li>{@code <root>/modelbuild.properties}</li>
 *   <li>Default (and {@code DATABASE_URL} for the database URL)</li>
 * </ol>
 */
public final class ProjectConfig {

    public static final String FILE_NAME = "modelbuild.properties";
    public static final String SYSTEM_PREFIX = "modelbuild.";

    public static final String KEY_MODELS_DIR = "models.dir";
    public static final String KEY_SOURCES = "sources";
    public static final String KEY_DATABASE_URL = "database.url";
    public static final String KEY_DATABASE_USER = "database.user";
    public static final String KEY_DATABASE_PASSWORD = "database.password";

    public static final String DEFAULT_MODELS_DIR = "models";
    public static final String ENV_DATABASE_URL = "DATABASE_URL";

    private final Path root;
    private final Path modelsDir;
    private final Set<Relation> sources;
    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;

    private ProjectConfig(Path root, Path modelsDir, Set<Relation> sources,
                          String databaseUrl, String databaseUser, String databasePassword) {
        this.root = root;
        this.modelsDir = modelsDir;
        this.sources = Collections.unmodifiableSet(sources);
        this.databaseUrl = databaseUrl;
        this.databaseUser = databaseUser;
        this.databasePassword = databasePassword;
    }

    public static ProjectConfig load(Path root, Map<String, String> argv) {
        return load(root, argv, System.getenv());
    }

    static ProjectConfig load(Path root, Map<String, String> argv, Map<String, String> env) {
        Path r = root.toAbsolutePath().normalize();
        Properties file = readFile(r.resolve(FILE_NAME));

        String modelsRaw = resolve(KEY_MODELS_DIR, argv, file);
        Path modelsDir = r.resolve(modelsRaw == null ? DEFAULT_MODELS_DIR : modelsRaw).normalize();

        Set<Relation> sources = parseSources(resolve(KEY_SOURCES, argv, file));

        String url = resolve(KEY_DATABASE_URL, argv, file);
        if (url == null && env != null) url = trimToNull(env.get(ENV_DATABASE_URL));

        return new ProjectConfig(r, modelsDir, sources, url,
                resolve(KEY_DATABASE_USER, argv, file),
                resolve(KEY_DATABASE_PASSWORD, argv, file));
    }

    private static String resolve(String key, Map<String, String> argv, Properties file) {
        String v = argv == null ? null : trimToNull(argv.get(key));
        if (v != null) return v;
        v = trimToNull(System.getProperty(SYSTEM_PREFIX + key));
        if (v != null) return v;
        return trimToNull(file.getProperty(key));
    }

    private static Properties readFile(Path file) {
        Properties p = new Properties();
        if (!Files.isRegularFile(file)) return p;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            p.load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read project config: " + file, e);
        }
        return p;
    }

    static Set<Relation> parseSources(String raw) {
        Set<Relation> out = new LinkedHashSet<>();
        if (raw == null) return out;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (t.isEmpty()) continue;
            try {
                out.add(Relation.parse(t));
            } catch (ModelBuildException e) {
                throw e.withContext(KEY_SOURCES);
            }
        }
        return out;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    public Path getRoot() {
        return root;
    }

    public Path getModelsDir() {
        return modelsDir;
    }

    public Set<Relation> getSources() {
        return sources;
    }

    /** Null when no URL is configured anywhere. */
    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public Path getTargetDir() {
        return root.resolve("target");
    }

    /** Lines for the {@code [CONF]} banner; the password is never shown. */
    public List<String> describe() {
        List<String> out = new ArrayList<>();
        out.add("root      = " + root);
        out.add("modelsDir = " + modelsDir);
        out.add("sources   = " + sources.size());
        out.add("database  = " + (databaseUrl == null ? "(not configured)" : redact(databaseUrl)));
        return out;
    }

    static String redact(String url) {
        return url.replaceAll("(://[^:/@]+:)[^@]*@", "$1***@")
                .replaceAll("(?i)(password=)[^&;]*", "$1***");
    }
}
