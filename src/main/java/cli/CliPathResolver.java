package cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** CLI project root resolver (baseDir). */
public final class CliPathResolver {

    private CliPathResolver() {}

    public static final String OPT_BASE_DIR = "baseDir";
    public static final String PROP_BASE_DIR = "modelbuild.baseDir";

    /**
     * {@code --baseDir}, then {@code -Dmodelbuild.baseDir}, then the working directory.
     */
    public static Path resolveBaseDir(Map<String, String> argv) {
        String bd = (argv == null) ? null : trimToNull(argv.get(OPT_BASE_DIR));
        if (bd == null) bd = trimToNull(System.getProperty(PROP_BASE_DIR));
        if (bd != null) {
            return resolveAgainstUserDir(bd).toAbsolutePath().normalize();
        }
        return Paths.get(".").toAbsolutePath().normalize();
    }

    public static Path resolveAgainstUserDir(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Path p = Paths.get(raw.trim());
        if (p.isAbsolute()) return p;
        return Paths.get(System.getProperty("user.dir")).resolve(p);
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
