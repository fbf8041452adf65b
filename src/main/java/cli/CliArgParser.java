package cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CLI argument parsing helpers.
 *
 * <p>Options are {@code --key=value} or {@code --key value}. Repeated keys are joined with a comma,
 * so {@code --select a.x --select tag:daily} reads as {@code a.x,tag:daily}. Keys listed as flags
 * never consume the next argument.</p>
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--fix       => true</li>
     *   <li>--fix=true  => true</li>
     *   <li>--fix=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /** Comma-separated option as a list; empty when absent. */
    public static List<String> list(Map<String, String> argv, String key) {
        List<String> out = new ArrayList<>();
        String raw = argv == null ? null : argv.get(key);
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Arguments that are not options nor option values, in order. */
    public static List<String> positionals(String[] args, Set<String> flags) {
        List<String> out = new ArrayList<>();
        if (args == null) return out;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null || a.isBlank()) continue;
            a = a.trim();
            if (!a.startsWith("--")) {
                out.add(a);
                continue;
            }
            if (a.indexOf('=') < 0 && !flags.contains(a.substring(2).trim())
                    && i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                i++;
            }
        }
        return out;
    }

    public static Map<String, String> parseArgs(String[] args, Set<String> flags) {
        Map<String, String> m = new LinkedHashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (!flags.contains(k) && i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (k.isEmpty()) continue;
            m.merge(k, v, CliArgParser::join);
        }

        return m;
    }

    private static String join(String prev, String next) {
        if (prev.isEmpty()) return next;
        if (next.isEmpty()) return prev;
        return prev + "," + next;
    }
}
