package domain.header;

import domain.error.HeaderParseException;
import domain.error.ModelBuildException;
import domain.model.Materialized;
import domain.model.ModelHeader;
import domain.model.Relation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns header comment lines ({@code -- key: value}) into a validated {@link ModelHeader}.
 *
 * <p>Unknown keys are ignored. A repeated key keeps its last value.</p>
 */
public final class HeaderParser {

    public static final String KEY_MATERIALIZED = "materialized";
    public static final String KEY_DEPS = "deps";
    public static final String KEY_UNIQUE_KEY = "unique_key";
    public static final String KEY_TESTS = "tests";
    public static final String KEY_TAGS = "tags";
    public static final String KEY_WATERMARK = "watermark";
    public static final String KEY_LOOKBACK = "lookback";
    public static final String KEY_INCREMENTAL_FILTER = "incremental_filter";
    public static final String KEY_DESCRIPTION = "description";

    private static final List<String> MATERIALIZED_MISSPELLINGS = List.of("materialize", "mat", "material");

    private HeaderParser() {
    }

    public static ModelHeader parse(List<String> headerLines) {
        Map<String, String> kv = keyValues(headerLines);

        String rawMaterialized = kv.get(KEY_MATERIALIZED);
        if (rawMaterialized == null) {
            for (String typo : MATERIALIZED_MISSPELLINGS) {
                if (kv.containsKey(typo)) {
                    throw new HeaderParseException("missing required header key: materialized (found '" + typo
                            + "', did you mean 'materialized'?)");
                }
            }
            throw new HeaderParseException("missing required header key: materialized");
        }
        Materialized materialized = Materialized.parse(rawMaterialized);

        List<String> uniqueKey = parseIdents(kv.getOrDefault(KEY_UNIQUE_KEY, ""));
        ModelHeader.Builder b = ModelHeader.builder(materialized)
                .deps(parseRelations(kv.getOrDefault(KEY_DEPS, "")))
                .uniqueKey(uniqueKey)
                .tests(TestSpecParser.parse(kv.getOrDefault(KEY_TESTS, "")))
                .tags(parseTags(kv.getOrDefault(KEY_TAGS, "")));

        List<String> watermark = kv.containsKey(KEY_WATERMARK) ? parseIdents(kv.get(KEY_WATERMARK)) : List.of();
        String lookback = blankToNull(kv.get(KEY_LOOKBACK));
        String filter = blankToNull(kv.get(KEY_INCREMENTAL_FILTER));
        boolean incremental = materialized == Materialized.INCREMENTAL;

        if (incremental && uniqueKey.isEmpty()) {
            throw new HeaderParseException("materialized: incremental requires unique_key");
        }
        if (!incremental) {
            requireIncremental(KEY_UNIQUE_KEY, !uniqueKey.isEmpty(), materialized);
            requireIncremental(KEY_WATERMARK, !watermark.isEmpty(), materialized);
            requireIncremental(KEY_LOOKBACK, lookback != null, materialized);
            requireIncremental(KEY_INCREMENTAL_FILTER, filter != null, materialized);
        }
        if (lookback != null && watermark.isEmpty()) {
            throw new HeaderParseException("lookback requires watermark");
        }
        if (!watermark.isEmpty() && filter != null) {
            throw new HeaderParseException("watermark and incremental_filter are mutually exclusive");
        }

        if (!watermark.isEmpty()) b.watermark(watermark);
        return b.lookback(lookback)
                .incrementalFilter(filter)
                .description(blankToNull(kv.get(KEY_DESCRIPTION)))
                .build();
    }

    private static void requireIncremental(String key, boolean present, Materialized actual) {
        if (present) {
            throw new HeaderParseException(key + " is only valid for materialized: incremental (got "
                    + actual.keyword() + ")");
        }
    }

    static Map<String, String> keyValues(List<String> lines) {
        Map<String, String> kv = new LinkedHashMap<>();
        for (String line : lines) {
            String s = line == null ? "" : line.trim();
            if (!s.startsWith("--")) continue;
            s = stripCommentMarker(s);
            int colon = s.indexOf(':');
            if (colon < 0) continue;
            kv.put(s.substring(0, colon).trim(), s.substring(colon + 1).trim());
        }
        return kv;
    }

    /** {@code "--- key: v"} -> {@code "key: v"}. */
    static String stripCommentMarker(String trimmedLine) {
        int i = 0;
        while (i < trimmedLine.length() && trimmedLine.charAt(i) == '-') i++;
        return trimmedLine.substring(i).trim();
    }

    static List<Relation> parseRelations(String raw) {
        List<Relation> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            if (part.isBlank()) continue;
            try {
                out.add(Relation.parse(part));
            } catch (ModelBuildException e) {
                throw e.withContext(KEY_DEPS);
            }
        }
        return out;
    }

    static List<String> parseIdents(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    static List<String> parseTags(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String part : raw.split(",")) {
            String tag = part.trim().toLowerCase(Locale.ROOT);
            if (tag.isEmpty()) continue;
            if (!isValidTag(tag)) {
                throw new HeaderParseException("invalid tag '" + part.trim()
                        + "': tags must contain only lowercase letters, numbers, underscores, and hyphens");
            }
            out.add(tag);
        }
        return out;
    }

    private static boolean isValidTag(String tag) {
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
            if (!ok) return false;
        }
        return true;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
