package domain.graph;

import java.util.Locale;

/** Output formats of the dependency graph. */
public enum GraphFormat {
    ASCII,
    DOT,
    JSON,
    MERMAID;

    public static GraphFormat parse(String raw) {
        String v = raw == null || raw.isBlank() ? "ascii" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "ascii" -> ASCII;
            case "dot" -> DOT;
            case "json" -> JSON;
            case "mermaid" -> MERMAID;
            default -> throw new IllegalArgumentException("Unknown format: " + raw + ". Use: ascii, dot, json, mermaid");
        };
    }
}
