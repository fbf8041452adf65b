package domain.header;

import domain.error.BodyParseException;
import domain.error.ModelBuildException;
import domain.model.Materialized;
import domain.model.Model;
import domain.model.ModelHeader;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits model file text into header block and body, and the body of incremental models into
 * optional {@code -- @base} / {@code -- @incremental} sections.
 *
 * <p>The header is the prefix of blank and {@code --} comment lines. A section marker ends the
 * header and is kept as the first line of the body.</p>
 */
public final class ModelFileParser {

    static final String MARKER_BASE = "@base";
    static final String MARKER_INCREMENTAL = "@incremental";

    private ModelFileParser() {
    }

    /**
     * Header/body boundary of raw file text. Line separators inside the body are preserved.
     */
    public static final class Split {
        private final List<String> headerLines;
        private final String body;

        Split(List<String> headerLines, String body) {
            this.headerLines = List.copyOf(headerLines);
            this.body = body;
        }

        public List<String> getHeaderLines() {
            return headerLines;
        }

        /** Untrimmed remainder after the header block. */
        public String getBody() {
            return body;
        }
    }

    public static Split split(String text) {
        String[] lines = (text == null ? "" : text).split("\\R", -1);
        List<String> header = new ArrayList<>();
        int i = 0;
        for (; i < lines.length; i++) {
            String t = lines[i].trim();
            if (t.isEmpty()) {
                header.add(lines[i]);
                continue;
            }
            if (t.startsWith("--") && sectionMarker(t) == null) {
                header.add(lines[i]);
                continue;
            }
            break;
        }
        StringBuilder body = new StringBuilder();
        for (int j = i; j < lines.length; j++) {
            if (j > i) body.append('\n');
            body.append(lines[j]);
        }
        return new Split(header, body.toString());
    }

    /**
     * @param location file path used as error context
     */
    public static ParsedModelFile parse(String text, String location) {
        Split split = split(text);

        ModelHeader header;
        try {
            header = HeaderParser.parse(split.getHeaderLines());
        } catch (ModelBuildException e) {
            throw e.withContext("parse model header: " + location);
        }

        String body = split.getBody().trim();
        if (body.isEmpty()) {
            throw new BodyParseException("model body is empty: " + location);
        }

        try {
            return sections(header, body);
        } catch (ModelBuildException e) {
            throw e.withContext("parse model body: " + location);
        }
    }

    private static ParsedModelFile sections(ModelHeader header, String body) {
        String[] lines = body.split("\n", -1);
        int baseAt = -1;
        int incrementalAt = -1;
        for (int i = 0; i < lines.length; i++) {
            String marker = sectionMarker(lines[i].trim());
            if (marker == null) continue;
            if (MARKER_BASE.equals(marker)) {
                if (baseAt >= 0) throw new BodyParseException("duplicate -- @base marker");
                if (incrementalAt >= 0) throw new BodyParseException("-- @base must come before -- @incremental");
                baseAt = i;
            } else {
                if (incrementalAt >= 0) throw new BodyParseException("duplicate -- @incremental marker");
                if (baseAt < 0) throw new BodyParseException("-- @incremental requires a preceding -- @base section");
                incrementalAt = i;
            }
        }

        if (baseAt < 0) {
            return new ParsedModelFile(header, body, null, null);
        }
        if (header.getMaterialized() != Materialized.INCREMENTAL) {
            throw new BodyParseException("-- @base / -- @incremental sections are only allowed for materialized: incremental");
        }
        if (!join(lines, 0, baseAt).isEmpty()) {
            throw new BodyParseException("unexpected SQL before -- @base marker");
        }

        int baseEnd = incrementalAt >= 0 ? incrementalAt : lines.length;
        String base = join(lines, baseAt + 1, baseEnd);
        if (base.isEmpty()) {
            throw new BodyParseException("-- @base section is empty");
        }
        if (base.contains(Model.THIS_PLACEHOLDER)) {
            throw new BodyParseException("-- @base section must not reference ${this} (the target table does not exist on first run)");
        }

        String incremental = null;
        if (incrementalAt >= 0) {
            incremental = join(lines, incrementalAt + 1, lines.length);
            if (incremental.isEmpty()) {
                throw new BodyParseException("-- @incremental section is empty");
            }
        }
        return new ParsedModelFile(header, body, base, incremental);
    }

    /**
     * {@code -- @base} -> {@code @base}; null for any other line.
     */
    static String sectionMarker(String trimmedLine) {
        if (!trimmedLine.startsWith("--")) return null;
        String s = HeaderParser.stripCommentMarker(trimmedLine);
        if (MARKER_BASE.equals(s) || MARKER_INCREMENTAL.equals(s)) return s;
        return null;
    }

    private static String join(String[] lines, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (i > from) sb.append('\n');
            sb.append(lines[i]);
        }
        return sb.toString().trim();
    }
}
