package domain.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A user-authored SQL definition (header + body) compiling to one database object.
 *
 * <p>{@code baseSql}/{@code incrementalSql} are only present for incremental models whose body
 * carries {@code -- @base} / {@code -- @incremental} section markers.</p>
 */
public final class Model {

    public static final String THIS_PLACEHOLDER = "${this}";

    private final Relation id;
    private final Path path;
    private final ModelHeader header;
    private final String bodySql;
    private final String baseSql;
    private final String incrementalSql;

    public Model(Relation id, Path path, ModelHeader header, String bodySql, String baseSql, String incrementalSql) {
        this.id = id;
        this.path = path;
        this.header = header;
        this.bodySql = bodySql;
        this.baseSql = baseSql;
        this.incrementalSql = incrementalSql;
    }

    public Relation getId() {
        return id;
    }

    public Path getPath() {
        return path;
    }

    public ModelHeader getHeader() {
        return header;
    }

    public Materialized getMaterialized() {
        return header.getMaterialized();
    }

    public String getBodySql() {
        return bodySql;
    }

    public Optional<String> getBaseSql() {
        return Optional.ofNullable(baseSql);
    }

    public Optional<String> getIncrementalSql() {
        return Optional.ofNullable(incrementalSql);
    }

    /** SQL for a first run or full refresh. */
    public String firstRunSql() {
        return baseSql != null ? baseSql : bodySql;
    }

    /** SQL for a steady-state run, with {@code ${this}} replaced by the model id. */
    public String incrementalRunSql() {
        String sql = incrementalSql != null ? incrementalSql : firstRunSql();
        return sql.replace(THIS_PLACEHOLDER, id.toString());
    }

    /**
     * Predicate bounding an incremental run by the target's high-water mark, or empty when no
     * watermark is declared. Lookback is applied to the first watermark column only.
     */
    public Optional<String> watermarkFilterSql() {
        List<String> watermark = header.getWatermark().orElse(List.of());
        if (watermark.isEmpty()) return Optional.empty();
        String lookback = header.getLookback().orElse(null);

        if (watermark.size() == 1) {
            String col = SqlIdentifierUtil.quoteIdent(watermark.get(0));
            String max = lookback == null
                    ? "(SELECT MAX(" + col + ") FROM " + id + ")"
                    : "(SELECT MAX(" + col + ") - interval " + SqlIdentifierUtil.quoteLiteral(lookback) + " FROM " + id + ")";
            return Optional.of(col + " > " + max);
        }

        String cols = watermark.stream()
                .map(SqlIdentifierUtil::quoteIdent)
                .collect(Collectors.joining(", "));
        StringBuilder maxes = new StringBuilder();
        for (int i = 0; i < watermark.size(); i++) {
            if (i > 0) maxes.append(", ");
            maxes.append("MAX(").append(SqlIdentifierUtil.quoteIdent(watermark.get(i))).append(')');
            if (i == 0 && lookback != null) {
                maxes.append(" - interval ").append(SqlIdentifierUtil.quoteLiteral(lookback));
            }
        }
        return Optional.of("(" + cols + ") > (SELECT " + maxes + " FROM " + id + ")");
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
