package domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validated metadata from a model file's leading comment block.
 *
 * <p>Instances are built by the header parser, which enforces the cross-field rules
 * (incremental-only keys, {@code lookback} needs {@code watermark}, and so on).</p>
 */
public final class ModelHeader {

    private final Materialized materialized;
    private final List<Relation> deps;
    private final List<String> uniqueKey;
    private final List<DataTest> tests;
    private final List<String> tags;
    private final List<String> watermark;
    private final String lookback;
    private final String incrementalFilter;
    private final String description;

    private ModelHeader(Builder b) {
        this.materialized = b.materialized;
        this.deps = List.copyOf(b.deps);
        this.uniqueKey = List.copyOf(b.uniqueKey);
        this.tests = List.copyOf(b.tests);
        this.tags = List.copyOf(b.tags);
        this.watermark = b.watermark == null ? null : List.copyOf(b.watermark);
        this.lookback = b.lookback;
        this.incrementalFilter = b.incrementalFilter;
        this.description = b.description;
    }

    public static Builder builder(Materialized materialized) {
        return new Builder(materialized);
    }

    public Materialized getMaterialized() {
        return materialized;
    }

    public List<Relation> getDeps() {
        return deps;
    }

    public List<String> getUniqueKey() {
        return uniqueKey;
    }

    public List<DataTest> getTests() {
        return tests;
    }

    public List<String> getTags() {
        return tags;
    }

    public Optional<List<String>> getWatermark() {
        return Optional.ofNullable(watermark);
    }

    public Optional<String> getLookback() {
        return Optional.ofNullable(lookback);
    }

    public Optional<String> getIncrementalFilter() {
        return Optional.ofNullable(incrementalFilter);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public static final class Builder {
        private final Materialized materialized;
        private final List<Relation> deps = new ArrayList<>();
        private final List<String> uniqueKey = new ArrayList<>();
        private final List<DataTest> tests = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private List<String> watermark;
        private String lookback;
        private String incrementalFilter;
        private String description;

        private Builder(Materialized materialized) {
            this.materialized = materialized;
        }

        public Builder deps(List<Relation> v) {
            deps.addAll(v);
            return this;
        }

        public Builder uniqueKey(List<String> v) {
            uniqueKey.addAll(v);
            return this;
        }

        public Builder tests(List<DataTest> v) {
            tests.addAll(v);
            return this;
        }

        public Builder tags(List<String> v) {
            tags.addAll(v);
            return this;
        }

        public Builder watermark(List<String> v) {
            watermark = v;
            return this;
        }

        public Builder lookback(String v) {
            lookback = v;
            return this;
        }

        public Builder incrementalFilter(String v) {
            incrementalFilter = v;
            return this;
        }

        public Builder description(String v) {
            description = v;
            return this;
        }

        public ModelHeader build() {
            return new ModelHeader(this);
        }
    }
}
