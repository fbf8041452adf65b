package domain.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Models and declared sources loaded for one command invocation. Read-only.
 */
public final class Project {

    private final Path root;
    private final SortedMap<Relation, Model> models;
    private final SortedSet<Relation> sources;

    public Project(Path root, Map<Relation, Model> models, Set<Relation> sources) {
        this.root = root;
        this.models = Collections.unmodifiableSortedMap(new TreeMap<>(models));
        this.sources = Collections.unmodifiableSortedSet(new TreeSet<>(sources));
    }

    public Path getRoot() {
        return root;
    }

    /** Models keyed by id, in id order. */
    public SortedMap<Relation, Model> getModels() {
        return models;
    }

    public SortedSet<Relation> getSources() {
        return sources;
    }

    public Optional<Model> find(Relation id) {
        return Optional.ofNullable(models.get(id));
    }

    public boolean isModel(Relation id) {
        return models.containsKey(id);
    }

    public boolean isSource(Relation id) {
        return sources.contains(id);
    }
}
