package domain.graph;

import domain.error.GraphException;
import domain.model.Model;
import domain.model.Project;
import domain.model.Relation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dependency DAG over the models of a {@link Project}.
 *
 * <p>Edges come from declared {@code deps:} only, restricted to in-project models; deps on sources
 * or unknown relations never create edges. All orders are deterministic: ties are broken by
 * relation order.</p>
 */
public final class ModelGraph {

    private final Project project;
    /** model -> in-project deps (with duplicates, as declared) */
    private final Map<Relation, List<Relation>> deps = new TreeMap<>();
    /** model -> models depending on it */
    private final Map<Relation, List<Relation>> dependents = new TreeMap<>();

    private ModelGraph(Project project) {
        this.project = project;
        for (Relation id : project.getModels().keySet()) {
            deps.put(id, new ArrayList<>());
            dependents.put(id, new ArrayList<>());
        }
        for (Model m : project.getModels().values()) {
            for (Relation dep : m.getHeader().getDeps()) {
                if (project.isModel(dep)) {
                    deps.get(m.getId()).add(dep);
                    dependents.get(dep).add(m.getId());
                }
            }
        }
    }

    public static ModelGraph of(Project project) {
        return new ModelGraph(project);
    }

    public Project getProject() {
        return project;
    }

    /** Distinct in-project deps of {@code id}, sorted. */
    public List<Relation> depsOf(Relation id) {
        return new ArrayList<>(new TreeSet<>(deps.getOrDefault(id, List.of())));
    }

    /** Distinct direct dependents of {@code id}, sorted. */
    public List<Relation> dependentsOf(Relation id) {
        return new ArrayList<>(new TreeSet<>(dependents.getOrDefault(id, List.of())));
    }

    /**
     * Kahn's algorithm by layers: layer 0 has no in-project deps, layer n depends only on
     * earlier layers. Each layer is sorted.
     *
     * @throws GraphException naming every model left with unresolved deps when a cycle exists
     */
    public List<List<Relation>> topoSortLayers() {
        Map<Relation, Integer> inDegree = new TreeMap<>();
        for (Map.Entry<Relation, List<Relation>> e : deps.entrySet()) {
            inDegree.put(e.getKey(), e.getValue().size());
        }

        List<List<Relation>> layers = new ArrayList<>();
        List<Relation> current = new ArrayList<>();
        for (Map.Entry<Relation, Integer> e : inDegree.entrySet()) {
            if (e.getValue() == 0) current.add(e.getKey());
        }

        int processed = 0;
        while (!current.isEmpty()) {
            Collections.sort(current);
            processed += current.size();
            List<Relation> next = new ArrayList<>();
            for (Relation rel : current) {
                for (Relation dependent : dependents.get(rel)) {
                    int d = inDegree.merge(dependent, -1, Integer::sum);
                    if (d == 0) next.add(dependent);
                }
            }
            layers.add(List.copyOf(current));
            current = next;
        }

        if (processed != inDegree.size()) {
            List<String> inCycle = new ArrayList<>();
            for (Map.Entry<Relation, Integer> e : inDegree.entrySet()) {
                if (e.getValue() > 0) inCycle.add(e.getKey().toString());
            }
            throw new GraphException("circular dependency: " + String.join(", ", inCycle));
        }
        return layers;
    }

    /** Every model exactly once, each after all of its in-project deps. */
    public List<Relation> topoSort() {
        List<Relation> out = new ArrayList<>();
        for (List<Relation> layer : topoSortLayers()) {
            out.addAll(layer);
        }
        return out;
    }

    /**
     * {@code target} and its transitive deps, dependencies before dependents (DFS post-order).
     */
    public List<Relation> upstreamOrder(Relation target) {
        requireModel(target);
        List<Relation> order = new ArrayList<>();
        visitUpstream(target, new HashSet<>(), new HashSet<>(), order);
        return order;
    }

    private void visitUpstream(Relation rel, Set<Relation> resolved, Set<Relation> onPath, List<Relation> order) {
        if (resolved.contains(rel)) return;
        if (!onPath.add(rel)) {
            throw new GraphException("circular dependency involving: " + rel);
        }
        for (Relation dep : deps.get(rel)) {
            visitUpstream(dep, resolved, onPath, order);
        }
        onPath.remove(rel);
        resolved.add(rel);
        order.add(rel);
    }

    /**
     * {@code target} and every transitive dependent, in global topological order.
     */
    public List<Relation> downstreamOrder(Relation target) {
        requireModel(target);
        Set<Relation> reached = new HashSet<>();
        Deque<Relation> queue = new ArrayDeque<>();
        reached.add(target);
        queue.add(target);
        while (!queue.isEmpty()) {
            Relation rel = queue.poll();
            for (Relation dependent : dependents.get(rel)) {
                if (reached.add(dependent)) queue.add(dependent);
            }
        }

        List<Relation> out = new ArrayList<>();
        for (Relation rel : topoSort()) {
            if (reached.contains(rel)) out.add(rel);
        }
        return out;
    }

    private void requireModel(Relation target) {
        if (!project.isModel(target)) {
            throw new GraphException("unknown model: " + target);
        }
    }
}
