package domain.graph;

import domain.error.GraphException;
import domain.model.Model;
import domain.model.Relation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves selectors against a {@link ModelGraph}.
 */
public final class SelectorResolver {

    private final ModelGraph graph;

    public SelectorResolver(ModelGraph graph) {
        this.graph = graph;
    }

    public Set<Relation> resolve(Selector selector) {
        Set<Relation> out = new HashSet<>();
        if (selector.getKind() != Selector.Kind.TAG && !graph.getProject().isModel(selector.getRelation())) {
            throw new GraphException("model not found: " + selector.getRelation());
        }
        switch (selector.getKind()) {
            case EXACT -> out.add(selector.getRelation());
            case TAG -> {
                for (Model m : graph.getProject().getModels().values()) {
                    if (m.getHeader().getTags().contains(selector.getTag())) out.add(m.getId());
                }
            }
            case DEPS -> out.addAll(graph.upstreamOrder(selector.getRelation()));
            case DOWNSTREAM -> out.addAll(graph.downstreamOrder(selector.getRelation()));
            case TREE -> {
                out.addAll(graph.upstreamOrder(selector.getRelation()));
                out.addAll(graph.downstreamOrder(selector.getRelation()));
            }
        }
        return out;
    }

    /**
     * Union of {@code selectors} (all models when empty) minus the union of {@code excludes},
     * in global topological order.
     */
    public List<Relation> apply(List<String> selectors, List<String> excludes) {
        List<Selector> include = parseAll(selectors);
        List<Selector> exclude = parseAll(excludes);

        Set<Relation> selected = new HashSet<>();
        if (include.isEmpty()) {
            selected.addAll(graph.getProject().getModels().keySet());
        } else {
            for (Selector s : include) selected.addAll(resolve(s));
        }
        for (Selector s : exclude) selected.removeAll(resolve(s));

        List<Relation> out = new ArrayList<>();
        for (Relation rel : graph.topoSort()) {
            if (selected.contains(rel)) out.add(rel);
        }
        return out;
    }

    private static List<Selector> parseAll(List<String> raw) {
        List<Selector> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            out.add(Selector.parse(s));
        }
        return out;
    }
}
