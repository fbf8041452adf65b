package domain.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import domain.model.Model;
import domain.model.Relation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Text renderings of the dependency graph restricted to a set of selected models.
 *
 * <p>Edges are drawn from every declared dep (sources included) to the dependent model.</p>
 */
public final class GraphRenderer {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ModelGraph graph;

    public GraphRenderer(ModelGraph graph) {
        this.graph = graph;
    }

    public String render(GraphFormat format, List<Relation> selected) {
        return switch (format) {
            case ASCII -> ascii(selected);
            case DOT -> dot(selected);
            case JSON -> json(selected);
            case MERMAID -> mermaid(selected);
        };
    }

    /** Topological layers restricted to {@code selected}; empty layers are dropped. */
    List<List<Relation>> layers(List<Relation> selected) {
        Set<Relation> keep = new TreeSet<>(selected);
        List<List<Relation>> out = new ArrayList<>();
        for (List<Relation> layer : graph.topoSortLayers()) {
            List<Relation> l = new ArrayList<>();
            for (Relation r : layer) {
                if (keep.contains(r)) l.add(r);
            }
            if (!l.isEmpty()) out.add(l);
        }
        return out;
    }

    private List<Relation> declaredDeps(Relation id) {
        return graph.getProject().find(id).map(Model::getHeader).map(h -> h.getDeps()).orElse(List.of());
    }

    String ascii(List<Relation> selected) {
        StringBuilder sb = new StringBuilder();
        List<List<Relation>> layers = layers(selected);
        for (int i = 0; i < layers.size(); i++) {
            sb.append("Layer ").append(i).append(":\n");
            for (Relation rel : layers.get(i)) {
                List<Relation> deps = declaredDeps(rel);
                sb.append("  ").append(rel);
                if (!deps.isEmpty()) {
                    sb.append(" <- [").append(join(deps)).append(']');
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    String dot(List<Relation> selected) {
        StringBuilder sb = new StringBuilder("digraph models {\n    rankdir=LR;\n");
        for (Relation rel : selected) {
            List<Relation> deps = declaredDeps(rel);
            if (deps.isEmpty()) {
                sb.append("    \"").append(rel).append("\";\n");
            }
            for (Relation dep : deps) {
                sb.append("    \"").append(dep).append("\" -> \"").append(rel).append("\";\n");
            }
        }
        return sb.append("}\n").toString();
    }

    String mermaid(List<Relation> selected) {
        StringBuilder sb = new StringBuilder("graph LR\n");
        for (Relation rel : selected) {
            List<Relation> deps = declaredDeps(rel);
            if (deps.isEmpty()) {
                sb.append("    ").append(rel).append('\n');
            }
            for (Relation dep : deps) {
                sb.append("    ").append(dep).append(" --> ").append(rel).append('\n');
            }
        }
        return sb.toString();
    }

    String json(List<Relation> selected) {
        List<List<String>> layers = new ArrayList<>();
        List<Map<String, String>> edges = new ArrayList<>();
        for (List<Relation> layer : layers(selected)) {
            List<String> names = new ArrayList<>();
            for (Relation rel : layer) {
                names.add(rel.toString());
                for (Relation dep : declaredDeps(rel)) {
                    Map<String, String> edge = new LinkedHashMap<>();
                    edge.put("from", dep.toString());
                    edge.put("to", rel.toString());
                    edges.add(edge);
                }
            }
            layers.add(names);
        }

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("layers", layers);
        root.put("edges", edges);
        try {
            return JSON.writeValueAsString(root) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render graph as json", e);
        }
    }

    private static String join(List<Relation> rels) {
        List<String> s = new ArrayList<>(rels.size());
        for (Relation r : rels) s.add(r.toString());
        return String.join(", ", s);
    }
}
