package infra.output;

import domain.graph.GraphFormat;
import domain.graph.GraphRenderer;
import domain.graph.ModelGraph;
import domain.model.DataTest;
import domain.model.Model;
import domain.model.Relation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Markdown model documentation.
 * <p>
 * Output layout: {@code <docsDir>/<schema>/<name>.md} per model, plus {@code <docsDir>/index.md}
 * (mermaid dependency graph and model index in topological order) when all models are documented.
 */
public final class MarkdownDocsWriter {

    /**
     * @return written files, index first when written
     */
    public List<Path> write(Path docsDir, ModelGraph graph, List<Relation> selected, boolean writeIndex) {
        List<Path> out = new ArrayList<>();
        if (writeIndex) {
            out.add(writeFile(docsDir.resolve("index.md"), index(graph)));
        }
        for (Relation id : selected) {
            Model model = graph.getProject().find(id)
                    .orElseThrow(() -> new IllegalArgumentException("model not found: " + id));
            Path file = docsDir.resolve(id.getSchema()).resolve(id.getName() + ".md");
            out.add(writeFile(file, modelDoc(model)));
        }
        return out;
    }

    static String index(ModelGraph graph) {
        List<Relation> sorted = graph.topoSort();
        StringBuilder sb = new StringBuilder("# Models\n\n");
        sb.append("## Dependency Graph\n\n");
        sb.append("```mermaid\n");
        sb.append(new GraphRenderer(graph).render(GraphFormat.MERMAID, sorted));
        sb.append("```\n\n");
        sb.append("## Models\n\n");
        for (Relation rel : sorted) {
            sb.append("- [").append(rel).append("](")
                    .append(rel.getSchema()).append('/').append(rel.getName()).append(".md)\n");
        }
        return sb.toString();
    }

    static String modelDoc(Model model) {
        StringBuilder sb = new StringBuilder("# ").append(model.getId()).append("\n\n");
        sb.append("**Materialized as:** ").append(model.getMaterialized().keyword()).append("\n\n");
        model.getHeader().getDescription().ifPresent(d -> sb.append(d).append("\n\n"));

        if (!model.getHeader().getTags().isEmpty()) {
            sb.append("**Tags:** ").append(String.join(", ", model.getHeader().getTags())).append("\n\n");
        }
        if (!model.getHeader().getDeps().isEmpty()) {
            sb.append("## Dependencies\n\n");
            for (Relation dep : model.getHeader().getDeps()) {
                sb.append("- ").append(dep).append('\n');
            }
            sb.append('\n');
        }
        if (!model.getHeader().getTests().isEmpty()) {
            sb.append("## Tests\n\n");
            for (DataTest t : model.getHeader().getTests()) {
                sb.append("- ").append(t.description()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## SQL\n\n```sql\n").append(model.getBodySql()).append("\n```\n");
        return sb.toString();
    }

    private static Path writeFile(Path file, String content) {
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write docs: " + file, e);
        }
        return file;
    }
}
