package domain.analyze;

import domain.error.ModelBuildException;
import domain.model.IssueKind;
import domain.model.IssueSink;
import domain.model.Model;
import domain.model.ModelIssue;
import domain.model.Project;
import domain.model.Relation;
import net.sf.jsqlparser.statement.select.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Rewrites one-part table references to {@code schema.name} when exactly one model or source
 * (other than the model itself) carries that name.
 *
 * <p>Name matching is case-sensitive. The parsed AST is mutated and re-serialized only when at
 * least one reference was qualified.</p>
 */
public final class ReferenceQualifier {

    private static final Logger log = LoggerFactory.getLogger(ReferenceQualifier.class);

    private ReferenceQualifier() {
    }

    /**
     * @throws ModelBuildException when the SQL cannot be parsed
     */
    public static QualifyResult qualify(Project project, Model model) {
        Select query = SqlStatementParser.parseQuery(model.firstRunSql());

        List<String> unqualified = new ArrayList<>();
        List<String> ambiguous = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        boolean[] changed = {false};

        TableReferenceWalker.walk(query, (table, parts) -> {
            if (parts.size() != 1) return;
            String name = parts.get(0);

            List<Relation> candidates = candidatesByName(project, name);
            if (candidates.isEmpty()) {
                unknown.add(name);
                return;
            }
            List<Relation> others = candidates.stream()
                    .filter(r -> !r.equals(model.getId()))
                    .collect(Collectors.toList());
            if (others.isEmpty()) {
                unqualified.add(name);
            } else if (others.size() == 1) {
                Relation target = others.get(0);
                table.setSchemaName(target.getSchema());
                changed[0] = true;
                log.debug("qualify {}: {} -> {}", model.getId(), name, target);
            } else {
                ambiguous.add(name + " (candidates: "
                        + others.stream().map(Relation::toString).collect(Collectors.joining(", ")) + ")");
            }
        });

        String rewritten = changed[0] ? query.toString() : null;
        return new QualifyResult(changed[0], dedupe(unqualified), dedupe(ambiguous), dedupe(unknown), rewritten);
    }

    /**
     * Qualifies and reports findings to {@code sink}; a parse failure becomes a
     * {@link IssueKind#PARSE_ERROR} issue and {@code null} is returned.
     */
    public static QualifyResult qualify(Project project, Model model, IssueSink sink) {
        QualifyResult r;
        try {
            r = qualify(project, model);
        } catch (ModelBuildException e) {
            sink.report(ModelIssue.of(IssueKind.PARSE_ERROR, model, e.getMessage()));
            return null;
        }
        for (String u : r.getUnqualified()) {
            sink.report(ModelIssue.of(IssueKind.UNQUALIFIED, model, "unqualified relation: " + u));
        }
        for (String a : r.getAmbiguous()) {
            sink.report(ModelIssue.of(IssueKind.AMBIGUOUS, model, "ambiguous relation: " + a));
        }
        for (String u : r.getUnknown()) {
            sink.report(ModelIssue.of(IssueKind.UNKNOWN, model, "unknown relation: " + u));
        }
        return r;
    }

    /** Models and sources named {@code name}, sorted. */
    static List<Relation> candidatesByName(Project project, String name) {
        TreeSet<Relation> out = new TreeSet<>();
        for (Relation r : project.getModels().keySet()) {
            if (r.getName().equals(name)) out.add(r);
        }
        for (Relation r : project.getSources()) {
            if (r.getName().equals(name)) out.add(r);
        }
        return new ArrayList<>(out);
    }

    private static List<String> dedupe(List<String> in) {
        return new ArrayList<>(new TreeSet<>(in));
    }
}
