package domain.analyze;

import domain.error.ModelBuildException;
import domain.model.IssueKind;
import domain.model.IssueSink;
import domain.model.Model;
import domain.model.ModelIssue;
import domain.model.Project;
import domain.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compares a model's declared {@code deps:} with the relations its SQL actually references.
 *
 * <p>Classification of each reference:</p>
 * <ul>
 *   <li>2 parts, a project model other than self: inferred dependency</li>
 *   <li>2 parts, a declared source: ignored</li>
 *   <li>2 parts, neither: unknown</li>
 *   <li>1 part: unqualified</li>
 *   <li>more than 2 parts: unknown (over-qualified)</li>
 * </ul>
 */
public final class DependencyLinter {

    private static final Logger log = LoggerFactory.getLogger(DependencyLinter.class);

    private DependencyLinter() {
    }

    /**
     * Analyses the first-run SQL of the model (the {@code @base} section for sectioned incremental
     * models).
     *
     * @throws ModelBuildException when the SQL cannot be parsed
     */
    public static LintDepsResult lint(Project project, Model model) {
        var query = SqlStatementParser.parseQuery(model.firstRunSql());

        SortedSet<Relation> inferred = new TreeSet<>();
        SortedSet<String> unqualified = new TreeSet<>();
        SortedSet<String> unknown = new TreeSet<>();

        TableReferenceWalker.walk(query, (table, parts) -> {
            switch (parts.size()) {
                case 1 -> unqualified.add(parts.get(0));
                case 2 -> {
                    Relation rel = Relation.of(parts.get(0), parts.get(1));
                    if (project.isModel(rel)) {
                        if (!rel.equals(model.getId())) inferred.add(rel);
                    } else if (!project.isSource(rel)) {
                        unknown.add(rel.toString());
                    }
                }
                default -> unknown.add(String.join(".", parts));
            }
        });

        SortedSet<Relation> declared = new TreeSet<>();
        for (Relation dep : model.getHeader().getDeps()) {
            if (!project.isSource(dep)) declared.add(dep);
        }

        List<Relation> missing = new ArrayList<>();
        for (Relation r : inferred) {
            if (!declared.contains(r)) missing.add(r);
        }
        List<Relation> extra = new ArrayList<>();
        for (Relation r : declared) {
            if (!inferred.contains(r)) extra.add(r);
        }

        log.debug("lint {}: inferred={} declared={} unqualified={} unknown={}",
                model.getId(), inferred, declared, unqualified, unknown);

        return new LintDepsResult(
                new ArrayList<>(declared),
                new ArrayList<>(inferred),
                new ArrayList<>(unqualified),
                new ArrayList<>(unknown),
                missing,
                extra
        );
    }

    /**
     * Lints and reports findings to {@code sink}; a parse failure becomes a
     * {@link IssueKind#PARSE_ERROR} issue and {@code null} is returned.
     */
    public static LintDepsResult lint(Project project, Model model, IssueSink sink) {
        LintDepsResult r;
        try {
            r = lint(project, model);
        } catch (ModelBuildException e) {
            sink.report(ModelIssue.of(IssueKind.PARSE_ERROR, model, e.getMessage()));
            return null;
        }
        for (String u : r.getUnqualified()) {
            sink.report(ModelIssue.of(IssueKind.UNQUALIFIED, model, "unqualified relation: " + u));
        }
        for (String u : r.getUnknown()) {
            sink.report(ModelIssue.of(IssueKind.UNKNOWN, model, "unknown relation: " + u));
        }
        for (Relation m : r.getMissing()) {
            sink.report(ModelIssue.of(IssueKind.MISSING_DEP, model, "missing dep: " + m));
        }
        for (Relation x : r.getExtra()) {
            sink.report(ModelIssue.of(IssueKind.EXTRA_DEP, model, "extra dep: " + x));
        }
        return r;
    }

    /** Sorted deps the header should declare: inferred model deps plus the declared sources kept as-is. */
    public static List<Relation> fixedDeps(Model model, LintDepsResult result, Project project) {
        SortedSet<Relation> out = new TreeSet<>(result.getInferred());
        for (Relation dep : model.getHeader().getDeps()) {
            if (project.isSource(dep)) out.add(dep);
        }
        return new ArrayList<>(out);
    }
}
