package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.ExitCode;
import cli.ModelBuildCli;
import domain.analyze.DependencyLinter;
import domain.analyze.LintDepsResult;
import domain.analyze.QualifyResult;
import domain.analyze.ReferenceQualifier;
import domain.compile.ModelCompiler;
import domain.error.ModelBuildException;
import domain.error.ModelExecutionException;
import domain.graph.GraphFormat;
import domain.graph.GraphRenderer;
import domain.graph.ModelGraph;
import domain.graph.SelectorResolver;
import domain.model.IssueKind;
import domain.model.ListIssueSink;
import domain.model.Model;
import domain.model.ModelIssue;
import domain.model.Project;
import domain.model.Relation;
import domain.output.IssueReportWriter;
import domain.output.SqlOutputWriter;
import domain.run.DataTestResult;
import domain.run.DataTestRunner;
import domain.run.ExecutionResult;
import domain.run.ModelDatabase;
import domain.run.ModelExecutor;
import domain.run.ModelRunner;
import domain.run.RunListener;
import domain.run.RunSummary;
import infra.project.ModelFilePatcher;
import infra.project.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** CLI entry (invoked by {@link ModelBuildCli}). */
public final class ModelBuildCliApp {

    private static final Logger log = LoggerFactory.getLogger(ModelBuildCliApp.class);

    static final String OPT_SELECT = "select";
    static final String OPT_EXCLUDE = "exclude";
    static final String OPT_FORMAT = "format";
    static final String FLAG_FIX = "fix";
    static final String FLAG_DRY_RUN = "dry-run";
    static final String FLAG_FULL_REFRESH = "full-refresh";
    static final String FLAG_NO_REPORT = "noReport";
    static final String FLAG_HELP = "help";

    static final Set<String> FLAGS = Set.of(FLAG_FIX, FLAG_DRY_RUN, FLAG_FULL_REFRESH, FLAG_NO_REPORT, FLAG_HELP);

    private static final long CANCEL_WAIT_SECONDS = 30L;

    private static final String USAGE = String.join("\n",
            "usage: modelbuild <command> [options]",
            "",
            "commands:",
            "  compile      write target/compiled/<schema>/<name>.sql (--dry-run prints only)",
            "  run          materialize models in dependency order (--dry-run, --full-refresh)",
            "  test         run data tests declared in model headers",
            "  lint-deps    compare declared deps with deps inferred from SQL (--fix)",
            "  lint-qualify schema-qualify one-part table references (--fix)",
            "  check        lint-deps and lint-qualify without fixing",
            "  docs         write markdown docs under target/docs",
            "  graph        print the dependency graph (--format ascii|dot|json|mermaid)",
            "",
            "options:",
            "  --baseDir <dir>          project root (default: working directory)",
            "  --select <selector>      schema.name | tag:<t> | deps:<rel> | downstream:<rel> | tree:<rel>",
            "  --exclude <selector>     same grammar, removed from the selection",
            "  --models.dir, --sources, --database.url, --database.user, --database.password",
            "  --noReport               do not write target/reports/<command>-issues.csv");

    private final ModelBuildComponentsFactory factory;

    ModelBuildCliApp(ModelBuildComponentsFactory factory) {
        this.factory = factory;
    }

    public static ExitCode run(String[] args) {
        return new ModelBuildCliApp(new ModelBuildComponentsFactory()).execute(args);
    }

    ExitCode execute(String[] args) {
        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args, FLAGS);
        List<String> positionals = CliArgParser.positionals(args, FLAGS);

        if (CliArgParser.flag(argv, FLAG_HELP)) {
            System.out.println(USAGE);
            return ExitCode.OK;
        }
        if (positionals.isEmpty()) {
            System.out.println("[ERROR] missing command");
            System.out.println(USAGE);
            return ExitCode.USAGE;
        }
        String command = positionals.get(0);
        boolean quiet = "graph".equals(command);

        ProjectConfig config;
        try {
            config = ProjectConfig.load(CliPathResolver.resolveBaseDir(argv), argv);
        } catch (ModelBuildException | IllegalStateException e) {
            System.out.println("[ERROR] configuration: " + e.getMessage());
            return ExitCode.USAGE;
        }

        if (!quiet) {
            System.out.println("==================================================");
            System.out.println("[START] " + command);
            for (String line : config.describe()) {
                System.out.println("[CONF] " + line);
            }
            System.out.println("==================================================");
        }

        ExitCode code;
        try {
            code = switch (command) {
                case "compile" -> compile(config, argv);
                case "run" -> runModels(config, argv);
                case "test" -> test(config, argv);
                case "lint-deps" -> lintDeps(config, argv);
                case "lint-qualify" -> lintQualify(config, argv);
                case "check" -> check(config, argv);
                case "docs" -> docs(config, argv);
                case "graph" -> graph(config, argv);
                default -> {
                    System.out.println("[ERROR] unknown command: " + command);
                    System.out.println(USAGE);
                    yield ExitCode.USAGE;
                }
            };
        } catch (ModelExecutionException e) {
            printExecutionError(e);
            code = ExitCode.FAILURE;
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] " + e.getMessage());
            code = ExitCode.USAGE;
        } catch (ModelBuildException | IllegalStateException e) {
            log.debug("{} failed", command, e);
            System.out.println("[ERROR] " + e.getMessage());
            code = ExitCode.FAILURE;
        }

        if (!quiet) {
            System.out.println("==================================================");
            System.out.println("[DONE] " + command + " exit=" + code.code() + " totalElapsed=" + ms(t0) + "ms");
            System.out.println("==================================================");
        }
        return code;
    }

    // ------------------------------------------------------------
    // commands
    // ------------------------------------------------------------

    private ExitCode compile(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        boolean dryRun = CliArgParser.flag(argv, FLAG_DRY_RUN);
        SqlOutputWriter writer = factory.createSqlOutputWriter(!dryRun);
        Path outDir = config.getTargetDir().resolve("compiled");

        for (Model model : selectModels(project, argv)) {
            String sql = ModelCompiler.compile(model);
            Path written = writer.write(outDir, model.getId(), sql);
            if (written == null) {
                System.out.println("-- " + model.getId());
                System.out.println(sql);
            } else {
                System.out.println("[OK] compiled " + model.getId() + " -> " + written);
            }
        }
        return ExitCode.OK;
    }

    private ExitCode runModels(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        List<Model> models = selectModels(project, argv);
        boolean fullRefresh = CliArgParser.flag(argv, FLAG_FULL_REFRESH);

        if (CliArgParser.flag(argv, FLAG_DRY_RUN)) {
            for (Model model : models) {
                System.out.println("-- " + model.getId() + " (" + model.getMaterialized().keyword() + ")");
                System.out.println(ModelCompiler.dryRunSql(model, fullRefresh));
            }
            return ExitCode.OK;
        }
        if (models.isEmpty()) {
            System.out.println("[RUN] no models selected");
            return ExitCode.OK;
        }

        AtomicBoolean cancelled = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancelled.set(true);
            System.out.println("[CANCEL] stopping after the current model...");
            try {
                finished.await(CANCEL_WAIT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "model-run-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        Thread heartbeat = CliProgressMonitor.startHeartbeat(models.size());
        try (ModelDatabase db = factory.openDatabase(config)) {
            ModelRunner runner = new ModelRunner(new ModelExecutor(db), cancelled);
            long loop0 = System.nanoTime();
            RunSummary summary = runner.run(models, fullRefresh, new RunListener() {
                @Override
                public void onModelStart(Model model, int index1Based, int total) {
                    CliProgressMonitor.setCurrent(model.getId().toString(), index1Based);
                    System.out.println("[RUN] " + index1Based + "/" + total + " " + model.getId());
                }

                @Override
                public void onModelDone(ExecutionResult result, int index1Based, int total) {
                    System.out.println("[OK] " + result.getModel() + " " + result.describe()
                            + " elapsed=" + result.getElapsedMs() + "ms");
                    CliProgressMonitor.logProgress(index1Based, total, loop0, result.getModel().toString());
                }
            });

            if (summary.isCancelled()) {
                System.out.println("[CANCELLED] completed " + summary.getCompleted().size() + "/" + summary.getTotal() + " models");
                return ExitCode.FAILURE;
            }
            System.out.println("[STAT] models=" + summary.getCompleted().size());
            return ExitCode.OK;
        } finally {
            heartbeat.interrupt();
            finished.countDown();
            removeShutdownHook(hook);
        }
    }

    private ExitCode test(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        List<Model> models = selectModels(project, argv);
        ListIssueSink sink = new ListIssueSink();

        List<DataTestResult> results;
        try (ModelDatabase db = factory.openDatabase(config)) {
            results = new DataTestRunner(db).run(models, sink);
        }

        int passed = 0;
        for (DataTestResult r : results) {
            if (r.isPassed()) {
                passed++;
                System.out.println("[OK] " + r.getModel() + " " + r.getTest().description());
            } else {
                System.out.println("[FAIL] " + r.getModel() + " " + r.getTest().description()
                        + (r.getError() != null ? " error=" + r.getError() : " violations=" + r.getViolations()));
            }
        }
        System.out.println("[STAT] tests=" + results.size() + " passed=" + passed + " failed=" + (results.size() - passed));
        return report("test", config, argv, sink);
    }

    private ExitCode lintDeps(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        boolean fix = CliArgParser.flag(argv, FLAG_FIX);
        ListIssueSink sink = new ListIssueSink();
        int fixed = 0;

        for (Model model : selectModels(project, argv)) {
            ListIssueSink local = new ListIssueSink();
            LintDepsResult r = DependencyLinter.lint(project, model, local);
            if (r != null && fix && r.isFixable()) {
                if (applyDepsFix(project, model, r, local)) {
                    fixed++;
                    local = withoutDepIssues(local);
                }
            } else if (r != null && fix && !r.getUnqualified().isEmpty()) {
                System.out.println("[SKIP] " + model.getId() + ": qualify references first (lint-qualify --fix)");
            }
            local.getIssues().forEach(sink::report);
        }

        if (fix) System.out.println("[STAT] fixed=" + fixed);
        return report("lint-deps", config, argv, sink);
    }

    private boolean applyDepsFix(Project project, Model model, LintDepsResult r, ListIssueSink local) {
        List<Relation> deps = DependencyLinter.fixedDeps(model, r, project);
        try {
            ModelFilePatcher.rewriteDepsLine(model.getPath(), deps);
        } catch (ModelBuildException | IllegalStateException e) {
            local.report(ModelIssue.of(IssueKind.FIX_FAILED, model, e.getMessage()));
            return false;
        }
        System.out.println("[FIXED] " + model.getId() + " deps: " + deps);
        return true;
    }

    private static ListIssueSink withoutDepIssues(ListIssueSink in) {
        ListIssueSink out = new ListIssueSink();
        for (ModelIssue issue : in.getIssues()) {
            if (issue.getKind() != IssueKind.MISSING_DEP && issue.getKind() != IssueKind.EXTRA_DEP) {
                out.report(issue);
            }
        }
        return out;
    }

    private ExitCode lintQualify(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        boolean fix = CliArgParser.flag(argv, FLAG_FIX);
        ListIssueSink sink = new ListIssueSink();
        int fixed = 0;

        for (Model model : selectModels(project, argv)) {
            QualifyResult r = ReferenceQualifier.qualify(project, model, sink);
            if (r == null || !r.isChanged()) continue;

            if (!fix) {
                sink.report(ModelIssue.of(IssueKind.UNQUALIFIED, model, "references can be qualified (rerun with --fix)"));
            } else if (model.getBaseSql().isPresent()) {
                sink.report(ModelIssue.of(IssueKind.FIX_FAILED, model,
                        "cannot rewrite a body with -- @base / -- @incremental sections; qualify manually"));
            } else {
                try {
                    ModelFilePatcher.rewriteBody(model.getPath(), r.getRewrittenSql());
                    fixed++;
                    System.out.println("[FIXED] " + model.getId() + " qualified references");
                } catch (IllegalStateException e) {
                    sink.report(ModelIssue.of(IssueKind.FIX_FAILED, model, e.getMessage()));
                }
            }
        }

        if (fix) System.out.println("[STAT] fixed=" + fixed);
        return report("lint-qualify", config, argv, sink);
    }

    private ExitCode check(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        ListIssueSink sink = new ListIssueSink();
        for (Model model : selectModels(project, argv)) {
            DependencyLinter.lint(project, model, sink);
            QualifyResult q = ReferenceQualifier.qualify(project, model, sink);
            if (q != null && q.isChanged()) {
                sink.report(ModelIssue.of(IssueKind.UNQUALIFIED, model, "references can be qualified (lint-qualify --fix)"));
            }
        }
        return report("check", config, argv, sink);
    }

    private ExitCode docs(ProjectConfig config, Map<String, String> argv) {
        Project project = factory.loadProject(config);
        ModelGraph graph = ModelGraph.of(project);
        List<String> selectors = CliArgParser.list(argv, OPT_SELECT);
        List<String> excludes = CliArgParser.list(argv, OPT_EXCLUDE);
        List<Relation> selected = new SelectorResolver(graph).apply(selectors, excludes);

        if (selected.isEmpty()) {
            System.out.println("[DOCS] no models found");
            return ExitCode.OK;
        }
        boolean all = selectors.isEmpty() && excludes.isEmpty();
        for (Path p : factory.createDocsWriter().write(config.getTargetDir().resolve("docs"), graph, selected, all)) {
            System.out.println("[OK] " + p);
        }
        return ExitCode.OK;
    }

    private ExitCode graph(ProjectConfig config, Map<String, String> argv) {
        GraphFormat format = GraphFormat.parse(argv.getOrDefault(OPT_FORMAT, "ascii"));
        Project project = factory.loadProject(config);
        ModelGraph graph = ModelGraph.of(project);
        List<Relation> selected = new SelectorResolver(graph)
                .apply(CliArgParser.list(argv, OPT_SELECT), CliArgParser.list(argv, OPT_EXCLUDE));
        System.out.print(new GraphRenderer(graph).render(format, selected));
        return ExitCode.OK;
    }

    // ------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------

    private static List<Model> selectModels(Project project, Map<String, String> argv) {
        ModelGraph graph = ModelGraph.of(project);
        List<Relation> ids = new SelectorResolver(graph)
                .apply(CliArgParser.list(argv, OPT_SELECT), CliArgParser.list(argv, OPT_EXCLUDE));
        List<Model> out = new ArrayList<>(ids.size());
        for (Relation id : ids) {
            project.find(id).ifPresent(out::add);
        }
        return out;
    }

    private ExitCode report(String command, ProjectConfig config, Map<String, String> argv, ListIssueSink sink) {
        List<ModelIssue> issues = sink.getIssues();
        for (ModelIssue issue : issues) {
            System.out.println("[ISSUE] " + issue.getModel() + " " + issue.getKind() + ": " + issue.getDetail());
        }
        System.out.println("[STAT] issues=" + issues.size());

        IssueReportWriter writer = factory.createIssueReportWriter(!CliArgParser.flag(argv, FLAG_NO_REPORT));
        Path reportFile = config.getTargetDir().resolve("reports").resolve(command + "-issues.csv");
        writer.write(reportFile, issues);

        return issues.isEmpty() ? ExitCode.OK : ExitCode.ISSUES;
    }

    private static void printExecutionError(ModelExecutionException e) {
        System.out.println("[ERROR] " + e.getMessage());
        if (!e.getSqlState().isEmpty()) {
            System.out.println("        sqlstate=" + e.getSqlState());
        }
        if (!e.getSqlPreview().isEmpty()) {
            System.out.println("        sql:");
            for (String line : e.getSqlPreview().split("\n")) {
                System.out.println("          " + line);
            }
        }
        for (String hint : e.getHints()) {
            System.out.println("        " + hint);
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("shutdown in progress, cancel hook stays registered");
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
