package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.ModelStatistics;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads the element tree of a commit and reports its composition.
 */
@Command(
    name = "stats",
    mixinStandardHelpOptions = true,
    description = "Generate model statistics for a project"
)
public class StatsCommand extends ProjectCommand {

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--limit"}, description = "Stop after expanding this many nodes (default: no limit)",
        paramLabel = "<n>", defaultValue = "0")
    private int limit;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public StatsCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException {
        String projectName = projectName(client);
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
            materialize(session, materializer, null, Integer.MAX_VALUE, limit);
        }

        List<Element> roots = client.getRoots(projectId, commit.id()).stream()
            .map(r -> session.cache().get(r.id()).orElse(r))
            .collect(Collectors.toList());
        ModelStatistics stats = ModelStatistics.of(session.cache().snapshot().values(), roots.size(),
            ModelStatistics.maxDepth(roots, session.cache()));

        String report = stats.report(projectName, projectId, commit.id());
        System.out.print(report);
        Path out = FileUtils.write(FileUtils.timestampedFile(outputDir, "model_statistics", projectName, "txt"), report);
        System.out.printf("%n  [OK]  %s%n", out);
        return 0;
    }
}
