package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.TraceabilityMatrix;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

@Command(
    name = "trace",
    mixinStandardHelpOptions = true,
    description = "Show a traceability matrix of the relationships between loaded elements"
)
public class TraceCommand extends ProjectCommand {

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--limit"}, description = "Stop after expanding this many nodes (default: no limit)",
        paramLabel = "<n>", defaultValue = "0")
    private int limit;

    @Option(names = {"--json"}, description = "Also write the matrix as JSON")
    private boolean json;

    @Option(names = {"--output", "-o"}, description = "Output directory for --json (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public TraceCommand(SysMLApiTool parent) {
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

        TraceabilityMatrix matrix = TraceabilityMatrix.of(session.cache().snapshot());
        System.out.print(matrix.render());

        if (json) {
            Path out = FileUtils.write(FileUtils.timestampedFile(outputDir, "traceability", projectName, "json"),
                matrix.toJson().toString(2));
            System.out.printf("%n  [OK]  %s%n", out);
        }
        return 0;
    }
}
