package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.HtmlReportGenerator;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Cancellation;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Writes a self-contained HTML page with every loaded element of a commit.
 */
@Command(
    name = "html",
    mixinStandardHelpOptions = true,
    description = "Export a project to a browsable HTML page"
)
public class HtmlCommand extends ProjectCommand {

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--paged"}, description = "Load elements through the paged element list instead of the tree")
    private boolean paged;

    @Option(names = {"--limit"}, description = "Stop after expanding this many nodes (default: no limit)",
        paramLabel = "<n>", defaultValue = "0")
    private int limit;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public HtmlCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException {
        String projectName = projectName(client);
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        if (paged) {
            session.loadAllElements(SysMLApiClient.DEFAULT_PAGE_SIZE, Cancellation.NONE);
        } else {
            try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
                materialize(session, materializer, null, Integer.MAX_VALUE, limit);
            }
        }
        if (session.cache().isEmpty()) {
            System.err.println("[ERROR] No elements loaded; nothing to export.");
            return 1;
        }

        String html = new HtmlReportGenerator().generate(projectName, commit.id(), session.cache().snapshot(),
            LocalDate.now());
        Path out = FileUtils.write(FileUtils.timestampedFile(outputDir, "sysml_export", projectName, "html"), html);
        System.out.printf("  [OK]  %s (%d elements)%n", out, session.cache().size());
        return 0;
    }
}
