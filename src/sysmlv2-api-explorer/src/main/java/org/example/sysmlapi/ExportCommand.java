package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.TextNotationGenerator;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Cancellation;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.ElementTreeNode;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Exports a project (or one element) as SysML v2 textual notation.
 */
@Command(
    name = "export",
    mixinStandardHelpOptions = true,
    description = "Export a project or element to SysML v2 textual notation (.sysml)"
)
public class ExportCommand extends ProjectCommand {

    @Parameters(index = "3", arity = "0..1", paramLabel = "<elementId>", description = "Export only this element")
    private String elementId;

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--with-dependencies"}, description = "Also cache root elements of used projects")
    private boolean withDependencies;

    @Option(names = {"--stdout"}, description = "Print to stdout instead of writing a file")
    private boolean stdout;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public ExportCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException {
        String projectName = projectName(client);
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        if (withDependencies) {
            List<String> loaded = session.loadDependencies(Cancellation.NONE);
            Logger.info("Loaded %d dependency project(s)", loaded.size());
        }

        ElementTreeNode root;
        try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
            root = materialize(session, materializer, elementId, Integer.MAX_VALUE, 0);
        }

        TextNotationGenerator generator = new TextNotationGenerator(session.cache());
        StringBuilder text = new StringBuilder(TextNotationGenerator.header(projectName, commit.name(), commit.id(),
            LocalDateTime.now()));
        if (elementId != null) {
            text.append(generator.generate(root.element()));
        } else {
            List<Element> topLevel = new ArrayList<>();
            for (ElementTreeNode node : root.children()) {
                topLevel.add(node.element());
            }
            text.append(generator.generateAll(topLevel));
        }

        if (stdout) {
            System.out.print(text);
            return 0;
        }
        Path out = FileUtils.write(FileUtils.timestampedFile(outputDir, "sysml_export", projectName, "sysml"),
            text.toString());
        System.out.printf("  [OK]  %s%n", out);
        return 0;
    }
}
