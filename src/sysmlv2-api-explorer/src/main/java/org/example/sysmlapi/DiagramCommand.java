package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.DiagramGenerator;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.ElementTreeNode;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Draws the containment structure of a project (or one element) with PlantUML.
 *
 * Usage:
 *   diagram user pass &lt;projectId&gt;                   -- all top-level elements, puml
 *   diagram user pass &lt;projectId&gt; &lt;elementId&gt; -f svg -- one element as SVG
 */
@Command(
    name = "diagram",
    mixinStandardHelpOptions = true,
    description = "Render a containment diagram (png, svg or puml)"
)
public class DiagramCommand extends ProjectCommand {

    @Parameters(index = "3", arity = "0..1", paramLabel = "<elementId>", description = "Draw only this element")
    private String elementId;

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--depth", "-d"}, description = "Levels drawn below the top elements (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>", defaultValue = "3")
    private int depth;

    @Option(names = {"-f", "--format"}, defaultValue = "puml", description = "Output format: puml (default), png or svg",
        paramLabel = "<fmt>")
    private String format;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public DiagramCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int validateProjectOptions() {
        try {
            DiagramGenerator.Format.parse(format);
        } catch (IllegalArgumentException e) {
            System.err.println("[ERROR] " + e.getMessage());
            return 2;
        }
        if (depth < 0) {
            System.err.println("[ERROR] --depth must be >= 0");
            return 2;
        }
        return 0;
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException {
        DiagramGenerator.Format fmt = DiagramGenerator.Format.parse(format);
        String projectName = projectName(client);
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        // The project tree has one synthetic level above the top elements.
        int levels = elementId == null ? depth + 1 : depth;
        ElementTreeNode root;
        try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
            root = materialize(session, materializer, elementId, levels, 0);
        }

        List<Element> top = new ArrayList<>();
        if (elementId != null) {
            top.add(root.element());
        } else {
            for (ElementTreeNode node : root.children()) {
                top.add(node.element());
            }
        }

        String title = elementId != null ? root.element().displayName() : projectName;
        String puml = new DiagramGenerator(session.cache(), depth).toPlantUml(title, top);
        byte[] content = DiagramGenerator.render(puml, fmt);

        Path out = FileUtils.write(FileUtils.timestampedFile(outputDir, "diagram", title, fmt.extension()), content);
        System.out.printf("  [OK]  %s%n", out);
        return 0;
    }
}
