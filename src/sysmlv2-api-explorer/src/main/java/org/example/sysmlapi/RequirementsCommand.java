package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.RequirementsReport;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Cancellation;
import org.example.sysmlapi.session.Session;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Pages through every element of a commit and reports the requirement-related ones.
 */
@Command(
    name = "requirements",
    mixinStandardHelpOptions = true,
    description = "List requirement-related elements of a project and save them as JSON"
)
public class RequirementsCommand extends ProjectCommand {

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--page-size"}, description = "Elements per page (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>", defaultValue = "" + SysMLApiClient.DEFAULT_PAGE_SIZE)
    private int pageSize;

    @Option(names = {"--output", "-o"}, description = "Output directory (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "output")
    private Path outputDir;

    public RequirementsCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int validateProjectOptions() {
        if (pageSize < 1) {
            System.err.println("[ERROR] --page-size must be >= 1");
            return 2;
        }
        return 0;
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException {
        Element project = client.getProject(projectId);
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        int total = session.loadAllElements(pageSize, Cancellation.NONE);
        RequirementsReport report = RequirementsReport.of(project, commit, session.cache().snapshot().values());

        System.out.print(report.render());
        System.out.printf("%n%d element(s), %d requirement-related%n", total, report.requirements().size());

        String name = project.name() != null ? project.name() : projectId;
        Path out = FileUtils.write(outputDir.resolve("requirements_" + FileUtils.safeFileName(name) + ".json"),
            report.toJson().toString(2));
        System.out.printf("  [OK]  %s%n", out);
        return 0;
    }
}
