package org.example.sysmlapi;

import org.example.sysmlapi.client.AccessibilityProbe;
import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.model.Element;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * Lists the projects visible to the user.
 */
@Command(
    name = "projects",
    mixinStandardHelpOptions = true,
    description = "List projects on the SysML v2 API server"
)
public class ProjectsCommand extends ApiCommand {

    @Option(names = {"--accessible", "-a"}, description = "Only list projects whose commits can be read")
    private boolean accessibleOnly;

    public ProjectsCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) {
        List<Element> projects = client.getProjects();
        if (accessibleOnly) {
            try (AccessibilityProbe probe = new AccessibilityProbe(client, settings.probeThreads())) {
                projects = probe.accessible(projects);
            }
        }

        System.out.println("=".repeat(100));
        System.out.printf("%-4s | %-50s | %-36s | %s%n", "#", "Name", "ID", "Created");
        System.out.println("-".repeat(100));
        for (int i = 0; i < projects.size(); i++) {
            Element p = projects.get(i);
            System.out.printf("%-4d | %-50s | %-36s | %s%n", i + 1, p.displayName(), p.id(),
                p.string("created") != null ? p.string("created") : "");
        }
        System.out.println("=".repeat(100));
        System.out.printf("%d project(s)%s%n", projects.size(), accessibleOnly ? " accessible" : "");
        return 0;
    }
}
