package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.model.Element;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * Shows one project's details, commits and (optionally) branches.
 */
@Command(
    name = "commits",
    mixinStandardHelpOptions = true,
    description = "Show a project's details and commit history"
)
public class CommitsCommand extends ProjectCommand {

    @Option(names = {"--branches", "-b"}, description = "Also list branches")
    private boolean branches;

    public CommitsCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) {
        Element project = client.getProject(projectId);
        System.out.printf("%n%s%n  Project: %s%n%s%n", "─".repeat(60), project.displayName(), "─".repeat(60));
        System.out.printf("  @id:          %s%n", project.id());
        System.out.printf("  @type:        %s%n", project.type());
        System.out.printf("  description:  %s%n", orNone(project.string("description")));
        System.out.printf("  created:      %s%n", orNone(project.string("created")));

        List<Element> commits = client.getCommits(projectId);
        Element latest = SysMLApiClient.latestCommit(commits);
        System.out.printf("%nCommits (%d):%n", commits.size());
        for (Element commit : commits) {
            System.out.printf("  %s %-36s  %-25s  %s%n",
                commit == latest ? "*" : " ",
                commit.id(),
                orNone(commit.string("created")),
                commit.name() != null ? commit.name() : orNone(commit.string("description")));
        }
        if (latest != null) {
            System.out.println("  (* = latest)");
        }

        if (branches) {
            List<Element> list = client.getBranches(projectId);
            System.out.printf("%nBranches (%d):%n", list.size());
            for (Element branch : list) {
                System.out.printf("  %-36s  %s%n", branch.id(), branch.displayName());
            }
        }
        return 0;
    }

    private static String orNone(String value) {
        return value != null ? value : "(none)";
    }
}
