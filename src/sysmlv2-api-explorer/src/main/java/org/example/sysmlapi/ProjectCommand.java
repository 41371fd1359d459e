package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Cancellation;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.ElementTreeNode;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Base for subcommands that work on one project: adds the positional
 * {@code <projectId>} and the helpers to pick a commit and load its tree.
 */
abstract class ProjectCommand extends ApiCommand {

    @Parameters(index = "2", arity = "0..1", paramLabel = "<projectId>", description = "Project to read")
    protected String projectId;

    protected ProjectCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected final int validateOptions() {
        if (projectId == null || projectId.isBlank()) {
            System.err.println("[ERROR] <projectId> is required. Use 'projects' to list available projects.");
            return 2;
        }
        return validateProjectOptions();
    }

    protected int validateProjectOptions() {
        return 0;
    }

    // ── Commit and session ───────────────────────────────────────────────────

    /** The commit with id {@code commitId}, or the most recent one when {@code commitId} is null. */
    protected Element resolveCommit(SysMLApiClient client, String commitId) {
        List<Element> commits = client.getCommits(projectId);
        if (commitId == null) {
            Element latest = SysMLApiClient.latestCommit(commits);
            if (latest == null || latest.id() == null) {
                throw new IllegalStateException("No commits found in project " + projectId);
            }
            return latest;
        }
        return commits.stream()
            .filter(c -> commitId.equals(c.id()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Commit " + commitId + " not found in project " + projectId));
    }

    protected Session openSession(SysMLApiClient client, Element commit) {
        Logger.info("Commit: %s (%s)", commit.displayName(), commit.id());
        return Session.open(client, projectId, commit.id());
    }

    /** Project name, or the id when the project has none. */
    protected String projectName(SysMLApiClient client) {
        String name = client.getProject(projectId).name();
        return name != null ? name : projectId;
    }

    // ── Tree loading ─────────────────────────────────────────────────────────

    /**
     * Materializes the project tree (or the subtree of {@code elementId}) down
     * to {@code depth} levels. A positive {@code limit} stops expansion after
     * that many nodes.
     */
    protected ElementTreeNode materialize(Session session, TreeMaterializer materializer, String elementId,
                                          int depth, int limit) {
        ElementTreeNode root = elementId == null
            ? materializer.buildProjectTree(session.loadRoots())
            : materializer.createNode(session.cache().require(elementId));

        Cancellation cancellation = new Cancellation();
        int expanded = materializer.expandToDepth(root, depth, cancellation, count -> {
            if (count % 100 == 0) Logger.info("Expanded %d nodes, %d elements cached", count, session.cache().size());
            if (limit > 0 && count >= limit) cancellation.cancel();
        });
        if (cancellation.isCancelled()) {
            System.err.printf("[WARN]  Stopped after %d expanded node(s) (--limit)%n", expanded);
        }
        Logger.info("Expanded %d node(s); %d element(s) cached", expanded, session.cache().size());
        return root;
    }
}
