package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.generate.CommitDiff;
import org.example.sysmlapi.generate.ModificationPolicy;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.TreeMaterializer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compares the root elements (or, with {@code --deep}, every loaded element)
 * of two commits of one project.
 */
@Command(
    name = "diff",
    mixinStandardHelpOptions = true,
    description = "Compare two commits of a project (default: the two most recent)"
)
public class DiffCommand extends ProjectCommand {

    @Option(names = {"--base"}, description = "Base commit (default: second most recent)", paramLabel = "<id>")
    private String baseCommitId;

    @Option(names = {"--compare"}, description = "Compared commit (default: most recent)", paramLabel = "<id>")
    private String compareCommitId;

    @Option(names = {"--policy"}, description = "When an element counts as modified: ${COMPLETION-CANDIDATES} "
        + "(default: ${DEFAULT-VALUE})", paramLabel = "<policy>", defaultValue = "STRUCTURAL")
    private ModificationPolicy policy;

    @Option(names = {"--deep"}, description = "Compare the whole element tree, not only root elements")
    private boolean deep;

    public DiffCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) {
        List<Element> commits = client.getCommits(projectId).stream()
            .filter(c -> c.id() != null)
            .sorted(Comparator.comparing(c -> c.string("created") != null ? c.string("created") : ""))
            .collect(Collectors.toList());

        String baseId = baseCommitId;
        String compareId = compareCommitId;
        if (baseId == null || compareId == null) {
            if (commits.size() < 2) {
                System.err.printf("[ERROR] Project must have at least 2 commits to compare; it has %d.%n", commits.size());
                return 1;
            }
            if (compareId == null) compareId = commits.get(commits.size() - 1).id();
            if (baseId == null) baseId = commits.get(commits.size() - 2).id();
        }
        if (baseId.equals(compareId)) {
            System.err.println("[ERROR] Please select two different commits");
            return 2;
        }

        Logger.info("Comparing commits: %s vs %s", baseId, compareId);
        Session base = Session.open(client, projectId, baseId);
        Session compare = base.withCommit(compareId);

        CommitDiff diff = CommitDiff.compare(load(base, settings), load(compare, settings), policy);
        System.out.print(diff.report(baseId, compareId));
        Logger.info("Commit diff: %d added, %d removed, %d modified",
            diff.added().size(), diff.removed().size(), diff.modified().size());
        return 0;
    }

    private Map<String, Element> load(Session session, ExplorerSettings settings) {
        if (!deep) {
            Map<String, Element> byId = new LinkedHashMap<>();
            for (Element root : session.loadRoots()) {
                if (root.id() != null) byId.put(root.id(), root);
            }
            return byId;
        }
        try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
            materialize(session, materializer, null, Integer.MAX_VALUE, 0);
        }
        return session.cache().snapshot();
    }
}
