package org.example.sysmlapi;

import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.ExplorerSettings;
import org.example.sysmlapi.model.Element;
import org.example.sysmlapi.session.Session;
import org.example.sysmlapi.tree.ChildSlot;
import org.example.sysmlapi.tree.ElementTreeNode;
import org.example.sysmlapi.tree.TreeMaterializer;
import org.json.JSONArray;
import org.json.JSONObject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Displays the element tree of a project commit, loaded lazily from the API.
 *
 * Usage:
 *   tree user pass &lt;projectId&gt;                 -- top-level elements, two levels deep
 *   tree user pass &lt;projectId&gt; &lt;elementId&gt;     -- subtree of one element
 *   tree user pass &lt;projectId&gt; --all           -- every level
 *   tree user pass &lt;projectId&gt; -f json         -- JSON output
 *
 * Nodes that were not expanded are marked with {@code [+]}. Children that
 * failed to load are listed with {@code --show-failures}.
 */
@Command(
    name = "tree",
    mixinStandardHelpOptions = true,
    description = "Display a project's element tree as ASCII tree or JSON"
)
public class TreeCommand extends ProjectCommand {

    static final String UNEXPANDED_MARK = " [+]";

    @Parameters(index = "3", arity = "0..1", paramLabel = "<elementId>", description = "Start at this element")
    private String elementId;

    @Option(names = {"--commit", "-c"}, description = "Commit to read (default: latest)", paramLabel = "<id>")
    private String commitId;

    @Option(names = {"--depth", "-d"}, description = "Levels to expand (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>", defaultValue = "2")
    private int depth;

    @Option(names = {"--all"}, description = "Expand every level")
    private boolean all;

    @Option(names = {"--limit"}, description = "Stop after expanding this many nodes (default: no limit)",
        paramLabel = "<n>", defaultValue = "0")
    private int limit;

    @Option(names = {"--show-failures"}, description = "List children that could not be loaded")
    private boolean showFailures;

    @Option(names = {"-f", "--format"}, defaultValue = "text", description = "Output format: text (default) or json",
        paramLabel = "<fmt>")
    private String format;

    public TreeCommand(SysMLApiTool parent) {
        super(parent);
    }

    @Override
    protected int validateProjectOptions() {
        String fmt = format.toLowerCase();
        if (!fmt.equals("text") && !fmt.equals("json")) {
            System.err.println("[ERROR] --format must be: text or json");
            return 2;
        }
        if (depth < 0) {
            System.err.println("[ERROR] --depth must be >= 0");
            return 2;
        }
        return 0;
    }

    @Override
    protected int execute(SysMLApiClient client, ExplorerSettings settings) {
        Element commit = resolveCommit(client, commitId);
        Session session = openSession(client, commit);

        ElementTreeNode root;
        try (TreeMaterializer materializer = new TreeMaterializer(session.cache(), settings.expansionThreads())) {
            root = materialize(session, materializer, elementId, all ? Integer.MAX_VALUE : depth, limit);
        }

        if ("json".equalsIgnoreCase(format)) {
            System.out.println(toJson(root).toString(2));
        } else {
            renderAscii(root, "", true, true);
            System.out.printf("%n%d element(s) loaded%n", session.cache().size());
        }
        return 0;
    }

    // ── ASCII rendering ──────────────────────────────────────────────────────

    /**
     * @param node   node to render
     * @param prefix indentation prefix built by the caller
     * @param isLast whether this is the last sibling (selects └── vs ├──)
     * @param isRoot whether this is the top node (no connector printed)
     */
    private void renderAscii(ElementTreeNode node, String prefix, boolean isLast, boolean isRoot) {
        String label = node.label() + (node.hasPlaceholder() ? UNEXPANDED_MARK : "");
        if (!isRoot) {
            String connector = isLast ? "└── " : "├── ";
            System.out.println(prefix + connector + label);
        } else {
            System.out.println(label);
        }

        String childPrefix = prefix + (isRoot ? "" : (isLast ? "    " : "│   "));
        List<ElementTreeNode> children = node.hasPlaceholder() ? List.of() : node.children();
        List<ChildSlot> failures = showFailures ? node.failedSlots() : List.of();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1 && failures.isEmpty();
            renderAscii(children.get(i), childPrefix, last, false);
        }
        for (int i = 0; i < failures.size(); i++) {
            ChildSlot slot = failures.get(i);
            String connector = i == failures.size() - 1 ? "└── " : "├── ";
            System.out.println(childPrefix + connector + "[!] " + slot.id() + " (" + slot.reason() + ")");
        }
    }

    // ── JSON rendering ───────────────────────────────────────────────────────

    private JSONObject toJson(ElementTreeNode node) {
        JSONObject obj = new JSONObject();
        Element element = node.element();
        if (element != null) {
            obj.put("id", element.id());
            obj.put("type", element.simpleType());
            if (element.name() != null) obj.put("name", element.name());
        } else {
            obj.put("name", node.label());
        }
        obj.put("expanded", !node.hasPlaceholder());

        if (!node.hasPlaceholder()) {
            JSONArray children = new JSONArray();
            for (ElementTreeNode child : node.children()) {
                children.put(toJson(child));
            }
            obj.put("children", children);
        }
        if (showFailures && !node.failedSlots().isEmpty()) {
            JSONArray failed = new JSONArray();
            for (ChildSlot slot : node.failedSlots()) {
                failed.put(new JSONObject().put("id", slot.id()).put("reason", String.valueOf(slot.reason())));
            }
            obj.put("failed", failed);
        }
        return obj;
    }
}
