package org.example.sysmlapi;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import org.example.sysmlapi.config.Credentials;
import org.example.sysmlapi.config.CredentialsLoader;
import org.example.sysmlapi.config.ExplorerSettings;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "sysmlv2-explorer",
    versionProvider = SysMLApiTool.VersionProvider.class,
    description = "Browse, export and compare models served by a SysML v2 REST API."
)
public class SysMLApiTool implements Runnable {

    static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            Properties props = new Properties();
            try (InputStream is = SysMLApiTool.class.getResourceAsStream("/META-INF/sysmlv2-explorer-version.properties")) {
                if (is != null) {
                    props.load(is);
                    return new String[]{ props.getProperty("version", "unknown") };
                }
            }
            return new String[]{ "unknown" };
        }
    }

    @Spec
    CommandSpec spec;

    @Option(names = {"--base-url"}, description = "API base URL (default: SYSMLV2_BASE_URL, credentials file, or "
        + ExplorerSettings.DEFAULT_BASE_URL + ")", paramLabel = "<url>")
    private String baseUrl;

    @Option(names = {"--credentials"}, description = "Credentials properties file (default: ./credentials.properties)",
        paramLabel = "<file>", defaultValue = CredentialsLoader.CREDENTIALS_FILE)
    private Path credentialsFile;

    @Option(names = {"--insecure", "-k"}, description = "Trust any TLS certificate (self-signed servers)")
    private boolean insecure;

    @Option(names = {"--threads"}, description = "Worker threads for tree expansion (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>", defaultValue = "" + ExplorerSettings.DEFAULT_EXPANSION_THREADS)
    private int threads;

    @Option(names = {"--probe-threads"}, description = "Worker threads for project access checks (default: ${DEFAULT-VALUE})",
        paramLabel = "<n>", defaultValue = "" + ExplorerSettings.DEFAULT_PROBE_THREADS)
    private int probeThreads;

    @Option(names = {"--connect-timeout"}, description = "Connect timeout in seconds (default: ${DEFAULT-VALUE})",
        paramLabel = "<s>", defaultValue = "30")
    private long connectTimeout;

    @Option(names = {"--read-timeout"}, description = "Read timeout in seconds (default: ${DEFAULT-VALUE})",
        paramLabel = "<s>", defaultValue = "60")
    private long readTimeout;

    @Option(names = {"--diagnostics-dir"}, description = "Directory for the diagnostic log (default: ${DEFAULT-VALUE})",
        paramLabel = "<dir>", defaultValue = "diagnostics")
    private Path diagnosticsDir;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "Print version information and exit")
    private boolean version;

    private final Map<String, String> env;
    private final CredentialsLoader.Prompt prompt;

    public SysMLApiTool() {
        this(System.getenv(), CredentialsLoader.CONSOLE);
    }

    SysMLApiTool(Map<String, String> env, CredentialsLoader.Prompt prompt) {
        this.env = env;
        this.prompt = prompt;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new SysMLApiTool()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(SysMLApiTool tool) {
        CommandLine cmd = new CommandLine(tool);
        cmd.addSubcommand("projects", new ProjectsCommand(tool));
        cmd.addSubcommand("commits", new CommitsCommand(tool));
        cmd.addSubcommand("tree", new TreeCommand(tool));
        cmd.addSubcommand("export", new ExportCommand(tool));
        cmd.addSubcommand("requirements", new RequirementsCommand(tool));
        cmd.addSubcommand("diff", new DiffCommand(tool));
        cmd.addSubcommand("html", new HtmlCommand(tool));
        cmd.addSubcommand("stats", new StatsCommand(tool));
        cmd.addSubcommand("trace", new TraceCommand(tool));
        cmd.addSubcommand("diagram", new DiagramCommand(tool));
        cmd.addSubcommand("help", new CommandLine.HelpCommand());
        return cmd;
    }

    @Override
    public void run() {
        // No subcommand given – print full usage including all registered subcommands
        spec.commandLine().usage(System.out);
    }

    // ── Shared setup for subcommands ─────────────────────────────────────────

    Credentials loadCredentials(String username, String password) {
        return new CredentialsLoader(env, credentialsFile, prompt).load(username, password, baseUrl);
    }

    /** Problem with the global options, or null when they are usable. */
    String invalidGlobalOptions() {
        if (baseUrl != null && !ExplorerSettings.isValidBaseUrl(baseUrl)) {
            return "--base-url must be an absolute http(s) URL: " + baseUrl;
        }
        if (threads < 1) return "--threads must be at least 1";
        if (probeThreads < 1) return "--probe-threads must be at least 1";
        if (connectTimeout < 1 || readTimeout < 1) return "Timeouts must be at least 1 second";
        return null;
    }

    ExplorerSettings settings(String resolvedBaseUrl) {
        return new ExplorerSettings(resolvedBaseUrl, Duration.ofSeconds(connectTimeout), Duration.ofSeconds(readTimeout),
            insecure, threads, probeThreads);
    }

    /** Starts this run's diagnostic log under {@code --diagnostics-dir}. */
    Path openDiagnosticLog() throws IOException {
        Path log = FileUtils.diagnosticLog(diagnosticsDir);
        Logger.attachFile(log);
        Logger.info("Diagnostic log: %s", log.toAbsolutePath());
        return log;
    }
}
