package org.example.sysmlapi;

import org.example.sysmlapi.config.CredentialsLoader;
import org.example.sysmlapi.testutil.MockApiServer;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command line against an in-process API server.
 */
class CliTest {

    private record CliResult(int exitCode, String output, String errors) {}

    private static final CredentialsLoader.Prompt NO_PROMPT = new CredentialsLoader.Prompt() {
        @Override public String readLine(String label) { return null; }
        @Override public String readPassword(String label) { return null; }
    };

    @TempDir
    Path dir;

    private MockApiServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockApiServer()
            .respond("/projects", "[{\"@id\":\"p1\",\"@type\":\"Project\",\"name\":\"Drone\",\"created\":\"2024-01-01\"},"
                + "{\"@id\":\"p2\",\"@type\":\"Project\",\"name\":\"Locked\"}]")
            .respond("/projects/p1", "{\"@id\":\"p1\",\"@type\":\"Project\",\"name\":\"Drone\"}")
            .respond("/projects/p1/commits", "[{\"@id\":\"c1\",\"created\":\"2024-01-01T00:00:00Z\",\"name\":\"first\"},"
                + "{\"@id\":\"c2\",\"created\":\"2024-02-01T00:00:00Z\",\"name\":\"second\"}]")
            .respond("/projects/p2/commits", 403, "{\"error\":\"forbidden\"}")
            .respond("/projects/p1/branches", "[{\"@id\":\"b1\",\"name\":\"main\"}]")
            .respond("/projects/p1/commits/c1/roots", "[{\"@id\":\"r\",\"@type\":\"Namespace\","
                + "\"ownedMember\":[{\"@id\":\"pkg\"}]}]")
            .respond("/projects/p1/commits/c2/roots", "[{\"@id\":\"r\",\"@type\":\"Namespace\","
                + "\"ownedMember\":[{\"@id\":\"pkg\"}]},{\"@id\":\"r2\",\"@type\":\"Namespace\"}]")
            .respond("/projects/p1/commits/c2/elements/pkg", "{\"@id\":\"pkg\",\"@type\":\"Package\",\"name\":\"Vehicle\","
                + "\"ownedMember\":[{\"@id\":\"motor\"},{\"@id\":\"broken\"}]}")
            .respond("/projects/p1/commits/c2/elements/motor", "{\"@id\":\"motor\",\"@type\":\"PartDefinition\","
                + "\"name\":\"Motor\"}")
            .respond("/projects/p1/commits/c2/elements/broken", 500, "{\"error\":\"internal\"}")
            .respond("/projects/p1/commits/c2/elements?page[size]=500", "[{\"@id\":\"req1\",\"@type\":\"RequirementUsage\","
                + "\"name\":\"MaxSpeed\"},{\"@id\":\"motor\",\"@type\":\"PartDefinition\",\"name\":\"Motor\"}]");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private CliResult run(Map<String, String> env, String... args) {
        return runAt(server.baseUrl(), env, args);
    }

    /** Runs with {@code --base-url baseUrl}, or without the option when {@code baseUrl} is null. */
    private CliResult runAt(String baseUrl, Map<String, String> env, String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
        try {
            List<String> all = new ArrayList<>();
            if (baseUrl != null) all.addAll(List.of("--base-url", baseUrl));
            all.addAll(List.of(
                "--credentials", dir.resolve("absent.properties").toString(),
                "--diagnostics-dir", dir.resolve("diagnostics").toString()));
            all.addAll(Arrays.asList(args));
            int exitCode = SysMLApiTool.commandLine(new SysMLApiTool(env, NO_PROMPT)).execute(all.toArray(new String[0]));
            return new CliResult(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult run(String... args) {
        return run(Map.of(), args);
    }

    private List<Path> files(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Usage")
    class Usage {

        @Test
        void noSubcommandPrintsUsage() {
            CliResult result = run();
            assertEquals(0, result.exitCode());
            for (String name : List.of("projects", "commits", "tree", "export", "requirements", "diff", "html",
                "stats", "trace", "diagram")) {
                assertTrue(result.output().contains(name), "usage mentions " + name);
            }
        }

        @Test
        void subcommandHelp() {
            CliResult result = run("tree", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--depth"));
        }

        @Test
        void missingProjectIdIsAUsageError() {
            CliResult result = run("tree", "u", "p");
            assertEquals(2, result.exitCode());
            assertTrue(result.errors().contains("<projectId> is required"));
            assertTrue(server.received().isEmpty());
        }

        @Test
        void invalidFormatIsAUsageError() {
            assertEquals(2, run("tree", "u", "p", "p1", "-f", "xml").exitCode());
            assertEquals(2, run("diagram", "u", "p", "p1", "-f", "gif").exitCode());
        }

        @Test
        void malformedBaseUrlOptionIsAUsageError() {
            CliResult result = runAt("not a url", Map.of(), "projects", "u", "p");
            assertEquals(2, result.exitCode());
            assertTrue(result.errors().contains("--base-url must be an absolute http(s) URL"));
            assertTrue(server.received().isEmpty());
        }

        @Test
        void zeroThreadsIsAUsageError() {
            CliResult result = run("--threads", "0", "tree", "u", "p", "p1");
            assertEquals(2, result.exitCode());
            assertTrue(result.errors().contains("--threads must be at least 1"));
        }

        @Test
        @DisplayName("a base URL from the environment that cannot form a request fails the request")
        void malformedBaseUrlFromEnvironmentIsARequestFailure() {
            CliResult result = runAt(null, Map.of("SYSMLV2_BASE_URL", "http://bad host"), "projects", "u", "p");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("[ERROR] "));
            assertFalse(result.errors().contains("\tat "));
        }

        @Test
        void missingCredentialsFail() {
            CliResult result = run("projects");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("No credentials found"));
        }

        @Test
        void writesADiagnosticLog() throws IOException {
            run("projects", "u", "p");
            List<Path> logs = files(dir.resolve("diagnostics"));
            assertEquals(1, logs.size());
            assertTrue(logs.get(0).getFileName().toString().startsWith("sysmlv2_api_"));
            assertTrue(Files.readString(logs.get(0)).contains("GET /projects"));
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        void projectsFromEnvironmentCredentials() {
            CliResult result = run(Map.of("SYSMLV2_USERNAME", "env", "SYSMLV2_PASSWORD", "pw"), "projects");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Drone"));
            assertTrue(result.output().contains("2 project(s)"));
        }

        @Test
        void accessibleProjectsOnly() {
            CliResult result = run("projects", "u", "p", "--accessible");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Drone"));
            assertFalse(result.output().contains("Locked"));
            assertTrue(result.output().contains("1 project(s) accessible"));
        }

        @Test
        void commitsMarkTheLatest() {
            CliResult result = run("commits", "u", "p", "p1", "--branches");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("* c2"));
            assertTrue(result.output().contains("Branches (1):"));
        }

        @Test
        void unknownProjectFailsWithOneLine() {
            CliResult result = run("commits", "u", "p", "nope");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("[ERROR] API returned status 404"));
        }
    }

    @Nested
    @DisplayName("Tree")
    class Tree {

        @Test
        void asciiTreeSkipsFailedChildren() {
            CliResult result = run("tree", "u", "p", "p1", "--show-failures");

            assertEquals(0, result.exitCode());
            String expected = "Project\n"
                + "└── Vehicle [Package]\n"
                + "    ├── Motor [PartDefinition]\n"
                + "    └── [!] broken (";
            assertTrue(result.output().replace("\r\n", "\n").startsWith(expected), result.output());
            assertTrue(result.errors().contains("Failed to load child broken"));
        }

        @Test
        void depthOneLeavesPackageUnexpanded() {
            CliResult result = run("tree", "u", "p", "p1", "--depth", "1");

            assertTrue(result.output().contains("└── Vehicle [Package] [+]"));
            assertEquals(0, server.count("/projects/p1/commits/c2/elements/motor"));
        }

        @Test
        void jsonOutputForOneElement() {
            CliResult result = run("tree", "u", "p", "p1", "pkg", "-f", "json");

            assertEquals(0, result.exitCode());
            JSONObject json = new JSONObject(result.output());
            assertEquals("pkg", json.getString("id"));
            assertEquals("Motor", json.getJSONArray("children").getJSONObject(0).getString("name"));
            assertEquals(1, json.getJSONArray("children").length());
        }

        @Test
        void unknownCommitFails() {
            CliResult result = run("tree", "u", "p", "p1", "--commit", "zzz");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("Commit zzz not found"));
        }

        @Test
        void elementIdThatCannotFormAUrlFailsTheRequest() {
            CliResult result = run("tree", "u", "p", "p1", "bad id");
            assertEquals(1, result.exitCode());
            assertTrue(result.errors().contains("[ERROR] "));
            assertFalse(result.errors().contains("\tat "));
        }
    }

    @Nested
    @DisplayName("Export and reports")
    class Reports {

        @Test
        void exportToStdout() {
            CliResult result = run("export", "u", "p", "p1", "--stdout");

            assertEquals(0, result.exitCode());
            String out = result.output().replace("\r\n", "\n");
            assertTrue(out.startsWith("// SysML v2 Export\n// Project: Drone\n// Commit: second (c2)\n"), out);
            assertTrue(out.contains("package Vehicle {\n    part def Motor;\n}\n"));
        }

        @Test
        void exportToFile() throws IOException {
            Path output = dir.resolve("out");
            CliResult result = run("export", "u", "p", "p1", "-o", output.toString());

            assertEquals(0, result.exitCode());
            List<Path> written = files(output);
            assertEquals(1, written.size());
            assertTrue(written.get(0).getFileName().toString().matches("sysml_export_Drone_\\d{8}_\\d{6}\\.sysml"));
            assertTrue(Files.readString(written.get(0)).contains("part def Motor;"));
        }

        @Test
        void requirementsJson() throws IOException {
            Path output = dir.resolve("req");
            CliResult result = run("requirements", "u", "p", "p1", "-o", output.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("MaxSpeed"));
            JSONObject json = new JSONObject(Files.readString(output.resolve("requirements_Drone.json")));
            assertEquals(1, json.getJSONArray("requirements").length());
            assertEquals("c2", json.getJSONObject("commit").getString("id"));
        }

        @Test
        void diffOfTheTwoLatestCommits() {
            CliResult result = run("diff", "u", "p", "p1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Base commit:    c1"));
            assertTrue(result.output().contains("Compare commit: c2"));
            assertTrue(result.output().contains("Added:     1 elements"));
            assertTrue(result.output().contains("Unchanged: 1 elements"));
        }

        @Test
        void diffOfOneCommitWithItselfIsRejected() {
            assertEquals(2, run("diff", "u", "p", "p1", "--base", "c2", "--compare", "c2").exitCode());
        }

        @Test
        void htmlAndStatsFiles() throws IOException {
            Path output = dir.resolve("reports");
            assertEquals(0, run("html", "u", "p", "p1", "-o", output.toString()).exitCode());
            CliResult stats = run("stats", "u", "p", "p1", "-o", output.toString());

            assertEquals(0, stats.exitCode());
            assertTrue(stats.output().contains("Total Elements:    4"));
            List<String> names = files(output).stream().map(p -> p.getFileName().toString()).sorted()
                .collect(Collectors.toList());
            assertEquals(2, names.size());
            assertTrue(names.get(0).startsWith("model_statistics_Drone_"));
            assertTrue(names.get(1).startsWith("sysml_export_Drone_"));
            assertTrue(names.get(1).endsWith(".html"));
        }

        @Test
        void traceMatrix() {
            CliResult result = run("trace", "u", "p", "p1");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Vehicle --[ownedMember]--> Motor"));
        }

        @Test
        void plantUmlDiagram() throws IOException {
            Path output = dir.resolve("diagrams");
            CliResult result = run("diagram", "u", "p", "p1", "pkg", "-o", output.toString());

            assertEquals(0, result.exitCode());
            List<Path> written = files(output);
            assertEquals(1, written.size());
            assertTrue(written.get(0).getFileName().toString().endsWith(".puml"));
            assertTrue(Files.readString(written.get(0)).contains("«PartDefinition»"));
        }
    }
}
