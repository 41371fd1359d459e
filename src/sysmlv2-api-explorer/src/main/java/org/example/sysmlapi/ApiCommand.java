package org.example.sysmlapi;

import org.example.sysmlapi.cache.NotFoundInCacheException;
import org.example.sysmlapi.client.ApiException;
import org.example.sysmlapi.client.RemoteException;
import org.example.sysmlapi.client.SysMLApiClient;
import org.example.sysmlapi.config.Credentials;
import org.example.sysmlapi.config.ExplorerSettings;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;

/**
 * Base for every subcommand that talks to the API.
 *
 * Resolves credentials (positional arguments first), opens the diagnostic log,
 * builds the client and maps failures to exit codes: 1 for missing
 * credentials or a failed request, 2 for invalid options.
 */
abstract class ApiCommand implements Callable<Integer> {
    static final int ERROR_MESSAGE_LIMIT = 200;

    protected final SysMLApiTool parent;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<username>",
        description = "API user (default: SYSMLV2_USERNAME, credentials file, or prompt)")
    protected String username;

    @Parameters(index = "1", arity = "0..1", paramLabel = "<password>",
        description = "API password (default: SYSMLV2_PASSWORD, credentials file, or prompt)")
    protected String password;

    protected ApiCommand(SysMLApiTool parent) {
        this.parent = parent;
    }

    @Override
    public Integer call() {
        try {
            parent.openDiagnosticLog();
        } catch (IOException e) {
            System.err.printf("[WARN]  Cannot open diagnostic log: %s%n", e.getMessage());
        }

        try {
            String invalidGlobal = parent.invalidGlobalOptions();
            if (invalidGlobal != null) {
                System.err.printf("[ERROR] %s%n", invalidGlobal);
                return 2;
            }
            int invalid = validateOptions();
            if (invalid != 0) return invalid;

            Credentials credentials = parent.loadCredentials(username, password);
            ExplorerSettings settings = parent.settings(credentials.baseUrl());
            Logger.info("Connecting to %s as %s", settings.baseUrl(), credentials.username());
            SysMLApiClient client = new SysMLApiClient(settings, credentials.username(), credentials.password());
            return execute(client, settings);

        } catch (MissingCredentialsException e) {
            System.err.printf("[ERROR] %s%n", e.getMessage());
            Logger.trace("Missing credentials", e);
            return 1;
        } catch (ApiException | NotFoundInCacheException | IllegalStateException | IOException | UncheckedIOException e) {
            System.err.printf("[ERROR] %s%n", oneLine(e));
            Logger.trace("Command failed", e);
            Logger.debug("Full detail written to %s", Logger.getFile());
            return 1;
        } finally {
            Logger.detachFile();
        }
    }

    /** Checks option combinations before any request is made; non-zero aborts with that exit code. */
    protected int validateOptions() {
        return 0;
    }

    protected abstract int execute(SysMLApiClient client, ExplorerSettings settings) throws IOException;

    /** First line of the message, cut at {@value #ERROR_MESSAGE_LIMIT} characters. */
    static String oneLine(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        int nl = message.indexOf('\n');
        if (nl >= 0) message = message.substring(0, nl);
        return RemoteException.truncate(message, ERROR_MESSAGE_LIMIT);
    }
}
