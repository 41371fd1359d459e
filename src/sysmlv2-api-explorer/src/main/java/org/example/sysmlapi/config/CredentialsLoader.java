package org.example.sysmlapi.config;

import org.example.sysmlapi.Logger;
import org.example.sysmlapi.MissingCredentialsException;

import java.io.Console;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Resolves credentials from, in order of precedence:
 * <ol>
 *   <li>explicit values (positional command-line arguments)</li>
 *   <li>environment variables {@code SYSMLV2_USERNAME} / {@code SYSMLV2_PASSWORD}</li>
 *   <li>a {@code credentials.properties} file using the same keys</li>
 *   <li>an interactive console prompt (password masked)</li>
 * </ol>
 * The base URL follows its own order: explicit option, {@code SYSMLV2_BASE_URL}
 * in the properties file, the same variable in the environment, then the default.
 */
public class CredentialsLoader {

    public static final String CREDENTIALS_FILE = "credentials.properties";
    public static final String KEY_USERNAME = "SYSMLV2_USERNAME";
    public static final String KEY_PASSWORD = "SYSMLV2_PASSWORD";
    public static final String KEY_BASE_URL = "SYSMLV2_BASE_URL";

    /** Source of interactive input; returns {@code null} when nothing can be read. */
    public interface Prompt {
        String readLine(String label);
        String readPassword(String label);
    }

    /** Prompts on the system console, or reads nothing when no console is attached. */
    public static final Prompt CONSOLE = new Prompt() {
        @Override
        public String readLine(String label) {
            Console console = System.console();
            return console != null ? console.readLine("%s", label) : null;
        }

        @Override
        public String readPassword(String label) {
            Console console = System.console();
            if (console == null) return null;
            char[] chars = console.readPassword("%s", label);
            return chars != null ? new String(chars) : null;
        }
    };

    private final Map<String, String> env;
    private final Path propertiesFile;
    private final Prompt prompt;

    public CredentialsLoader(Map<String, String> env, Path propertiesFile, Prompt prompt) {
        this.env = env;
        this.propertiesFile = propertiesFile != null ? propertiesFile : Path.of(CREDENTIALS_FILE);
        this.prompt = prompt;
    }

    public Credentials load(String username, String password, String baseUrlOverride) {
        String source = null;
        if (present(username) && present(password)) {
            source = "command-line arguments";
        }

        if (source == null) {
            String envUser = env.get(KEY_USERNAME);
            String envPass = env.get(KEY_PASSWORD);
            if (present(envUser) && present(envPass)) {
                username = envUser;
                password = envPass;
                source = "environment variables";
            }
        }

        Properties props = readProperties();
        if (source == null && props != null) {
            if (!present(username)) username = props.getProperty(KEY_USERNAME);
            if (!present(password)) password = props.getProperty(KEY_PASSWORD);
            if (present(username) && present(password)) source = propertiesFile.getFileName().toString();
        }

        if (source == null && prompt != null) {
            if (!present(username)) username = prompt.readLine("Username: ");
            if (!present(password)) password = prompt.readPassword("Password: ");
            if (present(username) && present(password)) source = "interactive prompt";
        }

        if (source == null) {
            throw new MissingCredentialsException("No credentials found. Pass <username> <password>, set "
                + KEY_USERNAME + "/" + KEY_PASSWORD + ", or create " + propertiesFile + ".");
        }

        String baseUrl = baseUrlOverride;
        if (!present(baseUrl) && props != null) baseUrl = props.getProperty(KEY_BASE_URL);
        if (!present(baseUrl)) baseUrl = env.get(KEY_BASE_URL);
        if (!present(baseUrl)) baseUrl = ExplorerSettings.DEFAULT_BASE_URL;

        Logger.info("Using credentials from %s", source);
        return new Credentials(username, password, baseUrl, source);
    }

    private Properties readProperties() {
        if (!Files.isRegularFile(propertiesFile)) return null;
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            props.load(in);
            return props;
        } catch (IOException e) {
            Logger.warn("Cannot read %s: %s", propertiesFile, e.getMessage());
            return null;
        }
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }
}
