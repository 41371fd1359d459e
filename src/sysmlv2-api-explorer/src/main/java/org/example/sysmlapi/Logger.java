package org.example.sysmlapi;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Console logger with an optional diagnostic file sink.
 *
 * Console output is filtered by {@code -Dsysmlv2explorer.loglevel}. The file
 * sink, once attached, receives every message regardless of level so that a
 * diagnostic log always carries the full request trail.
 */
public class Logger {
    public enum Level {
        NONE(0), ERROR(1), WARN(2), INFO(3), DEBUG(4);
        final int value;
        Level(int value) { this.value = value; }
    }

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Level CURRENT_LEVEL;

    private static Writer fileSink;
    private static Path filePath;

    static {
        String prop = System.getProperty("sysmlv2explorer.loglevel", "warn").toUpperCase();
        Level detected;
        try {
            detected = Level.valueOf(prop);
        } catch (IllegalArgumentException e) {
            detected = Level.WARN;
        }
        CURRENT_LEVEL = detected;
    }

    public static boolean isDebugEnabled() { return CURRENT_LEVEL.value >= Level.DEBUG.value; }
    public static boolean isInfoEnabled()  { return CURRENT_LEVEL.value >= Level.INFO.value; }
    public static boolean isWarnEnabled()  { return CURRENT_LEVEL.value >= Level.WARN.value; }
    public static boolean isErrorEnabled() { return CURRENT_LEVEL.value >= Level.ERROR.value; }

    // -------------------------------------------------------------------------
    // Diagnostic file
    // -------------------------------------------------------------------------

    /**
     * Appends all subsequent messages to {@code file}, creating parent
     * directories as needed. Replaces any previously attached file.
     */
    public static synchronized void attachFile(Path file) throws IOException {
        detachFile();
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        fileSink = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        filePath = file;
    }

    public static synchronized void detachFile() {
        if (fileSink == null) return;
        try {
            fileSink.close();
        } catch (IOException e) {
            System.err.printf("[WARN]  Could not close diagnostic log %s: %s%n", filePath, e.getMessage());
        }
        fileSink = null;
        filePath = null;
    }

    public static synchronized Path getFile() {
        return filePath;
    }

    private static synchronized void toFile(String tag, String line) {
        if (fileSink == null) return;
        try {
            fileSink.write("[" + LocalDateTime.now().format(TIMESTAMP) + "] " + tag + line + System.lineSeparator());
            fileSink.flush();
        } catch (IOException e) {
            System.err.printf("[WARN]  Diagnostic log write failed, detaching: %s%n", e.getMessage());
            fileSink = null;
        }
    }

    // -------------------------------------------------------------------------
    // Messages
    // -------------------------------------------------------------------------

    public static void error(String msg, Object... args) {
        String line = String.format(msg, args);
        toFile("[ERROR] ", line);
        if (isErrorEnabled()) System.err.println("[ERROR] " + line);
    }

    public static void warn(String msg, Object... args) {
        String line = String.format(msg, args);
        toFile("[WARN]  ", line);
        if (isWarnEnabled()) System.err.println("[WARN]  " + line);
    }

    public static void info(String msg, Object... args) {
        String line = String.format(msg, args);
        toFile("[INFO]  ", line);
        if (isInfoEnabled()) System.out.println("[INFO]  " + line);
    }

    public static void debug(String msg, Object... args) {
        String line = String.format(msg, args);
        toFile("[DEBUG] ", line);
        if (isDebugEnabled()) System.out.println("[DEBUG] " + line);
    }

    public static void error(String msg, Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        error("%s%n%s", msg, sw.toString());
    }

    /** Stack trace to the diagnostic file only; also to stderr at debug level. */
    public static void trace(String msg, Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        String line = msg + System.lineSeparator() + sw;
        toFile("[TRACE] ", line);
        if (isDebugEnabled()) System.err.println("[TRACE] " + line);
    }
}
