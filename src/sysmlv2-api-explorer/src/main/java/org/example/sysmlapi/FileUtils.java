package org.example.sysmlapi;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class FileUtils {

    public static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    /** Replaces every character outside {@code [A-Za-z0-9]} with an underscore. */
    public static String safeFileName(String name) {
        if (name == null || name.isBlank()) return "unnamed";
        return name.replaceAll("[^A-Za-z0-9]", "_");
    }

    public static String timestamp() {
        return LocalDateTime.now().format(FILE_TIMESTAMP);
    }

    /**
     * {@code dir/prefix_safeName_timestamp.extension}, e.g.
     * {@code output/sysml_export_Vehicle_Model_20240101_120000.sysml}.
     */
    public static Path timestampedFile(Path dir, String prefix, String name, String extension) {
        return dir.resolve(prefix + "_" + safeFileName(name) + "_" + timestamp() + "." + extension);
    }

    /** Diagnostic log location for this run: {@code dir/sysmlv2_api_<timestamp>.log}. */
    public static Path diagnosticLog(Path dir) {
        return dir.resolve("sysmlv2_api_" + timestamp() + ".log");
    }

    /** Writes {@code content} as UTF-8, creating parent directories first. */
    public static Path write(Path file, String content) throws IOException {
        return write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    public static Path write(Path file, byte[] content) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        Files.write(file, content);
        Logger.info("Wrote %s (%d bytes)", file, content.length);
        return file;
    }
}
