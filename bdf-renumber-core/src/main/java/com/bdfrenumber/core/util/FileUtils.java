package com.bdfrenumber.core.util;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Utility class for deck file operations.
 *
 * <p>Decks are read and written as ISO-8859-1 so that every byte of a record
 * the tool does not understand survives the round trip unchanged.
 */
public final class FileUtils {

    public static final Charset DECK_CHARSET = StandardCharsets.ISO_8859_1;

    private FileUtils() {
        // Utility class
    }

    /**
     * Reads all lines from a deck file.
     *
     * @param path path to file
     * @return list of lines without terminators
     * @throws IOException if reading fails
     */
    public static List<String> readLines(Path path) throws IOException {
        return Files.readAllLines(path, DECK_CHARSET);
    }

    /**
     * Writes lines to a deck file, each terminated by a newline, creating parent directories.
     *
     * @param path target file
     * @param lines lines without terminators
     * @throws IOException if writing fails
     */
    public static void writeLines(Path path, List<String> lines) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        Files.writeString(path, content, DECK_CHARSET);
    }

    /**
     * Checks if a path is an existing regular file.
     *
     * @param path path to check
     * @return true if the path is a regular file
     */
    public static boolean isRegularFile(Path path) {
        return Files.isRegularFile(path);
    }

    /**
     * Returns {@code path} relative to {@code base} with forward slashes.
     *
     * <p>Falls back to the absolute path when the two cannot be relativized
     * (different roots on Windows).
     *
     * @param base base directory
     * @param path path to express
     * @return portable relative name
     */
    public static String relativeName(Path base, Path path) {
        try {
            return base.toAbsolutePath().normalize()
                .relativize(path.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return path.toAbsolutePath().normalize().toString().replace('\\', '/');
        }
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
