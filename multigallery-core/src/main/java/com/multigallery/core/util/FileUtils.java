package com.multigallery.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return lowercase file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Gets the file name up to its first dot.
     *
     * <p>{@code chapter-1.final.odt} gives {@code chapter-1}.
     *
     * @param path file path
     * @return base name, or the whole file name if it has no dot after the first character
     */
    public static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int firstDot = fileName.indexOf('.', 1);
        return firstDot > 0 ? fileName.substring(0, firstDot) : fileName;
    }

    /**
     * Removes a leading UTF-8 byte order mark.
     *
     * @param text text as decoded
     * @return text without byte order mark
     */
    public static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    /**
     * Deletes a file, or a directory with everything in it.
     *
     * @param path file or directory; nothing happens if it does not exist
     * @throws IOException if deletion fails
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path entry : paths) {
            Files.delete(entry);
        }
    }
}
