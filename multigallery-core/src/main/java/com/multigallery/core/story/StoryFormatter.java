package com.multigallery.core.story;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level cleanup of story text for the gallery upload formats.
 *
 * <p>Stories are read from office documents, where paragraphs are often separated by any
 * number of empty lines. {@link #normalizeLines(String)} reduces that to the canonical
 * form the formats below are built from: trimmed lines, no leading or trailing empty
 * lines, at most one empty line between paragraphs.
 */
public final class StoryFormatter {

    private static final String CRLF = "\r\n";
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final Pattern SEQUENTIAL_EQUAL_SIGNS = Pattern.compile("=(?==)");

    private StoryFormatter() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Splits and normalizes story text.
     *
     * @param text raw story text
     * @return normalized lines, empty if the story has no visible text
     */
    public static List<String> normalizeLines(String text) {
        List<String> lines = new ArrayList<>();
        boolean pendingEmptyLine = false;
        for (String raw : LINE_BREAK.split(text, -1)) {
            String line = raw.strip();
            if (line.isEmpty()) {
                pendingEmptyLine = !lines.isEmpty();
                continue;
            }
            if (pendingEmptyLine) {
                lines.add("");
                pendingEmptyLine = false;
            }
            lines.add(line);
        }
        return lines;
    }

    /**
     * Plain text with CRLF line endings.
     *
     * @param lines normalized lines
     * @return text ending with a line break
     */
    public static String toText(List<String> lines) {
        return String.join(CRLF, lines) + CRLF;
    }

    /**
     * Markdown with CRLF line endings. Asterisks are escaped and runs of equal signs are
     * broken up so neither is read as markup.
     *
     * @param lines normalized lines
     * @return Markdown ending with a line break
     */
    public static String toMarkdown(List<String> lines) {
        List<String> escaped = new ArrayList<>(lines.size());
        for (String line : lines) {
            escaped.add(SEQUENTIAL_EQUAL_SIGNS.matcher(line.replace("*", "\\*")).replaceAll("= "));
        }
        return toText(escaped);
    }

    /**
     * Text for rich text conversion: one paragraph per line, LF separated, no empty lines.
     *
     * @param lines normalized lines
     * @return conversion source
     */
    public static String toRtfSource(List<String> lines) {
        return String.join("\n", lines.stream().filter(line -> !line.isEmpty()).toList());
    }
}
