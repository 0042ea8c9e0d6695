package com.multigallery.core.output;

import java.util.Objects;

/**
 * A generated text file to be written.
 *
 * @param relativePath path relative to the output directory (e.g. "desc_weasyl.md")
 * @param content file content
 * @param contentType media type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /** Media type of plain text files. */
    public static final String TEXT_PLAIN = "text/plain";

    /** Media type of Markdown files. */
    public static final String TEXT_MARKDOWN = "text/markdown";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates a file with the media type implied by its extension.
     *
     * @param relativePath path relative to the output directory
     * @param content file content
     * @return generated file
     */
    public static GeneratedFile of(String relativePath, String content) {
        return new GeneratedFile(relativePath, content,
            relativePath.endsWith(".md") ? TEXT_MARKDOWN : TEXT_PLAIN);
    }
}
