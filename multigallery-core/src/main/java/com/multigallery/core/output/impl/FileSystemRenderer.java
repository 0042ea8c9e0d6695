package com.multigallery.core.output.impl;

import com.multigallery.core.output.GeneratedFile;
import com.multigallery.core.output.GeneratedOutput;
import com.multigallery.core.output.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated files to the filesystem as UTF-8.
 *
 * <p>Creates directory structure automatically and preserves relative paths.
 * Handles existing files by overwriting them.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(
 *     GeneratedFile.of("desc_furaffinity.txt", "[b]Hello[/b]\n")
 * ));
 *
 * new FileSystemRenderer().render(output, Paths.get("./out"));
 * // Creates: ./out/desc_furaffinity.txt
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, Path outputDirectory) {
        logger.debug("Writing {} files to: {}", output.files().size(), outputDirectory);

        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDirectory, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDirectory, file);
        }
    }

    /**
     * Writes a single file to the filesystem.
     *
     * @param outputDir base output directory
     * @param file file to write
     */
    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir.normalize())) {
            throw new IllegalStateException("File escapes the output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
