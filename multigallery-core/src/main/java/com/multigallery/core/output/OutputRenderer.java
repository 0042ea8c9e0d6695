package com.multigallery.core.output;

import java.nio.file.Path;

/**
 * Writes generated files to a destination.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class ConsoleRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "console";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, Path outputDirectory) {
 *         for (GeneratedFile file : output.files()) {
 *             System.out.println("=== " + file.relativePath() + " ===");
 *             System.out.println(file.content());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Writes the generated files.
     *
     * @param output files to write
     * @param outputDirectory directory the relative paths of the files are resolved against
     * @throws IllegalStateException if writing fails
     */
    void render(GeneratedOutput output, Path outputDirectory);
}
