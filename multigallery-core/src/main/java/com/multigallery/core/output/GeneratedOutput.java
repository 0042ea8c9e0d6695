package com.multigallery.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Collection of generated files to be written together.
 *
 * @param files list of generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Returns true if there is nothing to write.
     *
     * @return true if files is empty
     */
    public boolean isEmpty() {
        return files.isEmpty();
    }
}
