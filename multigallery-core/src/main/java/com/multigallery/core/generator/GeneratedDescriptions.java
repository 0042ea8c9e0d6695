package com.multigallery.core.generator;

import com.multigallery.core.output.GeneratedOutput;
import com.multigallery.core.renderer.RenderResult;
import com.multigallery.core.renderer.RenderWarning;

import java.util.List;
import java.util.Objects;

/**
 * Descriptions generated for every configured site.
 *
 * @param results raw render results in configuration order
 * @param output description files ready to be written
 */
public record GeneratedDescriptions(
    List<RenderResult> results,
    GeneratedOutput output
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDescriptions {
        Objects.requireNonNull(results, "results must not be null");
        Objects.requireNonNull(output, "output must not be null");
        results = List.copyOf(results);
    }

    /**
     * Returns the warnings of all sites.
     *
     * @return warnings in configuration order
     */
    public List<RenderWarning> warnings() {
        return results.stream()
            .flatMap(result -> result.warnings().stream())
            .toList();
    }
}
