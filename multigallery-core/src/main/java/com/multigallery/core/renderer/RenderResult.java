package com.multigallery.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Description rendered for one site.
 *
 * @param site canonical site id
 * @param text rendered markup, not yet normalized for output
 * @param warnings problems found while rendering, in document order
 */
public record RenderResult(
    String site,
    String text,
    List<RenderWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderResult {
        Objects.requireNonNull(site, "site must not be null");
        Objects.requireNonNull(text, "text must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns true if any warning was recorded.
     *
     * @return true if warnings is not empty
     */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
