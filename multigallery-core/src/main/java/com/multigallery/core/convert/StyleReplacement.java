package com.multigallery.core.convert;

import java.util.Objects;

/**
 * Paragraph style to replace in a converted rich text document.
 *
 * @param sourceStyle name of the style to replace
 * @param targetStyle name of the style to use instead
 */
public record StyleReplacement(
    String sourceStyle,
    String targetStyle
) {
    /**
     * Plain text converts to the monospaced "Preformatted Text" style; stories read better
     * in the serif "Normal" style.
     */
    public static final StyleReplacement PREFORMATTED_TO_NORMAL =
        new StyleReplacement("Preformatted Text", "Normal");

    /**
     * Compact constructor with validation.
     */
    public StyleReplacement {
        Objects.requireNonNull(sourceStyle, "sourceStyle must not be null");
        Objects.requireNonNull(targetStyle, "targetStyle must not be null");
    }
}
