package com.multigallery.core.renderer;

import java.util.Objects;

/**
 * Non-fatal problem found while rendering a description for one site.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * RenderWarning warning = RenderWarning.resolutionGap(
 *     "weasyl",
 *     "[siteurl] with sofurry, aryion has no entry for weasyl and no [generic]"
 * );
 * }</pre>
 *
 * @param type kind of problem
 * @param site canonical id of the site being rendered for
 * @param message human-readable description
 */
public record RenderWarning(
    WarningType type,
    String site,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public RenderWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(site, "site must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates a resolution gap warning.
     *
     * @param site site being rendered for
     * @param message the message
     * @return a new warning of type {@link WarningType#RESOLUTION_GAP}
     */
    public static RenderWarning resolutionGap(String site, String message) {
        return new RenderWarning(WarningType.RESOLUTION_GAP, site, message);
    }

    /**
     * Creates a self link gap warning.
     *
     * @param site site being rendered for
     * @param message the message
     * @return a new warning of type {@link WarningType#SELF_LINK_GAP}
     */
    public static RenderWarning selfLinkGap(String site, String message) {
        return new RenderWarning(WarningType.SELF_LINK_GAP, site, message);
    }
}
