package com.multigallery.core.renderer;

/**
 * Kinds of non-fatal problems found while rendering for one site.
 */
public enum WarningType {
    /**
     * A site-url switch has neither an entry for the site nor a generic entry, so nothing
     * was rendered in its place.
     */
    RESOLUTION_GAP,

    /**
     * A {@code [self]} link had no username for the site being rendered for.
     */
    SELF_LINK_GAP
}
