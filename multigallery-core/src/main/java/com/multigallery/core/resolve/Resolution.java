package com.multigallery.core.resolve;

import com.multigallery.core.ast.Node;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of resolving a switch chain for one target site.
 *
 * @param kind rule that matched
 * @param linkSite site whose profile the link points to, or {@code generic} for a literal URL
 * @param linkAttribute username (user chains), URL (site-url chains and generic bindings)
 * @param display nodes to render as the visible text, possibly empty
 * @param displayOverridden true if {@code display} comes from text the author wrapped in the chain
 */
public record Resolution(
    MatchKind kind,
    String linkSite,
    String linkAttribute,
    List<Node> display,
    boolean displayOverridden
) {
    /**
     * Compact constructor with validation.
     */
    public Resolution {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(linkSite, "linkSite must not be null");
        Objects.requireNonNull(linkAttribute, "linkAttribute must not be null");
        display = display == null ? List.of() : List.copyOf(display);
    }

    /**
     * Returns true if the link is a literal URL rather than a profile.
     *
     * @return true for generic matches
     */
    public boolean isGeneric() {
        return kind == MatchKind.GENERIC;
    }
}
