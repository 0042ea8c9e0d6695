package com.multigallery.core.ast;

import com.multigallery.core.site.SiteIds;

import java.util.List;
import java.util.Objects;

/**
 * One switch tag of a {@link SwitchChain}.
 *
 * @param site canonical site id, or {@link #GENERIC} for the catch-all binding
 * @param attribute username (user chains), URL (site-url chains and generic bindings)
 * @param children display text supplied by the author; empty unless this is the innermost
 *     tag and it wraps text
 */
public record Binding(
    String site,
    String attribute,
    List<Node> children
) {
    /** Site value of the catch-all binding. */
    public static final String GENERIC = SiteIds.GENERIC;

    /**
     * Compact constructor with validation.
     */
    public Binding {
        Objects.requireNonNull(site, "site must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a binding without display children.
     *
     * @param site site id or {@link #GENERIC}
     * @param attribute username or URL
     * @return binding
     */
    public static Binding of(String site, String attribute) {
        return new Binding(site, attribute, List.of());
    }

    /**
     * Returns true for the catch-all binding.
     *
     * @return true if generic
     */
    public boolean isGeneric() {
        return GENERIC.equals(site);
    }

    /**
     * Returns true if the author wrapped display text in this tag.
     *
     * @return true if children are present
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
