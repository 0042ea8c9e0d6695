package com.multigallery.core.renderer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything one per-site render depends on besides the document.
 *
 * @param site canonical id of the site being rendered for
 * @param definedFlags flags consulted by {@code define} conditions
 * @param usernames configured usernames by canonical site id, in configuration order
 */
public record RenderContext(
    String site,
    Set<String> definedFlags,
    Map<String, String> usernames
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(site, "site must not be null");
        definedFlags = definedFlags == null ? Set.of() : Set.copyOf(definedFlags);
        usernames = usernames == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(usernames));
    }

    /**
     * Creates a context without flags or usernames.
     *
     * @param site canonical site id
     * @return context
     */
    public static RenderContext forSite(String site) {
        return new RenderContext(site, Set.of(), Map.of());
    }

    /**
     * Returns true if a flag was defined.
     *
     * @param flag flag name
     * @return true if defined
     */
    public boolean isDefined(String flag) {
        return definedFlags.contains(flag);
    }
}
