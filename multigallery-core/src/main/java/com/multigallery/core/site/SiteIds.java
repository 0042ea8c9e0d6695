package com.multigallery.core.site;

/**
 * Canonical identifiers of the destination sites known to the default registry.
 * <p>
 * Canonical ids are what the parser stores in bindings and conditions after alias
 * resolution, and what configuration keys are normalized to.
 * </p>
 */
public final class SiteIds {
    /** Eka's Portal. */
    public static final String ARYION = "aryion";

    /** Fur Affinity. */
    public static final String FURAFFINITY = "furaffinity";

    /** Weasyl. */
    public static final String WEASYL = "weasyl";

    /** Inkbunny. */
    public static final String INKBUNNY = "inkbunny";

    /** SoFurry. */
    public static final String SOFURRY = "sofurry";

    /** Twitter. */
    public static final String TWITTER = "twitter";

    /** Any Mastodon instance; usernames carry the instance as {@code user@instance}. */
    public static final String MASTODON = "mastodon";

    /** Reserved switch tag name for the catch-all binding; never a registered site. */
    public static final String GENERIC = "generic";

    private SiteIds() {
        // Prevent instantiation
    }
}
