package com.multigallery.core.site;

import com.multigallery.core.dialect.MarkupDialect;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Registry entry describing one destination site.
 *
 * <p>The canonical id is always one of the aliases. Aliases are stored lowercase, since
 * tag names and configuration keys are matched case-insensitively.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SiteDescriptor fa = new SiteDescriptor(
 *     "furaffinity",
 *     "Fur Affinity",
 *     Set.of("fa"),
 *     new FuraffinityDialect(),
 *     username -> "https://furaffinity.net/user/" + username.replace("_", ""),
 *     "desc_furaffinity.txt"
 * );
 * }</pre>
 *
 * @param id canonical site id (lowercase)
 * @param displayName human-readable site name, used by plain-text dialects
 * @param aliases alternative tag names; the id is added automatically
 * @param dialect markup adapter used when rendering for this site
 * @param profileUrl profile URL builder for usernames on this site
 * @param descriptionFileName name of the description file generated for this site
 */
public record SiteDescriptor(
    String id,
    String displayName,
    Set<String> aliases,
    MarkupDialect dialect,
    ProfileUrlBuilder profileUrl,
    String descriptionFileName
) {
    /**
     * Compact constructor with validation.
     */
    public SiteDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        Objects.requireNonNull(profileUrl, "profileUrl must not be null");
        Objects.requireNonNull(descriptionFileName, "descriptionFileName must not be null");
        id = id.toLowerCase(Locale.ROOT);
        if (SiteIds.GENERIC.equals(id)) {
            throw new IllegalArgumentException("'" + SiteIds.GENERIC + "' is reserved and cannot be a site id");
        }

        Set<String> normalized = new LinkedHashSet<>();
        normalized.add(id);
        if (aliases != null) {
            for (String alias : aliases) {
                normalized.add(alias.toLowerCase(Locale.ROOT));
            }
        }
        if (normalized.contains(SiteIds.GENERIC)) {
            throw new IllegalArgumentException("'" + SiteIds.GENERIC + "' is reserved and cannot be an alias of " + id);
        }
        aliases = Set.copyOf(normalized);
    }

    /**
     * Builds the profile URL of a user on this site.
     *
     * @param username username
     * @return profile URL
     */
    public String profileUrlOf(String username) {
        return profileUrl.build(username);
    }
}
