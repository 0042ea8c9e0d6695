package com.multigallery.core.dialect;

import java.util.Objects;

/**
 * A resolved link to a user profile, ready for a dialect to render.
 *
 * @param targetSite site being rendered for
 * @param linkSite site the user profile lives on
 * @param linkSiteName display name of {@code linkSite}
 * @param username username on {@code linkSite}
 * @param profileUrl profile URL of the user on {@code linkSite}
 * @param display rendered display text
 * @param displayOverridden true if the author supplied display text instead of the username
 */
public record UserLink(
    String targetSite,
    String linkSite,
    String linkSiteName,
    String username,
    String profileUrl,
    String display,
    boolean displayOverridden
) {
    /**
     * Compact constructor with validation.
     */
    public UserLink {
        Objects.requireNonNull(targetSite, "targetSite must not be null");
        Objects.requireNonNull(linkSite, "linkSite must not be null");
        Objects.requireNonNull(linkSiteName, "linkSiteName must not be null");
        Objects.requireNonNull(username, "username must not be null");
        Objects.requireNonNull(profileUrl, "profileUrl must not be null");
        Objects.requireNonNull(display, "display must not be null");
    }

    /**
     * Returns true if the profile lives on the site being rendered for.
     *
     * @return true for own-site links
     */
    public boolean isOwnSite() {
        return targetSite.equals(linkSite);
    }
}
