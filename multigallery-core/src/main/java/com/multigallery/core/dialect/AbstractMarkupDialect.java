package com.multigallery.core.dialect;

import java.util.Optional;

/**
 * Base class for dialects with native user mentions.
 *
 * <p>Implements {@link #userLink(UserLink)} as:
 * <ol>
 *   <li>display overridden by the author: always a plain link to the profile</li>
 *   <li>profile on the target site: {@link #ownSiteUser(UserLink)} if present</li>
 *   <li>profile on another site: {@link #otherSiteUser(UserLink)} if present</li>
 *   <li>otherwise a plain link to the profile</li>
 * </ol>
 */
public abstract class AbstractMarkupDialect implements MarkupDialect {

    @Override
    public String userLink(UserLink link) {
        if (!link.displayOverridden()) {
            Optional<String> mention = link.isOwnSite() ? ownSiteUser(link) : otherSiteUser(link);
            if (mention.isPresent()) {
                return mention.get();
            }
        }
        return link(link.profileUrl(), link.display());
    }

    /**
     * Native mention of a user on the site being rendered for.
     *
     * @param link user link
     * @return mention markup, or empty to fall back to a plain link
     */
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.empty();
    }

    /**
     * Native cross-site mention of a user on another site.
     *
     * @param link user link
     * @return mention markup, or empty to fall back to a plain link
     */
    protected Optional<String> otherSiteUser(UserLink link) {
        return Optional.empty();
    }
}
