package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.SiteIds;

import java.util.Locale;
import java.util.Optional;

/**
 * Inkbunny: BBCode with {@code [iconname]} and cross-site user tags for Fur Affinity,
 * SoFurry and Weasyl.
 */
public class InkbunnyDialect extends BbcodeDialect {

    @Override
    public String getId() {
        return "inkbunny";
    }

    @Override
    public String getDisplayName() {
        return "Inkbunny BBCode";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of("[iconname]" + link.username() + "[/iconname]");
    }

    @Override
    protected Optional<String> otherSiteUser(UserLink link) {
        String username = link.username();
        return switch (link.linkSite()) {
            case SiteIds.FURAFFINITY -> Optional.of("[fa]" + username + "[/fa]");
            case SiteIds.SOFURRY -> Optional.of("[sf]" + username + "[/sf]");
            case SiteIds.WEASYL -> Optional.of(
                "[weasyl]" + username.replace(" ", "").toLowerCase(Locale.ROOT) + "[/weasyl]");
            default -> Optional.empty();
        };
    }
}
