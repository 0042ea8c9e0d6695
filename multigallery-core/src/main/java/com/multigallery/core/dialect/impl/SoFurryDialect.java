package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.SiteIds;

import java.util.Optional;

/**
 * SoFurry: BBCode with {@code :iconname:} icons and {@code fa!}/{@code ib!} shorthands.
 */
public class SoFurryDialect extends BbcodeDialect {

    @Override
    public String getId() {
        return "sofurry";
    }

    @Override
    public String getDisplayName() {
        return "SoFurry BBCode";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of(":icon" + link.username() + ":");
    }

    @Override
    protected Optional<String> otherSiteUser(UserLink link) {
        return switch (link.linkSite()) {
            case SiteIds.FURAFFINITY -> Optional.of("fa!" + link.username());
            case SiteIds.INKBUNNY -> Optional.of("ib!" + link.username());
            default -> Optional.empty();
        };
    }
}
