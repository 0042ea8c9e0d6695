package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.SiteIds;

import java.util.Optional;

/**
 * Weasyl: Markdown with {@code <!~name>} user icons and {@code <fa:name>}-style
 * cross-site links.
 */
public class WeasylDialect extends MarkdownDialect {

    @Override
    public String getId() {
        return "weasyl";
    }

    @Override
    public String getDisplayName() {
        return "Weasyl Markdown";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of("<!~" + link.username().replace(" ", "") + ">");
    }

    @Override
    protected Optional<String> otherSiteUser(UserLink link) {
        return switch (link.linkSite()) {
            case SiteIds.FURAFFINITY -> Optional.of("<fa:" + link.username() + ">");
            case SiteIds.INKBUNNY -> Optional.of("<ib:" + link.username() + ">");
            case SiteIds.SOFURRY -> Optional.of("<sf:" + link.username() + ">");
            default -> Optional.empty();
        };
    }
}
