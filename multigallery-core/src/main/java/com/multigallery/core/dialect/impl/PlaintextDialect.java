package com.multigallery.core.dialect.impl;

import com.multigallery.core.ast.FormatKind;
import com.multigallery.core.dialect.AbstractMarkupDialect;
import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.ProfileUrls;
import com.multigallery.core.site.SiteIds;

import java.util.Optional;

/**
 * Plain text for sites without markup.
 *
 * <p>No formatting kind is supported, so formatted content is emitted as-is. Links are
 * spelled out as {@code display: url}, and users on other sites as {@code name on Site}.
 */
public class PlaintextDialect extends AbstractMarkupDialect {

    @Override
    public String getId() {
        return "plaintext";
    }

    @Override
    public String getDisplayName() {
        return "Plain text";
    }

    @Override
    public Optional<String> format(FormatKind kind, String content) {
        return Optional.empty();
    }

    @Override
    public String link(String url, String display) {
        if (display.isBlank() || display.strip().equals(url)) {
            return url;
        }
        return display.strip() + ": " + url;
    }

    @Override
    protected Optional<String> otherSiteUser(UserLink link) {
        if (SiteIds.MASTODON.equals(link.linkSite())) {
            ProfileUrls.MastodonHandle handle = ProfileUrls.MastodonHandle.parse(link.username());
            return Optional.of("@" + handle.user() + " on " + handle.instance());
        }
        if (SiteIds.TWITTER.equals(link.linkSite())) {
            return Optional.of("@" + ProfileUrls.twitterHandle(link.username()) + " on " + link.linkSiteName());
        }
        return Optional.of(link.username() + " on " + link.linkSiteName());
    }
}
