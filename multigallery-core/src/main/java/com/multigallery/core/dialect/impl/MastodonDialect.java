package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.ProfileUrls;

import java.util.Optional;

/**
 * Mastodon: plain text with fully qualified {@code @user@instance} mentions.
 */
public class MastodonDialect extends PlaintextDialect {

    @Override
    public String getId() {
        return "mastodon";
    }

    @Override
    public String getDisplayName() {
        return "Mastodon plain text";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of(ProfileUrls.MastodonHandle.parse(link.username()).toString());
    }
}
