package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.site.ProfileUrls;

import java.util.Optional;

/**
 * Twitter: plain text with {@code @handle} mentions.
 */
public class TwitterDialect extends PlaintextDialect {

    @Override
    public String getId() {
        return "twitter";
    }

    @Override
    public String getDisplayName() {
        return "Twitter plain text";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of("@" + ProfileUrls.twitterHandle(link.username()));
    }
}
