package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;

import java.util.Optional;

/**
 * Fur Affinity: BBCode with {@code :iconname:} user icons.
 */
public class FuraffinityDialect extends BbcodeDialect {

    @Override
    public String getId() {
        return "furaffinity";
    }

    @Override
    public String getDisplayName() {
        return "Fur Affinity BBCode";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of(":icon" + link.username() + ":");
    }
}
