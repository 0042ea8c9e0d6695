package com.multigallery.core.dialect.impl;

import com.multigallery.core.dialect.UserLink;

import java.util.Optional;

/**
 * Eka's Portal: BBCode with {@code :iconname:} user icons.
 */
public class AryionDialect extends BbcodeDialect {

    @Override
    public String getId() {
        return "aryion";
    }

    @Override
    public String getDisplayName() {
        return "Eka's Portal BBCode";
    }

    @Override
    protected Optional<String> ownSiteUser(UserLink link) {
        return Optional.of(":icon" + link.username() + ":");
    }
}
