package com.multigallery.core.site;

/**
 * Builds the canonical profile URL of a user on one site.
 */
@FunctionalInterface
public interface ProfileUrlBuilder {

    /**
     * Returns the profile URL for the given username.
     *
     * @param username username as written by the author (already trimmed)
     * @return absolute profile URL
     */
    String build(String username);
}
