package com.multigallery.core.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Usernames of the uploader by canonical site id.
 *
 * <p>A description is generated for every site in the configuration and for no other, in
 * the order the sites were configured.
 */
public final class UsernameConfig {

    private final Map<String, String> usernames;

    private UsernameConfig(Map<String, String> usernames) {
        this.usernames = Collections.unmodifiableMap(new LinkedHashMap<>(usernames));
    }

    /**
     * Creates a configuration from usernames keyed by canonical site id.
     *
     * @param usernames usernames in configuration order
     * @return configuration
     */
    public static UsernameConfig of(Map<String, String> usernames) {
        Objects.requireNonNull(usernames, "usernames must not be null");
        usernames.forEach((site, username) -> {
            Objects.requireNonNull(site, "site must not be null");
            Objects.requireNonNull(username, "username must not be null for " + site);
        });
        return new UsernameConfig(usernames);
    }

    /**
     * Returns the username for a site.
     *
     * @param site canonical site id
     * @return username, or empty if the site is not configured
     */
    public Optional<String> username(String site) {
        return Optional.ofNullable(usernames.get(site));
    }

    /**
     * Returns true if a site is configured.
     *
     * @param site canonical site id
     * @return true if configured
     */
    public boolean has(String site) {
        return usernames.containsKey(site);
    }

    /**
     * Returns the configured sites in configuration order.
     *
     * @return canonical site ids
     */
    public Set<String> sites() {
        return usernames.keySet();
    }

    /**
     * Returns the configuration as an ordered, unmodifiable map.
     *
     * @return usernames by canonical site id
     */
    public Map<String, String> asMap() {
        return usernames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof UsernameConfig other && usernames.equals(other.usernames);
    }

    @Override
    public int hashCode() {
        return usernames.hashCode();
    }

    @Override
    public String toString() {
        return "UsernameConfig" + usernames;
    }
}
