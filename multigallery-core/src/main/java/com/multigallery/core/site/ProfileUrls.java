package com.multigallery.core.site;

import java.util.Locale;

/**
 * Profile URL builders of the built-in sites.
 *
 * <p>Builders throw {@link IllegalArgumentException} for usernames the site cannot address;
 * the parser and configuration loader call them up front so rendering never does with an
 * invalid name.
 */
public final class ProfileUrls {

    private ProfileUrls() {
        // Utility class
    }

    public static String aryion(String username) {
        return "https://aryion.com/g4/user/" + username;
    }

    /** Fur Affinity drops underscores from profile paths. */
    public static String furaffinity(String username) {
        return "https://furaffinity.net/user/" + username.replace("_", "");
    }

    public static String weasyl(String username) {
        return "https://www.weasyl.com/~" + username.replace(" ", "").toLowerCase(Locale.ROOT);
    }

    public static String inkbunny(String username) {
        return "https://inkbunny.net/" + username;
    }

    public static String sofurry(String username) {
        return "https://" + username.replace(" ", "-").toLowerCase(Locale.ROOT) + ".sofurry.com";
    }

    /** Accepts both {@code name} and {@code @name}. */
    public static String twitter(String username) {
        return "https://twitter.com/" + twitterHandle(username);
    }

    /**
     * Builds {@code https://instance/@user} from {@code user@instance} or {@code @user@instance}.
     *
     * @param username handle including the instance
     * @return profile URL
     * @throws IllegalArgumentException if the handle has no instance part
     */
    public static String mastodon(String username) {
        MastodonHandle handle = MastodonHandle.parse(username);
        return "https://" + handle.instance() + "/@" + handle.user();
    }

    /**
     * Strips everything up to the last {@code @}.
     *
     * @param username twitter username with or without leading {@code @}
     * @return bare handle
     */
    public static String twitterHandle(String username) {
        int at = username.lastIndexOf('@');
        return at >= 0 ? username.substring(at + 1) : username;
    }

    /**
     * A Mastodon handle split into user and instance.
     *
     * @param user user part
     * @param instance instance host
     */
    public record MastodonHandle(String user, String instance) {

        /**
         * Parses {@code user@instance}, ignoring a leading {@code @}.
         *
         * @param handle raw handle
         * @return parsed handle
         * @throws IllegalArgumentException if either part is missing
         */
        public static MastodonHandle parse(String handle) {
            String trimmed = handle.trim();
            if (trimmed.startsWith("@")) {
                trimmed = trimmed.substring(1);
            }
            int at = trimmed.lastIndexOf('@');
            if (at <= 0 || at == trimmed.length() - 1) {
                throw new IllegalArgumentException(
                    "Mastodon handle must look like user@instance, got '" + handle + "'");
            }
            String user = trimmed.substring(0, at);
            // "@a@b@instance" style input keeps only the last user segment
            int previousAt = user.lastIndexOf('@');
            if (previousAt >= 0) {
                user = user.substring(previousAt + 1);
            }
            if (user.isEmpty()) {
                throw new IllegalArgumentException(
                    "Mastodon handle must look like user@instance, got '" + handle + "'");
            }
            return new MastodonHandle(user, trimmed.substring(at + 1));
        }

        @Override
        public String toString() {
            return "@" + user + "@" + instance;
        }
    }
}
