package com.multigallery.core.site;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Read-only table of destination sites, looked up by canonical id or alias.
 *
 * <p>The registry is the only place the interpreter learns which switch tags exist and how
 * each site renders markup. It is built once and shared by the parser and every per-site
 * render; nothing mutates it afterwards, so it is safe to use from several threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SiteRegistry registry = SiteRegistry.defaults();
 * registry.find("fa").map(SiteDescriptor::id);     // Optional["furaffinity"]
 * registry.find("Eka_Portal").map(SiteDescriptor::id); // Optional["aryion"]
 * }</pre>
 *
 * <p>Additional sites can be contributed through {@link SiteProvider} implementations
 * registered in {@code META-INF/services/com.multigallery.core.site.SiteProvider}
 * and loaded with {@link #discover()}.
 */
public final class SiteRegistry {

    private static final Logger log = LoggerFactory.getLogger(SiteRegistry.class);

    private final Map<String, SiteDescriptor> sitesById;
    private final Map<String, SiteDescriptor> sitesByAlias;

    private SiteRegistry(Map<String, SiteDescriptor> sitesById, Map<String, SiteDescriptor> sitesByAlias) {
        this.sitesById = Collections.unmodifiableMap(sitesById);
        this.sitesByAlias = Collections.unmodifiableMap(sitesByAlias);
    }

    /**
     * Returns the built-in registry (Eka's Portal, Fur Affinity, Weasyl, Inkbunny, SoFurry,
     * Twitter, Mastodon).
     *
     * @return default registry
     */
    public static SiteRegistry defaults() {
        return builder().addAll(new DefaultSiteProvider().sites()).build();
    }

    /**
     * Builds a registry from every {@link SiteProvider} found on the classpath.
     *
     * @return registry with all discovered sites
     * @throws IllegalStateException if no provider is found
     */
    public static SiteRegistry discover() {
        Builder builder = builder();
        int providers = 0;
        for (SiteProvider provider : ServiceLoader.load(SiteProvider.class)) {
            log.debug("Loading sites from provider {}", provider.getClass().getName());
            builder.addAll(provider.sites());
            providers++;
        }
        if (providers == 0) {
            throw new IllegalStateException("No SiteProvider registered on the classpath");
        }
        SiteRegistry registry = builder.build();
        log.debug("Discovered {} sites from {} providers", registry.sites().size(), providers);
        return registry;
    }

    /**
     * Creates an empty builder.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a site by canonical id or alias, case-insensitively.
     *
     * @param name id or alias
     * @return the site, or empty if the name is unknown (including {@code generic})
     */
    public Optional<SiteDescriptor> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sitesByAlias.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up a site that must exist.
     *
     * @param name id or alias
     * @return the site
     * @throws IllegalArgumentException if the name is not registered
     */
    public SiteDescriptor require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown site: " + name));
    }

    /**
     * Returns true if the name is a registered id or alias.
     *
     * @param name tag name or configuration key
     * @return true if known
     */
    public boolean isSite(String name) {
        return find(name).isPresent();
    }

    /**
     * Returns all sites in registration order.
     *
     * @return unmodifiable collection of sites
     */
    public Collection<SiteDescriptor> sites() {
        return sitesById.values();
    }

    /**
     * Builder collecting site descriptors; rejects alias collisions.
     */
    public static final class Builder {

        private final List<SiteDescriptor> sites = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a site.
         *
         * @param site descriptor
         * @return this builder
         */
        public Builder add(SiteDescriptor site) {
            sites.add(site);
            return this;
        }

        /**
         * Adds several sites.
         *
         * @param sites descriptors
         * @return this builder
         */
        public Builder addAll(Collection<SiteDescriptor> sites) {
            this.sites.addAll(sites);
            return this;
        }

        /**
         * Builds the registry.
         *
         * @return immutable registry
         * @throws IllegalArgumentException if two sites share an id or alias
         */
        public SiteRegistry build() {
            Map<String, SiteDescriptor> byId = new LinkedHashMap<>();
            Map<String, SiteDescriptor> byAlias = new HashMap<>();
            for (SiteDescriptor site : sites) {
                if (byId.putIfAbsent(site.id(), site) != null) {
                    throw new IllegalArgumentException("Duplicate site id: " + site.id());
                }
                for (String alias : site.aliases()) {
                    SiteDescriptor previous = byAlias.putIfAbsent(alias, site);
                    if (previous != null) {
                        throw new IllegalArgumentException(
                            "Alias '" + alias + "' is used by both " + previous.id() + " and " + site.id());
                    }
                }
            }
            return new SiteRegistry(byId, byAlias);
        }
    }
}
