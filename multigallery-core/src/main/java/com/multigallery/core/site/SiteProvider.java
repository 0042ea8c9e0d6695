package com.multigallery.core.site;

import java.util.List;

/**
 * Service provider contributing destination sites to {@link SiteRegistry#discover()}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.multigallery.core.site.SiteProvider}
 */
public interface SiteProvider {

    /**
     * Returns the sites contributed by this provider, in display order.
     *
     * @return site descriptors
     */
    List<SiteDescriptor> sites();
}
