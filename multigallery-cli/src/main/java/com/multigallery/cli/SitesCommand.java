package com.multigallery.cli;

import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;
import picocli.CommandLine.Command;

import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list the supported sites.
 *
 * <p>Sites are discovered via Java Service Provider Interface (SPI), so sites added by a
 * plugin jar on the class path are listed too.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * multigallery sites
 * }</pre>
 */
@Command(
    name = "sites",
    description = "List supported sites, their tag aliases and description files",
    mixinStandardHelpOptions = true
)
public class SitesCommand implements Callable<Integer> {

    private final SiteRegistry registry;

    /**
     * Creates the command with the sites found on the class path.
     */
    public SitesCommand() {
        this(SiteRegistry.discover());
    }

    SitesCommand(SiteRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        System.out.println("Supported Sites:");
        System.out.println();

        for (SiteDescriptor site : registry.sites()) {
            System.out.printf("  • %s (ID: %s)%n", site.displayName(), site.id());
            System.out.printf("    Tags: %s%n", String.join(", ", new TreeSet<>(site.aliases())));
            System.out.printf("    Markup: %s%n", site.dialect().getDisplayName());
            System.out.printf("    Description file: %s%n", site.descriptionFileName());
            System.out.println();
        }

        System.out.println("Other tags: b, i, u, url, self, if, else, user, siteurl, generic");
        return 0;
    }
}
