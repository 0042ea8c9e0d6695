package com.multigallery.core.site;

import com.multigallery.core.dialect.impl.AryionDialect;
import com.multigallery.core.dialect.impl.FuraffinityDialect;
import com.multigallery.core.dialect.impl.InkbunnyDialect;
import com.multigallery.core.dialect.impl.MastodonDialect;
import com.multigallery.core.dialect.impl.SoFurryDialect;
import com.multigallery.core.dialect.impl.TwitterDialect;
import com.multigallery.core.dialect.impl.WeasylDialect;

import java.util.List;
import java.util.Set;

/**
 * Built-in sites.
 *
 * <table>
 *   <caption>Built-in sites</caption>
 *   <tr><th>Id</th><th>Aliases</th><th>Description file</th></tr>
 *   <tr><td>aryion</td><td>eka, eka_portal</td><td>desc_aryion.txt</td></tr>
 *   <tr><td>furaffinity</td><td>fa</td><td>desc_furaffinity.txt</td></tr>
 *   <tr><td>weasyl</td><td></td><td>desc_weasyl.md</td></tr>
 *   <tr><td>inkbunny</td><td>ib</td><td>desc_inkbunny.txt</td></tr>
 *   <tr><td>sofurry</td><td>sf</td><td>desc_sofurry.txt</td></tr>
 *   <tr><td>twitter</td><td></td><td>desc_twitter.txt</td></tr>
 *   <tr><td>mastodon</td><td></td><td>desc_mastodon.txt</td></tr>
 * </table>
 */
public class DefaultSiteProvider implements SiteProvider {

    @Override
    public List<SiteDescriptor> sites() {
        return List.of(
            new SiteDescriptor(SiteIds.ARYION, "Eka's Portal", Set.of("eka", "eka_portal"),
                new AryionDialect(), ProfileUrls::aryion, "desc_aryion.txt"),
            new SiteDescriptor(SiteIds.FURAFFINITY, "Fur Affinity", Set.of("fa"),
                new FuraffinityDialect(), ProfileUrls::furaffinity, "desc_furaffinity.txt"),
            new SiteDescriptor(SiteIds.WEASYL, "Weasyl", Set.of(),
                new WeasylDialect(), ProfileUrls::weasyl, "desc_weasyl.md"),
            new SiteDescriptor(SiteIds.INKBUNNY, "Inkbunny", Set.of("ib"),
                new InkbunnyDialect(), ProfileUrls::inkbunny, "desc_inkbunny.txt"),
            new SiteDescriptor(SiteIds.SOFURRY, "SoFurry", Set.of("sf"),
                new SoFurryDialect(), ProfileUrls::sofurry, "desc_sofurry.txt"),
            new SiteDescriptor(SiteIds.TWITTER, "Twitter", Set.of(),
                new TwitterDialect(), ProfileUrls::twitter, "desc_twitter.txt"),
            new SiteDescriptor(SiteIds.MASTODON, "Mastodon", Set.of(),
                new MastodonDialect(), ProfileUrls::mastodon, "desc_mastodon.txt")
        );
    }
}
