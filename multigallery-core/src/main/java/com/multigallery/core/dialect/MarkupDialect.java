package com.multigallery.core.dialect;

import com.multigallery.core.ast.FormatKind;

import java.util.Optional;

/**
 * Markup adapter of one destination site.
 *
 * <p>The renderer produces plain strings for text and delegates every piece of markup to
 * the dialect of the site it is rendering for: basic formatting, literal links and user
 * links. Dialects are stateless and shared between concurrent renders.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class HtmlDialect implements MarkupDialect {
 *     public String getId() { return "html"; }
 *     public String getDisplayName() { return "HTML"; }
 *
 *     public Optional<String> format(FormatKind kind, String content) {
 *         return switch (kind) {
 *             case BOLD -> Optional.of("<b>" + content + "</b>");
 *             case ITALIC -> Optional.of("<i>" + content + "</i>");
 *             case UNDERLINE -> Optional.empty(); // rendered unwrapped
 *         };
 *     }
 *
 *     public String link(String url, String display) {
 *         return "<a href=\"" + url + "\">" + display + "</a>";
 *     }
 * }
 * }</pre>
 *
 * @see com.multigallery.core.site.SiteDescriptor
 * @see UserLink
 */
public interface MarkupDialect {

    /**
     * Returns the identifier of this dialect (e.g. "bbcode", "weasyl").
     *
     * @return lowercase identifier
     */
    String getId();

    /**
     * Returns a human-readable name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Wraps already rendered content in the markup for a formatting kind.
     *
     * @param kind formatting kind
     * @param content rendered children
     * @return formatted content, or empty if this dialect has no markup for the kind,
     *     in which case the content is emitted unwrapped
     */
    Optional<String> format(FormatKind kind, String content);

    /**
     * Renders a literal link.
     *
     * @param url target URL
     * @param display rendered display text (may be blank)
     * @return link markup
     */
    String link(String url, String display);

    /**
     * Renders a link to a user profile.
     *
     * <p>The default renders a plain link to the profile URL. Site dialects override this
     * to use their native user mentions.
     *
     * @param link resolved user link
     * @return user link markup
     */
    default String userLink(UserLink link) {
        return link(link.profileUrl(), link.display());
    }
}
