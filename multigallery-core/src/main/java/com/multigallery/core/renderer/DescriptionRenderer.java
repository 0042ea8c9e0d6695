package com.multigallery.core.renderer;

import com.multigallery.core.ast.Binding;
import com.multigallery.core.ast.Node;
import com.multigallery.core.ast.Node.Conditional;
import com.multigallery.core.ast.Node.Document;
import com.multigallery.core.ast.Node.Format;
import com.multigallery.core.ast.Node.Link;
import com.multigallery.core.ast.Node.SelfLink;
import com.multigallery.core.ast.Node.SiteUrlSwitch;
import com.multigallery.core.ast.Node.Text;
import com.multigallery.core.ast.Node.UserSwitch;
import com.multigallery.core.ast.SwitchChain;
import com.multigallery.core.dialect.MarkupDialect;
import com.multigallery.core.dialect.UserLink;
import com.multigallery.core.resolve.Resolution;
import com.multigallery.core.resolve.SwitchResolver;
import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders a parsed description for one site.
 *
 * <p>Rendering is a pure function of the document, the registry and the context: the
 * document is never modified, and no state is shared between calls, so one renderer may
 * render the same document for many sites concurrently.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SiteRegistry registry = SiteRegistry.defaults();
 * Document document = new MarkupParser(registry).parse("[b]Hi[/b] [fa=Ipsum]Dolor[/fa]");
 *
 * RenderResult result = new DescriptionRenderer(registry)
 *     .render(document, RenderContext.forSite("weasyl"));
 * // **Hi** [Dolor](https://furaffinity.net/user/Ipsum)
 * }</pre>
 */
public class DescriptionRenderer {

    private final SiteRegistry registry;
    private final SwitchResolver resolver;
    private final ConditionEvaluator evaluator;

    /**
     * Creates a renderer with the default resolver and evaluator.
     *
     * @param registry site registry
     */
    public DescriptionRenderer(SiteRegistry registry) {
        this(registry, new SwitchResolver(), new ConditionEvaluator());
    }

    /**
     * Creates a renderer.
     *
     * @param registry site registry
     * @param resolver switch chain resolver
     * @param evaluator condition evaluator
     */
    public DescriptionRenderer(SiteRegistry registry, SwitchResolver resolver, ConditionEvaluator evaluator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Renders a document.
     *
     * @param document parsed description
     * @param context site, flags and usernames to render with; the site may be an alias
     * @return rendered text with the warnings found on the way
     * @throws IllegalArgumentException if the context names a site the registry does not know
     */
    public RenderResult render(Document document, RenderContext context) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(context, "context must not be null");

        SiteDescriptor target = registry.require(context.site());
        RenderContext canonical = target.id().equals(context.site())
            ? context
            : new RenderContext(target.id(), context.definedFlags(), context.usernames());
        Pass pass = new Pass(target, canonical);
        String text = pass.renderAll(document.children());
        return new RenderResult(target.id(), text, pass.warnings);
    }

    /**
     * State of one render: the target site and the warnings collected so far.
     */
    private final class Pass {

        private final SiteDescriptor target;
        private final MarkupDialect dialect;
        private final RenderContext context;
        private final List<RenderWarning> warnings = new ArrayList<>();

        Pass(SiteDescriptor target, RenderContext context) {
            this.target = target;
            this.dialect = target.dialect();
            this.context = context;
        }

        String renderAll(List<Node> nodes) {
            StringBuilder out = new StringBuilder();
            for (Node node : nodes) {
                out.append(render(node));
            }
            return out.toString();
        }

        private String render(Node node) {
            if (node instanceof Text text) {
                return text.text();
            }
            if (node instanceof Format format) {
                String content = renderAll(format.children());
                return dialect.format(format.kind(), content).orElse(content);
            }
            if (node instanceof Link link) {
                return literalLink(link.url(), renderAll(link.children()));
            }
            if (node instanceof SelfLink) {
                return renderSelfLink();
            }
            if (node instanceof UserSwitch userSwitch) {
                return renderUserSwitch(userSwitch.chain());
            }
            if (node instanceof SiteUrlSwitch siteUrlSwitch) {
                return renderSiteUrlSwitch(siteUrlSwitch.chain());
            }
            if (node instanceof Conditional conditional) {
                if (evaluator.evaluate(conditional.condition(), context)) {
                    return renderAll(conditional.thenBranch());
                }
                return conditional.hasElse() ? renderAll(conditional.elseBranch()) : "";
            }
            if (node instanceof Document document) {
                return renderAll(document.children());
            }
            throw new IllegalStateException("Unsupported node type: " + node.getClass().getSimpleName());
        }

        private String renderSelfLink() {
            if (context.usernames().isEmpty()) {
                warnings.add(RenderWarning.selfLinkGap(target.id(),
                    "[self] rendered empty: no usernames are configured"));
                return "";
            }
            List<Binding> bindings = new ArrayList<>();
            for (Map.Entry<String, String> entry : context.usernames().entrySet()) {
                bindings.add(Binding.of(entry.getKey(), entry.getValue()));
            }
            // Exact match only: a self link never points at another site's profile.
            Optional<Resolution> resolution = resolver.resolve(new SwitchChain(bindings), false, target.id());
            if (resolution.isEmpty()) {
                warnings.add(RenderWarning.selfLinkGap(target.id(),
                    "[self] rendered empty: no username configured for " + target.id()));
                return "";
            }
            return userLink(resolution.get());
        }

        private String renderUserSwitch(SwitchChain chain) {
            return resolver.resolve(chain, true, target.id())
                .map(resolution -> resolution.isGeneric()
                    ? dialect.link(resolution.linkAttribute(), renderAll(resolution.display()))
                    : userLink(resolution))
                .orElse("");
        }

        private String renderSiteUrlSwitch(SwitchChain chain) {
            Optional<Resolution> resolution = resolver.resolve(chain, false, target.id());
            if (resolution.isEmpty()) {
                warnings.add(RenderWarning.resolutionGap(target.id(),
                    "[siteurl] with " + describe(chain) + " has no entry for " + target.id()
                        + " and no [generic]; rendered nothing"));
                return "";
            }
            return dialect.link(resolution.get().linkAttribute(), renderAll(resolution.get().display()));
        }

        private String literalLink(String url, String display) {
            return dialect.link(url, display.isBlank() ? url : display);
        }

        private String userLink(Resolution resolution) {
            SiteDescriptor linkSite = registry.require(resolution.linkSite());
            String username = resolution.linkAttribute();
            return dialect.userLink(new UserLink(
                target.id(),
                linkSite.id(),
                linkSite.displayName(),
                username,
                linkSite.profileUrlOf(username),
                renderAll(resolution.display()),
                resolution.displayOverridden()
            ));
        }

        private String describe(SwitchChain chain) {
            return chain.bindings().stream()
                .map(Binding::site)
                .collect(Collectors.joining(", "));
        }
    }
}
