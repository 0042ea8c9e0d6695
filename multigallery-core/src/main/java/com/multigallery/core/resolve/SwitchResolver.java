package com.multigallery.core.resolve;

import com.multigallery.core.ast.Binding;
import com.multigallery.core.ast.Node;
import com.multigallery.core.ast.Node.Text;
import com.multigallery.core.ast.SwitchChain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the binding of a switch chain that applies to a target site.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li><b>Exact</b>: a binding for the target site. Display is the chain's override text,
 *       else the binding's attribute.</li>
 *   <li><b>Generic</b>: the chain's generic binding, linked to its literal URL. Display is the
 *       generic binding's own text, else the chain's override text, else nothing.</li>
 *   <li><b>Innermost</b> (user chains only): the innermost binding, linked to its own site.
 *       Display is the chain's override text, else the binding's attribute.</li>
 * </ol>
 * Site-url chains without exact or generic match resolve to nothing.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SwitchChain chain = SwitchChain.of(
 *     Binding.of("furaffinity", "Elit"),
 *     new Binding(Binding.GENERIC, "https://example.com", List.of(new Text("Bad Manners"))));
 *
 * resolver.resolve(chain, true, "furaffinity"); // EXACT, Elit
 * resolver.resolve(chain, true, "weasyl");      // GENERIC, https://example.com
 * }</pre>
 */
public class SwitchResolver {

    /**
     * Resolves a chain.
     *
     * @param chain switch chain
     * @param userChain true for user chains, false for site-url chains
     * @param targetSite canonical id of the site being rendered for
     * @return resolution, or empty if nothing applies
     */
    public Optional<Resolution> resolve(SwitchChain chain, boolean userChain, String targetSite) {
        Objects.requireNonNull(chain, "chain must not be null");
        Objects.requireNonNull(targetSite, "targetSite must not be null");

        Optional<List<Node>> override = chain.displayOverride();

        Optional<Binding> exact = chain.bindingFor(targetSite);
        if (exact.isPresent()) {
            return Optional.of(named(MatchKind.EXACT, exact.get(), override));
        }

        Optional<Binding> generic = chain.generic();
        if (generic.isPresent()) {
            Binding binding = generic.get();
            List<Node> display = binding.hasChildren() ? binding.children() : override.orElse(List.of());
            return Optional.of(new Resolution(MatchKind.GENERIC, Binding.GENERIC, binding.attribute(),
                display, !display.isEmpty()));
        }

        if (userChain) {
            return Optional.of(named(MatchKind.INNERMOST, chain.innermost(), override));
        }
        return Optional.empty();
    }

    private static Resolution named(MatchKind kind, Binding binding, Optional<List<Node>> override) {
        if (override.isPresent()) {
            return new Resolution(kind, binding.site(), binding.attribute(), override.get(), true);
        }
        return new Resolution(kind, binding.site(), binding.attribute(),
            List.of(new Text(binding.attribute())), false);
    }
}
