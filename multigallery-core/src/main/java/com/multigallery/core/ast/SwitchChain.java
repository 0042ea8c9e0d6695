package com.multigallery.core.ast;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Nested switch tags flattened into bindings, outermost first.
 *
 * <p>Invariants checked on construction:
 * <ul>
 *   <li>at least one binding</li>
 *   <li>no concrete site appears twice</li>
 *   <li>at most one generic binding</li>
 *   <li>at most one binding carries display children</li>
 * </ul>
 * The parser reports these as positioned parse errors before ever building a chain, so
 * the checks here only guard programmatic construction.
 *
 * @param bindings bindings from the outermost tag to the innermost
 */
public record SwitchChain(List<Binding> bindings) {

    /**
     * Compact constructor with validation.
     */
    public SwitchChain {
        Objects.requireNonNull(bindings, "bindings must not be null");
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException("a switch chain needs at least one binding");
        }
        Set<String> sites = new HashSet<>();
        int withChildren = 0;
        for (Binding binding : bindings) {
            if (!sites.add(binding.site())) {
                throw new IllegalArgumentException(binding.isGeneric()
                    ? "a switch chain allows only one generic binding"
                    : "duplicate site in switch chain: " + binding.site());
            }
            if (binding.hasChildren()) {
                withChildren++;
            }
        }
        if (withChildren > 1) {
            throw new IllegalArgumentException("only the innermost binding may carry display text");
        }
        bindings = List.copyOf(bindings);
    }

    /**
     * Creates a chain from bindings listed outermost first.
     *
     * @param bindings bindings
     * @return chain
     */
    public static SwitchChain of(Binding... bindings) {
        return new SwitchChain(List.of(bindings));
    }

    /**
     * Returns the binding for a concrete site.
     *
     * @param site canonical site id
     * @return binding, or empty if the chain has none for the site
     */
    public Optional<Binding> bindingFor(String site) {
        return bindings.stream()
            .filter(binding -> !binding.isGeneric() && binding.site().equals(site))
            .findFirst();
    }

    /**
     * Returns the generic binding.
     *
     * @return generic binding, or empty
     */
    public Optional<Binding> generic() {
        return bindings.stream().filter(Binding::isGeneric).findFirst();
    }

    /**
     * Returns the innermost binding.
     *
     * @return last binding
     */
    public Binding innermost() {
        return bindings.get(bindings.size() - 1);
    }

    /**
     * Returns the display text the author wrapped in a site binding of the chain, if any.
     *
     * <p>Text inside {@code [generic]} is not an override: it is shown only when the generic
     * binding itself is selected.
     *
     * @return children of the site binding that has them, or empty
     */
    public Optional<List<Node>> displayOverride() {
        return bindings.stream()
            .filter(binding -> !binding.isGeneric() && binding.hasChildren())
            .map(Binding::children)
            .findFirst();
    }
}
