package com.multigallery.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed description.
 *
 * <p>All nodes are immutable records; child lists are copied on construction. A parsed
 * tree can therefore be rendered for several sites at once without coordination.
 *
 * <p><b>Example:</b> {@code [b]Hi[/b] [self][/self]} parses to
 * <pre>{@code
 * new Document(List.of(
 *     new Format(FormatKind.BOLD, List.of(new Text("Hi"))),
 *     new Text(" "),
 *     new SelfLink()
 * ))
 * }</pre>
 */
public sealed interface Node permits Node.Document, Node.Text, Node.Format, Node.Link, Node.SelfLink,
    Node.UserSwitch, Node.SiteUrlSwitch, Node.Conditional {

    /**
     * Root of a parse: a sequence of nodes.
     *
     * @param children top-level nodes
     */
    record Document(List<Node> children) implements Node {
        public Document {
            children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        }
    }

    /**
     * Literal text.
     *
     * @param text the text
     */
    record Text(String text) implements Node {
        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /**
     * Bold, italic or underlined content.
     *
     * @param kind formatting kind
     * @param children formatted content
     */
    record Format(FormatKind kind, List<Node> children) implements Node {
        public Format {
            Objects.requireNonNull(kind, "kind must not be null");
            children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        }
    }

    /**
     * Literal {@code [url]} link.
     *
     * @param url target URL
     * @param children display content
     */
    record Link(String url, List<Node> children) implements Node {
        public Link {
            Objects.requireNonNull(url, "url must not be null");
            children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
        }
    }

    /**
     * {@code [self][/self]}: link to the uploader's own profile, resolved at render time.
     */
    record SelfLink() implements Node {
    }

    /**
     * Per-site user link; bindings hold usernames.
     *
     * @param chain switch chain
     */
    record UserSwitch(SwitchChain chain) implements Node {
        public UserSwitch {
            Objects.requireNonNull(chain, "chain must not be null");
        }
    }

    /**
     * Per-site URL; bindings hold raw URLs and there is no innermost fallback.
     *
     * @param chain switch chain
     */
    record SiteUrlSwitch(SwitchChain chain) implements Node {
        public SiteUrlSwitch {
            Objects.requireNonNull(chain, "chain must not be null");
        }
    }

    /**
     * {@code [if=...]...[/if]} with an optional adjacent {@code [else]...[/else]}.
     *
     * @param condition tested condition
     * @param thenBranch rendered when the condition holds
     * @param elseBranch rendered otherwise; {@code null} when no else was bound
     */
    record Conditional(Condition condition, List<Node> thenBranch, List<Node> elseBranch) implements Node {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            thenBranch = List.copyOf(Objects.requireNonNull(thenBranch, "thenBranch must not be null"));
            elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
        }

        /**
         * Returns true if an else branch was bound.
         *
         * @return true if present
         */
        public boolean hasElse() {
            return elseBranch != null;
        }
    }
}
