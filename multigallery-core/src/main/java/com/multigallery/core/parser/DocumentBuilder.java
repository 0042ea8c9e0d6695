package com.multigallery.core.parser;

import com.multigallery.core.ast.Binding;
import com.multigallery.core.ast.Condition;
import com.multigallery.core.ast.FormatKind;
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
import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link Document} tree from a {@link DescriptionParser} parse tree.
 *
 * <p>The grammar accepts any token sequence; everything that makes a description invalid
 * (unknown tags, unclosed or mismatched tags, malformed switch chains, bad usernames) is
 * checked here and reported as a {@link MarkupParseException} at the offending tag.
 */
final class DocumentBuilder extends DescriptionParserBaseVisitor<Node> {

    private static final String URL = "url";
    private static final String SELF = "self";
    private static final String USER = "user";
    private static final String SITEURL = "siteurl";

    private static final int PREVIEW_LENGTH = 20;

    private final SiteRegistry registry;
    private final ConditionParser conditionParser;

    DocumentBuilder(SiteRegistry registry, ConditionParser conditionParser) {
        this.registry = registry;
        this.conditionParser = conditionParser;
    }

    /**
     * Builds the document for a whole parse.
     *
     * @param document root of the parse tree
     * @return document node
     * @throws MarkupParseException at the first problem, in source order
     */
    Document build(DescriptionParser.DocumentContext document) {
        return (Document) visitDocument(document);
    }

    @Override
    public Node visitDocument(DescriptionParser.DocumentContext ctx) {
        List<Node> nodes = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof DescriptionParser.NodeContext node) {
                nodes.add(visitNode(node));
            } else if (child instanceof DescriptionParser.StrayCloseContext stray) {
                throw MarkupParseException.at(stray.getStart(), "Unexpected closing tag " + stray.getText());
            }
        }
        return new Document(nodes);
    }

    @Override
    public Node visitNode(DescriptionParser.NodeContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitText(DescriptionParser.TextContext ctx) {
        return new Text(ctx.getText());
    }

    @Override
    public Node visitMalformed(DescriptionParser.MalformedContext ctx) {
        Token token = ctx.getStart();
        if (ctx.CLOSE_TAG_WITH_ATTRIBUTE() != null) {
            throw MarkupParseException.at(token,
                "Closing tag [/" + TagToken.of(token).name() + "] cannot have an attribute");
        }
        throw MarkupParseException.at(token, "Malformed tag '" + preview(token) + "'");
    }

    @Override
    public Node visitStrayElse(DescriptionParser.StrayElseContext ctx) {
        throw MarkupParseException.at(ctx.getStart(), "[else] must directly follow [/if] with nothing in between");
    }

    @Override
    public Node visitConditional(DescriptionParser.ConditionalContext ctx) {
        TagToken open = TagToken.of(ctx.IF_OPEN().getSymbol());
        Condition condition;
        try {
            condition = conditionParser.parse(open.attribute());
        } catch (IllegalArgumentException e) {
            throw MarkupParseException.at(open.token(), e.getMessage());
        }
        List<Node> thenBranch = content(ctx.content());
        if (ctx.IF_CLOSE() == null) {
            throw unclosed(open);
        }

        List<Node> elseBranch = null;
        DescriptionParser.ElseBranchContext branch = ctx.elseBranch();
        if (branch != null) {
            TagToken elseOpen = TagToken.of(branch.ELSE_OPEN().getSymbol());
            rejectAttribute(elseOpen);
            elseBranch = content(branch.content());
            if (branch.ELSE_CLOSE() == null) {
                throw unclosed(elseOpen);
            }
        }
        return new Conditional(condition, thenBranch, elseBranch);
    }

    @Override
    public Node visitElement(DescriptionParser.ElementContext ctx) {
        TagToken open = TagToken.of(ctx.OPEN_TAG().getSymbol());
        String name = open.name();

        FormatKind kind = formatKind(name);
        if (kind != null) {
            rejectAttribute(open);
            return new Format(kind, closedContent(ctx, open));
        }
        switch (name) {
            case URL:
                return link(ctx, open);
            case SELF:
                return self(ctx, open);
            case USER:
                rejectAttribute(open);
                return new UserSwitch(wrapper(ctx, open, true));
            case SITEURL:
                rejectAttribute(open);
                return new SiteUrlSwitch(wrapper(ctx, open, false));
            default:
                break;
        }
        if (isSwitchTag(name)) {
            List<Binding> bindings = new ArrayList<>();
            binding(ctx, open, bindings, new HashSet<>(), true);
            return new UserSwitch(new SwitchChain(bindings));
        }
        throw MarkupParseException.at(open.token(), "Unknown tag " + open.describe());
    }

    private List<Node> content(DescriptionParser.ContentContext ctx) {
        List<Node> nodes = new ArrayList<>();
        for (DescriptionParser.NodeContext node : ctx.node()) {
            nodes.add(visitNode(node));
        }
        return nodes;
    }

    private List<Node> closedContent(DescriptionParser.ElementContext ctx, TagToken open) {
        List<Node> nodes = content(ctx.content());
        requireClosed(ctx, open);
        return nodes;
    }

    private void requireClosed(DescriptionParser.ElementContext ctx, TagToken open) {
        if (ctx.CLOSE_TAG() == null) {
            throw unclosed(open);
        }
        TagToken close = TagToken.of(ctx.CLOSE_TAG().getSymbol());
        if (!close.name().equals(open.name())) {
            throw MarkupParseException.at(close.token(), "Expected [/" + open.name() + "] to close "
                + open.describe() + " but found " + close.describe());
        }
    }

    private static MarkupParseException unclosed(TagToken open) {
        return MarkupParseException.at(open.token(), "Unclosed tag " + open.describe());
    }

    private static void rejectAttribute(TagToken open) {
        if (open.attribute() != null) {
            throw MarkupParseException.at(open.token(), "[" + open.name() + "] does not take an attribute");
        }
    }

    private Node link(DescriptionParser.ElementContext ctx, TagToken open) {
        List<Node> children = closedContent(ctx, open);
        String url = blankToNull(open.attribute());
        if (url == null) {
            if (!isPlainText(children)) {
                throw MarkupParseException.at(open.token(), "[url] without attribute must contain a plain URL");
            }
            url = plainText(children).trim();
            if (url.isEmpty()) {
                throw MarkupParseException.at(open.token(),
                    "[url] requires a URL: [url=https://...]text[/url] or [url]https://...[/url]");
            }
        }
        return new Link(url, children);
    }

    private Node self(DescriptionParser.ElementContext ctx, TagToken open) {
        rejectAttribute(open);
        if (!closedContent(ctx, open).isEmpty()) {
            throw MarkupParseException.at(open.token(), "[self] must be empty; write [self][/self]");
        }
        return new SelfLink();
    }

    /**
     * Builds the single chain inside {@code [user]} or {@code [siteurl]}.
     */
    private SwitchChain wrapper(DescriptionParser.ElementContext ctx, TagToken open, boolean userChain) {
        List<Binding> bindings = null;
        for (DescriptionParser.NodeContext node : ctx.content().node()) {
            if (node.text() != null) {
                if (!node.getText().isBlank()) {
                    throw MarkupParseException.at(node.getStart(), "Text is not allowed directly inside "
                        + open.describe() + "; put it inside a site tag");
                }
                continue;
            }
            if (node.malformed() != null || node.strayElse() != null) {
                visitNode(node);
            }
            DescriptionParser.ElementContext element = node.element();
            if (element == null || !isSwitchTag(TagToken.of(element.OPEN_TAG().getSymbol()).name())) {
                throw MarkupParseException.at(node.getStart(), open.describe()
                    + " may only contain site tags or [generic], found " + node.getStart().getText());
            }
            if (bindings != null) {
                throw MarkupParseException.at(node.getStart(), open.describe()
                    + " must contain a single chain of nested site tags");
            }
            bindings = new ArrayList<>();
            binding(element, TagToken.of(element.OPEN_TAG().getSymbol()), bindings, new HashSet<>(), userChain);
        }
        requireClosed(ctx, open);
        if (bindings == null) {
            throw MarkupParseException.at(open.token(), open.describe() + " must contain at least one site tag");
        }
        return new SwitchChain(bindings);
    }

    /**
     * Builds one switch tag and everything nested in it, appending bindings outermost first.
     */
    private void binding(DescriptionParser.ElementContext ctx, TagToken open, List<Binding> bindings,
                         Set<String> seen, boolean userChain) {
        boolean generic = Binding.GENERIC.equals(open.name());
        SiteDescriptor descriptor = generic ? null : registry.require(open.name());
        String site = generic ? Binding.GENERIC : descriptor.id();
        if (!seen.add(site)) {
            throw MarkupParseException.at(open.token(), generic
                ? "Only one [generic] tag is allowed per chain"
                : "Site '" + site + "' appears twice in the same chain");
        }

        String attribute = blankToNull(open.attribute());
        if (generic && attribute == null) {
            throw MarkupParseException.at(open.token(), "[generic] requires a URL: [generic=https://...]text[/generic]");
        }

        int slot = bindings.size();
        bindings.add(null);

        List<DescriptionParser.NodeContext> significant = new ArrayList<>();
        for (DescriptionParser.NodeContext node : ctx.content().node()) {
            if (node.text() == null || !node.getText().isBlank()) {
                significant.add(node);
            }
        }
        DescriptionParser.ElementContext inner = significant.isEmpty() ? null : significant.get(0).element();
        if (inner != null && isSwitchTag(TagToken.of(inner.OPEN_TAG().getSymbol()).name())) {
            if (attribute == null) {
                throw MarkupParseException.at(open.token(), open.describe()
                    + " wraps another site tag and needs an attribute, e.g. [" + open.name() + "=name]");
            }
            binding(inner, TagToken.of(inner.OPEN_TAG().getSymbol()), bindings, seen, userChain);
            if (significant.size() > 1) {
                throw MarkupParseException.at(significant.get(1).getStart(), open.describe()
                    + " may contain either one nested site tag or display text, not both");
            }
            requireClosed(ctx, open);
            bindings.set(slot, Binding.of(site, checkedAttribute(open, descriptor, attribute, userChain)));
            return;
        }

        List<Node> children = closedContent(ctx, open);
        if (containsSwitch(children)) {
            throw MarkupParseException.at(open.token(), open.describe()
                + " may contain either one nested site tag or display text, not both");
        }

        if (attribute == null) {
            if (!isPlainText(children)) {
                throw MarkupParseException.at(open.token(), open.describe()
                    + " without attribute must contain only a plain name");
            }
            attribute = plainText(children).trim();
            if (attribute.isEmpty()) {
                throw MarkupParseException.at(open.token(), open.describe() + " needs a name: [" + open.name()
                    + "=name][/" + open.name() + "] or [" + open.name() + "]name[/" + open.name() + "]");
            }
            children = List.of();
        } else if (isPlainText(children)) {
            String text = plainText(children).trim();
            children = text.isEmpty() ? List.of() : List.of(new Text(text));
        }
        bindings.set(slot, new Binding(site, checkedAttribute(open, descriptor, attribute, userChain), children));
    }

    private String checkedAttribute(TagToken open, SiteDescriptor descriptor, String attribute, boolean userChain) {
        if (userChain && descriptor != null) {
            try {
                descriptor.profileUrlOf(attribute);
            } catch (IllegalArgumentException e) {
                throw MarkupParseException.at(open.token(), e.getMessage());
            }
        }
        return attribute;
    }

    private boolean isSwitchTag(String name) {
        return Binding.GENERIC.equals(name) || registry.isSite(name);
    }

    /**
     * Returns true if a switch appears anywhere in the nodes, at any depth.
     */
    private static boolean containsSwitch(List<Node> nodes) {
        for (Node node : nodes) {
            if (node instanceof UserSwitch || node instanceof SiteUrlSwitch) {
                return true;
            }
            if (node instanceof Format format && containsSwitch(format.children())) {
                return true;
            }
            if (node instanceof Link link && containsSwitch(link.children())) {
                return true;
            }
            if (node instanceof Conditional conditional
                && (containsSwitch(conditional.thenBranch())
                    || conditional.hasElse() && containsSwitch(conditional.elseBranch()))) {
                return true;
            }
        }
        return false;
    }

    private static FormatKind formatKind(String name) {
        for (FormatKind kind : FormatKind.values()) {
            if (kind.tagName().equals(name)) {
                return kind;
            }
        }
        return null;
    }

    private static boolean isPlainText(List<Node> nodes) {
        return nodes.stream().allMatch(node -> node instanceof Text);
    }

    private static String plainText(List<Node> nodes) {
        StringBuilder text = new StringBuilder();
        for (Node node : nodes) {
            text.append(((Text) node).text());
        }
        return text.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String preview(Token token) {
        CharStream input = token.getInputStream();
        int start = token.getStartIndex();
        int stop = Math.min(input.size(), start + PREVIEW_LENGTH) - 1;
        String text = input.getText(Interval.of(start, stop));
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
