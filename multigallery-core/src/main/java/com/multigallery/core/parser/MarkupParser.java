package com.multigallery.core.parser;

import com.multigallery.core.ast.Node.Document;
import com.multigallery.core.site.SiteRegistry;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses tagged description source into an immutable {@link Document}.
 *
 * <h2>Tags</h2>
 * <ul>
 *   <li>{@code [b]}, {@code [i]}, {@code [u]}: formatting</li>
 *   <li>{@code [url=URL]text[/url]} or {@code [url]URL[/url]}: literal link</li>
 *   <li>{@code [self][/self]}: the uploader's own profile</li>
 *   <li>{@code [fa=name]}, {@code [eka]name[/eka]}, ...: per-site user link; nesting site tags
 *       builds a switch chain, e.g. {@code [fa=a][ib=b]Display[/ib][/fa]}</li>
 *   <li>{@code [generic=URL]text[/generic]}: catch-all entry of a chain</li>
 *   <li>{@code [user]...[/user]}, {@code [siteurl]...[/siteurl]}: explicit chain wrappers; in
 *       a site-url chain attributes are URLs instead of usernames</li>
 *   <li>{@code [if=site==fa]...[/if][else]...[/else]}: conditional content</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <p>The parser does not recover: the first problem raises a {@link MarkupParseException}
 * with the position of the offending tag.
 *
 * <p>Tokens and the parse tree come from the ANTLR grammars {@code DescriptionLexer} and
 * {@code DescriptionParser}; {@link DocumentBuilder} turns the tree into nodes. Instances
 * are immutable and may be shared between threads; each call to {@link #parse(String)}
 * runs its own lexer and parser.
 */
public class MarkupParser {

    private static final Logger log = LoggerFactory.getLogger(MarkupParser.class);

    private final DocumentBuilder builder;

    /**
     * Creates a parser recognising the switch tags of the given registry.
     *
     * @param registry site registry
     */
    public MarkupParser(SiteRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        this.builder = new DocumentBuilder(registry, new ConditionParser(registry));
    }

    /**
     * Parses a complete description.
     *
     * @param source description source
     * @return parsed document
     * @throws MarkupParseException if the source is malformed
     */
    public Document parse(String source) {
        Objects.requireNonNull(source, "source must not be null");

        DescriptionLexer lexer = new DescriptionLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        DescriptionParser grammar = new DescriptionParser(tokens);
        grammar.removeErrorListeners();
        grammar.addErrorListener(SyntaxErrorListener.INSTANCE);

        Document document = builder.build(grammar.document());
        log.debug("Parsed {} tokens into {} top-level nodes", tokens.size(), document.children().size());
        return document;
    }
}
