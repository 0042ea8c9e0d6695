package com.multigallery.core.generator;

import com.multigallery.core.ast.Node.Document;
import com.multigallery.core.config.UsernameConfig;
import com.multigallery.core.output.GeneratedFile;
import com.multigallery.core.output.GeneratedOutput;
import com.multigallery.core.parser.MarkupParser;
import com.multigallery.core.renderer.DescriptionRenderer;
import com.multigallery.core.renderer.RenderContext;
import com.multigallery.core.renderer.RenderResult;
import com.multigallery.core.renderer.RenderWarning;
import com.multigallery.core.site.SiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Generates the description file of every configured site from one description source.
 *
 * <p>The source is parsed once; the resulting document is then rendered for each site on
 * a thread pool. Nothing is written here: the returned {@link GeneratedOutput} is handed to
 * an {@link com.multigallery.core.output.OutputRenderer} only after every site rendered,
 * so a failure never leaves a partial set of descriptions behind.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DescriptionGenerator generator = new DescriptionGenerator(SiteRegistry.defaults());
 * GeneratedDescriptions descriptions = generator.generate(source, config, Set.of("nsfw"), false);
 * new FileSystemRenderer().render(descriptions.output(), outputDir);
 * }</pre>
 */
public class DescriptionGenerator {

    private static final Logger log = LoggerFactory.getLogger(DescriptionGenerator.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final Pattern MULTIPLE_EMPTY_LINES = Pattern.compile("\n\n+");

    private final SiteRegistry registry;
    private final MarkupParser parser;
    private final DescriptionRenderer renderer;

    /**
     * Creates a generator for the sites of a registry.
     *
     * @param registry site registry
     */
    public DescriptionGenerator(SiteRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.parser = new MarkupParser(registry);
        this.renderer = new DescriptionRenderer(registry);
    }

    /**
     * Parses, renders and normalizes a description for every configured site.
     *
     * @param source description source
     * @param config usernames; one description per configured site
     * @param definedFlags flags for {@code define} conditions
     * @param ignoreEmpty true to write empty descriptions for a blank source instead of failing
     * @return descriptions and their warnings
     * @throws com.multigallery.core.parser.MarkupParseException if the source is malformed
     * @throws IllegalStateException if the source is blank and {@code ignoreEmpty} is false,
     *     or rendering fails for a site
     */
    public GeneratedDescriptions generate(String source, UsernameConfig config, Set<String> definedFlags,
                                          boolean ignoreEmpty) {
        String prepared = prepareSource(source);
        if (prepared.isBlank()) {
            String error = "Description processing returned empty file";
            if (!ignoreEmpty) {
                throw new IllegalStateException(error);
            }
            log.warn("Ignoring error ({})", error);
        }

        Document document = parser.parse(prepared);
        List<RenderResult> results = renderAll(document, config, definedFlags);
        return new GeneratedDescriptions(results, toOutput(results, prepared.isBlank()));
    }

    /**
     * Trims every line of a description source.
     *
     * @param source raw source
     * @return source with trimmed lines joined by LF
     */
    public static String prepareSource(String source) {
        return LINE_BREAK.splitAsStream(source)
            .map(String::strip)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Renders a document for every configured site, concurrently.
     *
     * @param document parsed description
     * @param config usernames; one render per configured site
     * @param definedFlags flags for {@code define} conditions
     * @return results in configuration order
     * @throws IllegalStateException if rendering fails for a site
     */
    public List<RenderResult> renderAll(Document document, UsernameConfig config, Set<String> definedFlags) {
        List<String> sites = new ArrayList<>(config.sites());
        if (sites.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(sites.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threads));
        try {
            Map<String, Future<RenderResult>> futures = new LinkedHashMap<>();
            for (String site : sites) {
                RenderContext context = new RenderContext(site, definedFlags, config.asMap());
                futures.put(site, executor.submit(() -> renderer.render(document, context)));
            }

            List<RenderResult> results = new ArrayList<>();
            IllegalStateException failure = null;
            for (Map.Entry<String, Future<RenderResult>> entry : futures.entrySet()) {
                try {
                    results.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = new IllegalStateException("Rendering for " + entry.getKey() + " failed: "
                            + e.getCause().getMessage(), e.getCause());
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }

            for (RenderResult result : results) {
                for (RenderWarning warning : result.warnings()) {
                    log.warn("{}: {}", warning.site(), warning.message());
                }
                log.debug("Rendered description for {} ({} chars)", result.site(), result.text().length());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while rendering descriptions", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Turns render results into description files.
     *
     * @param results render results
     * @param emptySource true to write empty files
     * @return one file per result, named after the site's description file
     */
    public GeneratedOutput toOutput(List<RenderResult> results, boolean emptySource) {
        List<GeneratedFile> files = new ArrayList<>();
        for (RenderResult result : results) {
            String fileName = registry.require(result.site()).descriptionFileName();
            files.add(GeneratedFile.of(fileName, emptySource ? "" : normalize(result.text())));
        }
        return new GeneratedOutput(files);
    }

    /**
     * Collapses runs of empty lines into one, trims, and ends the text with a line break.
     *
     * @param text rendered description
     * @return normalized description
     */
    public static String normalize(String text) {
        return MULTIPLE_EMPTY_LINES.matcher(text).replaceAll("\n\n").strip() + "\n";
    }
}
