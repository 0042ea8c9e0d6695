package com.multigallery.core.story;

import com.multigallery.core.config.ConfigurationException;
import com.multigallery.core.config.UsernameConfig;
import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.StyleReplacement;
import com.multigallery.core.output.GeneratedFile;
import com.multigallery.core.output.GeneratedOutput;
import com.multigallery.core.output.OutputRenderer;
import com.multigallery.core.site.SiteIds;
import com.multigallery.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a story document into the files the configured galleries accept.
 *
 * <table>
 *   <caption>Story outputs</caption>
 *   <tr><th>File</th><th>Written when configured</th></tr>
 *   <tr><td>{@code <name>.txt}</td><td>furaffinity, inkbunny, sofurry</td></tr>
 *   <tr><td>{@code <name>.md}</td><td>weasyl</td></tr>
 *   <tr><td>{@code <name>.rtf}</td><td>aryion</td></tr>
 * </table>
 */
public class StoryProcessor {

    private static final Logger log = LoggerFactory.getLogger(StoryProcessor.class);

    private static final Set<String> TEXT_SITES = Set.of(SiteIds.FURAFFINITY, SiteIds.INKBUNNY, SiteIds.SOFURRY);
    private static final Set<String> MARKDOWN_SITES = Set.of(SiteIds.WEASYL);
    private static final Set<String> RTF_SITES = Set.of(SiteIds.ARYION);

    private final DocumentConverter converter;
    private final OutputRenderer renderer;

    /**
     * Creates a story processor.
     *
     * @param converter converter reading the story and producing rich text
     * @param renderer renderer writing the text outputs
     */
    public StoryProcessor(DocumentConverter converter, OutputRenderer renderer) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    /**
     * Processes a story.
     *
     * @param story story document
     * @param config username configuration selecting the outputs
     * @param outputDir directory to write to
     * @param ignoreEmpty true to write empty outputs for an empty story instead of failing
     * @return names of the written files
     * @throws ConversionException if reading the story or converting it fails
     * @throws ConfigurationException if no configured site accepts stories
     * @throws IllegalStateException if the story is empty and {@code ignoreEmpty} is false
     */
    public List<String> process(Path story, UsernameConfig config, Path outputDir, boolean ignoreEmpty)
            throws ConversionException {
        boolean text = configuresAny(config, TEXT_SITES);
        boolean markdown = configuresAny(config, MARKDOWN_SITES);
        boolean rtf = configuresAny(config, RTF_SITES);
        if (!text && !markdown && !rtf) {
            throw new ConfigurationException("Invalid configuration for story processing",
                List.of("none of the configured sites accepts story files"));
        }

        List<String> lines = StoryFormatter.normalizeLines(converter.readText(story));
        if (lines.isEmpty()) {
            String error = "Story processing returned empty file: " + story;
            if (!ignoreEmpty) {
                throw new IllegalStateException(error);
            }
            log.warn("Ignoring error ({})", error);
        }

        String name = FileUtils.baseName(story);
        List<GeneratedFile> files = new ArrayList<>();
        if (text) {
            files.add(GeneratedFile.of(name + ".txt", StoryFormatter.toText(lines)));
        }
        if (markdown) {
            files.add(GeneratedFile.of(name + ".md", StoryFormatter.toMarkdown(lines)));
        }
        renderer.render(new GeneratedOutput(files), outputDir);

        List<String> written = new ArrayList<>();
        files.forEach(file -> written.add(file.relativePath()));
        if (rtf) {
            written.add(writeRtf(name, lines, outputDir).getFileName().toString());
        }
        return written;
    }

    private Path writeRtf(String name, List<String> lines, Path outputDir) throws ConversionException {
        Path tempDir = null;
        try {
            tempDir = Files.createTempDirectory("multigallery-story-");
            Path source = tempDir.resolve(name + ".txt");
            Files.writeString(source, StoryFormatter.toRtfSource(lines), StandardCharsets.UTF_8);
            Path rtf = converter.convertToRtf(source, outputDir, StyleReplacement.PREFORMATTED_TO_NORMAL);
            log.info("Wrote file: {}", rtf.getFileName());
            return rtf;
        } catch (IOException e) {
            throw new ConversionException("Failed to prepare RTF conversion of " + name, e);
        } finally {
            if (tempDir != null) {
                try {
                    FileUtils.deleteRecursively(tempDir);
                } catch (IOException e) {
                    log.debug("Could not delete temporary directory {}: {}", tempDir, e.getMessage());
                }
            }
        }
    }

    private static boolean configuresAny(UsernameConfig config, Set<String> sites) {
        return sites.stream().anyMatch(config::has);
    }
}
