package com.multigallery.cli;

import com.multigallery.core.config.ConfigurationException;
import com.multigallery.core.config.UsernameConfig;
import com.multigallery.core.config.UsernameConfigLoader;
import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.impl.LibreOfficeDocumentConverter;
import com.multigallery.core.generator.DescriptionGenerator;
import com.multigallery.core.generator.GeneratedDescriptions;
import com.multigallery.core.output.OutputDirectory;
import com.multigallery.core.output.OutputRenderer;
import com.multigallery.core.output.impl.FileSystemRenderer;
import com.multigallery.core.parser.MarkupParseException;
import com.multigallery.core.renderer.RenderWarning;
import com.multigallery.core.site.SiteRegistry;
import com.multigallery.core.story.StoryProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

/**
 * Command to generate upload-ready files for every configured gallery.
 *
 * <p>Runs the whole pipeline:
 * <ol>
 *   <li>Validate the options and load the username configuration</li>
 *   <li>Prepare the output directory, moving previous contents aside</li>
 *   <li>Convert the story into .txt, .md and .rtf files</li>
 *   <li>Render the description for each configured site</li>
 *   <li>Copy the extra files</li>
 * </ol>
 * If any step fails the previous contents of the output directory are restored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * multigallery generate -s story.odt -d description.txt -f thumbnail.png
 * multigallery generate -d description.txt -c config.json -o out -D nsfw
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate story, description and extra files for every configured gallery",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final Pattern DEFINE_OPTION_PATTERN = Pattern.compile("[a-zA-Z0-9_-]+");

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-o", "--output-dir"},
        description = "Output directory (default: ${DEFAULT-VALUE})",
        defaultValue = "./out"
    )
    private Path outputDir;

    @Option(
        names = {"-c", "--config"},
        description = "JSON configuration file with a username per site (default: ${DEFAULT-VALUE})",
        defaultValue = "./config.json"
    )
    private Path configPath;

    @Option(
        names = {"-D", "--define-option"},
        description = "Option to define as true in description [if=define==...] conditions"
    )
    private List<String> defineOptions = new ArrayList<>();

    @Option(
        names = {"-s", "--story"},
        description = "Story file, in any format LibreOffice reads"
    )
    private Path storyPath;

    @Option(
        names = {"-d", "--description"},
        description = "Tagged description file"
    )
    private Path descriptionPath;

    @Option(
        names = {"-f", "--file"},
        description = "Extra file to copy to the output (e.g. an image or thumbnail)"
    )
    private List<Path> filePaths = new ArrayList<>();

    @Option(
        names = {"-k", "--keep-out-dir"},
        description = "Keep existing output directory contents; a failure may leave partial files behind"
    )
    private boolean keepOutDir;

    @Option(
        names = {"-I", "--ignore-empty-files"},
        description = "Do not fail if an input file is empty or whitespace-only"
    )
    private boolean ignoreEmptyFiles;

    private final SiteRegistry registry;
    private final DocumentConverter converter;
    private final OutputRenderer renderer = new FileSystemRenderer();

    /**
     * Creates the command with the sites found on the class path and LibreOffice conversion.
     */
    public GenerateCommand() {
        this(SiteRegistry.discover(), new LibreOfficeDocumentConverter());
    }

    GenerateCommand(SiteRegistry registry, DocumentConverter converter) {
        this.registry = registry;
        this.converter = converter;
    }

    @Override
    public Integer call() {
        validateOptions();
        Set<String> definedFlags = definedFlags();

        UsernameConfig config;
        OutputDirectory output;
        try {
            config = needsConfig() ? UsernameConfigLoader.load(configPath, registry) : null;
            output = OutputDirectory.prepare(outputDir, keepOutDir);
        } catch (ConfigurationException e) {
            log.debug("Configuration error", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Could not prepare output directory", e);
            System.err.println("✗ Could not prepare output directory: " + e.getMessage());
            return 1;
        }

        try {
            if (storyPath != null) {
                processStory(config, output);
            }
            if (descriptionPath != null) {
                processDescription(config, definedFlags, output);
            }
            if (!filePaths.isEmpty()) {
                output.copyFiles(filePaths);
                System.out.println("✓ Copied " + filePaths.size() + " file(s)");
            }
            output.commit();

            System.out.println();
            System.out.println("✓ Output written to: " + output.path());
            return 0;

        } catch (MarkupParseException e) {
            System.err.println("✗ Invalid description " + descriptionPath + ": " + e.getMessage());
        } catch (ConversionException e) {
            log.debug("Conversion failed", e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
        } catch (Exception e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
        }
        restore(output);
        return 1;
    }

    private void processStory(UsernameConfig config, OutputDirectory output) throws ConversionException {
        StoryProcessor processor = new StoryProcessor(converter, renderer);
        List<String> written = processor.process(storyPath, config, output.path(), ignoreEmptyFiles);
        System.out.println("✓ Story written as: " + String.join(", ", written));
    }

    private void processDescription(UsernameConfig config, Set<String> definedFlags, OutputDirectory output)
            throws ConversionException {
        String source = converter.readText(descriptionPath);
        GeneratedDescriptions descriptions = new DescriptionGenerator(registry)
            .generate(source, config, definedFlags, ignoreEmptyFiles);
        renderer.render(descriptions.output(), output.path());

        for (RenderWarning warning : descriptions.warnings()) {
            System.err.println("⚠ " + warning.site() + ": " + warning.message());
        }
        System.out.println("✓ Generated " + descriptions.output().files().size() + " description(s)");
    }

    private void restore(OutputDirectory output) {
        try {
            output.rollback();
        } catch (IOException e) {
            log.error("Could not restore previous output directory contents", e);
            System.err.println("✗ Could not restore " + outputDir + ": " + e.getMessage());
        }
    }

    private boolean needsConfig() {
        return storyPath != null || descriptionPath != null;
    }

    private void validateOptions() {
        if (storyPath == null && descriptionPath == null && filePaths.isEmpty()) {
            throw usageError("at least one of ( --story | --description | --file ) must be set");
        }
        if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
            throw usageError("--output-dir " + outputDir
                + " must be an existing directory or inexistent; found a file instead");
        }
        if (storyPath != null && !Files.isRegularFile(storyPath)) {
            throw usageError("--story " + storyPath + " is not a valid file");
        }
        if (descriptionPath != null && !Files.isRegularFile(descriptionPath)) {
            throw usageError("--description " + descriptionPath + " is not a valid file");
        }
        for (Path file : filePaths) {
            if (!Files.isRegularFile(file)) {
                throw usageError("--file " + file + " is not a valid file");
            }
        }
        if (needsConfig() && !Files.isRegularFile(configPath)) {
            throw usageError("--config " + configPath + " must be a valid file");
        }
        for (String option : defineOptions) {
            if (!DEFINE_OPTION_PATTERN.matcher(option).matches()) {
                throw usageError("--define-option " + option + " is not a valid option; it must only contain"
                    + " alphanumeric characters, dashes, or underlines");
            }
        }
    }

    private Set<String> definedFlags() {
        Set<String> flags = new LinkedHashSet<>(defineOptions);
        if (flags.size() < defineOptions.size()) {
            System.err.println("⚠ Duplicated entries defined with -D / --define-option");
        }
        return flags;
    }

    private ParameterException usageError(String message) {
        return new ParameterException(spec.commandLine(), message);
    }
}
