package com.multigallery.cli;

import com.multigallery.core.ast.Node.Document;
import com.multigallery.core.config.ConfigurationException;
import com.multigallery.core.config.UsernameConfig;
import com.multigallery.core.config.UsernameConfigLoader;
import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.impl.LibreOfficeDocumentConverter;
import com.multigallery.core.generator.DescriptionGenerator;
import com.multigallery.core.parser.MarkupParseException;
import com.multigallery.core.parser.MarkupParser;
import com.multigallery.core.renderer.DescriptionRenderer;
import com.multigallery.core.renderer.RenderContext;
import com.multigallery.core.renderer.RenderResult;
import com.multigallery.core.renderer.RenderWarning;
import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to check a description without writing anything.
 *
 * <p>Parses the description and renders it for every configured site, or for every
 * supported site when no configuration file exists, reporting parse errors and render
 * warnings.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * multigallery validate description.txt
 * multigallery validate description.txt -c config.json -D nsfw
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Check a description for errors and missing site coverage",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Description file to validate")
    private Path descriptionPath;

    @Option(
        names = {"-c", "--config"},
        description = "JSON configuration file; all sites are checked if it does not exist (default: ${DEFAULT-VALUE})",
        defaultValue = "./config.json"
    )
    private Path configPath;

    @Option(
        names = {"-D", "--define-option"},
        description = "Option to define as true in description [if=define==...] conditions"
    )
    private List<String> defineOptions = new ArrayList<>();

    private final SiteRegistry registry;
    private final DocumentConverter converter;

    /**
     * Creates the command with the sites found on the class path and LibreOffice conversion.
     */
    public ValidateCommand() {
        this(SiteRegistry.discover(), new LibreOfficeDocumentConverter());
    }

    ValidateCommand(SiteRegistry registry, DocumentConverter converter) {
        this.registry = registry;
        this.converter = converter;
    }

    @Override
    public Integer call() {
        log.info("Validating description: {}", descriptionPath);

        Document document;
        List<String> sites = new ArrayList<>();
        Map<String, String> usernames = Map.of();
        try {
            if (Files.isRegularFile(configPath)) {
                UsernameConfig config = UsernameConfigLoader.load(configPath, registry);
                sites.addAll(config.sites());
                usernames = config.asMap();
            } else {
                registry.sites().forEach(site -> sites.add(site.id()));
            }
            String source = DescriptionGenerator.prepareSource(converter.readText(descriptionPath));
            document = new MarkupParser(registry).parse(source);
        } catch (MarkupParseException e) {
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (ConfigurationException | ConversionException e) {
            log.debug("Validation failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }
        System.out.println("✓ Description parsed");

        DescriptionRenderer renderer = new DescriptionRenderer(registry);
        int warnings = 0;
        for (String site : sites) {
            SiteDescriptor descriptor = registry.require(site);
            RenderResult result = renderer.render(document,
                new RenderContext(site, new HashSet<>(defineOptions), usernames));
            for (RenderWarning warning : result.warnings()) {
                System.out.println("⚠ " + descriptor.displayName() + ": " + warning.message());
                warnings++;
            }
        }

        System.out.println("✓ Rendered for " + sites.size() + " site(s) with " + warnings + " warning(s)");
        return 0;
    }
}
