package com.multigallery;

import ch.qos.logback.classic.Level;
import com.multigallery.cli.GenerateCommand;
import com.multigallery.cli.SitesCommand;
import com.multigallery.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for MultiGallery.
 *
 * <p>MultiGallery turns one story and one tagged description into upload-ready files for
 * several art galleries at once, each in the markup that gallery understands.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate story, description and extra files</li>
 *   <li>{@code validate} - Check a description without writing anything</li>
 *   <li>{@code sites} - List supported sites and their tag aliases</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Story and descriptions for every site in config.json
 * multigallery generate -s story.odt -d description.txt -f thumbnail.png
 *
 * # Render with a define option, keeping the previous output
 * multigallery generate -d description.txt -D nsfw -k
 *
 * # Check a description
 * multigallery -v validate description.txt
 * }</pre>
 */
@Command(
    name = "multigallery",
    mixinStandardHelpOptions = true,
    version = "MultiGallery 1.0.0-SNAPSHOT",
    description = "Generate multi-gallery upload-ready files",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class,
        SitesCommand.class
    }
)
public class MultiGalleryCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MultiGalleryCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("MultiGallery - Multi-gallery upload file generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'multigallery --help' to see available commands");
        System.out.println("Use 'multigallery <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        MultiGalleryCLI cli = new MultiGalleryCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
