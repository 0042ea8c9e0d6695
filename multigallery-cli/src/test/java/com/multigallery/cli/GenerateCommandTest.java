package com.multigallery.cli;

import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.StyleReplacement;
import com.multigallery.core.site.SiteRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private Path config;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        config = Files.writeString(tempDir.resolve("config.json"), """
            {
              "fa": "Ipsum",
              "weasyl": "Lorem",
              "eka": "Dolor"
            }
            """);
        outputDir = tempDir.resolve("out");
    }

    @Test
    void call_withDescription_writesDescriptionPerConfiguredSite() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"),
            "[b]New story![/b]\n\nBy [self][/self] for [fa=Amet][/fa]");

        int exitCode = execute("-d", description.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("desc_furaffinity.txt")))
            .isEqualTo("[b]New story![/b]\n\nBy :iconIpsum: for :iconAmet:\n");
        assertThat(Files.readString(outputDir.resolve("desc_weasyl.md")))
            .isEqualTo("**New story!**\n\nBy <!~Lorem> for <fa:Amet>\n");
        assertThat(Files.readString(outputDir.resolve("desc_aryion.txt")))
            .isEqualTo("[b]New story![/b]\n\nBy :iconDolor: for [url=https://furaffinity.net/user/Amet]Amet[/url]\n");
        assertThat(outputDir.resolve("desc_twitter.txt")).doesNotExist();
    }

    @Test
    void call_withStoryDescriptionAndFile_writesEverything() throws IOException {
        Path story = Files.writeString(tempDir.resolve("story.txt"), "Once upon a time.\n\n\nThe end.");
        Path description = Files.writeString(tempDir.resolve("description.txt"), "Hello [if=define==nsfw]adults[/if]");
        Path cover = Files.writeString(tempDir.resolve("cover.png"), "png");

        int exitCode = execute("-s", story.toString(), "-d", description.toString(),
            "-f", cover.toString(), "-D", "nsfw");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(outputDir.resolve("story.txt"))).isEqualTo("Once upon a time.\r\n\r\nThe end.\r\n");
        assertThat(outputDir.resolve("story.md")).exists();
        assertThat(Files.readString(outputDir.resolve("story.rtf"))).isEqualTo("Once upon a time.\nThe end.");
        assertThat(Files.readString(outputDir.resolve("desc_furaffinity.txt"))).isEqualTo("Hello adults\n");
        assertThat(outputDir.resolve("cover.png")).hasContent("png");
    }

    @Test
    void call_replacesPreviousOutputUnlessKept() throws IOException {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("old.txt"), "old");
        Path cover = Files.writeString(tempDir.resolve("cover.png"), "png");

        assertThat(execute("-f", cover.toString(), "-k")).isZero();
        assertThat(outputDir.resolve("old.txt")).exists();

        assertThat(execute("-f", cover.toString())).isZero();
        assertThat(outputDir.resolve("old.txt")).doesNotExist();
        assertThat(outputDir.resolve("cover.png")).exists();
    }

    @Test
    void call_withMalformedDescription_restoresPreviousOutput() throws IOException {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("old.txt"), "old");
        Path description = Files.writeString(tempDir.resolve("description.txt"), "[b]never closed");

        int exitCode = execute("-d", description.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(outputDir.resolve("old.txt")).hasContent("old");
        assertThat(outputDir.resolve("desc_furaffinity.txt")).doesNotExist();
    }

    @Test
    void call_withEmptyDescription_failsUnlessIgnored() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"), "  \n\n ");

        assertThat(execute("-d", description.toString())).isEqualTo(1);
        assertThat(execute("-d", description.toString(), "-I")).isZero();
        assertThat(Files.readString(outputDir.resolve("desc_weasyl.md"))).isEmpty();
    }

    @Test
    void call_withoutInputs_isUsageError() {
        assertThat(execute()).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void call_withInvalidDefineOption_isUsageError() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"), "x");

        assertThat(execute("-d", description.toString(), "-D", "not valid")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void call_withMissingConfig_isUsageError() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"), "x");
        Files.delete(config);

        assertThat(execute("-d", description.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void call_withOutputPathBeingFile_isUsageError() throws IOException {
        Files.writeString(outputDir, "not a directory");
        Path cover = Files.writeString(tempDir.resolve("cover.png"), "png");

        assertThat(execute("-f", cover.toString())).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private int execute(String... args) {
        String[] all = new String[args.length + 4];
        all[0] = "-c";
        all[1] = config.toString();
        all[2] = "-o";
        all[3] = outputDir.toString();
        System.arraycopy(args, 0, all, 4, args.length);
        return new CommandLine(new GenerateCommand(SiteRegistry.defaults(), new CopyingConverter())).execute(all);
    }

    /**
     * Converter that copies the conversion source instead of calling an office application.
     */
    private static final class CopyingConverter implements DocumentConverter {

        @Override
        public String extractText(Path document) throws ConversionException {
            throw new ConversionException("Only .txt documents are supported in tests: " + document);
        }

        @Override
        public Path convertToRtf(Path plainText, Path outputDir, StyleReplacement styles) throws ConversionException {
            String name = plainText.getFileName().toString().replace(".txt", ".rtf");
            try {
                return Files.copy(plainText, outputDir.resolve(name));
            } catch (IOException e) {
                throw new ConversionException("Copy failed", e);
            }
        }
    }
}
