package com.multigallery.cli;

import com.multigallery.core.convert.ConversionException;
import com.multigallery.core.convert.DocumentConverter;
import com.multigallery.core.convert.StyleReplacement;
import com.multigallery.core.site.SiteRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void call_withoutConfig_rendersForAllSites() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"), "[b]Hi[/b] [fa=Ipsum][/fa]");

        int exitCode = execute(description.toString(), "-c", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("✓ Description parsed")
            .contains("✓ Rendered for 7 site(s) with 0 warning(s)");
    }

    @Test
    void call_withConfig_reportsWarningsOfConfiguredSites() throws IOException {
        Path config = Files.writeString(tempDir.resolve("config.json"), "{\"fa\": \"Ipsum\", \"ib\": \"Lorem\"}");
        Path description = Files.writeString(tempDir.resolve("description.txt"),
            "[siteurl][fa=https://fa.example/1][/fa][/siteurl]");

        int exitCode = execute(description.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("⚠ Inkbunny: [siteurl]")
            .contains("✓ Rendered for 2 site(s) with 1 warning(s)");
    }

    @Test
    void call_withMalformedDescription_fails() throws IOException {
        Path description = Files.writeString(tempDir.resolve("description.txt"), "[foo]x[/foo]");

        int exitCode = execute(description.toString(), "-c", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).doesNotContain("✓ Description parsed");
    }

    private int execute(String... args) {
        DocumentConverter converter = new DocumentConverter() {
            @Override
            public String extractText(Path document) throws ConversionException {
                throw new ConversionException("Only .txt documents are supported in tests");
            }

            @Override
            public Path convertToRtf(Path plainText, Path outputDir, StyleReplacement styles)
                    throws ConversionException {
                throw new ConversionException("Not used by validate");
            }
        };
        return new CommandLine(new ValidateCommand(SiteRegistry.defaults(), converter)).execute(args);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }
}
