package com.multigallery.core.output.impl;

import com.multigallery.core.output.GeneratedFile;
import com.multigallery.core.output.GeneratedOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllFilesAsUtf8() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.of("desc_furaffinity.txt", "[b]Hi[/b]\n"),
            GeneratedFile.of("desc_weasyl.md", "**Hi** – ünïcode\n")));

        // When
        renderer.render(output, tempDir);

        // Then
        assertThat(Files.readString(tempDir.resolve("desc_furaffinity.txt"))).isEqualTo("[b]Hi[/b]\n");
        assertThat(Files.readString(tempDir.resolve("desc_weasyl.md"))).isEqualTo("**Hi** – ünïcode\n");
    }

    @Test
    void render_withMissingOutputDirectory_createsIt() throws IOException {
        Path outputDir = tempDir.resolve("a/b");

        renderer.render(new GeneratedOutput(List.of(GeneratedFile.of("x.txt", "x"))), outputDir);

        assertThat(Files.readString(outputDir.resolve("x.txt"))).isEqualTo("x");
    }

    @Test
    void render_withExistingFile_overwritesIt() throws IOException {
        Files.writeString(tempDir.resolve("x.txt"), "old content");

        renderer.render(new GeneratedOutput(List.of(GeneratedFile.of("x.txt", "new"))), tempDir);

        assertThat(Files.readString(tempDir.resolve("x.txt"))).isEqualTo("new");
    }

    @Test
    void render_withPathOutsideOutputDirectory_throws() {
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.of("../escape.txt", "x")));
        Path outputDir = tempDir.resolve("out");

        assertThatThrownBy(() -> renderer.render(output, outputDir))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes the output directory");
        assertThat(tempDir.resolve("escape.txt")).doesNotExist();
    }

    @Test
    void generatedFile_of_infersContentType() {
        assertThat(GeneratedFile.of("a.md", "").contentType()).isEqualTo(GeneratedFile.TEXT_MARKDOWN);
        assertThat(GeneratedFile.of("a.txt", "").contentType()).isEqualTo(GeneratedFile.TEXT_PLAIN);
    }
}
