package com.multigallery.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void getExtension_returnsLowercaseExtension() {
        assertThat(FileUtils.getExtension(Paths.get("dir/Story.ODT"))).isEqualTo("odt");
        assertThat(FileUtils.getExtension(Paths.get("archive.tar.gz"))).isEqualTo("gz");
    }

    @Test
    void getExtension_withoutExtension_returnsEmptyString() {
        assertThat(FileUtils.getExtension(Paths.get("README"))).isEmpty();
        assertThat(FileUtils.getExtension(Paths.get(".hidden"))).isEmpty();
    }

    @Test
    void baseName_stopsAtFirstDot() {
        assertThat(FileUtils.baseName(Paths.get("dir/chapter-1.final.odt"))).isEqualTo("chapter-1");
        assertThat(FileUtils.baseName(Paths.get("story"))).isEqualTo("story");
        assertThat(FileUtils.baseName(Paths.get(".story"))).isEqualTo(".story");
    }

    @Test
    void stripByteOrderMark_removesOnlyLeadingMark() {
        assertThat(FileUtils.stripByteOrderMark("\uFEFFHello")).isEqualTo("Hello");
        assertThat(FileUtils.stripByteOrderMark("Hello")).isEqualTo("Hello");
        assertThat(FileUtils.stripByteOrderMark("")).isEmpty();
    }

    @Test
    void deleteRecursively_removesDirectoryTree() throws IOException {
        Path root = tempDir.resolve("root");
        Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("a/b/file.txt"), "x");
        Files.writeString(root.resolve("top.txt"), "x");

        FileUtils.deleteRecursively(root);

        assertThat(root).doesNotExist();
    }

    @Test
    void deleteRecursively_withMissingPath_doesNothing() throws IOException {
        FileUtils.deleteRecursively(tempDir.resolve("missing"));

        assertThat(tempDir).exists();
    }
}
