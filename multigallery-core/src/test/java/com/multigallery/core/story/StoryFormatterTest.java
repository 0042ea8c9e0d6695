package com.multigallery.core.story;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StoryFormatter}.
 */
class StoryFormatterTest {

    @Test
    void normalizeLines_trimsAndCollapsesEmptyLines() {
        String text = "\n\n  Chapter 1  \r\n\r\n\r\n\tOnce upon a time.\n   \nThe end.  \n\n";

        assertThat(StoryFormatter.normalizeLines(text))
            .containsExactly("Chapter 1", "", "Once upon a time.", "", "The end.");
    }

    @Test
    void normalizeLines_withBlankText_returnsEmptyList() {
        assertThat(StoryFormatter.normalizeLines(" \n\t\n")).isEmpty();
    }

    @Test
    void toText_usesCrlfAndEndsWithLineBreak() {
        assertThat(StoryFormatter.toText(List.of("One", "", "Two"))).isEqualTo("One\r\n\r\nTwo\r\n");
    }

    @Test
    void toMarkdown_escapesAsterisksAndEqualSignRuns() {
        assertThat(StoryFormatter.toMarkdown(List.of("*gasp*", "===", "a = b")))
            .isEqualTo("\\*gasp\\*\r\n= = =\r\na = b\r\n");
    }

    @Test
    void toRtfSource_dropsEmptyLines() {
        assertThat(StoryFormatter.toRtfSource(List.of("One", "", "Two"))).isEqualTo("One\nTwo");
    }
}
