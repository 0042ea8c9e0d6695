package com.multigallery.core.generator;

import com.multigallery.core.config.UsernameConfig;
import com.multigallery.core.output.GeneratedFile;
import com.multigallery.core.parser.MarkupParseException;
import com.multigallery.core.renderer.RenderWarning;
import com.multigallery.core.renderer.WarningType;
import com.multigallery.core.site.SiteRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DescriptionGenerator}.
 */
class DescriptionGeneratorTest {

    private DescriptionGenerator generator;
    private UsernameConfig config;

    @BeforeEach
    void setUp() {
        generator = new DescriptionGenerator(SiteRegistry.defaults());
        Map<String, String> usernames = new LinkedHashMap<>();
        usernames.put("weasyl", "Lorem");
        usernames.put("furaffinity", "Ipsum");
        config = UsernameConfig.of(usernames);
    }

    @Test
    void generate_writesOneNormalizedFilePerConfiguredSite() {
        String source = "  [b]Hi[/b]  \r\n\r\n\r\n\r\n  [fa=Ipsum][/fa]  \n\n";

        GeneratedDescriptions descriptions = generator.generate(source, config, Set.of(), false);

        assertThat(descriptions.output().files())
            .extracting(GeneratedFile::relativePath, GeneratedFile::content)
            .containsExactly(
                tuple("desc_weasyl.md", "**Hi**\n\n<fa:Ipsum>\n"),
                tuple("desc_furaffinity.txt", "[b]Hi[/b]\n\n:iconIpsum:\n"));
        assertThat(descriptions.warnings()).isEmpty();
    }

    @Test
    void generate_passesDefinedFlagsToEveryRender() {
        GeneratedDescriptions descriptions = generator.generate(
            "[if=define==nsfw]Adult[/if][else]Safe[/else]", config, Set.of("nsfw"), false);

        assertThat(descriptions.output().files())
            .extracting(GeneratedFile::content)
            .containsOnly("Adult\n");
    }

    @Test
    void generate_collectsWarningsOfAllSites() {
        GeneratedDescriptions descriptions = generator.generate(
            "[siteurl][sf=https://sf.example][/sf][/siteurl]", config, Set.of(), false);

        assertThat(descriptions.warnings())
            .extracting(RenderWarning::site, RenderWarning::type)
            .containsExactly(
                tuple("weasyl", WarningType.RESOLUTION_GAP),
                tuple("furaffinity", WarningType.RESOLUTION_GAP));
    }

    @Test
    void generate_withBlankSource_throwsUnlessIgnored() {
        assertThatThrownBy(() -> generator.generate("  \n \n", config, Set.of(), false))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Description processing returned empty file");

        GeneratedDescriptions descriptions = generator.generate("  \n \n", config, Set.of(), true);

        assertThat(descriptions.output().files())
            .extracting(GeneratedFile::content)
            .containsExactly("", "");
    }

    @Test
    void generate_withMalformedSource_throwsParseError() {
        assertThatThrownBy(() -> generator.generate("[b]open", config, Set.of(), false))
            .isInstanceOf(MarkupParseException.class)
            .hasMessageContaining("Unclosed tag");
    }

    @Test
    void prepareSource_trimsEveryLine() {
        assertThat(DescriptionGenerator.prepareSource("  a \r\n\tb\t\n c")).isEqualTo("a\nb\nc");
    }

    @Test
    void normalize_collapsesEmptyLinesAndEndsWithLineBreak() {
        assertThat(DescriptionGenerator.normalize("\n\na\n\n\n\nb\n\n")).isEqualTo("a\n\nb\n");
        assertThat(DescriptionGenerator.normalize("")).isEqualTo("\n");
    }
}
