package com.multigallery.core.dialect.impl;

import com.multigallery.core.ast.FormatKind;
import com.multigallery.core.dialect.UserLink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PlaintextDialect}.
 */
class PlaintextDialectTest {

    private final PlaintextDialect dialect = new PlaintextDialect();

    @ParameterizedTest
    @EnumSource(FormatKind.class)
    void format_supportsNoKind(FormatKind kind) {
        assertThat(dialect.format(kind, "x")).isEmpty();
    }

    @Test
    void link_spellsOutDisplayAndUrl() {
        assertThat(dialect.link("https://example.com", "Example")).isEqualTo("Example: https://example.com");
    }

    @Test
    void link_withDisplayEqualToUrl_printsUrlOnce() {
        assertThat(dialect.link("https://example.com", "https://example.com")).isEqualTo("https://example.com");
        assertThat(dialect.link("https://example.com", " ")).isEqualTo("https://example.com");
    }

    @Test
    void userLink_onOtherSite_namesTheSite() {
        UserLink link = new UserLink("plaintext", "inkbunny", "Inkbunny", "Lorem",
            "https://inkbunny.net/Lorem", "Lorem", false);

        assertThat(dialect.userLink(link)).isEqualTo("Lorem on Inkbunny");
    }

    @Test
    void userLink_withOverriddenDisplay_printsProfileUrl() {
        UserLink link = new UserLink("plaintext", "inkbunny", "Inkbunny", "Lorem",
            "https://inkbunny.net/Lorem", "my friend", true);

        assertThat(dialect.userLink(link)).isEqualTo("my friend: https://inkbunny.net/Lorem");
    }
}
