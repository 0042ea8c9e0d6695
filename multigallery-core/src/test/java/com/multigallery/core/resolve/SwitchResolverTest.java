package com.multigallery.core.resolve;

import com.multigallery.core.ast.Binding;
import com.multigallery.core.ast.Node.Text;
import com.multigallery.core.ast.SwitchChain;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SwitchResolver}.
 */
class SwitchResolverTest {

    private static final String URL = "https://example.com/bad-manners";

    private final SwitchResolver resolver = new SwitchResolver();

    @Test
    void resolve_exactMatchWithoutOverride_echoesAttribute() {
        SwitchChain chain = SwitchChain.of(Binding.of("furaffinity", "Ipsum"), Binding.of("inkbunny", "Dolor"));

        Optional<Resolution> resolution = resolver.resolve(chain, true, "inkbunny");

        assertThat(resolution).contains(
            new Resolution(MatchKind.EXACT, "inkbunny", "Dolor", List.of(new Text("Dolor")), false));
    }

    @Test
    void resolve_exactMatchWithOverride_usesOverride() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "Ipsum"),
            new Binding("inkbunny", "Dolor", List.of(new Text("Sit"))));

        Optional<Resolution> resolution = resolver.resolve(chain, true, "furaffinity");

        assertThat(resolution).contains(
            new Resolution(MatchKind.EXACT, "furaffinity", "Ipsum", List.of(new Text("Sit")), true));
    }

    @Test
    void resolve_genericOutranksInnermost() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "Elit"),
            new Binding(Binding.GENERIC, URL, List.of(new Text("Bad Manners"))));

        Optional<Resolution> resolution = resolver.resolve(chain, true, "weasyl");

        assertThat(resolution).contains(
            new Resolution(MatchKind.GENERIC, Binding.GENERIC, URL, List.of(new Text("Bad Manners")), true));
    }

    @Test
    void resolve_exactOutranksGeneric_andIgnoresGenericText() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "Elit"),
            new Binding(Binding.GENERIC, URL, List.of(new Text("Bad Manners"))));

        Optional<Resolution> resolution = resolver.resolve(chain, true, "furaffinity");

        assertThat(resolution).contains(
            new Resolution(MatchKind.EXACT, "furaffinity", "Elit", List.of(new Text("Elit")), false));
    }

    @Test
    void resolve_genericWithoutOwnText_fallsBackToOverride() {
        SwitchChain chain = SwitchChain.of(
            Binding.of(Binding.GENERIC, URL),
            new Binding("sofurry", "Amet", List.of(new Text("Consectetur"))));

        Resolution resolution = resolver.resolve(chain, false, "aryion").orElseThrow();

        assertThat(resolution.kind()).isEqualTo(MatchKind.GENERIC);
        assertThat(resolution.display()).containsExactly(new Text("Consectetur"));
    }

    @Test
    void resolve_genericWithoutAnyText_hasEmptyDisplay() {
        SwitchChain chain = SwitchChain.of(Binding.of("sofurry", "Amet"), Binding.of(Binding.GENERIC, URL));

        Resolution resolution = resolver.resolve(chain, false, "aryion").orElseThrow();

        assertThat(resolution.display()).isEmpty();
        assertThat(resolution.displayOverridden()).isFalse();
        assertThat(resolution.isGeneric()).isTrue();
    }

    @Test
    void resolve_userChainWithoutMatch_usesInnermostBindingAndItsSite() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "Ipsum"),
            new Binding("inkbunny", "Dolor", List.of(new Text("Sit"))));

        Optional<Resolution> resolution = resolver.resolve(chain, true, "twitter");

        assertThat(resolution).contains(
            new Resolution(MatchKind.INNERMOST, "inkbunny", "Dolor", List.of(new Text("Sit")), true));
    }

    @Test
    void resolve_siteUrlChainWithoutMatch_isEmpty() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("sofurry", "https://a.example"),
            new Binding("aryion", "https://b.example", List.of(new Text("Text"))));

        assertThat(resolver.resolve(chain, false, "furaffinity")).isEmpty();
        assertThat(resolver.resolve(chain, false, "sofurry")).isPresent();
        assertThat(resolver.resolve(chain, false, "aryion")).isPresent();
    }
}
