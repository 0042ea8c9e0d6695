package com.multigallery.core.ast;

import com.multigallery.core.ast.Node.Text;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SwitchChain}.
 */
class SwitchChainTest {

    @Test
    void constructor_withNoBindings_throws() {
        assertThatThrownBy(() -> new SwitchChain(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_withDuplicateSite_throws() {
        assertThatThrownBy(() -> SwitchChain.of(Binding.of("furaffinity", "A"), Binding.of("furaffinity", "B")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("duplicate site");
    }

    @Test
    void constructor_withTwoGenericBindings_throws() {
        assertThatThrownBy(() -> SwitchChain.of(Binding.of("generic", "https://a"), Binding.of("generic", "https://b")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("only one generic");
    }

    @Test
    void constructor_withTwoDisplayBindings_throws() {
        Binding first = new Binding("furaffinity", "A", List.of(new Text("x")));
        Binding second = new Binding("inkbunny", "B", List.of(new Text("y")));

        assertThatThrownBy(() -> SwitchChain.of(first, second))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lookups_findBindingsByRole() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "A"),
            new Binding("generic", "https://example.com", List.of(new Text("Shop"))));

        assertThat(chain.bindingFor("furaffinity")).map(Binding::attribute).contains("A");
        assertThat(chain.bindingFor("generic")).isEmpty();
        assertThat(chain.generic()).map(Binding::attribute).contains("https://example.com");
        assertThat(chain.innermost().isGeneric()).isTrue();
    }

    @Test
    void displayOverride_ignoresGenericText() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "A"),
            new Binding("generic", "https://example.com", List.of(new Text("Shop"))));

        assertThat(chain.displayOverride()).isEmpty();
    }

    @Test
    void displayOverride_returnsSiteBindingText() {
        SwitchChain chain = SwitchChain.of(
            Binding.of("furaffinity", "A"),
            new Binding("inkbunny", "B", List.of(new Text("Friend"))));

        assertThat(chain.displayOverride()).contains(List.of(new Text("Friend")));
    }
}
