package meerkat;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

public class KeywordRegistryTest {

  private static KeywordRegistry loadFixture() throws IOException, ConfigurationException {
    return KeywordRegistry.fromCsv(
        Resources.toString(Resources.getResource("test_keywords.csv"), StandardCharsets.UTF_8));
  }

  @Test
  public void readsListing() throws IOException, ConfigurationException {
    KeywordRegistry registry = loadFixture();

    assertThat(registry.keywords())
        .containsExactly("fast_pattern", "http.uri", "msg", "nocase", "sid")
        .inOrder();

    KeywordRegistry.KeywordSpec msg = registry.lookup("msg").get();
    assertThat(msg.allowsSetting()).isTrue();
    assertThat(msg.requiresSetting()).isTrue();
    assertThat(msg.singleUsePerRule()).isTrue();
    assertThat(msg.description()).isEqualTo("information about the rule and the possible alert");
    assertThat(msg.documentation()).endsWith("meta.html#msg-message");

    KeywordRegistry.KeywordSpec nocase = registry.lookup("nocase").get();
    assertThat(nocase.allowsSetting()).isFalse();
    assertThat(nocase.requiresSetting()).isFalse();

    assertThat(registry.lookup("http.uri").get().allowsSetting()).isFalse();

    KeywordRegistry.KeywordSpec fastPattern = registry.lookup("fast_pattern").get();
    assertThat(fastPattern.allowsSetting()).isTrue();
    assertThat(fastPattern.requiresSetting()).isFalse();
    assertThat(fastPattern.singleUsePerRule()).isFalse();
  }

  @Test
  public void missingHeader() {
    ConfigurationException ex =
        assertThrows(
            ConfigurationException.class, () -> KeywordRegistry.fromCsv("msg;x;Unset;none;url;"));
    assertThat(ex).hasMessageThat().contains("missing header");
  }

  @Test
  public void headerOnly() throws ConfigurationException {
    assertThat(KeywordRegistry.fromCsv("name;description;app layer;features;documentation;").size())
        .isEqualTo(0);
  }

  @Test
  public void unusableNames() {
    ConfigurationException ex =
        assertThrows(
            ConfigurationException.class,
            () ->
                KeywordRegistry.fromCsv(
                    "name;description;app layer;features;documentation;\n"
                        + "bad name;x;Unset;none;url;\n"
                        + "ok;x;Unset;none;url;\n"));
    assertThat(ex.problems()).containsExactly("'bad name' is not a usable keyword name");
  }

  @Test
  public void inconsistentSpec() {
    KeywordRegistry registry =
        KeywordRegistry.of(
            ImmutableMap.of(
                "sid", KeywordRegistry.KeywordSpec.create(false, true, true),
                "nocase", KeywordRegistry.KeywordSpec.create(false, false, false)));

    ConfigurationException ex =
        assertThrows(ConfigurationException.class, registry::checkConsistency);
    assertThat(ex.problems()).hasSize(1);
    assertThat(ex.problems().get(0)).contains("'sid'");
  }

  @Test
  public void bundledDefaults() throws ConfigurationException {
    KeywordRegistry registry = KeywordRegistry.defaults();

    registry.checkConsistency();
    assertThat(registry.keywords())
        .containsAtLeast("msg", "sid", "rev", "content", "nocase", "flow", "classtype");
    assertThat(registry.lookup("content").get().requiresSetting()).isTrue();
    assertThat(registry.lookup("nocase").get().allowsSetting()).isFalse();
    assertThat(registry.lookup("rev").get().singleUsePerRule()).isTrue();
    assertThat(registry.contains("frobnicate")).isFalse();
    assertThat(KeywordRegistry.defaults()).isSameInstanceAs(registry);
  }

  @Test
  public void empty() {
    assertThat(KeywordRegistry.empty().size()).isEqualTo(0);
    assertThat(KeywordRegistry.empty().lookup("msg")).isEmpty();
  }
}
