package meerkat;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class MeerkatConfigTest {

  @Test
  public void defaults() throws ConfigurationException {
    MeerkatConfig config = MeerkatConfig.fromProperties(new Properties());

    assertThat(config).isEqualTo(MeerkatConfig.defaults());
    assertThat(config.maxGroupDepth()).isEqualTo(RuleParser.DEFAULT_MAX_GROUP_DEPTH);
    assertThat(config.formatStyle()).isEqualTo(FormatStyle.defaults());
    assertThat(config.skipCommentsAndBlankLines()).isTrue();
  }

  @Test
  public void fromFixture() throws IOException, ConfigurationException {
    MeerkatConfig config = MeerkatConfig.fromProperties(SymbolTableTest.loadFixture());

    assertThat(config.maxGroupDepth()).isEqualTo(8);
    assertThat(config.formatStyle().spaceAfterOptionSeparator()).isTrue();
    assertThat(config.formatStyle().spaceAfterLastOption()).isFalse();
    assertThat(config.formatStyle().spaceAfterSettingColon()).isTrue();
    assertThat(config.skipCommentsAndBlankLines()).isTrue();
  }

  @Test
  public void valuesAreTrimmedAndCaseInsensitive() throws ConfigurationException {
    Properties properties = new Properties();
    properties.setProperty(MeerkatConfig.MAX_GROUP_DEPTH, " 3 ");
    properties.setProperty(MeerkatConfig.SKIP_COMMENTS_AND_BLANK_LINES, "FALSE");

    MeerkatConfig config = MeerkatConfig.fromProperties(properties);
    assertThat(config.maxGroupDepth()).isEqualTo(3);
    assertThat(config.skipCommentsAndBlankLines()).isFalse();
  }

  @Test
  public void unknownKeysAreIgnored() throws ConfigurationException {
    Properties properties = new Properties();
    properties.setProperty("format.indent", "4");
    properties.setProperty("somebody.else", "x");

    assertThat(MeerkatConfig.fromProperties(properties)).isEqualTo(MeerkatConfig.defaults());
  }

  @Test
  public void invalidValuesAreAllReported() {
    Properties properties = new Properties();
    properties.setProperty(MeerkatConfig.MAX_GROUP_DEPTH, "0");
    properties.setProperty(MeerkatConfig.SPACE_AFTER_LAST_OPTION, "maybe");

    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> MeerkatConfig.fromProperties(properties));
    assertThat(ex.problems())
        .containsExactly(
            "parser.maxGroupDepth must be a positive integer, was '0'",
            "format.spaceAfterLastOption must be true or false, was 'maybe'");
  }

  @Test
  public void builderRejectsNonPositiveDepth() {
    assertThrows(
        IllegalArgumentException.class,
        () -> MeerkatConfig.builder().setMaxGroupDepth(0).build());
  }

  @Test
  public void configuredDepthReachesTheParser() {
    DocumentIndex index =
        new DocumentIndex(
            MeerkatConfig.builder().setMaxGroupDepth(1).build(),
            SymbolTable.empty(),
            KeywordRegistry.defaults());
    index.openDocument("doc", "alert ip [[1.2.3.4]] any -> any any (sid:1;)");

    assertThat(index.allDiagnostics("doc").get(0).diagnostic().code())
        .isEqualTo(DiagnosticCode.NESTING_TOO_DEEP);
  }
}
