package meerkat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;

/** Analyzer settings: parser limits, the default format style and the document line filter. */
@AutoValue
public abstract class MeerkatConfig {
  private static final Logger logger = LoggerFactory.getLogger(MeerkatConfig.class);

  static final String MAX_GROUP_DEPTH = "parser.maxGroupDepth";
  static final String SPACE_AFTER_OPTION_SEPARATOR = "format.spaceAfterOptionSeparator";
  static final String SPACE_AFTER_LAST_OPTION = "format.spaceAfterLastOption";
  static final String SPACE_AFTER_SETTING_COLON = "format.spaceAfterSettingColon";
  static final String SKIP_COMMENTS_AND_BLANK_LINES = "index.skipCommentsAndBlankLines";

  private static final ImmutableSet<String> KNOWN_KEYS =
      ImmutableSet.of(
          MAX_GROUP_DEPTH,
          SPACE_AFTER_OPTION_SEPARATOR,
          SPACE_AFTER_LAST_OPTION,
          SPACE_AFTER_SETTING_COLON,
          SKIP_COMMENTS_AND_BLANK_LINES);

  private static final ImmutableSet<String> OWNED_PREFIXES =
      ImmutableSet.of("parser.", "format.", "index.");

  public abstract int maxGroupDepth();

  public abstract FormatStyle formatStyle();

  /** Whether the document index leaves '#' comments and blank lines unparsed. */
  public abstract boolean skipCommentsAndBlankLines();

  public static MeerkatConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_MeerkatConfig.Builder()
        .setMaxGroupDepth(RuleParser.DEFAULT_MAX_GROUP_DEPTH)
        .setFormatStyle(FormatStyle.defaults())
        .setSkipCommentsAndBlankLines(true);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxGroupDepth(int value);

    public abstract Builder setFormatStyle(FormatStyle value);

    public abstract Builder setSkipCommentsAndBlankLines(boolean value);

    abstract MeerkatConfig autoBuild();

    public MeerkatConfig build() {
      MeerkatConfig config = autoBuild();
      Preconditions.checkArgument(config.maxGroupDepth() > 0, "maxGroupDepth must be positive");
      return config;
    }
  }

  /**
   * Reads the recognized keys, keeping defaults for absent ones. Other keys under {@code parser.},
   * {@code format.} or {@code index.} are ignored with a warning.
   */
  public static MeerkatConfig fromProperties(Properties properties)
      throws ConfigurationException {
    List<String> problems = new ArrayList<>();
    for (String key : new TreeSet<>(properties.stringPropertyNames())) {
      if (!KNOWN_KEYS.contains(key) && OWNED_PREFIXES.stream().anyMatch(key::startsWith)) {
        logger.warn("Ignoring unrecognized configuration key: {}", key);
      }
    }

    Builder builder = builder();
    String depth = properties.getProperty(MAX_GROUP_DEPTH);
    if (depth != null) {
      Integer value = Ints.tryParse(depth.trim());
      if (value == null || value < 1) {
        problems.add(
            String.format("%s must be a positive integer, was '%s'", MAX_GROUP_DEPTH, depth));
      } else {
        builder.setMaxGroupDepth(value);
      }
    }

    FormatStyle.Builder style = FormatStyle.builder();
    readBoolean(properties, SPACE_AFTER_OPTION_SEPARATOR, problems)
        .ifPresent(style::setSpaceAfterOptionSeparator);
    readBoolean(properties, SPACE_AFTER_LAST_OPTION, problems)
        .ifPresent(style::setSpaceAfterLastOption);
    readBoolean(properties, SPACE_AFTER_SETTING_COLON, problems)
        .ifPresent(style::setSpaceAfterSettingColon);
    readBoolean(properties, SKIP_COMMENTS_AND_BLANK_LINES, problems)
        .ifPresent(builder::setSkipCommentsAndBlankLines);

    if (!problems.isEmpty()) {
      throw new ConfigurationException("configuration", problems);
    }
    return builder.setFormatStyle(style.build()).build();
  }

  private static Optional<Boolean> readBoolean(
      Properties properties, String key, List<String> problems) {
    String value = properties.getProperty(key);
    if (value == null) return Optional.empty();

    switch (Ascii.toLowerCase(value.trim())) {
      case "true":
        return Optional.of(true);
      case "false":
        return Optional.of(false);
      default:
        problems.add(String.format("%s must be true or false, was '%s'", key, value));
        return Optional.empty();
    }
  }
}
