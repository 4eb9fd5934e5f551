package meerkat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.io.Resources;

/**
 * The option keywords a rule may use, as reported by {@code suricata --list-keywords=csv}.
 *
 * <p>A registry is an immutable snapshot; reloading it means building a new one.
 */
public class KeywordRegistry {
  private static final Logger logger = LoggerFactory.getLogger(KeywordRegistry.class);

  private static final String CSV_HEADER = "name;description;app layer;features;documentation";
  private static final String NO_OPTION_FEATURE = "No option";

  // The CSV only says whether a setting is allowed, so these come from the rule reference.
  private static final ImmutableSet<String> REQUIRES_SETTING =
      ImmutableSet.of(
          "msg",
          "sid",
          "rev",
          "gid",
          "classtype",
          "priority",
          "reference",
          "metadata",
          "content",
          "pcre",
          "flow",
          "flowbits",
          "threshold",
          "depth",
          "offset",
          "distance",
          "within",
          "byte_test",
          "byte_jump",
          "dsize",
          "target");

  private static final CharMatcher INVALID_NAME_CHARS =
      CharMatcher.whitespace().or(CharMatcher.anyOf(";:()"));

  private static final ImmutableSet<String> SINGLE_USE =
      ImmutableSet.of("sid", "rev", "msg", "gid", "classtype", "priority");

  @AutoValue
  public abstract static class KeywordSpec {
    public abstract boolean allowsSetting();

    public abstract boolean requiresSetting();

    public abstract boolean singleUsePerRule();

    public abstract String description();

    /** A documentation URL; empty when unknown. */
    public abstract String documentation();

    public static KeywordSpec create(
        boolean allowsSetting, boolean requiresSetting, boolean singleUsePerRule) {
      return create(allowsSetting, requiresSetting, singleUsePerRule, "", "");
    }

    public static KeywordSpec create(
        boolean allowsSetting,
        boolean requiresSetting,
        boolean singleUsePerRule,
        String description,
        String documentation) {
      return new AutoValue_KeywordRegistry_KeywordSpec(
          allowsSetting, requiresSetting, singleUsePerRule, description, documentation);
    }
  }

  private static class DefaultsHolder {
    private static final KeywordRegistry DEFAULTS = loadDefaults();

    private static KeywordRegistry loadDefaults() {
      try {
        return fromCsv(
            Resources.toString(
                Resources.getResource(KeywordRegistry.class, "keywords.csv"),
                StandardCharsets.UTF_8));
      } catch (IOException | ConfigurationException ex) {
        throw new IllegalStateException("bundled keyword list is unusable", ex);
      }
    }
  }

  private final ImmutableSortedMap<String, KeywordSpec> keywords;

  private KeywordRegistry(Map<String, KeywordSpec> keywords) {
    this.keywords = ImmutableSortedMap.copyOf(keywords);
  }

  public static KeywordRegistry of(Map<String, KeywordSpec> keywords) {
    return new KeywordRegistry(keywords);
  }

  public static KeywordRegistry empty() {
    return new KeywordRegistry(ImmutableMap.of());
  }

  /** The keyword list bundled with the analyzer. */
  public static KeywordRegistry defaults() {
    return DefaultsHolder.DEFAULTS;
  }

  /**
   * Reads the semicolon-separated keyword listing. Anything before the header line is skipped, as
   * is any row that does not have a name; a listing without a header is rejected.
   */
  public static KeywordRegistry fromCsv(String csv) throws ConfigurationException {
    int headerAt = csv.indexOf(CSV_HEADER);
    if (headerAt < 0) {
      throw new ConfigurationException("keyword list", "missing header '" + CSV_HEADER + "'");
    }

    int bodyAt = csv.indexOf('\n', headerAt);
    Map<String, KeywordSpec> keywords = new HashMap<>();
    List<String> rows =
        bodyAt < 0
            ? ImmutableList.of()
            : Splitter.on('\n').trimResults().omitEmptyStrings().splitToList(csv.substring(bodyAt));
    for (String row : rows) {
      List<String> fields = Splitter.on(';').trimResults().splitToList(row);
      if (fields.size() < 5 || fields.get(0).isEmpty()) {
        logger.warn("Skipping malformed keyword row: {}", row);
        continue;
      }

      String name = fields.get(0);
      boolean allowsSetting = !fields.get(3).startsWith(NO_OPTION_FEATURE);
      keywords.put(
          name,
          KeywordSpec.create(
              allowsSetting,
              allowsSetting && REQUIRES_SETTING.contains(name),
              SINGLE_USE.contains(name),
              fields.get(1),
              fields.get(4)));
    }

    KeywordRegistry registry = new KeywordRegistry(keywords);
    registry.checkConsistency();
    logger.debug("Loaded {} keywords", keywords.size());
    return registry;
  }

  /** Rejects entries no rule could ever satisfy and names that could never be parsed. */
  public void checkConsistency() throws ConfigurationException {
    List<String> problems = new ArrayList<>();
    keywords.forEach(
        (name, spec) -> {
          if (name.isEmpty() || INVALID_NAME_CHARS.matchesAnyOf(name)) {
            problems.add(String.format("'%s' is not a usable keyword name", name));
          }
          if (spec.requiresSetting() && !spec.allowsSetting()) {
            problems.add(String.format("'%s' requires a setting but does not allow one", name));
          }
        });
    if (!problems.isEmpty()) {
      throw new ConfigurationException("keyword registry", problems);
    }
  }

  public Optional<KeywordSpec> lookup(String keyword) {
    return Optional.ofNullable(keywords.get(keyword));
  }

  public boolean contains(String keyword) {
    return keywords.containsKey(keyword);
  }

  /** All keyword names in sorted order. */
  public ImmutableSet<String> keywords() {
    return keywords.keySet();
  }

  public int size() {
    return keywords.size();
  }
}
