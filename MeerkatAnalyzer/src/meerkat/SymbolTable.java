package meerkat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Declared rule variables and the kind of set each one names, mirroring the {@code vars} section
 * of a Suricata configuration.
 */
public class SymbolTable {
  private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  public enum VariableKind {
    ADDRESS_SET("address-set", "address-groups."),
    PORT_SET("port-set", "port-groups.");

    private final String displayName;
    private final String propertyPrefix;

    VariableKind(String displayName, String propertyPrefix) {
      this.displayName = displayName;
      this.propertyPrefix = propertyPrefix;
    }

    public String displayName() {
      return displayName;
    }

    public String propertyPrefix() {
      return propertyPrefix;
    }
  }

  @AutoValue
  public abstract static class Declaration {
    public abstract String name();

    public abstract VariableKind kind();

    /** The declared value as written, e.g. {@code [10.0.0.0/8,!10.1.0.0/16]}; may be empty. */
    public abstract String definition();

    public static Declaration create(String name, VariableKind kind, String definition) {
      return new AutoValue_SymbolTable_Declaration(name, kind, definition);
    }
  }

  public static class Builder {
    private final Map<String, Declaration> declarations = new TreeMap<>();
    private final List<String> problems = new ArrayList<>();

    private Builder() {}

    public Builder declare(String name, VariableKind kind) {
      return declare(name, kind, "");
    }

    public Builder declare(String name, VariableKind kind, String definition) {
      if (name.isEmpty() || !NAME_CHARS.matchesAllOf(name)) {
        problems.add(String.format("'%s' is not a valid variable name", name));
      }
      Declaration previous = declarations.put(name, Declaration.create(name, kind, definition));
      if (previous != null && previous.kind() != kind) {
        problems.add(
            String.format(
                "'%s' is declared as both %s and %s",
                name,
                previous.kind().displayName(),
                kind.displayName()));
      }
      return this;
    }

    public SymbolTable build() {
      return new SymbolTable(declarations, problems);
    }
  }

  private final ImmutableSortedMap<String, Declaration> declarations;
  private final ImmutableList<String> problems;

  private SymbolTable(Map<String, Declaration> declarations, List<String> problems) {
    this.declarations = ImmutableSortedMap.copyOf(declarations);
    this.problems = ImmutableList.copyOf(problems);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SymbolTable empty() {
    return builder().build();
  }

  /**
   * Reads {@code address-groups.NAME} and {@code port-groups.NAME} entries; other keys belong to
   * someone else and are skipped.
   */
  public static SymbolTable fromProperties(Properties properties) throws ConfigurationException {
    Builder builder = builder();
    for (String key : new TreeSet<>(properties.stringPropertyNames())) {
      Optional<VariableKind> kind = kindForKey(key);
      if (!kind.isPresent()) continue;
      builder.declare(
          key.substring(kind.get().propertyPrefix().length()),
          kind.get(),
          properties.getProperty(key).trim());
    }

    SymbolTable table = builder.build();
    table.checkConsistency();
    logger.debug("Declared {} variables", table.declarations.size());
    return table;
  }

  private static Optional<VariableKind> kindForKey(String key) {
    for (VariableKind kind : VariableKind.values()) {
      if (key.startsWith(kind.propertyPrefix())) return Optional.of(kind);
    }
    return Optional.empty();
  }

  public void checkConsistency() throws ConfigurationException {
    if (!problems.isEmpty()) {
      throw new ConfigurationException("symbol table", problems);
    }
  }

  public Optional<VariableKind> lookup(String name) {
    return declaration(name).map(Declaration::kind);
  }

  public Optional<Declaration> declaration(String name) {
    return Optional.ofNullable(declarations.get(name));
  }

  public boolean isDeclared(String name) {
    return declarations.containsKey(name);
  }

  /** Names of every variable of the given kind, sorted. */
  public ImmutableSortedSet<String> variables(VariableKind kind) {
    return declarations
        .values()
        .stream()
        .filter(d -> d.kind() == kind)
        .map(Declaration::name)
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }
}
