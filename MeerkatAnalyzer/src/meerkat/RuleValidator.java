package meerkat;

import java.util.Comparator;

import com.google.common.collect.ImmutableList;

/**
 * Runs every semantic check over a parsed rule and returns all findings at once, ordered by
 * position.
 *
 * <p>The symbol table and keyword registry are fixed for the lifetime of a validator; to observe an
 * update, create a new one.
 */
public class RuleValidator {
  private static final Comparator<Diagnostic> BY_POSITION =
      Comparator.comparing(Diagnostic::span).thenComparing(Diagnostic::code);

  private final SymbolTable symbols;
  private final KeywordRegistry registry;

  private RuleValidator(SymbolTable symbols, KeywordRegistry registry) {
    this.symbols = symbols;
    this.registry = registry;
  }

  public static RuleValidator create(SymbolTable symbols, KeywordRegistry registry)
      throws ConfigurationException {
    symbols.checkConsistency();
    registry.checkConsistency();
    return new RuleValidator(symbols, registry);
  }

  /** Validates one rule; a malformed configuration yields a single configuration diagnostic. */
  public static ImmutableList<Diagnostic> validate(
      Rule rule, SymbolTable symbols, KeywordRegistry registry) {
    try {
      return create(symbols, registry).validate(rule);
    } catch (ConfigurationException ex) {
      return ImmutableList.of(ex.toDiagnostic());
    }
  }

  public ImmutableList<Diagnostic> validate(Rule rule) {
    ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
    diagnostics.addAll(run(rule, new AddressValidator()));
    diagnostics.addAll(run(rule, new PortValidator()));
    diagnostics.addAll(run(rule, new KeywordValidator(registry)));
    diagnostics.addAll(run(rule, new VariableValidator(symbols)));
    return ImmutableList.sortedCopyOf(BY_POSITION, diagnostics.build());
  }

  public SymbolTable symbols() {
    return symbols;
  }

  public KeywordRegistry registry() {
    return registry;
  }

  private static ImmutableList<Diagnostic> run(Rule rule, DiagnosticCollectingValidator visitor) {
    rule.accept(visitor, null);
    return visitor.diagnostics();
  }
}
