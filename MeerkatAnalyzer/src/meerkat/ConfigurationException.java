package meerkat;

import com.google.common.collect.ImmutableList;

/** Raised once per pass when caller-supplied configuration cannot be used. */
public class ConfigurationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> problems;

  public ConfigurationException(String source, Iterable<String> problems) {
    super(source + ": " + String.join("; ", problems));
    this.problems = ImmutableList.copyOf(problems);
  }

  public ConfigurationException(String source, String problem) {
    this(source, ImmutableList.of(problem));
  }

  public ImmutableList<String> problems() {
    return problems;
  }

  public Diagnostic toDiagnostic() {
    return Diagnostic.create(
        DiagnosticCode.CONFIGURATION_ERROR, Tokenizer.Span.of(0, 0), getMessage());
  }
}
