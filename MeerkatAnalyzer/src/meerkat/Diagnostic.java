package meerkat;

import com.google.auto.value.AutoValue;

/** A parse, semantic or configuration finding anchored to a span of one line. */
@AutoValue
public abstract class Diagnostic {
  public enum Severity {
    ERROR,
    WARNING,
    INFORMATION,
    HINT;
  }

  public abstract Severity severity();

  public abstract Tokenizer.Span span();

  public abstract String message();

  public abstract DiagnosticCode code();

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public static Diagnostic create(DiagnosticCode code, Tokenizer.Span span, String message) {
    return create(code.defaultSeverity(), code, span, message);
  }

  public static Diagnostic create(
      Severity severity, DiagnosticCode code, Tokenizer.Span span, String message) {
    return new AutoValue_Diagnostic(severity, span, message, code);
  }

  @Override
  public final String toString() {
    return String.format(
        "%s %s@%d:%d %s",
        severity(), code().id(), span().start(), span().end(), message());
  }
}
