package meerkat;

import com.google.auto.value.AutoValue;

/** The structural failure of one line: which construct broke, where, and why. */
@AutoValue
public abstract class ParseError {
  public abstract DiagnosticCode code();

  public abstract Tokenizer.Span span();

  public abstract String message();

  public Diagnostic toDiagnostic() {
    return Diagnostic.create(code(), span(), message());
  }

  public static ParseError create(DiagnosticCode code, Tokenizer.Span span, String message) {
    return new AutoValue_ParseError(code, span, message);
  }

  @Override
  public final String toString() {
    return String.format("%s@%d:%d %s", code().id(), span().start(), span().end(), message());
  }
}
