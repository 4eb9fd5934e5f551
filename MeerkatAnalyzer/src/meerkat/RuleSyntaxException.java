package meerkat;

public class RuleSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Span span;
  private final DiagnosticCode code;

  public RuleSyntaxException(Tokenizer.Span span, DiagnosticCode code, String errorMsg) {
    super(errorMsg);
    this.span = span;
    this.code = code;
  }

  public Tokenizer.Span span() {
    return span;
  }

  public DiagnosticCode code() {
    return code;
  }

  public ParseError toParseError() {
    return ParseError.create(code, span, getMessage());
  }
}
