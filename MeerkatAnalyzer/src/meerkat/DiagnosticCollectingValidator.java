package meerkat;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class DiagnosticCollectingValidator extends VoidDefaultTreeVisitor {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  protected ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  protected void report(DiagnosticCode code, Tokenizer.Span span, String msg) {
    report(Diagnostic.create(code, span, msg));
  }

  protected void report(Diagnostic diagnostic) {
    diagnostics.add(diagnostic);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }
}
