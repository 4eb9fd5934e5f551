package meerkat;

import java.util.Optional;

class VariableValidator extends DiagnosticCollectingValidator {

  private final SymbolTable symbols;

  public VariableValidator(SymbolTable symbols) {
    this.symbols = symbols;
  }

  @Override
  public void visitImpl(Rule.Header header) {
    for (VariableReferenceCollector.VariableReference ref :
        VariableReferenceCollector.collect(header)) {
      Optional<SymbolTable.VariableKind> kind = symbols.lookup(ref.name());
      if (!kind.isPresent()) {
        report(
            DiagnosticCode.UNDECLARED_VARIABLE, ref.span(), "undeclared variable: $" + ref.name());
      } else if (kind.get() != ref.expectedKind()) {
        report(
            DiagnosticCode.VARIABLE_KIND_MISMATCH,
            ref.span(),
            String.format(
                "$%s is declared as %s, expected %s",
                ref.name(),
                kind.get().displayName(),
                ref.expectedKind().displayName()));
      }
    }
  }
}
