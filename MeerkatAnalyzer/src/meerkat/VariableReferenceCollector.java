package meerkat;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Finds every {@code $NAME} in a rule header, in source order. */
class VariableReferenceCollector extends VoidDefaultTreeVisitor {
  @AutoValue
  abstract static class VariableReference {
    abstract String name();

    /** Covers the leading '$'. */
    abstract Tokenizer.Span span();

    /** The kind of set the header position calls for. */
    abstract SymbolTable.VariableKind expectedKind();

    static VariableReference create(
        String name, Tokenizer.Span span, SymbolTable.VariableKind expectedKind) {
      return new AutoValue_VariableReferenceCollector_VariableReference(name, span, expectedKind);
    }
  }

  private final List<VariableReference> references = new ArrayList<>();

  static ImmutableList<VariableReference> collect(TreeNodeInterface node) {
    VariableReferenceCollector collector = new VariableReferenceCollector();
    node.accept(collector, null);
    return ImmutableList.copyOf(collector.references);
  }

  @Override
  public void visitImpl(AddressExpr.Variable variable) {
    references.add(
        VariableReference.create(
            variable.name(), variable.span(), SymbolTable.VariableKind.ADDRESS_SET));
  }

  @Override
  public void visitImpl(PortExpr.Variable variable) {
    references.add(
        VariableReference.create(
            variable.name(), variable.span(), SymbolTable.VariableKind.PORT_SET));
  }
}
