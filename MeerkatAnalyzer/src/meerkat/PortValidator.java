package meerkat;

class PortValidator extends DiagnosticCollectingValidator {
  private static final int MAX_PORT = 65535;

  @Override
  public void visitImpl(PortExpr.Number number) {
    if (number.value() > MAX_PORT) {
      report(
          DiagnosticCode.PORT_OUT_OF_RANGE,
          number.span(),
          String.format("port %s is not between 0 and %d", number.digits(), MAX_PORT));
    }
  }

  @Override
  public void visitImpl(PortExpr.Range range) {
    if (range.low().isPresent()
        && range.high().isPresent()
        && range.low().get().value() > range.high().get().value()) {
      report(
          DiagnosticCode.PORT_RANGE_INVERTED,
          range.span(),
          String.format(
              "port range starts after it ends: %s > %s",
              range.low().get().digits(),
              range.high().get().digits()));
    }
    super.visitImpl(range);
  }
}
