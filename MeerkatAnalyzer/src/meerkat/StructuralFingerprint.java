package meerkat;

import com.google.common.collect.ImmutableList;

/**
 * A span-free, pre-order description of a rule tree. Two rules are structurally equal exactly when
 * their fingerprints are.
 */
class StructuralFingerprint extends DefaultTreeVisitor<ImmutableList.Builder<String>> {

  static ImmutableList<String> of(Rule rule) {
    return rule.accept(new StructuralFingerprint(), ImmutableList.<String>builder()).build();
  }

  private ImmutableList.Builder<String> describe(
      TreeNodeInterface node, ImmutableList.Builder<String> out, String description) {
    out.add(description);
    return node.visitChildren(this, out);
  }

  @Override
  public ImmutableList.Builder<String> visit(Rule rule, ImmutableList.Builder<String> out) {
    return describe(rule, out, "rule " + rule.action() + " " + rule.options().size());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      Rule.Header header, ImmutableList.Builder<String> out) {
    return describe(header, out, "header " + header.protocol() + " " + header.direction());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      Rule.Option option, ImmutableList.Builder<String> out) {
    return describe(option, out, "option " + option.keyword() + " " + option.rawSetting());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      AddressExpr.Any any, ImmutableList.Builder<String> out) {
    return describe(any, out, "address any");
  }

  @Override
  public ImmutableList.Builder<String> visit(
      AddressExpr.Single single, ImmutableList.Builder<String> out) {
    return describe(single, out, "address " + single.family() + " " + single.text());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      AddressExpr.Negated negated, ImmutableList.Builder<String> out) {
    return describe(negated, out, "address not");
  }

  @Override
  public ImmutableList.Builder<String> visit(
      AddressExpr.Group group, ImmutableList.Builder<String> out) {
    return describe(group, out, "address group " + group.members().size());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      AddressExpr.Variable variable, ImmutableList.Builder<String> out) {
    return describe(variable, out, "address $" + variable.name());
  }

  @Override
  public ImmutableList.Builder<String> visit(PortExpr.Any any, ImmutableList.Builder<String> out) {
    return describe(any, out, "port any");
  }

  @Override
  public ImmutableList.Builder<String> visit(
      PortExpr.Number number, ImmutableList.Builder<String> out) {
    return describe(number, out, "port " + number.digits());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      PortExpr.Range range, ImmutableList.Builder<String> out) {
    return describe(
        range,
        out,
        "port range " + range.low().isPresent() + " " + range.high().isPresent());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      PortExpr.Negated negated, ImmutableList.Builder<String> out) {
    return describe(negated, out, "port not");
  }

  @Override
  public ImmutableList.Builder<String> visit(
      PortExpr.Group group, ImmutableList.Builder<String> out) {
    return describe(group, out, "port group " + group.members().size());
  }

  @Override
  public ImmutableList.Builder<String> visit(
      PortExpr.Variable variable, ImmutableList.Builder<String> out) {
    return describe(variable, out, "port $" + variable.name());
  }
}
