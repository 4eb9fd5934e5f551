package meerkat;

import com.google.common.base.Preconditions;

/**
 * Prints a parsed rule in canonical form.
 *
 * <p>Only whitespace changes: options keep their order and settings are printed exactly as they
 * were written. The style is always passed in, never looked up.
 */
public class RuleFormatter {

  public static String format(Rule rule, FormatStyle style) {
    Preconditions.checkNotNull(style);
    return rule.accept(new Printer(style), new StringBuilder()).toString();
  }

  private static class Printer extends DefaultTreeVisitor<StringBuilder> {
    private final FormatStyle style;

    Printer(FormatStyle style) {
      this.style = style;
    }

    @Override
    public StringBuilder visit(Rule rule, StringBuilder out) {
      out.append(rule.action().keyword()).append(' ');
      rule.header().accept(this, out);
      out.append(" (");
      for (int i = 0; i < rule.options().size(); i++) {
        if (i > 0 && style.spaceAfterOptionSeparator()) out.append(' ');
        rule.options().get(i).accept(this, out);
      }
      if (style.spaceAfterLastOption()) out.append(' ');
      return out.append(')');
    }

    @Override
    public StringBuilder visit(Rule.Header header, StringBuilder out) {
      out.append(header.protocol()).append(' ');
      header.source().accept(this, out).append(' ');
      header.sourcePort().accept(this, out).append(' ');
      out.append(header.direction().token()).append(' ');
      header.destination().accept(this, out).append(' ');
      return header.destinationPort().accept(this, out);
    }

    @Override
    public StringBuilder visit(Rule.Option option, StringBuilder out) {
      out.append(option.keyword());
      if (option.rawSetting().isPresent()) {
        out.append(':');
        if (style.spaceAfterSettingColon()) out.append(' ');
        out.append(option.rawSetting().get());
      }
      return out.append(';');
    }

    @Override
    public StringBuilder visit(AddressExpr.Any any, StringBuilder out) {
      return out.append("any");
    }

    @Override
    public StringBuilder visit(AddressExpr.Single single, StringBuilder out) {
      return out.append(single.text());
    }

    @Override
    public StringBuilder visit(AddressExpr.Negated negated, StringBuilder out) {
      return negated.inner().accept(this, out.append('!'));
    }

    @Override
    public StringBuilder visit(AddressExpr.Group group, StringBuilder out) {
      out.append('[');
      for (int i = 0; i < group.members().size(); i++) {
        if (i > 0) out.append(',');
        group.members().get(i).accept(this, out);
      }
      return out.append(']');
    }

    @Override
    public StringBuilder visit(AddressExpr.Variable variable, StringBuilder out) {
      return out.append('$').append(variable.name());
    }

    @Override
    public StringBuilder visit(PortExpr.Any any, StringBuilder out) {
      return out.append("any");
    }

    @Override
    public StringBuilder visit(PortExpr.Number number, StringBuilder out) {
      return out.append(number.digits());
    }

    @Override
    public StringBuilder visit(PortExpr.Range range, StringBuilder out) {
      range.low().ifPresent(low -> out.append(low.digits()));
      out.append(':');
      range.high().ifPresent(high -> out.append(high.digits()));
      return out;
    }

    @Override
    public StringBuilder visit(PortExpr.Negated negated, StringBuilder out) {
      return negated.inner().accept(this, out.append('!'));
    }

    @Override
    public StringBuilder visit(PortExpr.Group group, StringBuilder out) {
      out.append('[');
      for (int i = 0; i < group.members().size(); i++) {
        if (i > 0) out.append(',');
        group.members().get(i).accept(this, out);
      }
      return out.append(']');
    }

    @Override
    public StringBuilder visit(PortExpr.Variable variable, StringBuilder out) {
      return out.append('$').append(variable.name());
    }
  }
}
