package meerkat;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import meerkat.processor.TreeChild;
import meerkat.processor.TreeNode;

/** A port in a rule header. */
public abstract class PortExpr implements TreeNodeInterface {
  public enum Kind {
    ANY,
    NUMBER,
    RANGE,
    NEGATED,
    GROUP,
    VARIABLE;
  }

  private final Kind kind;
  private final Tokenizer.Span span;

  private PortExpr(Kind kind, Tokenizer.Span span) {
    this.kind = kind;
    this.span = span;
  }

  public Kind kind() {
    return kind;
  }

  public Tokenizer.Span span() {
    return span;
  }

  @SuppressWarnings("unchecked")
  public <T extends PortExpr> T cast() {
    return (T) this;
  }

  @TreeNode
  public static final class Any extends PortExpr implements PortExpr_Any_TreeNode {
    private Any(Tokenizer.Span span) {
      super(Kind.ANY, span);
    }

    public static Any create(Tokenizer.Span span) {
      return new Any(span);
    }
  }

  @TreeNode
  public static final class Number extends PortExpr implements PortExpr_Number_TreeNode {
    private final String digits;

    private Number(String digits, Tokenizer.Span span) {
      super(Kind.NUMBER, span);
      this.digits = digits;
    }

    public static Number create(String digits, Tokenizer.Span span) {
      return new Number(digits, span);
    }

    public String digits() {
      return digits;
    }

    /** The numeric value, saturated at {@link Integer#MAX_VALUE} for absurdly long inputs. */
    public int value() {
      return saturatedValue(digits);
    }
  }

  /** {@code low:high}, {@code low:} or {@code :high}; at least one bound is present. */
  @TreeNode
  public static final class Range extends PortExpr implements PortExpr_Range_TreeNode {
    private final Optional<Number> low;
    private final Optional<Number> high;

    private Range(Optional<Number> low, Optional<Number> high, Tokenizer.Span span) {
      super(Kind.RANGE, span);
      this.low = low;
      this.high = high;
    }

    public static Range create(
        Optional<Number> low, Optional<Number> high, Tokenizer.Span span) {
      Preconditions.checkArgument(
          low.isPresent() || high.isPresent(), "a port range needs at least one bound");
      return new Range(low, high, span);
    }

    @TreeChild
    @Override
    public Optional<Number> low() {
      return low;
    }

    @TreeChild
    @Override
    public Optional<Number> high() {
      return high;
    }
  }

  @TreeNode
  public static final class Negated extends PortExpr implements PortExpr_Negated_TreeNode {
    private final PortExpr inner;

    private Negated(PortExpr inner, Tokenizer.Span span) {
      super(Kind.NEGATED, span);
      this.inner = inner;
    }

    public static Negated create(PortExpr inner, Tokenizer.Span bangSpan) {
      Preconditions.checkArgument(
          inner.kind() != Kind.NEGATED, "double negation needs an intervening group");
      return new Negated(inner, bangSpan.to(inner.span()));
    }

    @TreeChild
    @Override
    public PortExpr inner() {
      return inner;
    }
  }

  @TreeNode
  public static final class Group extends PortExpr implements PortExpr_Group_TreeNode {
    private final ImmutableList<PortExpr> members;

    private Group(ImmutableList<PortExpr> members, Tokenizer.Span span) {
      super(Kind.GROUP, span);
      this.members = members;
    }

    public static Group create(Iterable<? extends PortExpr> members, Tokenizer.Span span) {
      ImmutableList<PortExpr> list = ImmutableList.copyOf(members);
      Preconditions.checkArgument(!list.isEmpty(), "port groups are never empty");
      return new Group(list, span);
    }

    @TreeChild
    @Override
    public ImmutableList<PortExpr> members() {
      return members;
    }
  }

  @TreeNode
  public static final class Variable extends PortExpr implements PortExpr_Variable_TreeNode {
    private final String name;

    private Variable(String name, Tokenizer.Span span) {
      super(Kind.VARIABLE, span);
      this.name = name;
    }

    public static Variable create(String name, Tokenizer.Span span) {
      return new Variable(name, span);
    }

    public String name() {
      return name;
    }
  }

  static int saturatedValue(String digits) {
    long value = 0;
    for (int i = 0; i < digits.length(); i++) {
      value = value * 10 + (digits.charAt(i) - '0');
      if (value > Integer.MAX_VALUE) return Integer.MAX_VALUE;
    }
    return (int) value;
  }
}
