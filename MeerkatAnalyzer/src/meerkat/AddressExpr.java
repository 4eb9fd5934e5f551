package meerkat;

import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import meerkat.processor.TreeChild;
import meerkat.processor.TreeNode;

/** An address in a rule header. */
public abstract class AddressExpr implements TreeNodeInterface {
  public enum Kind {
    ANY,
    SINGLE,
    NEGATED,
    GROUP,
    VARIABLE;
  }

  private final Kind kind;
  private final Tokenizer.Span span;

  private AddressExpr(Kind kind, Tokenizer.Span span) {
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
  public <T extends AddressExpr> T cast() {
    return (T) this;
  }

  @TreeNode
  public static final class Any extends AddressExpr implements AddressExpr_Any_TreeNode {
    private Any(Tokenizer.Span span) {
      super(Kind.ANY, span);
    }

    public static Any create(Tokenizer.Span span) {
      return new Any(span);
    }
  }

  /** An IPv4 or IPv6 address, optionally with a prefix length. Values are checked later. */
  @TreeNode
  public static final class Single extends AddressExpr implements AddressExpr_Single_TreeNode {
    public enum Family {
      IPV4,
      IPV6;
    }

    private final Family family;
    private final String address;
    private final Tokenizer.Span addressSpan;
    private final Optional<String> prefix;
    private final Optional<Tokenizer.Span> prefixSpan;

    private Single(
        Family family,
        String address,
        Tokenizer.Span addressSpan,
        Optional<String> prefix,
        Optional<Tokenizer.Span> prefixSpan) {
      super(Kind.SINGLE, prefixSpan.map(addressSpan::to).orElse(addressSpan));
      this.family = family;
      this.address = address;
      this.addressSpan = addressSpan;
      this.prefix = prefix;
      this.prefixSpan = prefixSpan;
    }

    public static Single ip(Family family, String address, Tokenizer.Span addressSpan) {
      return new Single(family, address, addressSpan, Optional.empty(), Optional.empty());
    }

    public static Single cidr(
        Family family,
        String address,
        Tokenizer.Span addressSpan,
        String prefix,
        Tokenizer.Span prefixSpan) {
      return new Single(family, address, addressSpan, Optional.of(prefix), Optional.of(prefixSpan));
    }

    public Family family() {
      return family;
    }

    /** The address exactly as written, without the prefix. */
    public String address() {
      return address;
    }

    public Tokenizer.Span addressSpan() {
      return addressSpan;
    }

    public boolean isCidr() {
      return prefix.isPresent();
    }

    /** The prefix digits as written, e.g. {@code "24"} for {@code 10.0.0.0/24}. */
    public Optional<String> prefix() {
      return prefix;
    }

    public Optional<Tokenizer.Span> prefixSpan() {
      return prefixSpan;
    }

    /** The dotted parts of an IPv4 address; empty for IPv6. */
    public ImmutableList<String> octets() {
      return family == Family.IPV4
          ? ImmutableList.copyOf(Splitter.on('.').split(address))
          : ImmutableList.of();
    }

    public String text() {
      return prefix.map(p -> address + "/" + p).orElse(address);
    }
  }

  @TreeNode
  public static final class Negated extends AddressExpr implements AddressExpr_Negated_TreeNode {
    private final AddressExpr inner;

    private Negated(AddressExpr inner, Tokenizer.Span span) {
      super(Kind.NEGATED, span);
      this.inner = inner;
    }

    public static Negated create(AddressExpr inner, Tokenizer.Span bangSpan) {
      Preconditions.checkArgument(
          inner.kind() != Kind.NEGATED, "double negation needs an intervening group");
      return new Negated(inner, bangSpan.to(inner.span()));
    }

    @TreeChild
    @Override
    public AddressExpr inner() {
      return inner;
    }
  }

  @TreeNode
  public static final class Group extends AddressExpr implements AddressExpr_Group_TreeNode {
    private final ImmutableList<AddressExpr> members;

    private Group(ImmutableList<AddressExpr> members, Tokenizer.Span span) {
      super(Kind.GROUP, span);
      this.members = members;
    }

    public static Group create(Iterable<? extends AddressExpr> members, Tokenizer.Span span) {
      ImmutableList<AddressExpr> list = ImmutableList.copyOf(members);
      Preconditions.checkArgument(!list.isEmpty(), "address groups are never empty");
      return new Group(list, span);
    }

    @TreeChild
    @Override
    public ImmutableList<AddressExpr> members() {
      return members;
    }
  }

  @TreeNode
  public static final class Variable extends AddressExpr implements AddressExpr_Variable_TreeNode {
    private final String name;

    private Variable(String name, Tokenizer.Span span) {
      super(Kind.VARIABLE, span);
      this.name = name;
    }

    /** @param span covers the leading '$' */
    public static Variable create(String name, Tokenizer.Span span) {
      return new Variable(name, span);
    }

    /** The name without its '$'. */
    public String name() {
      return name;
    }
  }
}
