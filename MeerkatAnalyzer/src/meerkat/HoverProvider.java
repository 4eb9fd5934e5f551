package meerkat;

import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.net.InetAddresses;

/** Markdown hover text for the element under a column of a parsed rule. */
public class HoverProvider {

  @AutoValue
  public abstract static class Hover {
    /** What the hover describes. */
    public abstract Tokenizer.Span span();

    public abstract String contents();

    public static Hover create(Tokenizer.Span span, String contents) {
      return new AutoValue_HoverProvider_Hover(span, contents);
    }
  }

  /**
   * Over a CIDR block, the first and last address of the range; over an option keyword, its
   * registry description. Nothing elsewhere.
   */
  public static Optional<Hover> hover(Rule rule, int column, KeywordRegistry registry) {
    Finder finder = new Finder(column, registry);
    rule.accept(finder, null);
    return finder.hover;
  }

  private static class Finder extends VoidDefaultTreeVisitor {
    private final int column;
    private final KeywordRegistry registry;
    private Optional<Hover> hover = Optional.empty();

    Finder(int column, KeywordRegistry registry) {
      this.column = column;
      this.registry = registry;
    }

    @Override
    public void visitImpl(AddressExpr.Single single) {
      if (single.isCidr() && single.span().contains(column)) {
        hover = cidrRange(single).map(range -> Hover.create(single.span(), range));
      }
    }

    @Override
    public void visitImpl(Rule.Option option) {
      if (!option.keywordSpan().contains(column)) return;

      hover =
          registry
              .lookup(option.keyword())
              .map(
                  spec ->
                      Hover.create(
                          option.keywordSpan(),
                          String.join(
                              "\n\n",
                              "**" + option.keyword() + "**",
                              spec.description(),
                              "*Documentation: " + spec.documentation() + "*")));
    }
  }

  static Optional<String> cidrRange(AddressExpr.Single single) {
    if (!InetAddresses.isInetAddress(single.address())) return Optional.empty();

    InetAddress address = InetAddresses.forString(single.address());
    boolean ipv4 = address instanceof Inet4Address;
    int bits = ipv4 ? 32 : 128;
    int prefix = PortExpr.saturatedValue(single.prefix().get());
    if (prefix > bits) return Optional.empty();

    BigInteger hostMask = BigInteger.ONE.shiftLeft(bits - prefix).subtract(BigInteger.ONE);
    BigInteger network = InetAddresses.toBigInteger(address).andNot(hostMask);
    BigInteger broadcast = network.or(hostMask);
    return Optional.of(
        String.format(
            "**%s/%d**\n\n%s - %s",
            InetAddresses.toAddrString(toAddress(network, ipv4)),
            prefix,
            InetAddresses.toAddrString(toAddress(network, ipv4)),
            InetAddresses.toAddrString(toAddress(broadcast, ipv4))));
  }

  private static InetAddress toAddress(BigInteger value, boolean ipv4) {
    return ipv4 ? InetAddresses.fromIPv4BigInteger(value) : InetAddresses.fromIPv6BigInteger(value);
  }
}
