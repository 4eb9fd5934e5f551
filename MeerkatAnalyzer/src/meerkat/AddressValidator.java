package meerkat;

import java.util.List;

import com.google.common.net.InetAddresses;

class AddressValidator extends DiagnosticCollectingValidator {
  private static final int MAX_OCTET = 255;
  private static final int IPV4_BITS = 32;
  private static final int IPV6_BITS = 128;

  @Override
  public void visitImpl(AddressExpr.Single single) {
    if (single.family() == AddressExpr.Single.Family.IPV4) {
      checkIpv4(single);
    } else if (!InetAddresses.isInetAddress(single.address())) {
      report(
          DiagnosticCode.INVALID_IP_ADDRESS,
          single.addressSpan(),
          "invalid IPv6 address: " + single.address());
    }

    if (single.isCidr()) {
      int maxPrefix = single.family() == AddressExpr.Single.Family.IPV4 ? IPV4_BITS : IPV6_BITS;
      if (PortExpr.saturatedValue(single.prefix().get()) > maxPrefix) {
        report(
            DiagnosticCode.CIDR_PREFIX_OUT_OF_RANGE,
            single.prefixSpan().get(),
            String.format("prefix length must be between 0 and %d", maxPrefix));
      }
    }
  }

  private void checkIpv4(AddressExpr.Single single) {
    List<String> octets = single.octets();
    if (octets.size() != 4) {
      report(
          DiagnosticCode.INVALID_IP_ADDRESS,
          single.addressSpan(),
          String.format("IPv4 address needs 4 octets, found %d", octets.size()));
      return;
    }

    int column = single.addressSpan().start();
    for (String octet : octets) {
      if (PortExpr.saturatedValue(octet) > MAX_OCTET) {
        report(
            DiagnosticCode.IP_OCTET_OUT_OF_RANGE,
            Tokenizer.Span.of(column, column + octet.length()),
            String.format("octet %s is not between 0 and %d", octet, MAX_OCTET));
      }
      column += octet.length() + 1;
    }
  }
}
