package meerkat;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class RuleFormatterTest {

  private static final ImmutableList<String> RULES =
      ImmutableList.of(
          "alert tcp $HOME_NET any -> $EXTERNAL_NET any (msg:\"test\"; sid:1; rev:1;)",
          "drop udp any any <> any any (flow:to_client;)",
          "pass ip ![10.0.0.0/8,!10.1.0.0/16] [1024:,!:80] <- 2001:db8::/32 $HTTP_PORTS (sid:3;)",
          "reject tcp [[1.1.1.1,2.2.2.2],$HOME_NET] 1:2 -> fe80::1 ![22,23] (content:\"a;b\"; "
              + "nocase; metadata:[x;y]; sid:4;)",
          "alert  http   any any ->any 80 ( msg : \"spaced\" ;sid:5 ; )",
          "alert tcp any any -> any any (msg:a\\ ; content:b\\\\ ; sid:6;)");

  private static Rule parse(String text) {
    ParseResult result = RuleParser.parseRule(text);
    assertWithMessage("parse of %s", text).that(result.isRule()).isTrue();
    return result.rule();
  }

  private static String format(String text) {
    return RuleFormatter.format(parse(text), FormatStyle.defaults());
  }

  @Test
  public void canonicalTextIsUnchanged() {
    String text = "drop udp any any <> any any (flow:to_client;)";
    assertThat(format(text)).isEqualTo(text);

    String scenario =
        "alert tcp $HOME_NET any -> $EXTERNAL_NET any (msg:\"test\"; sid:1; rev:1;)";
    assertThat(format(scenario)).isEqualTo(scenario);
  }

  @Test
  public void whitespaceIsNormalized() {
    assertThat(format("alert  http   any any ->any 80 ( msg : \"spaced\" ;sid:5 ; )"))
        .isEqualTo("alert http any any -> any 80 (msg:\"spaced\"; sid:5;)");
    assertThat(format("alert tcp [1.1.1.1, 2.2.2.2]  any -> any any (sid:1;)"))
        .isEqualTo("alert tcp [1.1.1.1,2.2.2.2] any -> any any (sid:1;)");
  }

  @Test
  public void roundTrip() {
    for (String text : RULES) {
      Rule rule = parse(text);
      String formatted = RuleFormatter.format(rule, FormatStyle.defaults());
      Rule reparsed = parse(formatted);

      assertWithMessage("round trip of %s", text).that(reparsed.structurallyEquals(rule)).isTrue();
      assertWithMessage("format of %s", formatted)
          .that(RuleFormatter.format(reparsed, FormatStyle.defaults()))
          .isEqualTo(formatted);
    }
  }

  @Test
  public void roundTripUnderEveryStyle() {
    for (int bits = 0; bits < 8; bits++) {
      FormatStyle style =
          FormatStyle.builder()
              .setSpaceAfterOptionSeparator((bits & 1) != 0)
              .setSpaceAfterLastOption((bits & 2) != 0)
              .setSpaceAfterSettingColon((bits & 4) != 0)
              .build();
      for (String text : RULES) {
        Rule rule = parse(text);
        assertThat(parse(RuleFormatter.format(rule, style)).structurallyEquals(rule)).isTrue();
      }
    }
  }

  @Test
  public void styleOptions() {
    Rule rule = parse("alert tcp any any -> any any (msg:\"x\"; nocase; sid:1;)");

    assertThat(RuleFormatter.format(rule, FormatStyle.defaults()))
        .isEqualTo("alert tcp any any -> any any (msg:\"x\"; nocase; sid:1;)");
    assertThat(
            RuleFormatter.format(
                rule, FormatStyle.builder().setSpaceAfterOptionSeparator(false).build()))
        .isEqualTo("alert tcp any any -> any any (msg:\"x\";nocase;sid:1;)");
    assertThat(
            RuleFormatter.format(
                rule, FormatStyle.defaults().toBuilder().setSpaceAfterLastOption(true).build()))
        .isEqualTo("alert tcp any any -> any any (msg:\"x\"; nocase; sid:1; )");
    assertThat(
            RuleFormatter.format(
                rule, FormatStyle.builder().setSpaceAfterSettingColon(true).build()))
        .isEqualTo("alert tcp any any -> any any (msg: \"x\"; nocase; sid: 1;)");
  }

  @Test
  public void portsAndDirectionAsWritten() {
    assertThat(format("alert tcp any 1024: <- any :1024 (sid:1;)"))
        .isEqualTo("alert tcp any 1024: <- any :1024 (sid:1;)");
    assertThat(format("alert tcp any [ 80 , 1:2 ] -> any any (sid:1;)"))
        .isEqualTo("alert tcp any [80,1:2] -> any any (sid:1;)");
  }

  @Test
  public void settingsAreKeptVerbatim() {
    assertThat(format("alert tcp any any -> any any (pcre:\"/a  b;c/i\"; sid:1;)"))
        .isEqualTo("alert tcp any any -> any any (pcre:\"/a  b;c/i\"; sid:1;)");
    assertThat(format("alert tcp any any -> any any (reference:url, example.com/x ; sid:1;)"))
        .isEqualTo("alert tcp any any -> any any (reference:url, example.com/x; sid:1;)");
  }

  @Test
  public void deterministic() {
    Rule rule = parse(RULES.get(3));

    assertThat(RuleFormatter.format(rule, FormatStyle.defaults()))
        .isEqualTo(RuleFormatter.format(rule, FormatStyle.defaults()));
  }
}
