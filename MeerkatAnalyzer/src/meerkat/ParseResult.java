package meerkat;

import java.util.Optional;

/** Either the parsed {@link Rule} of one line or the {@link ParseError} that stopped it. */
public class ParseResult {
  private final Optional<Rule> rule;
  private final Optional<ParseError> error;

  private ParseResult(Optional<Rule> rule, Optional<ParseError> error) {
    this.rule = rule;
    this.error = error;
  }

  public static ParseResult rule(Rule rule) {
    return new ParseResult(Optional.of(rule), Optional.empty());
  }

  public static ParseResult error(ParseError error) {
    return new ParseResult(Optional.empty(), Optional.of(error));
  }

  public boolean isRule() {
    return rule.isPresent();
  }

  public boolean isError() {
    return error.isPresent();
  }

  public Rule rule() {
    return rule.get();
  }

  public ParseError error() {
    return error.get();
  }

  public Optional<Rule> asRule() {
    return rule;
  }

  @Override
  public String toString() {
    return isRule() ? "Rule" + rule().span() : error().toString();
  }
}
