package meerkat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import meerkat.Tokenizer.Span;
import meerkat.Tokenizer.Token;

/**
 * Recursive-descent parser for one rule line.
 *
 * <p>{@link #parseRule} is total: every structural failure comes back as a {@link ParseError}
 * inside the {@link ParseResult}. Values (octets, ports, prefixes) are only checked for shape here;
 * their ranges are the validator's business.
 */
public class RuleParser {
  public static final int DEFAULT_MAX_GROUP_DEPTH = 64;

  private static final ImmutableSet<Token.Kind> IPV6_PARTS =
      ImmutableSet.of(Token.Kind.NUMBER, Token.Kind.IDENTIFIER, Token.Kind.COLON, Token.Kind.IPV4);

  private final Tokenizer.Line line;
  private final int maxGroupDepth;
  private int cursor = 0;
  private int limit = 0;

  private RuleParser(Tokenizer.Line line, int maxGroupDepth) {
    Preconditions.checkArgument(maxGroupDepth > 0, "maxGroupDepth must be positive");
    this.line = Preconditions.checkNotNull(line);
    this.maxGroupDepth = maxGroupDepth;
  }

  public static ParseResult parseRule(String text) {
    return parseRule(Tokenizer.tokenize(text), DEFAULT_MAX_GROUP_DEPTH);
  }

  public static ParseResult parseRule(String text, int maxGroupDepth) {
    return parseRule(Tokenizer.tokenize(text), maxGroupDepth);
  }

  public static ParseResult parseRule(Tokenizer.Line line) {
    return parseRule(line, DEFAULT_MAX_GROUP_DEPTH);
  }

  public static ParseResult parseRule(Tokenizer.Line line, int maxGroupDepth) {
    try {
      return ParseResult.rule(new RuleParser(line, maxGroupDepth).parse());
    } catch (RuleSyntaxException ex) {
      return ParseResult.error(ex.toParseError());
    }
  }

  private Rule parse() throws RuleSyntaxException {
    checkLexicalErrors();

    Token actionToken = line.token(0);
    if (actionToken.is(Token.Kind.EOF)) {
      throw new RuleSyntaxException(
          actionToken.span(), DiagnosticCode.MISSING_ACTION, "empty rule");
    }
    if (!actionToken.is(Token.Kind.IDENTIFIER)) {
      throw new RuleSyntaxException(
          actionToken.span(), DiagnosticCode.MISSING_ACTION, "expected a rule action");
    }
    Rule.Action action =
        Rule.Action.forKeyword(actionToken.lexeme())
            .orElseThrow(
                () ->
                    new RuleSyntaxException(
                        actionToken.span(),
                        DiagnosticCode.INVALID_ACTION,
                        "unknown action: " + actionToken.lexeme()));

    int bodyStart = findHeaderEnd();
    Rule.Header header = parseHeader(bodyStart);
    List<Rule.Option> options = parseOptions(bodyStart);

    Token close = line.token(cursor);
    Token after = line.token(cursor + 1);
    if (!after.is(Token.Kind.EOF)) {
      throw new RuleSyntaxException(
          after.span().to(lastToken().span()),
          DiagnosticCode.TRAILING_INPUT,
          "unexpected input after the option body");
    }

    return Rule.create(
        action, actionToken.span(), header, options, actionToken.span().to(close.span()));
  }

  private void checkLexicalErrors() throws RuleSyntaxException {
    Optional<Token> error = Optional.empty();
    for (Token token : line.tokens()) {
      // An unterminated string hides every bracket after it, so it wins over unclosed ones.
      if (token.is(Token.Kind.ERROR)
          && (!error.isPresent()
              || token.errorCode().get() == DiagnosticCode.UNTERMINATED_STRING)) {
        error = Optional.of(token);
      }
    }
    if (error.isPresent()) {
      Token token = error.get();
      throw new RuleSyntaxException(
          token.span(), token.errorCode().get(), token.errorMessage().get());
    }
  }

  private Token lastToken() {
    // The final token is EOF; the one before it is the last real token.
    return line.tokens().get(Math.max(0, line.tokens().size() - 2));
  }

  /** Index of the first '(' outside of any group, which opens the option body. */
  private int findHeaderEnd() throws RuleSyntaxException {
    int depth = 0;
    for (int i = 1; i < line.tokens().size(); i++) {
      Token token = line.token(i);
      if (token.is(Token.Kind.LBRACKET)) {
        depth++;
      } else if (token.is(Token.Kind.RBRACKET)) {
        depth--;
      } else if (token.is(Token.Kind.LPAREN) && depth == 0) {
        return i;
      }
    }

    Token end = line.token(line.tokens().size() - 1);
    throw new RuleSyntaxException(
        end.span(), DiagnosticCode.MISSING_OPTION_BODY, "expected '(' to open the rule options");
  }

  private int findDirection(int from, int to) throws RuleSyntaxException {
    int depth = 0;
    for (int i = from; i < to; i++) {
      Token token = line.token(i);
      if (token.is(Token.Kind.LBRACKET)) {
        depth++;
      } else if (token.is(Token.Kind.RBRACKET)) {
        depth--;
      } else if (token.is(Token.Kind.ARROW) && depth == 0) {
        return i;
      }
    }

    throw new RuleSyntaxException(
        line.token(from).span().to(line.token(to).span()),
        DiagnosticCode.MISSING_DIRECTION,
        "expected a direction: '->', '<>' or '<-'");
  }

  private Rule.Header parseHeader(int bodyStart) throws RuleSyntaxException {
    Token protocol = line.token(1);
    if (bodyStart == 1 || !protocol.is(Token.Kind.IDENTIFIER)) {
      throw new RuleSyntaxException(
          protocol.span(), DiagnosticCode.MISSING_PROTOCOL, "expected a protocol");
    }

    int arrow = findDirection(2, bodyStart);
    Token arrowToken = line.token(arrow);

    cursor = 2;
    limit = arrow;
    AddressExpr source = parseAddress(0);
    PortExpr sourcePort = parsePort(0);
    expectSegmentEnd("source");

    cursor = arrow + 1;
    limit = bodyStart;
    AddressExpr destination = parseAddress(0);
    PortExpr destinationPort = parsePort(0);
    expectSegmentEnd("destination");

    return Rule.Header.create(
        protocol.lexeme(),
        protocol.span(),
        source,
        sourcePort,
        Rule.Direction.forToken(arrowToken.lexeme()).get(),
        arrowToken.span(),
        destination,
        destinationPort);
  }

  private void expectSegmentEnd(String side) throws RuleSyntaxException {
    if (cursor != limit) {
      throw new RuleSyntaxException(
          line.token(cursor).span().to(line.token(limit - 1).span()),
          DiagnosticCode.UNEXPECTED_TOKEN,
          String.format("unexpected input after the %s port", side));
    }
  }

  private Token peek() {
    return cursor < limit ? line.token(cursor) : line.token(limit);
  }

  private boolean atEnd() {
    return cursor >= limit;
  }

  private Token next() {
    return line.token(cursor++);
  }

  private void checkDepth(Token open, int depth) throws RuleSyntaxException {
    if (depth >= maxGroupDepth) {
      throw new RuleSyntaxException(
          open.span(),
          DiagnosticCode.NESTING_TOO_DEEP,
          String.format("groups nested more than %d deep", maxGroupDepth));
    }
  }

  private RuleSyntaxException doubleNegation(Token bang) {
    return new RuleSyntaxException(
        bang.span().to(line.token(cursor).span()),
        DiagnosticCode.DOUBLE_NEGATION,
        "double negation; wrap the inner value in a group");
  }

  private AddressExpr parseAddress(int depth) throws RuleSyntaxException {
    if (atEnd()) {
      throw new RuleSyntaxException(
          peek().span(), DiagnosticCode.INVALID_ADDRESS, "expected an address");
    }

    Token token = peek();
    switch (token.kind()) {
      case BANG:
        next();
        if (!atEnd() && peek().is(Token.Kind.BANG)) throw doubleNegation(token);
        return AddressExpr.Negated.create(parseAddress(depth), token.span());
      case LBRACKET:
        return parseAddressGroup(depth);
      case VARIABLE:
        next();
        return AddressExpr.Variable.create(token.lexeme().substring(1), token.span());
      case IDENTIFIER:
        if (token.lexeme().equals("any")) {
          next();
          return AddressExpr.Any.create(token.span());
        }
        return parseIp();
      case NUMBER:
      case IPV4:
      case COLON:
        return parseIp();
      default:
        throw new RuleSyntaxException(
            token.span(),
            DiagnosticCode.INVALID_ADDRESS,
            "expected an address: " + token.lexeme());
    }
  }

  private AddressExpr parseAddressGroup(int depth) throws RuleSyntaxException {
    Token open = next();
    checkDepth(open, depth);
    if (!atEnd() && peek().is(Token.Kind.RBRACKET)) {
      throw new RuleSyntaxException(
          open.span().to(peek().span()), DiagnosticCode.EMPTY_GROUP, "empty address group");
    }

    List<AddressExpr> members = new ArrayList<>();
    while (true) {
      members.add(parseAddress(depth + 1));
      Token separator = peek();
      if (!atEnd() && separator.is(Token.Kind.COMMA)) {
        next();
      } else if (!atEnd() && separator.is(Token.Kind.RBRACKET)) {
        next();
        return AddressExpr.Group.create(members, open.span().to(separator.span()));
      } else {
        throw new RuleSyntaxException(
            separator.span(),
            DiagnosticCode.INVALID_ADDRESS,
            "expected ',' or ']' in address group");
      }
    }
  }

  private AddressExpr parseIp() throws RuleSyntaxException {
    Token first = peek();
    int end = cursor + 1;
    boolean sawColon = first.is(Token.Kind.COLON);
    // IPv6 text arrives as several touching tokens; dotted IPv4 is always a single token.
    while (!first.is(Token.Kind.IPV4)
        && end < limit
        && IPV6_PARTS.contains(line.token(end).kind())
        && line.token(end - 1).abuts(line.token(end))) {
      sawColon |= line.token(end).is(Token.Kind.COLON);
      end++;
    }

    AddressExpr.Single.Family family;
    Span addressSpan = first.span().to(line.token(end - 1).span());
    if (sawColon) {
      family = AddressExpr.Single.Family.IPV6;
    } else if (first.is(Token.Kind.IPV4)) {
      family = AddressExpr.Single.Family.IPV4;
    } else {
      throw new RuleSyntaxException(
          addressSpan,
          DiagnosticCode.INVALID_ADDRESS,
          "expected an address: " + addressSpan.slice(line.text()));
    }

    String address = addressSpan.slice(line.text());
    cursor = end;

    if (atEnd() || !peek().is(Token.Kind.SLASH) || !line.token(cursor - 1).abuts(peek())) {
      return AddressExpr.Single.ip(family, address, addressSpan);
    }

    Token slash = next();
    if (atEnd() || !peek().is(Token.Kind.NUMBER) || !slash.abuts(peek())) {
      throw new RuleSyntaxException(
          slash.span(), DiagnosticCode.INVALID_ADDRESS, "expected a prefix length after '/'");
    }
    Token prefix = next();
    return AddressExpr.Single.cidr(
        family, address, addressSpan, prefix.lexeme(), slash.span().to(prefix.span()));
  }

  private PortExpr parsePort(int depth) throws RuleSyntaxException {
    if (atEnd()) {
      throw new RuleSyntaxException(
          peek().span(), DiagnosticCode.INVALID_PORT, "expected a port");
    }

    Token token = peek();
    switch (token.kind()) {
      case BANG:
        next();
        if (!atEnd() && peek().is(Token.Kind.BANG)) throw doubleNegation(token);
        return PortExpr.Negated.create(parsePort(depth), token.span());
      case LBRACKET:
        return parsePortGroup(depth);
      case VARIABLE:
        next();
        return PortExpr.Variable.create(token.lexeme().substring(1), token.span());
      case IDENTIFIER:
        if (token.lexeme().equals("any")) {
          next();
          return PortExpr.Any.create(token.span());
        }
        break;
      case NUMBER:
        return parseNumberOrRange();
      case COLON:
        next();
        if (atEnd() || !peek().is(Token.Kind.NUMBER) || !token.abuts(peek())) {
          throw new RuleSyntaxException(
              token.span(),
              DiagnosticCode.EMPTY_PORT_RANGE,
              "port range needs at least one bound");
        }
        Token high = next();
        return PortExpr.Range.create(
            Optional.empty(),
            Optional.of(PortExpr.Number.create(high.lexeme(), high.span())),
            token.span().to(high.span()));
      default:
        break;
    }

    throw new RuleSyntaxException(
        token.span(), DiagnosticCode.INVALID_PORT, "expected a port: " + token.lexeme());
  }

  private PortExpr parseNumberOrRange() {
    Token lowToken = next();
    PortExpr.Number low = PortExpr.Number.create(lowToken.lexeme(), lowToken.span());
    if (atEnd() || !peek().is(Token.Kind.COLON) || !lowToken.abuts(peek())) return low;

    Token colon = next();
    if (atEnd() || !peek().is(Token.Kind.NUMBER) || !colon.abuts(peek())) {
      return PortExpr.Range.create(
          Optional.of(low), Optional.empty(), lowToken.span().to(colon.span()));
    }

    Token highToken = next();
    return PortExpr.Range.create(
        Optional.of(low),
        Optional.of(PortExpr.Number.create(highToken.lexeme(), highToken.span())),
        lowToken.span().to(highToken.span()));
  }

  private PortExpr parsePortGroup(int depth) throws RuleSyntaxException {
    Token open = next();
    checkDepth(open, depth);
    if (!atEnd() && peek().is(Token.Kind.RBRACKET)) {
      throw new RuleSyntaxException(
          open.span().to(peek().span()), DiagnosticCode.EMPTY_GROUP, "empty port group");
    }

    List<PortExpr> members = new ArrayList<>();
    while (true) {
      members.add(parsePort(depth + 1));
      Token separator = peek();
      if (!atEnd() && separator.is(Token.Kind.COMMA)) {
        next();
      } else if (!atEnd() && separator.is(Token.Kind.RBRACKET)) {
        next();
        return PortExpr.Group.create(members, open.span().to(separator.span()));
      } else {
        throw new RuleSyntaxException(
            separator.span(),
            DiagnosticCode.INVALID_PORT,
            "expected ',' or ']' in port group");
      }
    }
  }

  /** Parses the options after the '(' at {@code bodyStart}; the cursor ends on the closing ')'. */
  private List<Rule.Option> parseOptions(int bodyStart) throws RuleSyntaxException {
    List<Rule.Option> options = new ArrayList<>();
    cursor = bodyStart + 1;
    limit = line.tokens().size() - 1;

    while (true) {
      Token token = peek();
      if (token.is(Token.Kind.RPAREN)) {
        if (options.isEmpty()) {
          throw new RuleSyntaxException(
              line.token(bodyStart).span().to(token.span()),
              DiagnosticCode.MISSING_OPTIONS,
              "a rule needs at least one option");
        }
        return options;
      }
      if (!token.is(Token.Kind.IDENTIFIER)) {
        throw new RuleSyntaxException(
            token.span(), DiagnosticCode.INVALID_KEYWORD, "expected an option keyword");
      }
      options.add(parseOption());
    }
  }

  private Rule.Option parseOption() throws RuleSyntaxException {
    Token keyword = next();
    Token after = peek();
    Span emptySetting = Span.of(keyword.span().end(), keyword.span().end());

    if (after.is(Token.Kind.SEMICOLON)) {
      next();
      return Rule.Option.create(
          keyword.lexeme(),
          keyword.span(),
          Optional.empty(),
          emptySetting,
          keyword.span().to(after.span()));
    }
    if (after.is(Token.Kind.RPAREN)) {
      throw missingTerminator(keyword.span());
    }
    if (!after.is(Token.Kind.COLON)) {
      throw new RuleSyntaxException(
          after.span(),
          DiagnosticCode.UNEXPECTED_TOKEN,
          String.format("expected ':' or ';' after '%s'", keyword.lexeme()));
    }

    Token colon = next();
    int depth = 0;
    Token last = colon;
    while (true) {
      Token token = peek();
      if (depth == 0 && token.is(Token.Kind.SEMICOLON)) break;
      if (token.is(Token.Kind.EOF) || (depth == 0 && token.is(Token.Kind.RPAREN))) {
        throw missingTerminator(keyword.span().to(last.span()));
      }
      if (token.is(Token.Kind.LBRACKET) || token.is(Token.Kind.LPAREN)) {
        depth++;
      } else if (token.is(Token.Kind.RBRACKET) || token.is(Token.Kind.RPAREN)) {
        depth--;
      }
      last = next();
    }

    Token semicolon = next();
    Span settingSpan = trimmed(Span.of(colon.span().end(), semicolon.span().start()));
    return Rule.Option.create(
        keyword.lexeme(),
        keyword.span(),
        Optional.of(settingSpan.slice(line.text())),
        settingSpan,
        keyword.span().to(semicolon.span()));
  }

  private static RuleSyntaxException missingTerminator(Span optionSpan) {
    return new RuleSyntaxException(
        optionSpan, DiagnosticCode.MISSING_OPTION_TERMINATOR, "option is missing its ';'");
  }

  private Span trimmed(Span span) {
    String text = line.text();
    int start = span.start();
    int end = span.end();
    while (start < end && CharMatcher.whitespace().matches(text.charAt(start))) start++;
    while (end > start
        && CharMatcher.whitespace().matches(text.charAt(end - 1))
        && !isEscaped(text, start, end - 1)) {
      end--;
    }
    return Span.of(start, end);
  }

  // True when an odd run of backslashes within [from, at) ends right before index at.
  private static boolean isEscaped(String text, int from, int at) {
    int backslashes = 0;
    while (at - backslashes - 1 >= from && text.charAt(at - backslashes - 1) == '\\') {
      backslashes++;
    }
    return backslashes % 2 == 1;
  }
}
