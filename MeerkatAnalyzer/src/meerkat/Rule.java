package meerkat;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import meerkat.processor.TreeChild;
import meerkat.processor.TreeNode;

/**
 * One signature line: action, header and the parenthesized option list.
 *
 * <p>Trees are immutable once built by {@link RuleParser}; an edit to the line produces a new tree.
 */
@TreeNode
public final class Rule implements Rule_TreeNode {
  public enum Action {
    ALERT("alert"),
    PASS("pass"),
    DROP("drop"),
    REJECT("reject"),
    REJECTSRC("rejectsrc"),
    REJECTDST("rejectdst"),
    REJECTBOTH("rejectboth");

    private final String keyword;

    Action(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() {
      return keyword;
    }

    public static Optional<Action> forKeyword(String keyword) {
      return Arrays.stream(values()).filter(a -> a.keyword.equals(keyword)).findFirst();
    }
  }

  public enum Direction {
    SRC_TO_DST("->"),
    BOTH("<>"),
    // Kept as written; source and destination are never swapped.
    DST_TO_SRC("<-");

    private final String token;

    Direction(String token) {
      this.token = token;
    }

    public String token() {
      return token;
    }

    public static Optional<Direction> forToken(String token) {
      return Arrays.stream(values()).filter(d -> d.token.equals(token)).findFirst();
    }
  }

  @TreeNode
  public static final class Header implements Rule_Header_TreeNode {
    private final String protocol;
    private final Tokenizer.Span protocolSpan;
    private final AddressExpr source;
    private final PortExpr sourcePort;
    private final Direction direction;
    private final Tokenizer.Span directionSpan;
    private final AddressExpr destination;
    private final PortExpr destinationPort;

    private Header(
        String protocol,
        Tokenizer.Span protocolSpan,
        AddressExpr source,
        PortExpr sourcePort,
        Direction direction,
        Tokenizer.Span directionSpan,
        AddressExpr destination,
        PortExpr destinationPort) {
      this.protocol = protocol;
      this.protocolSpan = protocolSpan;
      this.source = source;
      this.sourcePort = sourcePort;
      this.direction = direction;
      this.directionSpan = directionSpan;
      this.destination = destination;
      this.destinationPort = destinationPort;
    }

    public static Header create(
        String protocol,
        Tokenizer.Span protocolSpan,
        AddressExpr source,
        PortExpr sourcePort,
        Direction direction,
        Tokenizer.Span directionSpan,
        AddressExpr destination,
        PortExpr destinationPort) {
      return new Header(
          Preconditions.checkNotNull(protocol),
          protocolSpan,
          source,
          sourcePort,
          direction,
          directionSpan,
          destination,
          destinationPort);
    }

    public String protocol() {
      return protocol;
    }

    public Tokenizer.Span protocolSpan() {
      return protocolSpan;
    }

    @TreeChild
    @Override
    public AddressExpr source() {
      return source;
    }

    @TreeChild
    @Override
    public PortExpr sourcePort() {
      return sourcePort;
    }

    public Direction direction() {
      return direction;
    }

    public Tokenizer.Span directionSpan() {
      return directionSpan;
    }

    @TreeChild
    @Override
    public AddressExpr destination() {
      return destination;
    }

    @TreeChild
    @Override
    public PortExpr destinationPort() {
      return destinationPort;
    }

    public Tokenizer.Span span() {
      return protocolSpan.to(destinationPort.span());
    }
  }

  /** One {@code keyword[:setting];} clause. */
  @TreeNode
  public static final class Option implements Rule_Option_TreeNode {
    private final String keyword;
    private final Tokenizer.Span keywordSpan;
    private final Optional<String> rawSetting;
    private final Tokenizer.Span settingSpan;
    private final Tokenizer.Span span;

    private Option(
        String keyword,
        Tokenizer.Span keywordSpan,
        Optional<String> rawSetting,
        Tokenizer.Span settingSpan,
        Tokenizer.Span span) {
      this.keyword = keyword;
      this.keywordSpan = keywordSpan;
      this.rawSetting = rawSetting;
      this.settingSpan = settingSpan;
      this.span = span;
    }

    /**
     * @param settingSpan span of the trimmed setting; for an option without a setting, the empty
     *     span right after the keyword
     * @param span the whole clause, from the keyword through the terminating ';'
     */
    public static Option create(
        String keyword,
        Tokenizer.Span keywordSpan,
        Optional<String> rawSetting,
        Tokenizer.Span settingSpan,
        Tokenizer.Span span) {
      return new Option(keyword, keywordSpan, rawSetting, settingSpan, span);
    }

    public String keyword() {
      return keyword;
    }

    public Tokenizer.Span keywordSpan() {
      return keywordSpan;
    }

    public Optional<String> rawSetting() {
      return rawSetting;
    }

    public boolean hasSetting() {
      return rawSetting.isPresent();
    }

    public Tokenizer.Span settingSpan() {
      return settingSpan;
    }

    public Tokenizer.Span span() {
      return span;
    }
  }

  private final Action action;
  private final Tokenizer.Span actionSpan;
  private final Header header;
  private final ImmutableList<Option> options;
  private final Tokenizer.Span span;

  private Rule(
      Action action,
      Tokenizer.Span actionSpan,
      Header header,
      ImmutableList<Option> options,
      Tokenizer.Span span) {
    this.action = action;
    this.actionSpan = actionSpan;
    this.header = header;
    this.options = options;
    this.span = span;
  }

  public static Rule create(
      Action action,
      Tokenizer.Span actionSpan,
      Header header,
      Iterable<Option> options,
      Tokenizer.Span span) {
    ImmutableList<Option> optionList = ImmutableList.copyOf(options);
    Preconditions.checkArgument(!optionList.isEmpty(), "a rule needs at least one option");
    return new Rule(action, actionSpan, header, optionList, span);
  }

  public Action action() {
    return action;
  }

  public Tokenizer.Span actionSpan() {
    return actionSpan;
  }

  @TreeChild
  @Override
  public Header header() {
    return header;
  }

  @TreeChild
  @Override
  public ImmutableList<Option> options() {
    return options;
  }

  public Tokenizer.Span span() {
    return span;
  }

  /** Compares everything except spans: same action, header values and options in order. */
  public boolean structurallyEquals(Rule other) {
    return StructuralFingerprint.of(this).equals(StructuralFingerprint.of(other));
  }
}
