package meerkat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Classifies the parts of a parsed rule for syntax highlighting. */
public class SemanticHighlighter {

  public enum TokenType {
    ACTION,
    PROTOCOL,
    DIRECTION,
    ADDRESS,
    PORT,
    OPERATOR,
    VARIABLE,
    KEYWORD,
    SETTING;
  }

  @AutoValue
  public abstract static class SemanticToken {
    public abstract Tokenizer.Span span();

    public abstract TokenType type();

    public static SemanticToken create(Tokenizer.Span span, TokenType type) {
      return new AutoValue_SemanticHighlighter_SemanticToken(span, type);
    }
  }

  /** Tokens in source order; spans never overlap. */
  public static ImmutableList<SemanticToken> highlight(Rule rule) {
    Collector collector = new Collector();
    rule.accept(collector, null);
    return ImmutableList.sortedCopyOf(Comparator.comparing(SemanticToken::span), collector.tokens);
  }

  private static class Collector extends VoidDefaultTreeVisitor {
    private final List<SemanticToken> tokens = new ArrayList<>();

    private void add(Tokenizer.Span span, TokenType type) {
      tokens.add(SemanticToken.create(span, type));
    }

    private void addBang(Tokenizer.Span negatedSpan) {
      add(Tokenizer.Span.of(negatedSpan.start(), negatedSpan.start() + 1), TokenType.OPERATOR);
    }

    @Override
    public void visitImpl(Rule rule) {
      add(rule.actionSpan(), TokenType.ACTION);
      super.visitImpl(rule);
    }

    @Override
    public void visitImpl(Rule.Header header) {
      add(header.protocolSpan(), TokenType.PROTOCOL);
      add(header.directionSpan(), TokenType.DIRECTION);
      super.visitImpl(header);
    }

    @Override
    public void visitImpl(Rule.Option option) {
      add(option.keywordSpan(), TokenType.KEYWORD);
      if (option.hasSetting() && option.settingSpan().length() > 0) {
        add(option.settingSpan(), TokenType.SETTING);
      }
    }

    @Override
    public void visitImpl(AddressExpr.Any any) {
      add(any.span(), TokenType.ADDRESS);
    }

    @Override
    public void visitImpl(AddressExpr.Single single) {
      add(single.span(), TokenType.ADDRESS);
    }

    @Override
    public void visitImpl(AddressExpr.Negated negated) {
      addBang(negated.span());
      super.visitImpl(negated);
    }

    @Override
    public void visitImpl(AddressExpr.Variable variable) {
      add(variable.span(), TokenType.VARIABLE);
    }

    @Override
    public void visitImpl(PortExpr.Any any) {
      add(any.span(), TokenType.PORT);
    }

    @Override
    public void visitImpl(PortExpr.Number number) {
      add(number.span(), TokenType.PORT);
    }

    @Override
    public void visitImpl(PortExpr.Range range) {
      // One token for the whole range, bounds included.
      add(range.span(), TokenType.PORT);
    }

    @Override
    public void visitImpl(PortExpr.Negated negated) {
      addBang(negated.span());
      super.visitImpl(negated);
    }

    @Override
    public void visitImpl(PortExpr.Variable variable) {
      add(variable.span(), TokenType.VARIABLE);
    }
  }
}
