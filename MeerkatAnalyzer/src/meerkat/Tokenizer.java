package meerkat;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Produces a tokenization of a single rule line.
 *
 * <p>Tokenizing never fails: unterminated strings, stray or unclosed brackets and empty variable
 * names become {@link Token.Kind#ERROR} tokens carrying their offset, so the parser can report the
 * problem at the right place. Whitespace is dropped; spans keep the original columns.
 */
public class Tokenizer {
  /** Half-open column range {@code [start, end)} within one line. */
  @AutoValue
  public abstract static class Span implements Comparable<Span> {
    public abstract int start();

    public abstract int end();

    public static Span of(int start, int end) {
      Preconditions.checkArgument(0 <= start && start <= end, "bad span [%s, %s)", start, end);
      return new AutoValue_Tokenizer_Span(start, end);
    }

    public int length() {
      return end() - start();
    }

    public boolean contains(int column) {
      return start() <= column && column < end();
    }

    /** Like {@link #contains}, but also true for the column just past the end. */
    public boolean touches(int column) {
      return start() <= column && column <= end();
    }

    public Span to(Span other) {
      return of(Math.min(start(), other.start()), Math.max(end(), other.end()));
    }

    public String slice(String text) {
      return text.substring(start(), end());
    }

    @Override
    public int compareTo(Span span) {
      return start() != span.start()
          ? Integer.compare(start(), span.start())
          : Integer.compare(end(), span.end());
    }

    @Override
    public final String toString() {
      return "[" + start() + ", " + end() + ")";
    }
  }

  @AutoValue
  public abstract static class Token {
    public enum Kind {
      IDENTIFIER,
      NUMBER,
      IPV4,
      SLASH,
      VARIABLE,
      LBRACKET,
      RBRACKET,
      LPAREN,
      RPAREN,
      SEMICOLON,
      COLON,
      COMMA,
      ARROW,
      BANG,
      STRING,
      OTHER,
      ERROR,
      EOF;
    }

    public abstract Kind kind();

    public abstract String lexeme();

    public abstract Span span();

    /** Present only for {@link Kind#ERROR} tokens. */
    public abstract Optional<DiagnosticCode> errorCode();

    public abstract Optional<String> errorMessage();

    public boolean is(Kind kind) {
      return kind() == kind;
    }

    public boolean is(Kind kind, String lexeme) {
      return kind() == kind && lexeme().equals(lexeme);
    }

    /** True if no whitespace separates this token from the next one. */
    public boolean abuts(Token next) {
      return span().end() == next.span().start();
    }

    static Token create(Kind kind, String lexeme, Span span) {
      return new AutoValue_Tokenizer_Token(
          kind, lexeme, span, Optional.empty(), Optional.empty());
    }

    static Token error(DiagnosticCode code, String lexeme, Span span, String message) {
      return new AutoValue_Tokenizer_Token(
          Kind.ERROR, lexeme, span, Optional.of(code), Optional.of(message));
    }

    @Override
    public final String toString() {
      return kind() + "(" + lexeme() + ")" + span();
    }
  }

  /** The source text of one line together with its tokens; the last token is always EOF. */
  @AutoValue
  public abstract static class Line {
    public abstract String text();

    public abstract ImmutableList<Token> tokens();

    public Token token(int index) {
      return tokens().get(Math.min(index, tokens().size() - 1));
    }

    static Line create(String text, ImmutableList<Token> tokens) {
      return new AutoValue_Tokenizer_Line(text, tokens);
    }
  }

  public static final char QUOTE = '"';
  public static final char ESCAPE = '\\';

  private final String text;
  private int pos = 0;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private int tokenCount = 0;

  // Token indexes and characters of brackets still waiting for their closing partner.
  private final Deque<Integer> openBrackets = new ArrayDeque<>();
  private final Deque<Character> openBracketChars = new ArrayDeque<>();

  public Tokenizer(String text) {
    this.text = Preconditions.checkNotNull(text);
  }

  public static Line tokenize(String text) {
    return new Tokenizer(text).tokenize();
  }

  public Line tokenize() {
    while (pos < text.length()) {
      char ch = text.charAt(pos);
      if (Character.isWhitespace(ch)) {
        pos++;
        continue;
      }

      switch (ch) {
        case QUOTE:
          readString();
          break;
        case ESCAPE:
          // An escaped character is never structural: "\;" does not end an option.
          emit(Token.Kind.OTHER, Math.min(pos + 2, text.length()));
          break;
        case '$':
          readVariable();
          break;
        case '[':
        case '(':
          openBrackets.push(tokenCount);
          openBracketChars.push(ch);
          emit(ch == '[' ? Token.Kind.LBRACKET : Token.Kind.LPAREN, pos + 1);
          break;
        case ']':
        case ')':
          closeBracket(ch);
          break;
        case ';':
          emit(Token.Kind.SEMICOLON, pos + 1);
          break;
        case ':':
          emit(Token.Kind.COLON, pos + 1);
          break;
        case ',':
          emit(Token.Kind.COMMA, pos + 1);
          break;
        case '!':
          emit(Token.Kind.BANG, pos + 1);
          break;
        case '/':
          emit(Token.Kind.SLASH, pos + 1);
          break;
        case '-':
          readArrowOr(peekIs(1, '>'));
          break;
        case '<':
          readArrowOr(peekIs(1, '>') || peekIs(1, '-'));
          break;
        default:
          if (isDigit(ch)) {
            readNumberOrAddress();
          } else if (isIdentifierStart(ch)) {
            readIdentifier();
          } else {
            emit(Token.Kind.OTHER, pos + 1);
          }
      }
    }

    ImmutableList<Token> list = tokens.build();
    if (!openBrackets.isEmpty()) {
      Token[] patched = list.toArray(new Token[0]);
      for (int index : openBrackets) {
        Token open = patched[index];
        patched[index] =
            Token.error(
                DiagnosticCode.UNCLOSED_BRACKET,
                open.lexeme(),
                open.span(),
                String.format("unclosed '%s'", open.lexeme()));
      }
      list = ImmutableList.copyOf(patched);
    }

    return Line.create(
        text,
        ImmutableList.<Token>builder()
            .addAll(list)
            .add(Token.create(Token.Kind.EOF, "", Span.of(text.length(), text.length())))
            .build());
  }

  private void emit(Token.Kind kind, int end) {
    add(Token.create(kind, text.substring(pos, end), Span.of(pos, end)));
    pos = end;
  }

  private void emitError(DiagnosticCode code, int end, String message) {
    add(Token.error(code, text.substring(pos, end), Span.of(pos, end), message));
    pos = end;
  }

  private void add(Token token) {
    tokens.add(token);
    tokenCount++;
  }

  private boolean peekIs(int ahead, char expected) {
    return pos + ahead < text.length() && text.charAt(pos + ahead) == expected;
  }

  private void readString() {
    int end = pos + 1;
    while (end < text.length()) {
      char ch = text.charAt(end);
      if (ch == ESCAPE) {
        end += 2;
        continue;
      } else if (ch == QUOTE) {
        emit(Token.Kind.STRING, end + 1);
        return;
      }
      end++;
    }

    emitError(DiagnosticCode.UNTERMINATED_STRING, text.length(), "unterminated string");
  }

  private void readVariable() {
    int end = pos + 1;
    while (end < text.length() && isVariablePart(text.charAt(end))) end++;

    if (end == pos + 1) {
      emitError(DiagnosticCode.INVALID_VARIABLE, end, "expected a variable name after '$'");
    } else {
      emit(Token.Kind.VARIABLE, end);
    }
  }

  private void closeBracket(char ch) {
    char expected = ch == ']' ? '[' : '(';
    if (openBrackets.isEmpty()) {
      emitError(DiagnosticCode.UNMATCHED_BRACKET, pos + 1, String.format("unexpected '%c'", ch));
      return;
    }

    char innermost = openBracketChars.peek();
    if (innermost != expected) {
      emitError(
          DiagnosticCode.UNMATCHED_BRACKET,
          pos + 1,
          String.format("'%c' does not close '%c'", ch, innermost));
      return;
    }

    openBrackets.pop();
    openBracketChars.pop();
    emit(ch == ']' ? Token.Kind.RBRACKET : Token.Kind.RPAREN, pos + 1);
  }

  private void readArrowOr(boolean arrow) {
    emit(arrow ? Token.Kind.ARROW : Token.Kind.OTHER, arrow ? pos + 2 : pos + 1);
  }

  private void readNumberOrAddress() {
    int end = pos;
    while (end < text.length() && isDigit(text.charAt(end))) end++;

    boolean dotted = false;
    while (end + 1 < text.length() && text.charAt(end) == '.' && isDigit(text.charAt(end + 1))) {
      dotted = true;
      end++;
      while (end < text.length() && isDigit(text.charAt(end))) end++;
    }

    emit(dotted ? Token.Kind.IPV4 : Token.Kind.NUMBER, end);
  }

  private void readIdentifier() {
    int end = pos + 1;
    while (end < text.length() && isIdentifierPart(text.charAt(end))) {
      char ch = text.charAt(end);
      // "any->any" keeps its arrow.
      if (ch == '-' && end + 1 < text.length() && text.charAt(end + 1) == '>') break;
      end++;
    }
    emit(Token.Kind.IDENTIFIER, end);
  }

  private static boolean isDigit(char ch) {
    return ch >= '0' && ch <= '9';
  }

  private static boolean isIdentifierStart(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  private static boolean isVariablePart(char ch) {
    return isIdentifierStart(ch) || isDigit(ch);
  }

  private static boolean isIdentifierPart(char ch) {
    return isIdentifierStart(ch) || isDigit(ch) || ch == '.' || ch == '-';
  }
}
