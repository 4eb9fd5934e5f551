package meerkat;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Suggestions for the text before a cursor on a rule line that may still be incomplete.
 *
 * <p>Works on raw text rather than a parsed rule, since the line being typed rarely parses.
 */
public class CompletionProvider {

  public enum Kind {
    ACTION,
    PROTOCOL,
    VARIABLE,
    VALUE,
    OPERATOR,
    KEYWORD;
  }

  @AutoValue
  public abstract static class CompletionItem {
    public abstract String label();

    public abstract String insertText();

    public abstract Kind kind();

    public abstract String detail();

    public static CompletionItem create(String label, String insertText, Kind kind, String detail) {
      return new AutoValue_CompletionProvider_CompletionItem(label, insertText, kind, detail);
    }
  }

  private static final ImmutableList<String> PROTOCOLS =
      ImmutableList.of(
          "ip", "tcp", "udp", "icmp", "http", "tls", "dns", "smb", "ssh", "ftp", "smtp", "dcerpc");

  private static final ImmutableList<CompletionItem> COMMON_PORTS =
      ImmutableList.of(
          CompletionItem.create("any", "any", Kind.VALUE, "any port"),
          CompletionItem.create("SSH", "22", Kind.VALUE, "22"),
          CompletionItem.create("Telnet", "23", Kind.VALUE, "23"),
          CompletionItem.create("HTTP", "80", Kind.VALUE, "80"),
          CompletionItem.create("HTTPS", "443", Kind.VALUE, "443"),
          CompletionItem.create("SMB", "445", Kind.VALUE, "445"));

  // Header fields in order; the option body follows the last one.
  private enum Slot {
    ACTION,
    PROTOCOL,
    SOURCE,
    SOURCE_PORT,
    DIRECTION,
    DESTINATION,
    DESTINATION_PORT,
    OPTIONS;

    static Slot forField(int field) {
      return values()[Math.min(field, OPTIONS.ordinal())];
    }

    Optional<SymbolTable.VariableKind> variableKind() {
      switch (this) {
        case SOURCE:
        case DESTINATION:
          return Optional.of(SymbolTable.VariableKind.ADDRESS_SET);
        case SOURCE_PORT:
        case DESTINATION_PORT:
          return Optional.of(SymbolTable.VariableKind.PORT_SET);
        default:
          return Optional.empty();
      }
    }
  }

  /** Where the cursor is: which field, and the partial word typed so far. */
  private static class Context {
    private Slot slot = Slot.ACTION;
    private boolean inBody = false;
    private boolean inSetting = false;
    private String word = "";
  }

  public static ImmutableList<CompletionItem> complete(
      String lineText, int column, SymbolTable symbols, KeywordRegistry registry) {
    Context context = scan(lineText.substring(0, Math.min(column, lineText.length())));
    ImmutableList.Builder<CompletionItem> items = ImmutableList.builder();

    if (context.inBody) {
      if (context.inSetting) return ImmutableList.of();
      for (String keyword : registry.keywords()) {
        KeywordRegistry.KeywordSpec spec = registry.lookup(keyword).get();
        items.add(
            CompletionItem.create(
                keyword,
                spec.allowsSetting() ? keyword : keyword + "; ",
                Kind.KEYWORD,
                spec.description()));
      }
      return filter(items.build(), context.word);
    }

    if (context.word.startsWith("$")) {
      for (SymbolTable.VariableKind kind : SymbolTable.VariableKind.values()) {
        if (context.slot.variableKind().map(k -> k == kind).orElse(true)) {
          addVariables(items, symbols, kind);
        }
      }
      return filter(items.build(), context.word);
    }

    switch (context.slot) {
      case ACTION:
        for (Rule.Action action : Rule.Action.values()) {
          items.add(CompletionItem.create(action.keyword(), action.keyword(), Kind.ACTION, ""));
        }
        break;
      case PROTOCOL:
        for (String protocol : PROTOCOLS) {
          items.add(CompletionItem.create(protocol, protocol, Kind.PROTOCOL, ""));
        }
        break;
      case SOURCE:
      case DESTINATION:
        items.add(CompletionItem.create("any", "any", Kind.VALUE, "any address"));
        addVariables(items, symbols, SymbolTable.VariableKind.ADDRESS_SET);
        break;
      case SOURCE_PORT:
      case DESTINATION_PORT:
        items.addAll(COMMON_PORTS);
        addVariables(items, symbols, SymbolTable.VariableKind.PORT_SET);
        break;
      case DIRECTION:
        for (Rule.Direction direction : Rule.Direction.values()) {
          items.add(
              CompletionItem.create(
                  direction.token(), direction.token(), Kind.OPERATOR, direction.name()));
        }
        break;
      default:
        break;
    }
    return filter(items.build(), context.word);
  }

  private static void addVariables(
      ImmutableList.Builder<CompletionItem> items,
      SymbolTable symbols,
      SymbolTable.VariableKind kind) {
    for (String name : symbols.variables(kind)) {
      items.add(CompletionItem.create("$" + name, "$" + name, Kind.VARIABLE, kind.displayName()));
    }
  }

  private static ImmutableList<CompletionItem> filter(
      ImmutableList<CompletionItem> items, String word) {
    return items
        .stream()
        .filter(item -> item.label().startsWith(word) || item.insertText().startsWith(word))
        .collect(ImmutableList.toImmutableList());
  }

  private static Context scan(String prefix) {
    Context context = new Context();
    int field = 0;
    int depth = 0;
    boolean inField = false;
    boolean inString = false;
    int wordStart = 0;

    for (int i = 0; i < prefix.length(); i++) {
      char ch = prefix.charAt(i);
      if (inString) {
        if (ch == Tokenizer.ESCAPE) {
          i++;
        } else if (ch == Tokenizer.QUOTE) {
          inString = false;
        }
        continue;
      }

      if (context.inBody) {
        if (ch == Tokenizer.QUOTE) {
          inString = true;
        } else if (ch == Tokenizer.ESCAPE) {
          i++;
        } else if (ch == '(' || ch == '[') {
          depth++;
        } else if ((ch == ')' || ch == ']') && depth > 0) {
          depth--;
        } else if (ch == ':' && depth == 0) {
          context.inSetting = true;
        } else if (ch == ';' && depth == 0) {
          context.inSetting = false;
          wordStart = i + 1;
        }
        continue;
      }

      if (ch == '[') {
        depth++;
      } else if (ch == ']' && depth > 0) {
        depth--;
      } else if (ch == '(' && depth == 0) {
        context.inBody = true;
        wordStart = i + 1;
        continue;
      }

      boolean space = Character.isWhitespace(ch);
      if (space && inField && depth == 0) {
        inField = false;
        field++;
      } else if (!space && !inField) {
        inField = true;
        wordStart = i;
      }
    }

    context.slot = context.inBody ? Slot.OPTIONS : Slot.forField(field);
    String word = prefix.substring(Math.min(wordStart, prefix.length())).trim();
    if (!context.inBody) {
      // Inside a group only the current member counts.
      int separator = CharMatcher.anyOf(",[!").lastIndexIn(word);
      word = inField ? word.substring(separator + 1).trim() : "";
    }
    context.word = word;
    return context;
  }
}
