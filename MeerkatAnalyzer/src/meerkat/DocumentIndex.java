package meerkat;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Parsed and validated rules of open documents, one entry per line.
 *
 * <p>Only a changed line is re-analyzed, and a line whose text was analyzed before in the same
 * document is served from its content-hash cache. Writers to one document are serialized; readers
 * see an immutable snapshot and never block. Distinct documents are independent.
 */
public class DocumentIndex {
  private static final Logger logger = LoggerFactory.getLogger(DocumentIndex.class);

  private static final HashFunction LINE_HASH = Hashing.sha256();
  private static final CharMatcher VARIABLE_NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  /** A span on a specific line of a document. */
  @AutoValue
  public abstract static class Location {
    public abstract int line();

    public abstract Tokenizer.Span span();

    public static Location create(int line, Tokenizer.Span span) {
      return new AutoValue_DocumentIndex_Location(line, span);
    }
  }

  /** Replace {@code span} on {@code line} with {@code newText}. */
  @AutoValue
  public abstract static class TextEdit {
    public abstract int line();

    public abstract Tokenizer.Span span();

    public abstract String newText();

    public static TextEdit create(int line, Tokenizer.Span span, String newText) {
      return new AutoValue_DocumentIndex_TextEdit(line, span, newText);
    }
  }

  @AutoValue
  public abstract static class LineDiagnostic {
    public abstract int line();

    public abstract Diagnostic diagnostic();

    public static LineDiagnostic create(int line, Diagnostic diagnostic) {
      return new AutoValue_DocumentIndex_LineDiagnostic(line, diagnostic);
    }
  }

  /** The analysis of one line's text. Lines left unparsed carry no result. */
  @AutoValue
  abstract static class LineAnalysis {
    abstract String text();

    abstract HashCode hash();

    abstract Optional<ParseResult> result();

    abstract ImmutableList<Diagnostic> diagnostics();

    static LineAnalysis create(
        String text,
        HashCode hash,
        Optional<ParseResult> result,
        ImmutableList<Diagnostic> diagnostics) {
      return new AutoValue_DocumentIndex_LineAnalysis(text, hash, result, diagnostics);
    }
  }

  private static class DocumentState {
    // Replaced wholesale on every write.
    private volatile ImmutableList<LineAnalysis> lines = ImmutableList.of();

    // Guarded by this.
    private final Map<HashCode, LineAnalysis> cache = new HashMap<>();
  }

  private final MeerkatConfig config;
  private final Optional<RuleValidator> validator;
  private final Optional<Diagnostic> configurationError;
  private final Map<String, DocumentState> documents = new ConcurrentHashMap<>();

  public DocumentIndex(MeerkatConfig config, SymbolTable symbols, KeywordRegistry registry) {
    this.config = Preconditions.checkNotNull(config);
    Optional<RuleValidator> validator;
    Optional<Diagnostic> configurationError;
    try {
      validator = Optional.of(RuleValidator.create(symbols, registry));
      configurationError = Optional.empty();
    } catch (ConfigurationException ex) {
      logger.warn("Semantic checks disabled: {}", ex.getMessage());
      validator = Optional.empty();
      configurationError = Optional.of(ex.toDiagnostic());
    }
    this.validator = validator;
    this.configurationError = configurationError;
  }

  public MeerkatConfig config() {
    return config;
  }

  /** Replaces the whole content of {@code doc}. */
  public void openDocument(String doc, String text) {
    DocumentState state = documents.computeIfAbsent(doc, d -> new DocumentState());
    synchronized (state) {
      List<LineAnalysis> lines = new ArrayList<>();
      for (String line : Splitter.onPattern("\r?\n").split(text)) {
        lines.add(analyze(state, line));
      }
      publish(doc, state, lines);
    }
    logger.info("Opened {} ({} lines)", doc, state.lines.size());
  }

  public void closeDocument(String doc) {
    if (documents.remove(doc) != null) {
      logger.info("Closed {}", doc);
    }
  }

  public boolean isOpen(String doc) {
    return documents.containsKey(doc);
  }

  /**
   * Records new text for one line. {@code line} may equal the current line count, which appends a
   * line.
   */
  public void onDidChangeLine(String doc, int line, String text) {
    Preconditions.checkNotNull(text);
    DocumentState state = state(doc);
    synchronized (state) {
      checkStillOpen(doc, state);
      List<LineAnalysis> lines = new ArrayList<>(state.lines);
      Preconditions.checkElementIndex(line, lines.size() + 1, "line");
      LineAnalysis analysis = analyze(state, text);
      if (line == lines.size()) {
        lines.add(analysis);
      } else {
        lines.set(line, analysis);
      }
      publish(doc, state, lines);
    }
  }

  /** Removes one line; the lines after it move up by one. */
  public void onDidDeleteLine(String doc, int line) {
    DocumentState state = state(doc);
    synchronized (state) {
      checkStillOpen(doc, state);
      List<LineAnalysis> lines = new ArrayList<>(state.lines);
      Preconditions.checkElementIndex(line, lines.size(), "line");
      lines.remove(line);
      publish(doc, state, lines);
    }
  }

  public int lineCount(String doc) {
    return state(doc).lines.size();
  }

  /** The parse outcome of one line; empty when the line is a comment or blank and left unparsed. */
  public Optional<ParseResult> getRuleAt(String doc, int line) {
    ImmutableList<LineAnalysis> lines = state(doc).lines;
    Preconditions.checkElementIndex(line, lines.size(), "line");
    return lines.get(line).result();
  }

  /** Every finding in the document, line by line. */
  public ImmutableList<LineDiagnostic> allDiagnostics(String doc) {
    ImmutableList<LineAnalysis> lines = state(doc).lines;
    ImmutableList.Builder<LineDiagnostic> diagnostics = ImmutableList.builder();
    configurationError.ifPresent(d -> diagnostics.add(LineDiagnostic.create(0, d)));
    for (int i = 0; i < lines.size(); i++) {
      for (Diagnostic diagnostic : lines.get(i).diagnostics()) {
        diagnostics.add(LineDiagnostic.create(i, diagnostic));
      }
    }
    return diagnostics.build();
  }

  /** The name of the variable under the cursor, without its '$'. */
  public Optional<String> findVariableAt(String doc, int line, int column) {
    return getRuleAt(doc, line)
        .flatMap(ParseResult::asRule)
        .flatMap(
            rule ->
                VariableReferenceCollector.collect(rule)
                    .stream()
                    .filter(ref -> ref.span().touches(column))
                    .map(VariableReferenceCollector.VariableReference::name)
                    .findFirst());
  }

  /** Every {@code $name} in rules of the document, in document order. */
  public ImmutableList<Location> findVariableReferences(String doc, String name) {
    ImmutableList<LineAnalysis> lines = state(doc).lines;
    ImmutableList.Builder<Location> locations = ImmutableList.builder();
    for (int i = 0; i < lines.size(); i++) {
      Optional<Rule> rule = lines.get(i).result().flatMap(ParseResult::asRule);
      if (!rule.isPresent()) continue;

      for (VariableReferenceCollector.VariableReference ref :
          VariableReferenceCollector.collect(rule.get())) {
        if (ref.name().equals(name)) locations.add(Location.create(i, ref.span()));
      }
    }
    return locations.build();
  }

  /** Edits renaming every reference of the variable under the cursor; empty if there is none. */
  public ImmutableList<TextEdit> renameVariable(
      String doc, int line, int column, String newName) {
    Preconditions.checkArgument(
        !newName.isEmpty() && VARIABLE_NAME_CHARS.matchesAllOf(newName),
        "invalid variable name: %s",
        newName);
    Optional<String> name = findVariableAt(doc, line, column);
    if (!name.isPresent()) return ImmutableList.of();

    return findVariableReferences(doc, name.get())
        .stream()
        .map(loc -> TextEdit.create(loc.line(), loc.span(), "$" + newName))
        .collect(ImmutableList.toImmutableList());
  }

  /** One whole-line edit per parsed rule whose canonical text differs from what is there now. */
  public ImmutableList<TextEdit> formatDocument(String doc, FormatStyle style) {
    ImmutableList<LineAnalysis> lines = state(doc).lines;
    return formatLines(lines, 0, lines.size(), style);
  }

  /** Like {@link #formatDocument}, restricted to lines in {@code [fromLine, toLine)}. */
  public ImmutableList<TextEdit> formatRange(
      String doc, int fromLine, int toLine, FormatStyle style) {
    ImmutableList<LineAnalysis> lines = state(doc).lines;
    Preconditions.checkPositionIndexes(fromLine, toLine, lines.size());
    return formatLines(lines, fromLine, toLine, style);
  }

  private static ImmutableList<TextEdit> formatLines(
      ImmutableList<LineAnalysis> lines, int fromLine, int toLine, FormatStyle style) {
    ImmutableList.Builder<TextEdit> edits = ImmutableList.builder();
    for (int i = fromLine; i < toLine; i++) {
      LineAnalysis analysis = lines.get(i);
      Optional<Rule> rule = analysis.result().flatMap(ParseResult::asRule);
      if (!rule.isPresent()) continue;

      String formatted = RuleFormatter.format(rule.get(), style);
      if (!formatted.equals(analysis.text())) {
        edits.add(TextEdit.create(i, Tokenizer.Span.of(0, analysis.text().length()), formatted));
      }
    }
    return edits.build();
  }

  private DocumentState state(String doc) {
    DocumentState state = documents.get(doc);
    Preconditions.checkArgument(state != null, "document is not open: %s", doc);
    return state;
  }

  // A close that ran before the caller took the lock must not be undone by the write.
  private void checkStillOpen(String doc, DocumentState state) {
    Preconditions.checkArgument(documents.get(doc) == state, "document is not open: %s", doc);
  }

  private boolean isSkipped(String text) {
    if (!config.skipCommentsAndBlankLines()) return false;
    String trimmed = CharMatcher.whitespace().trimLeadingFrom(text);
    return trimmed.isEmpty() || trimmed.startsWith("#");
  }

  // Caller holds the lock on state.
  private LineAnalysis analyze(DocumentState state, String text) {
    HashCode hash = LINE_HASH.hashString(text, StandardCharsets.UTF_8);
    LineAnalysis cached = state.cache.get(hash);
    if (cached != null) {
      logger.debug("Cache hit for line {}", hash);
      return cached;
    }

    LineAnalysis analysis;
    if (isSkipped(text)) {
      analysis = LineAnalysis.create(text, hash, Optional.empty(), ImmutableList.of());
    } else {
      ParseResult result = RuleParser.parseRule(text, config.maxGroupDepth());
      ImmutableList<Diagnostic> diagnostics;
      if (result.isError()) {
        diagnostics = ImmutableList.of(result.error().toDiagnostic());
      } else {
        diagnostics = validator.map(v -> v.validate(result.rule())).orElse(ImmutableList.of());
      }
      analysis = LineAnalysis.create(text, hash, Optional.of(result), diagnostics);
      logger.debug("Parsed line {}: {}", hash, result);
    }
    state.cache.put(hash, analysis);
    return analysis;
  }

  // Caller holds the lock on state.
  private static void publish(String doc, DocumentState state, List<LineAnalysis> lines) {
    state.lines = ImmutableList.copyOf(lines);
    Set<HashCode> live = lines.stream().map(LineAnalysis::hash).collect(Collectors.toSet());
    int before = state.cache.size();
    state.cache.keySet().retainAll(live);
    if (state.cache.size() < before) {
      logger.debug("Evicted {} cached lines of {}", before - state.cache.size(), doc);
    }
  }
}
