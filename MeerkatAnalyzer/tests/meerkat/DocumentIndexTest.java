package meerkat;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

import meerkat.Tokenizer.Span;

public class DocumentIndexTest {

  private static final String DOC = "file:///rules/local.rules";

  private static final Correspondence<DocumentIndex.LineDiagnostic, DiagnosticCode> HAS_CODE =
      Correspondence.transforming(d -> d.diagnostic().code(), "has code");

  private static final SymbolTable SYMBOLS =
      SymbolTable.builder()
          .declare("HOME_NET", SymbolTable.VariableKind.ADDRESS_SET)
          .declare("EXTERNAL_NET", SymbolTable.VariableKind.ADDRESS_SET)
          .declare("HTTP_PORTS", SymbolTable.VariableKind.PORT_SET)
          .build();

  private DocumentIndex index;

  @BeforeEach
  public void setUp() {
    index = new DocumentIndex(MeerkatConfig.defaults(), SYMBOLS, KeywordRegistry.defaults());
  }

  private void open(String... lines) {
    index.openDocument(DOC, Joiner.on('\n').join(lines));
  }

  @Test
  public void openAndQuery() {
    open(
        "# local rules",
        "alert tcp $HOME_NET any -> $EXTERNAL_NET any (msg:\"test\"; sid:1; rev:1;)",
        "",
        "alert tcp any any -> any any (sid:1)");

    assertThat(index.isOpen(DOC)).isTrue();
    assertThat(index.lineCount(DOC)).isEqualTo(4);
    assertThat(index.getRuleAt(DOC, 0)).isEmpty();
    assertThat(index.getRuleAt(DOC, 1).get().isRule()).isTrue();
    assertThat(index.getRuleAt(DOC, 2)).isEmpty();
    assertThat(index.getRuleAt(DOC, 3).get().error().code())
        .isEqualTo(DiagnosticCode.MISSING_OPTION_TERMINATOR);

    ImmutableList<DocumentIndex.LineDiagnostic> diagnostics = index.allDiagnostics(DOC);
    assertThat(diagnostics)
        .comparingElementsUsing(HAS_CODE)
        .containsExactly(DiagnosticCode.MISSING_OPTION_TERMINATOR);
    assertThat(diagnostics.get(0).line()).isEqualTo(3);
  }

  @Test
  public void windowsLineEndings() {
    index.openDocument(
        DOC, "alert tcp any any -> any any (sid:1;)\r\nalert tcp any any -> any any (sid:2;)");

    assertThat(index.lineCount(DOC)).isEqualTo(2);
    assertThat(index.allDiagnostics(DOC)).isEmpty();
  }

  @Test
  public void commentsAreParsedWhenNotSkipped() {
    DocumentIndex strict =
        new DocumentIndex(
            MeerkatConfig.builder().setSkipCommentsAndBlankLines(false).build(),
            SYMBOLS,
            KeywordRegistry.defaults());
    strict.openDocument(DOC, "# comment");

    assertThat(strict.getRuleAt(DOC, 0).get().isError()).isTrue();
    assertThat(strict.allDiagnostics(DOC)).hasSize(1);
  }

  @Test
  public void changeAppendAndDelete() {
    open("alert tcp any any -> any any (sid:1;)", "alert tcp any 99999 -> any any (sid:2;)");
    assertThat(index.allDiagnostics(DOC))
        .comparingElementsUsing(HAS_CODE)
        .containsExactly(DiagnosticCode.PORT_OUT_OF_RANGE);

    index.onDidChangeLine(DOC, 1, "alert tcp any 80 -> any any (sid:2;)");
    assertThat(index.allDiagnostics(DOC)).isEmpty();

    index.onDidChangeLine(DOC, 2, "alert tcp $NOPE any -> any any (sid:3;)");
    assertThat(index.lineCount(DOC)).isEqualTo(3);
    ImmutableList<DocumentIndex.LineDiagnostic> diagnostics = index.allDiagnostics(DOC);
    assertThat(diagnostics)
        .comparingElementsUsing(HAS_CODE)
        .containsExactly(DiagnosticCode.UNDECLARED_VARIABLE);
    assertThat(diagnostics.get(0).line()).isEqualTo(2);

    index.onDidDeleteLine(DOC, 0);
    assertThat(index.lineCount(DOC)).isEqualTo(2);
    assertThat(index.allDiagnostics(DOC).get(0).line()).isEqualTo(1);

    assertThrows(IndexOutOfBoundsException.class, () -> index.onDidChangeLine(DOC, 5, ""));
    assertThrows(IndexOutOfBoundsException.class, () -> index.onDidDeleteLine(DOC, 2));
  }

  @Test
  public void unchangedLinesKeepTheirAnalysis() {
    open("alert tcp any any -> any any (sid:1;)", "alert tcp any any -> any any (sid:2;)");
    ParseResult first = index.getRuleAt(DOC, 0).get();

    index.onDidChangeLine(DOC, 1, "alert tcp any any -> any any (sid:3;)");
    assertThat(index.getRuleAt(DOC, 0).get()).isSameInstanceAs(first);

    // Same text again on another line is a cache hit.
    index.onDidChangeLine(DOC, 1, "alert tcp any any -> any any (sid:1;)");
    assertThat(index.getRuleAt(DOC, 1).get()).isSameInstanceAs(first);
  }

  @Test
  public void closeDocument() {
    open("alert tcp any any -> any any (sid:1;)");
    index.closeDocument(DOC);

    assertThat(index.isOpen(DOC)).isFalse();
    assertThrows(IllegalArgumentException.class, () -> index.lineCount(DOC));
    assertThrows(IllegalArgumentException.class, () -> index.getRuleAt(DOC, 0));
  }

  @Test
  public void documentsAreIndependent() {
    open("alert tcp any any -> any any (sid:1;)");
    index.openDocument("other.rules", "alert tcp any any -> any any (sid:1)");

    assertThat(index.allDiagnostics(DOC)).isEmpty();
    assertThat(index.allDiagnostics("other.rules")).hasSize(1);
  }

  @Test
  public void malformedConfigurationIsReportedOnce() {
    SymbolTable conflicting =
        SymbolTable.builder()
            .declare("A", SymbolTable.VariableKind.ADDRESS_SET)
            .declare("A", SymbolTable.VariableKind.PORT_SET)
            .build();
    DocumentIndex broken =
        new DocumentIndex(MeerkatConfig.defaults(), conflicting, KeywordRegistry.defaults());
    broken.openDocument(
        DOC,
        "alert tcp any 99999 -> any any (sid:1;)\n"
            + "alert tcp any 99999 -> any any (sid:2;)\n"
            + "alert tcp any any -> any any (sid:3)");

    assertThat(broken.allDiagnostics(DOC))
        .comparingElementsUsing(HAS_CODE)
        .containsExactly(
            DiagnosticCode.CONFIGURATION_ERROR, DiagnosticCode.MISSING_OPTION_TERMINATOR)
        .inOrder();
  }

  @Test
  public void variableReferencesAndRename() {
    open(
        "alert tcp $HOME_NET any -> $EXTERNAL_NET any (sid:1;)",
        "# $HOME_NET in a comment",
        "alert tcp [$HOME_NET,!$EXTERNAL_NET] any -> any $HTTP_PORTS (sid:2;)");

    assertThat(index.findVariableAt(DOC, 0, 12)).hasValue("HOME_NET");
    // The column just past the name still counts.
    assertThat(index.findVariableAt(DOC, 0, 19)).hasValue("HOME_NET");
    assertThat(index.findVariableAt(DOC, 0, 22)).isEmpty();
    assertThat(index.findVariableAt(DOC, 1, 4)).isEmpty();

    ImmutableList<DocumentIndex.Location> locations =
        index.findVariableReferences(DOC, "HOME_NET");
    assertThat(locations)
        .containsExactly(
            DocumentIndex.Location.create(0, Span.of(10, 19)),
            DocumentIndex.Location.create(2, Span.of(11, 20)))
        .inOrder();

    ImmutableList<DocumentIndex.TextEdit> edits = index.renameVariable(DOC, 2, 13, "LAN");
    assertThat(edits)
        .containsExactly(
            DocumentIndex.TextEdit.create(0, Span.of(10, 19), "$LAN"),
            DocumentIndex.TextEdit.create(2, Span.of(11, 20), "$LAN"))
        .inOrder();

    assertThat(index.renameVariable(DOC, 0, 0, "LAN")).isEmpty();
    assertThrows(
        IllegalArgumentException.class, () -> index.renameVariable(DOC, 0, 12, "bad name"));
  }

  @Test
  public void formatDocument() {
    open(
        "alert  tcp any any -> any any (sid:1;)",
        "alert tcp any any -> any any (sid:2;)",
        "alert tcp any any -> any any (sid:3)",
        "#   comment");

    ImmutableList<DocumentIndex.TextEdit> edits =
        index.formatDocument(DOC, FormatStyle.defaults());
    assertThat(edits)
        .containsExactly(
            DocumentIndex.TextEdit.create(
                0, Span.of(0, 38), "alert tcp any any -> any any (sid:1;)"));

    assertThat(
            index.formatDocument(
                DOC, FormatStyle.builder().setSpaceAfterLastOption(true).build()))
        .hasSize(2);
  }

  @Test
  public void formatRange() {
    open(
        "alert  tcp any any -> any any (sid:1;)",
        "alert tcp any any  -> any any (sid:2;)",
        "alert tcp any any -> any  any (sid:3;)");

    assertThat(index.formatRange(DOC, 1, 3, FormatStyle.defaults()))
        .containsExactly(
            DocumentIndex.TextEdit.create(
                1, Span.of(0, 38), "alert tcp any any -> any any (sid:2;)"),
            DocumentIndex.TextEdit.create(
                2, Span.of(0, 38), "alert tcp any any -> any any (sid:3;)"))
        .inOrder();
    assertThat(index.formatRange(DOC, 1, 1, FormatStyle.defaults())).isEmpty();
    assertThat(index.formatRange(DOC, 0, 3, FormatStyle.defaults()))
        .isEqualTo(index.formatDocument(DOC, FormatStyle.defaults()));
    assertThrows(
        IndexOutOfBoundsException.class,
        () -> index.formatRange(DOC, 2, 4, FormatStyle.defaults()));
    assertThrows(
        IndexOutOfBoundsException.class,
        () -> index.formatRange(DOC, 2, 1, FormatStyle.defaults()));
  }

  @Test
  public void writesRequireAnOpenDocument() {
    assertThrows(
        IllegalArgumentException.class,
        () -> index.onDidChangeLine(DOC, 0, "alert tcp any any -> any any (sid:1;)"));
    assertThat(index.isOpen(DOC)).isFalse();

    open("alert tcp any any -> any any (sid:1;)");
    index.closeDocument(DOC);
    assertThrows(
        IllegalArgumentException.class,
        () -> index.onDidChangeLine(DOC, 0, "alert tcp any any -> any any (sid:2;)"));
    assertThrows(IllegalArgumentException.class, () -> index.onDidDeleteLine(DOC, 0));
    assertThat(index.isOpen(DOC)).isFalse();
  }

  @Test
  public void concurrentReadersAndWriters() throws Exception {
    int lines = 50;
    List<String> text = new ArrayList<>();
    for (int i = 0; i < lines; i++) {
      text.add(String.format("alert tcp any any -> any any (sid:%d;)", i));
    }
    index.openDocument(DOC, Joiner.on('\n').join(text));

    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        int offset = t;
        futures.add(
            executor.submit(
                () -> {
                  for (int i = offset; i < lines; i += 4) {
                    index.onDidChangeLine(
                        DOC, i, String.format("alert tcp any %d -> any any (sid:%d;)", i, i));
                  }
                }));
        futures.add(
            executor.submit(
                () -> {
                  for (int i = 0; i < lines; i++) {
                    assertThat(index.getRuleAt(DOC, i).get().isRule()).isTrue();
                    assertThat(index.allDiagnostics(DOC)).isEmpty();
                  }
                }));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(index.lineCount(DOC)).isEqualTo(lines);
    for (int i = 0; i < lines; i++) {
      PortExpr.Number port = index.getRuleAt(DOC, i).get().rule().header().sourcePort().cast();
      assertThat(port.value()).isEqualTo(i);
    }
  }
}
