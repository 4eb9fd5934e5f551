package meerkat;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class MeerkatMain {
  private static final Logger logger = LoggerFactory.getLogger(MeerkatMain.class);

  private static final String USAGE =
      "Usage: meerkat [--format] [--config file.properties] [--keywords keywords.csv] rules_file";

  public static void main(String[] args) throws IOException {
    System.exit(run(args, System.out));
  }

  /** Checks (and with --format rewrites) one rules file; returns the process exit code. */
  static int run(String[] args, PrintStream out) throws IOException {
    boolean format = false;
    File configFile = null;
    File keywordsFile = null;
    File rulesFile = null;
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--format":
          format = true;
          break;
        case "--config":
          if (++i == args.length) return usage();
          configFile = new File(args[i]);
          break;
        case "--keywords":
          if (++i == args.length) return usage();
          keywordsFile = new File(args[i]);
          break;
        default:
          if (rulesFile != null || args[i].startsWith("--")) return usage();
          rulesFile = new File(args[i]);
      }
    }
    if (rulesFile == null) return usage();

    MeerkatConfig config;
    SymbolTable symbols;
    KeywordRegistry registry;
    try {
      Properties properties = new Properties();
      if (configFile != null) {
        try (Reader reader =
            Files.asCharSource(configFile, StandardCharsets.UTF_8).openBufferedStream()) {
          properties.load(reader);
        }
      }
      config = MeerkatConfig.fromProperties(properties);
      symbols = SymbolTable.fromProperties(properties);
      registry =
          keywordsFile == null
              ? KeywordRegistry.defaults()
              : KeywordRegistry.fromCsv(read(keywordsFile));
    } catch (ConfigurationException ex) {
      out.println("ERROR: " + ex.getMessage());
      return 1;
    }

    String doc = rulesFile.getPath();
    DocumentIndex index = new DocumentIndex(config, symbols, registry);
    String contents = read(rulesFile);
    index.openDocument(doc, contents);

    if (format) {
      ImmutableList<DocumentIndex.TextEdit> edits = index.formatDocument(doc, config.formatStyle());
      if (edits.isEmpty()) {
        out.println("Rules file is already formatted");
      } else {
        List<String> lines = new ArrayList<>(Splitter.onPattern("\r?\n").splitToList(contents));
        for (DocumentIndex.TextEdit edit : edits) {
          String line = lines.get(edit.line());
          lines.set(
              edit.line(),
              line.substring(0, edit.span().start())
                  + edit.newText()
                  + line.substring(edit.span().end()));
        }
        String separator = contents.contains("\r\n") ? "\r\n" : "\n";
        write(Joiner.on(separator).join(lines), rulesFile);
        out.println(String.format("Formatted %d rules", edits.size()));
      }
    }

    boolean failed = false;
    for (DocumentIndex.LineDiagnostic found : index.allDiagnostics(doc)) {
      Diagnostic diagnostic = found.diagnostic();
      failed |= diagnostic.isError();
      out.println(
          String.format(
              "%s: %s@%d:%d [%s] %s",
              diagnostic.severity(),
              doc,
              found.line() + 1,
              diagnostic.span().start() + 1,
              diagnostic.code().id(),
              diagnostic.message()));
    }
    logger.debug("Checked {} lines of {}", index.lineCount(doc), doc);

    if (failed) {
      out.println("Check failed.  See errors above.");
      return 1;
    }
    out.println("Check succeeded!");
    return 0;
  }

  private static int usage() {
    System.err.println(USAGE);
    return 1;
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  private static void write(String string, File file) throws IOException {
    Files.asCharSink(file, StandardCharsets.UTF_8).write(string);
  }
}
