package meerkat;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.Files;

public class MeerkatMainTest {

  @TempDir Path tempDir;

  private ByteArrayOutputStream output;

  @BeforeEach
  public void setUp() {
    output = new ByteArrayOutputStream();
  }

  private File write(String name, String content) throws IOException {
    File file = tempDir.resolve(name).toFile();
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file;
  }

  private int run(String... args) throws IOException {
    return MeerkatMain.run(args, new PrintStream(output, true, StandardCharsets.UTF_8.name()));
  }

  private String output() {
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void checkSucceeds() throws IOException {
    File rules =
        write(
            "ok.rules",
            "# comment\nalert tcp any any -> any 80 (msg:\"x\"; sid:1; rev:1;)\n\n");

    assertThat(run(rules.getPath())).isEqualTo(0);
    assertThat(output()).contains("Check succeeded!");
  }

  @Test
  public void checkReportsErrors() throws IOException {
    File rules =
        write(
            "bad.rules",
            "alert tcp any any -> any any (sid:1;)\n"
                + "alert tcp any any -> any any (sid:1)\n"
                + "alert tcp any any -> any any (frob; sid:2;)");

    assertThat(run(rules.getPath())).isEqualTo(1);
    assertThat(output())
        .contains(
            "ERROR: " + rules.getPath() + "@2:30 [MEERKAT-P018] option is missing its ';'");
    assertThat(output())
        .contains("WARNING: " + rules.getPath() + "@3:31 [MEERKAT-W001] unknown keyword: frob");
    assertThat(output()).contains("Check failed.");
  }

  @Test
  public void warningsAloneDoNotFail() throws IOException {
    File rules = write("warn.rules", "alert tcp any any -> any any (frob; sid:2;)");

    assertThat(run(rules.getPath())).isEqualTo(0);
    assertThat(output()).contains("[MEERKAT-W001]");
  }

  @Test
  public void configurationDeclaresVariables() throws IOException {
    File rules = write("vars.rules", "alert tcp $HOME_NET any -> any $WEB (sid:1;)");
    File config =
        write(
            "meerkat.properties",
            "address-groups.HOME_NET=10.0.0.0/8\nport-groups.WEB=[80,443]\n");

    assertThat(run(rules.getPath())).isEqualTo(1);
    assertThat(output()).contains("[MEERKAT-S009] undeclared variable: $HOME_NET");

    output.reset();
    assertThat(run("--config", config.getPath(), rules.getPath())).isEqualTo(0);
  }

  @Test
  public void customKeywordList() throws IOException {
    File rules = write("kw.rules", "alert tcp any any -> any any (custom; sid:1;)");
    File keywords =
        write(
            "keywords.csv",
            "name;description;app layer;features;documentation;\n"
                + "sid;set rule ID;Unset;none;;\n"
                + "custom;a local keyword;Unset;No option;;\n");

    assertThat(run("--keywords", keywords.getPath(), rules.getPath())).isEqualTo(0);
    assertThat(output()).doesNotContain("MEERKAT-W001");
  }

  @Test
  public void badConfiguration() throws IOException {
    File rules = write("x.rules", "alert tcp any any -> any any (sid:1;)");
    File config = write("bad.properties", "parser.maxGroupDepth=deep\n");

    assertThat(run("--config", config.getPath(), rules.getPath())).isEqualTo(1);
    assertThat(output()).startsWith("ERROR: configuration: parser.maxGroupDepth");
  }

  @Test
  public void formatRewritesFile() throws IOException {
    File rules =
        write(
            "fmt.rules",
            "#  keep   me\n"
                + "alert  tcp any any ->  any any (msg:\"x\";sid:1;)\n"
                + "alert tcp any any -> any any (sid:2)");

    assertThat(run("--format", rules.getPath())).isEqualTo(1);
    assertThat(output()).contains("Formatted 1 rules");
    assertThat(Files.asCharSource(rules, StandardCharsets.UTF_8).read())
        .isEqualTo(
            "#  keep   me\n"
                + "alert tcp any any -> any any (msg:\"x\"; sid:1;)\n"
                + "alert tcp any any -> any any (sid:2)");

    output.reset();
    write("clean.rules", "alert tcp any any -> any any (sid:1;)");
    assertThat(run("--format", tempDir.resolve("clean.rules").toString())).isEqualTo(0);
    assertThat(output()).contains("already formatted");
  }

  @Test
  public void formatKeepsLineSeparators() throws IOException {
    File rules =
        write(
            "crlf.rules",
            "# header\r\n"
                + "alert  tcp any any -> any any (sid:1;)\r\n"
                + "alert tcp any any -> any any (sid:2;)\r\n");

    assertThat(run("--format", rules.getPath())).isEqualTo(0);
    assertThat(Files.asCharSource(rules, StandardCharsets.UTF_8).read())
        .isEqualTo(
            "# header\r\n"
                + "alert tcp any any -> any any (sid:1;)\r\n"
                + "alert tcp any any -> any any (sid:2;)\r\n");
  }

  @Test
  public void usage() throws IOException {
    assertThat(run()).isEqualTo(1);
    assertThat(run("--config")).isEqualTo(1);
    assertThat(run("a.rules", "b.rules")).isEqualTo(1);
    assertThat(run("--verbose", "a.rules")).isEqualTo(1);
  }
}
