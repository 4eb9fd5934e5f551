package meerkat;

/** Stable identifiers for every finding the analyzer can report. */
public enum DiagnosticCode {
  // Structural: the line does not follow the rule grammar.
  UNEXPECTED_TOKEN("P001", Category.STRUCTURAL),
  MISSING_ACTION("P002", Category.STRUCTURAL),
  INVALID_ACTION("P003", Category.STRUCTURAL),
  MISSING_PROTOCOL("P004", Category.STRUCTURAL),
  MISSING_DIRECTION("P005", Category.STRUCTURAL),
  INVALID_ADDRESS("P006", Category.STRUCTURAL),
  INVALID_PORT("P007", Category.STRUCTURAL),
  EMPTY_PORT_RANGE("P008", Category.STRUCTURAL),
  EMPTY_GROUP("P009", Category.STRUCTURAL),
  DOUBLE_NEGATION("P010", Category.STRUCTURAL),
  NESTING_TOO_DEEP("P011", Category.STRUCTURAL),
  UNCLOSED_BRACKET("P012", Category.STRUCTURAL),
  UNMATCHED_BRACKET("P013", Category.STRUCTURAL),
  UNTERMINATED_STRING("P014", Category.STRUCTURAL),
  INVALID_VARIABLE("P015", Category.STRUCTURAL),
  MISSING_OPTION_BODY("P016", Category.STRUCTURAL),
  MISSING_OPTIONS("P017", Category.STRUCTURAL),
  MISSING_OPTION_TERMINATOR("P018", Category.STRUCTURAL),
  INVALID_KEYWORD("P019", Category.STRUCTURAL),
  TRAILING_INPUT("P020", Category.STRUCTURAL),

  // Semantic: well-formed, but the values are not acceptable.
  IP_OCTET_OUT_OF_RANGE("S001", Category.SEMANTIC),
  INVALID_IP_ADDRESS("S002", Category.SEMANTIC),
  CIDR_PREFIX_OUT_OF_RANGE("S003", Category.SEMANTIC),
  PORT_OUT_OF_RANGE("S004", Category.SEMANTIC),
  PORT_RANGE_INVERTED("S005", Category.SEMANTIC),
  SETTING_NOT_ALLOWED("S006", Category.SEMANTIC),
  SETTING_REQUIRED("S007", Category.SEMANTIC),
  DUPLICATE_KEYWORD("S008", Category.SEMANTIC),
  UNDECLARED_VARIABLE("S009", Category.SEMANTIC),
  VARIABLE_KIND_MISMATCH("S010", Category.SEMANTIC),
  UNKNOWN_KEYWORD("W001", Category.SEMANTIC, Diagnostic.Severity.WARNING),

  // Configuration: the caller supplied a malformed registry, symbol table or config.
  CONFIGURATION_ERROR("C001", Category.CONFIGURATION);

  public enum Category {
    STRUCTURAL,
    SEMANTIC,
    CONFIGURATION;
  }

  private final String id;
  private final Category category;
  private final Diagnostic.Severity defaultSeverity;

  DiagnosticCode(String id, Category category) {
    this(id, category, Diagnostic.Severity.ERROR);
  }

  DiagnosticCode(String id, Category category, Diagnostic.Severity defaultSeverity) {
    this.id = "MEERKAT-" + id;
    this.category = category;
    this.defaultSeverity = defaultSeverity;
  }

  public String id() {
    return id;
  }

  public Category category() {
    return category;
  }

  public Diagnostic.Severity defaultSeverity() {
    return defaultSeverity;
  }
}
