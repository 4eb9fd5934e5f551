package meerkat;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

class KeywordValidator extends DiagnosticCollectingValidator {

  private final KeywordRegistry registry;

  public KeywordValidator(KeywordRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void visitImpl(Rule rule) {
    Set<String> seen = new HashSet<>();
    for (Rule.Option option : rule.options()) {
      Optional<KeywordRegistry.KeywordSpec> spec = registry.lookup(option.keyword());
      if (spec.isPresent() && spec.get().singleUsePerRule() && !seen.add(option.keyword())) {
        report(
            DiagnosticCode.DUPLICATE_KEYWORD,
            option.keywordSpan(),
            String.format("'%s' may appear only once per rule", option.keyword()));
      }
    }
    super.visitImpl(rule);
  }

  @Override
  public void visitImpl(Rule.Option option) {
    Optional<KeywordRegistry.KeywordSpec> spec = registry.lookup(option.keyword());
    if (!spec.isPresent()) {
      report(
          DiagnosticCode.UNKNOWN_KEYWORD,
          option.keywordSpan(),
          "unknown keyword: " + option.keyword());
      return;
    }

    boolean hasSetting = option.rawSetting().map(s -> !s.isEmpty()).orElse(false);
    if (option.hasSetting() && !spec.get().allowsSetting()) {
      report(
          DiagnosticCode.SETTING_NOT_ALLOWED,
          option.settingSpan(),
          String.format("'%s' does not take a setting", option.keyword()));
    } else if (!hasSetting && spec.get().requiresSetting()) {
      report(
          DiagnosticCode.SETTING_REQUIRED,
          option.keywordSpan(),
          String.format("'%s' requires a setting", option.keyword()));
    }
  }
}
