package meerkat;

import com.google.auto.value.AutoValue;

/** Whitespace choices for {@link RuleFormatter}. The defaults match common Suricata rule sets. */
@AutoValue
public abstract class FormatStyle {
  /** {@code msg:"x"; sid:1;} rather than {@code msg:"x";sid:1;}. */
  public abstract boolean spaceAfterOptionSeparator();

  /** {@code sid:1; )} rather than {@code sid:1;)}. */
  public abstract boolean spaceAfterLastOption();

  /** {@code sid: 1;} rather than {@code sid:1;}. */
  public abstract boolean spaceAfterSettingColon();

  public static FormatStyle defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_FormatStyle.Builder()
        .setSpaceAfterOptionSeparator(true)
        .setSpaceAfterLastOption(false)
        .setSpaceAfterSettingColon(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSpaceAfterOptionSeparator(boolean value);

    public abstract Builder setSpaceAfterLastOption(boolean value);

    public abstract Builder setSpaceAfterSettingColon(boolean value);

    public abstract FormatStyle build();
  }
}
