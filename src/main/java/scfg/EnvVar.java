package scfg;

import org.jetbrains.annotations.Nullable;

/** Environment variables that tune the restructuring. */
public enum EnvVar {
  SCFG_ROUND_FACTOR("Multiplier of the structuring round bound, defaults to 8."),
  SCFG_DUMP("Set to \"1\" to log every restructured region tree.");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  public boolean isSetToOne() {
    return isAvailable() && isSetToValue("1");
  }

  public boolean isSetToValue(String varValue) {
    String value = getValue();
    return value != null && value.equals(varValue);
  }

  /**
   * Parses the value of this variable as an integer, falling back to {@code defaultValue} when it
   * is not set.
   *
   * @throws RestructuringError if the variable is set to something that is not an integer
   */
  public int intValue(int defaultValue) {
    return parseInt(getValue(), defaultValue);
  }

  /** {@link #intValue(int)} for the given raw value, {@code null} meaning unset. */
  int parseInt(@Nullable String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new RestructuringError(
          name() + " is not an integer: \"" + value + "\" (" + description + ")");
    }
  }

  @Nullable
  private String getValue() {
    return System.getenv(this.name());
  }

  public boolean isAvailable() {
    return System.getenv().containsKey(this.name());
  }
}
