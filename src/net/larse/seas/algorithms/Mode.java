package net.larse.seas.algorithms;

import net.larse.seas.helper.NameResolver;

/** How trend, seasonal factor and irregular combine into the data. */
public enum Mode {
  /** data = trend + sf + ir. */
  ADDITIVE("add", "none", "additive"),
  /** data = trend * sf * ir. */
  MULTIPLICATIVE("mult", "multiplicative"),
  /** log(data) = trend + sf + ir, results are exponentiated. */
  LOG_ADDITIVE("logadd", "log-additive", "logadditive");

  private static final NameResolver<Mode> NAMES = new NameResolver<>();

  static {
    for (Mode mode : values()) {
      NAMES.add(mode, mode.aliases);
    }
  }

  private final String[] aliases;

  Mode(String... aliases) {
    this.aliases = aliases;
  }

  public String getName() {
    return aliases[0];
  }

  public boolean isMultiplicative() {
    return this == MULTIPLICATIVE;
  }

  /** Returns the mode with this name or unambiguous abbreviation, or null. */
  public static Mode fromName(String name) {
    return NAMES.resolve(name);
  }
}
