package net.larse.seas.timeseries;

import net.larse.seas.helper.NameResolver;

/**
 * The smoothing kernels known to {@link KernelWeights}.
 */
public enum KernelType {
  REHOMME_LADIRAY(Support.OPTIMIZED, 0, "rehomme-ladiray"),
  BONGARD(Support.OPTIMIZED, 0, "bongard"),
  HENDERSON(Support.OPTIMIZED, 0, "henderson"),
  SPENCER(Support.FIXED, 0, "spencer", "spencer15"),
  CMA(Support.UNIFORM, 0, "cma", "centered moving average", "uniform", "rectangular",
      "rectangle", "box"),
  MA(Support.UNIFORM, 0, "ma", "moving average"),
  EPANECHNIKOV(Support.FINITE, 0, "epanechnikov"),
  TRIANGLE(Support.FINITE, 0, "triangle", "triangular"),
  BIWEIGHT(Support.FINITE, 0, "biweight", "quartic"),
  TRIWEIGHT(Support.FINITE, 0, "triweight"),
  TRICUBE(Support.FINITE, 0, "tricube"),
  COSINE(Support.FINITE, 0, "cosine"),
  OPTCOSINE(Support.FINITE, 0, "optcosine"),
  CAUCHY(Support.FINITE, 0, "cauchy"),
  LOGISTIC(Support.INFINITE, 71, "logistic"),
  SIGMOID(Support.INFINITE, 71, "sigmoid"),
  SILVERMAN(Support.INFINITE, 98, "silverman"),
  GAUSSIAN(Support.INFINITE, 19, "gaussian", "normal"),
  EXPONENTIAL(Support.INFINITE, 135, "exponential");

  /** How the weights of a kernel are laid out. */
  public enum Support {
    /** Obtained by constrained minimization. */
    OPTIMIZED,
    /** A single predefined filter. */
    FIXED,
    /** Unit weights. */
    UNIFORM,
    /** Evaluated on lags scaled to [-1, 1]. */
    FINITE,
    /** Evaluated on lags scaled by the bandwidth and truncated. */
    INFINITE
  }

  private static final NameResolver<KernelType> NAMES = new NameResolver<>();

  static {
    for (KernelType type : values()) {
      NAMES.add(type, type.aliases);
    }
  }

  private final Support support;
  // length multiple beyond which all weights are below 1e-15
  private final int truncation;
  private final String[] aliases;

  KernelType(Support support, int truncation, String... aliases) {
    this.support = support;
    this.truncation = truncation;
    this.aliases = aliases;
  }

  public Support getSupport() {
    return support;
  }

  int getTruncation() {
    return truncation;
  }

  /** The canonical name of the kernel. */
  public String getName() {
    return aliases[0];
  }

  public String[] getAliases() {
    return aliases.clone();
  }

  /** Returns the kernel type with this name or unambiguous abbreviation, or null. */
  public static KernelType fromName(String name) {
    return NAMES.resolve(name);
  }
}
