package net.larse.seas.timeseries;

/** The ways {@link TrendFilter} can compute a trend. */
public enum TrendMethod {
  /** Arithmetic mean over the whole series. */
  MEAN("mean"),
  /** Linear trend, continuous and piecewise linear if breakpoints are given. */
  DETREND("detrend"),
  /** Cubic smoothing spline. */
  SPLINE("spline"),
  /** Polynomial of fixed degree. */
  POLYNOMIAL("polynomial"),
  /** Hodrick-Prescott filter. */
  HP("hp"),
  /** Weighted mean with the weights of a {@link KernelType}. */
  KERNEL("kernel");

  private final String name;

  TrendMethod(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
