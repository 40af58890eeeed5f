/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.seas.algorithms;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.exceptions.ShapeMismatchException;
import net.larse.seas.helper.ArrayHelper;
import net.larse.seas.timeseries.EdgeHandling;
import net.larse.seas.timeseries.KernelType;
import net.larse.seas.timeseries.SeasonalFilter;
import net.larse.seas.timeseries.TimeSeriesUtils;
import net.larse.seas.timeseries.TrendFilter;
import net.larse.seas.timeseries.TrendMethod;
import net.larse.seas.timeseries.TrendSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A simple seasonal filter with fixed seasonal factors, essentially a dummy per phase of the
 * cycle (e.g. a January dummy, a February dummy, ... for monthly data).
 *
 * <p>For one period p the decomposition is:
 *
 * <ol>
 *   <li>trend: by default a centered moving average of length p, so for p = 6
 *       trend(t) = (0.5x(t-3) + x(t-2) + ... + x(t+2) + 0.5x(t+3)) / 6;
 *   <li>seasonal-irregular: si = x - trend;
 *   <li>average si over all observations in the same phase, m(1), ..., m(p);
 *   <li>seasonal factor: sf(i) = m(i) - mean(m);
 *   <li>seasonally adjusted: sa = x - sf;
 *   <li>irregular: ir = sa - trend.
 * </ol>
 *
 * <p>Multiplicative decompositions replace differences by ratios. The log-additive mode
 * decomposes log(x) additively and exponentiates the results.
 *
 * <p>Several periods are removed one after the other, from left to right, each consuming the
 * seasonally adjusted series of the previous one. The ordering matters: [14, 20] does not give
 * the same result as [20, 14]. If all periods use the same mode an aggregate component is
 * appended, with the seasonal factors, seasonal-irregulars and irregulars of all periods
 * multiplied (multiplicative) or added (otherwise).
 */
public final class FixedSeas {
  private static final Logger LOG = LogManager.getLogger(FixedSeas.class);

  // Default HP lambda as a function of the period, log(lambda) = ABSOLUTE + SLOPE * log(period).
  private static final double HP_ABSOLUTE = -7.10636;
  private static final double HP_SLOPE = 5.91863781313348;

  public static class Args {
    /**
     * Decomposition mode per period: add (none), mult, or logadd. Lists shorter than the list of
     * periods are padded with their last entry. Default is logadd.
     */
    public List<String> modes = new ArrayList<>();

    /**
     * Trend method per period: a kernel name, or mean, detrend, spline, polynomial, hp. Padded
     * like modes. Default is cma.
     */
    public List<String> methods = new ArrayList<>();

    /**
     * Arguments of the trend method per period. Null or empty entries select the default for
     * the method and period. Breakpoints of detrend are given as dates.
     */
    public List<double[]> methodArgs = new ArrayList<>();

    /** Strictly increasing dates of the observations. Default is 1, 2, ..., n. */
    public double[] dates = null;

    /** Extension of the series before the trend is computed, by one period at each end. */
    public EdgeHandling edgeHandling = EdgeHandling.MIRROR;
  }

  static final String DEFAULT_MODE = Mode.LOG_ADDITIVE.getName();
  static final String DEFAULT_METHOD = KernelType.CMA.getName();

  private final Args args;

  public FixedSeas() {
    this(new Args());
  }

  public FixedSeas(Args args) {
    this.args = args;
  }

  /**
   * Decompose data for each of the periods in turn.
   *
   * @param modes mode names per period, may be null or shorter than periods
   * @param methods trend method names per period, may be null or shorter than periods
   * @param methodArgs trend method arguments per period, may be null or shorter than periods
   * @param dates dates of the observations, may be null
   */
  public static DecompositionResult decompose(double[] data, double[] periods, List<String> modes,
      List<String> methods, List<double[]> methodArgs, double[] dates) {
    Args args = new Args();
    args.modes = modes;
    args.methods = methods;
    args.methodArgs = methodArgs;
    args.dates = dates;
    return new FixedSeas(args).getResult(data, periods);
  }

  public DecompositionResult getResult(double[] data, double... periods) {
    if (data.length < 2) {
      throw new ShapeMismatchException(String.format(
          "Decomposition expects a vector of at least 2 observations, got %d.", data.length));
    }
    if (periods.length == 0) {
      throw new InvalidConfigurationException("At least one period is required.");
    }
    int[] intPeriods = new int[periods.length];
    for (int q = 0; q < periods.length; q++) {
      intPeriods[q] = checkPeriod(periods[q]);
    }
    double[] dates = args.dates == null ? TimeSeriesUtils.defaultDates(data.length) : args.dates;
    TimeSeriesUtils.checkDates(data, dates);

    int np = periods.length;
    List<Mode> modes = new ArrayList<>(np);
    for (String name : ArrayHelper.broadcastToLength(args.modes, np, DEFAULT_MODE)) {
      Mode mode = Mode.fromName(name);
      if (mode == null) {
        throw new InvalidConfigurationException(String.format("Unknown mode '%s'.", name));
      }
      modes.add(mode);
    }
    List<TrendSpec> methods = new ArrayList<>(np);
    List<double[]> methodArgs = ArrayHelper.broadcastToLength(args.methodArgs, np, null);
    List<String> names = ArrayHelper.broadcastToLength(args.methods, np, DEFAULT_METHOD);
    for (int q = 0; q < np; q++) {
      methods.add(TrendSpec.parse(names.get(q), methodArgs.get(q)));
    }

    List<String> warnings = new ArrayList<>();
    List<DecompositionResult.Component> components = new ArrayList<>(np + 1);
    double[] input = data;
    for (int q = 0; q < np; q++) {
      DecompositionResult.Component component =
          decomposeOne(input, dates, intPeriods[q], modes.get(q), methods.get(q), warnings);
      components.add(component);
      input = component.getSeasonallyAdjusted();
    }

    boolean aggregated = np > 1 && modes.stream().allMatch(m -> m == modes.get(0));
    if (aggregated) {
      components.add(aggregate(components, periods, modes.get(0)));
    }
    return new DecompositionResult(dates, components, aggregated, warnings);
  }

  private static int checkPeriod(double period) {
    if (!(period > 0) || period != Math.floor(period) || Double.isInfinite(period)) {
      throw new InvalidConfigurationException(String.format(
          "Periods must be positive integers, got %s.", period));
    }
    return (int) period;
  }

  private DecompositionResult.Component decomposeOne(double[] input, double[] dates, int period,
      Mode mode, TrendSpec method, List<String> warnings) {
    boolean multiplicative = mode.isMultiplicative();
    double[] x = input;
    if (mode == Mode.LOG_ADDITIVE) {
      if (!TimeSeriesUtils.isPositive(input)) {
        throw new InvalidConfigurationException(
            "Data must be strictly positive for a log-additive decomposition.");
      }
      x = TimeSeriesUtils.log(input);
    }

    TrendSpec spec = method.hasArgs() ? method : method.withArgs(defaultArgs(method, period, dates));
    TrendSpec filterSpec = spec;
    if (spec.getMethod() == TrendMethod.DETREND) {
      filterSpec = spec.withArgs(breakpointIndices(spec.getArgs(), dates));
    }
    LOG.debug("Period {}: mode {}, trend {}", period, mode.getName(), spec);

    double[] tr = TrendFilter.apply(x, filterSpec, args.edgeHandling, period, warnings::add);
    double[] si = ArrayHelper.normalize(x, tr, multiplicative);
    double[] sf = SeasonalFilter.deviation(si, period, multiplicative);
    double[] sa = ArrayHelper.normalize(x, sf, multiplicative);
    double[] ir = ArrayHelper.normalize(sa, tr, multiplicative);

    if (mode == Mode.LOG_ADDITIVE) {
      tr = TimeSeriesUtils.exp(tr);
      sa = TimeSeriesUtils.exp(sa);
      sf = TimeSeriesUtils.exp(sf);
      si = TimeSeriesUtils.exp(si);
      ir = TimeSeriesUtils.exp(ir);
    }
    return new DecompositionResult.Component(new double[] {period}, mode, spec.getName(),
        spec.getArgs(), input, tr, sa, sf, si, ir);
  }

  /** Arguments used when the caller gives none for this method. */
  @VisibleForTesting
  static double[] defaultArgs(TrendSpec method, int period, double[] dates) {
    switch (method.getMethod()) {
      case SPLINE:
        double h = TimeSeriesUtils.averageSpacing(dates) / period;
        return new double[] {1 / (1 + h * h * h / 0.6)};
      case POLYNOMIAL:
        return new double[] {Math.floor(dates.length / (double) period)};
      case HP:
        return new double[] {Math.exp(HP_ABSOLUTE + HP_SLOPE * Math.log(period))};
      case KERNEL:
        switch (method.getKernel()) {
          case REHOMME_LADIRAY:
          case HENDERSON:
          case BONGARD:
            return new double[] {2 * period - 1};
          default:
            return new double[] {period};
        }
      default:
        return new double[0];
    }
  }

  /** Positions of the breakpoint dates; dates before the first observation are dropped. */
  private static double[] breakpointIndices(double[] breakDates, double[] dates) {
    return Arrays.stream(breakDates)
        .map(d -> TimeSeriesUtils.lastIndexNotAfter(dates, d))
        .filter(i -> i >= 0)
        .toArray();
  }

  private static DecompositionResult.Component aggregate(
      List<DecompositionResult.Component> components, double[] periods, Mode mode) {
    boolean multiplicative = mode.isMultiplicative();
    DecompositionResult.Component first = components.get(0);
    DecompositionResult.Component last = components.get(components.size() - 1);
    double[] sf = first.getSeasonalFactor();
    double[] si = first.getSeasonalIrregular();
    double[] ir = first.getIrregular();
    List<String> names = new ArrayList<>();
    names.add(first.getMethod());
    for (int q = 1; q < components.size(); q++) {
      DecompositionResult.Component c = components.get(q);
      combine(sf, c.getSeasonalFactor(), multiplicative);
      combine(si, c.getSeasonalIrregular(), multiplicative);
      combine(ir, c.getIrregular(), multiplicative);
      names.add(c.getMethod());
    }
    return new DecompositionResult.Component(periods, mode, Joiner.on(',').join(names), null,
        first.getData(), last.getTrend(), last.getSeasonallyAdjusted(), sf, si, ir);
  }

  private static void combine(double[] acc, double[] values, boolean multiplicative) {
    for (int i = 0; i < acc.length; i++) {
      acc[i] = multiplicative ? acc[i] * values[i] : acc[i] + values[i];
    }
  }
}
