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

import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.exceptions.ShapeMismatchException;
import net.larse.seas.helper.ArrayHelper;
import net.larse.seas.timeseries.EdgeHandling;
import net.larse.seas.timeseries.KernelType;
import net.larse.seas.timeseries.KernelWeights;
import net.larse.seas.timeseries.SeasonalFilter;
import net.larse.seas.timeseries.TimeSeriesUtils;
import net.larse.seas.timeseries.TrendFilter;
import net.larse.seas.timeseries.TrendSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Approximation of "Method I", developed by Julius Shiskin in the 1950s at the US Census Bureau.
 *
 * <p>The seasonal-irregular is the ratio (or difference) of the data and a centered moving
 * average over one period. Seasonal factors are moving averages of the seasonal-irregular of
 * each phase. A second pass replaces the trend by a five term moving average of the first
 * seasonally adjusted series.
 *
 * <p>The treatment of the edges differs from the Census Bureau procedure.
 */
public final class MethodOne {
  private static final Logger LOG = LogManager.getLogger(MethodOne.class);

  // cycles mirrored before smoothing the seasonal-irregular of one phase
  private static final int SEASONAL_MIRROR = 3;
  // observations mirrored before the second trend
  private static final int TREND_MIRROR = 3;

  public static class Args {
    /** add (none), mult, or logadd. */
    public String mode = Mode.LOG_ADDITIVE.getName();
  }

  private final Mode mode;

  public MethodOne() {
    this(new Args());
  }

  public MethodOne(Args args) {
    this.mode = Mode.fromName(args.mode);
    if (mode == null) {
      throw new InvalidConfigurationException(String.format("Unknown mode '%s'.", args.mode));
    }
  }

  /** Final and first-pass components of Method I. */
  public static final class Result {
    private final DecompositionResult.Component component;
    private final double[] preliminaryTrend;
    private final double[] preliminarySeasonalIrregular;
    private final double[] preliminarySeasonalFactor;
    private final double[] preliminarySeasonallyAdjusted;

    Result(DecompositionResult.Component component, double[] preliminaryTrend,
        double[] preliminarySeasonalIrregular, double[] preliminarySeasonalFactor,
        double[] preliminarySeasonallyAdjusted) {
      this.component = component;
      this.preliminaryTrend = preliminaryTrend;
      this.preliminarySeasonalIrregular = preliminarySeasonalIrregular;
      this.preliminarySeasonalFactor = preliminarySeasonalFactor;
      this.preliminarySeasonallyAdjusted = preliminarySeasonallyAdjusted;
    }

    public DecompositionResult.Component getComponent() {
      return component;
    }

    public double[] getPreliminaryTrend() {
      return preliminaryTrend.clone();
    }

    public double[] getPreliminarySeasonalIrregular() {
      return preliminarySeasonalIrregular.clone();
    }

    public double[] getPreliminarySeasonalFactor() {
      return preliminarySeasonalFactor.clone();
    }

    public double[] getPreliminarySeasonallyAdjusted() {
      return preliminarySeasonallyAdjusted.clone();
    }
  }

  public Result getResult(double[] data, int period) {
    if (data.length < 2) {
      throw new ShapeMismatchException(String.format(
          "Method I expects a vector of at least 2 observations, got %d.", data.length));
    }
    if (period <= 0) {
      throw new InvalidConfigurationException(
          "The period of Method I must be a positive integer, got " + period);
    }
    boolean multiplicative = mode.isMultiplicative();
    boolean logAdditive = mode == Mode.LOG_ADDITIVE;
    double[] x = data;
    if (logAdditive) {
      if (!TimeSeriesUtils.isPositive(data)) {
        throw new InvalidConfigurationException(
            "Data must be strictly positive for a log-additive decomposition.");
      }
      x = TimeSeriesUtils.log(data);
    }
    double[] seasonalWeights = KernelWeights.generate(KernelType.MA.getName(), 3, 3);
    LOG.debug("Method I with period {} on {} observations", period, data.length);

    double[] tr1 = TrendFilter.apply(x, TrendSpec.kernel(KernelType.CMA, period),
        EdgeHandling.MIRROR, (period + 1) / 2, message -> {});
    double[] si1 = ArrayHelper.normalize(x, tr1, multiplicative);
    double[] sf1 = SeasonalFilter.smoothed(si1, period, seasonalWeights, SEASONAL_MIRROR);
    double[] sa1 = ArrayHelper.normalize(x, sf1, multiplicative);

    double[] tr = TrendFilter.apply(sa1, TrendSpec.kernel(KernelType.MA, 5),
        EdgeHandling.MIRROR, TREND_MIRROR, message -> {});
    double[] si = ArrayHelper.normalize(x, tr, multiplicative);
    double[] sf = SeasonalFilter.smoothed(si, period, seasonalWeights, SEASONAL_MIRROR);
    double[] sa = ArrayHelper.normalize(x, sf, multiplicative);
    double[] ir = ArrayHelper.normalize(sa, tr, multiplicative);

    if (logAdditive) {
      tr = TimeSeriesUtils.exp(tr);
      si = TimeSeriesUtils.exp(si);
      sf = TimeSeriesUtils.exp(sf);
      sa = TimeSeriesUtils.exp(sa);
      ir = TimeSeriesUtils.exp(ir);
      tr1 = TimeSeriesUtils.exp(tr1);
      si1 = TimeSeriesUtils.exp(si1);
      sf1 = TimeSeriesUtils.exp(sf1);
      sa1 = TimeSeriesUtils.exp(sa1);
    }
    DecompositionResult.Component component = new DecompositionResult.Component(
        new double[] {period}, mode, "method1", null, data, tr, sa, sf, si, ir);
    return new Result(component, tr1, si1, sf1, sa1);
  }
}
