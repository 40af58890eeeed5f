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
 * Decomposition with a moving seasonal factor.
 *
 * <p>The trend is a centered moving average over one period, convolved with centered moving
 * averages over half and a third of a period. The seasonal factor of every phase is smoothed
 * across cycles with a short Epanechnikov kernel, so it may drift slowly from one cycle to the
 * next.
 */
public final class Seas {
  private static final Logger LOG = LogManager.getLogger(Seas.class);

  // bandwidth of the kernel smoothing each phase across cycles
  private static final double SEASONAL_BANDWIDTH = 5;

  public static class Args {
    /** add (none), mult, or logadd. */
    public String mode = Mode.LOG_ADDITIVE.getName();
  }

  private final Mode mode;

  public Seas() {
    this(new Args());
  }

  public Seas(Args args) {
    this.mode = Mode.fromName(args.mode);
    if (mode == null) {
      throw new InvalidConfigurationException(String.format("Unknown mode '%s'.", args.mode));
    }
  }

  public DecompositionResult.Component getResult(double[] data, int period) {
    if (data.length < 2) {
      throw new ShapeMismatchException(String.format(
          "Seas expects a vector of at least 2 observations, got %d.", data.length));
    }
    if (period <= 0) {
      throw new InvalidConfigurationException(
          "The period must be a positive integer, got " + period);
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
    int cycles = (data.length + period - 1) / period;
    LOG.debug("Seas with period {} on {} observations", period, data.length);

    double[] tr = TrendFilter.apply(x, trendSpec(period), EdgeHandling.MIRROR,
        trendMirror(period), message -> {});
    double[] si = ArrayHelper.normalize(x, tr, multiplicative);
    double[] sf = SeasonalFilter.smoothed(si, period,
        KernelWeights.generate(KernelType.EPANECHNIKOV.getName(), SEASONAL_BANDWIDTH), cycles);
    double[] sa = ArrayHelper.normalize(x, sf, multiplicative);
    double[] ir = ArrayHelper.normalize(sa, tr, multiplicative);

    if (logAdditive) {
      tr = TimeSeriesUtils.exp(tr);
      si = TimeSeriesUtils.exp(si);
      sf = TimeSeriesUtils.exp(sf);
      sa = TimeSeriesUtils.exp(sa);
      ir = TimeSeriesUtils.exp(ir);
    }
    TrendSpec spec = trendSpec(period);
    return new DecompositionResult.Component(new double[] {period}, mode, spec.getName(),
        spec.getArgs(), data, tr, sa, sf, si, ir);
  }

  /** cma(p, p/2, p/3). */
  @VisibleForTesting
  static TrendSpec trendSpec(int period) {
    return TrendSpec.kernel(KernelType.CMA, period, period / 2.0, period / 3.0);
  }

  /** Observations mirrored at each end, about half the width of the trend kernel. */
  @VisibleForTesting
  static int trendMirror(int period) {
    return (int) (Math.ceil(period / 2.0) + Math.ceil(period / 4.0) + Math.ceil(period / 6.0))
        + 1;
  }
}
