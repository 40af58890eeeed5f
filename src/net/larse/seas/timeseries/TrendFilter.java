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

package net.larse.seas.timeseries;

import com.google.common.annotations.VisibleForTesting;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.Arrays;
import java.util.function.Consumer;
import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.helper.ArrayHelper;
import net.larse.seas.helper.FitGenerator;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes the long run trend of a series.
 *
 * <p>The series can be extended at both ends before the trend is computed, which reduces the
 * distortion of kernel smoothers near the edges. The extension is removed from the result, so
 * the trend always has the length of the data.
 *
 * <p>Arguments by method: kernel methods take the kernel arguments (see {@link KernelWeights});
 * detrend takes optional breakpoint indices; spline takes the smoothing parameter in [0,1];
 * polynomial takes the degree; hp takes lambda; mean takes none.
 */
public final class TrendFilter {
  private static final Logger LOG = LogManager.getLogger(TrendFilter.class);

  private TrendFilter() {}

  public static double[] apply(double[] data, TrendSpec spec) {
    return apply(data, spec, EdgeHandling.NONE, 0, message -> {});
  }

  /**
   * Compute the trend of data.
   *
   * @param edge how to extend the series before filtering
   * @param edgeLength number of observations added at each end, capped at the data length
   * @param warnings receives messages about corrected arguments
   */
  public static double[] apply(double[] data, TrendSpec spec, EdgeHandling edge,
      int edgeLength, Consumer<String> warnings) {
    int e = edge == EdgeHandling.NONE ? 0 : Math.max(0, Math.min(edgeLength, data.length));
    double[] x = TimeSeriesUtils.extend(data, edge, e);
    double[] args = spec.getArgs();
    LOG.debug("Trend {} on {} observations, {} edge of {}", spec, data.length, edge, e);

    double[] trend;
    switch (spec.getMethod()) {
      case MEAN:
        trend = new double[x.length];
        Arrays.fill(trend, ArrayHelper.nanMean(x));
        break;
      case KERNEL:
        double[] weights =
            KernelWeights.generate(new KernelSpec(spec.getKernel(), args), warnings);
        trend = WeightedMean.smooth(x, weights);
        break;
      case DETREND:
        int[] breakpoints = new int[args.length];
        for (int i = 0; i < args.length; i++) {
          breakpoints[i] = (int) args[i] + e;
        }
        trend = detrend(x, breakpoints);
        break;
      case SPLINE:
        trend = spline(x, requireArg(spec, args));
        break;
      case POLYNOMIAL:
        trend = polynomial(x, requireArg(spec, args), warnings);
        break;
      case HP:
        trend = hodrickPrescott(x, requireArg(spec, args));
        break;
      default:
        throw new InvalidConfigurationException("Unsupported trend method " + spec.getMethod());
    }
    return TimeSeriesUtils.trim(trend, edge, e);
  }

  private static double requireArg(TrendSpec spec, double[] args) {
    if (args.length == 0 || Double.isNaN(args[0])) {
      throw new InvalidConfigurationException(String.format(
          "Trend method '%s' expects one argument, but got no valid one.", spec.getName()));
    }
    return args[0];
  }

  /**
   * Least squares fit of a continuous, piecewise linear function with kinks at the breakpoints.
   * The fit uses the valid observations; the trend is evaluated everywhere.
   */
  @VisibleForTesting
  static double[] detrend(double[] x, int[] breakpoints) {
    int n = x.length;
    IntArrayList kinks = new IntArrayList();
    for (int bp : breakpoints) {
      if (bp > 0 && bp < n - 1 && !kinks.contains(bp)) {
        kinks.add(bp);
      }
    }
    IntArrayList valid = validIndices(x);
    int numCols = 2 + kinks.size();
    double[] trend = new double[n];

    FitGenerator fitGenerator = new FitGenerator();
    fitGenerator.init(valid.size(), numCols);
    for (int row = 0; row < valid.size(); row++) {
      int t = valid.getInt(row);
      double[] basis = detrendBasis(t, kinks);
      for (int col = 0; col < numCols; col++) {
        fitGenerator.setObservation(row, col, basis[col]);
      }
      fitGenerator.setTarget(row, x[t]);
    }
    double[] beta = fitGenerator.linearFit();
    if (beta == null) {
      // too few observations for the requested segments
      Arrays.fill(trend, ArrayHelper.nanMean(x));
      return trend;
    }
    for (int t = 0; t < n; t++) {
      double[] basis = detrendBasis(t, kinks);
      for (int col = 0; col < numCols; col++) {
        trend[t] += beta[col] * basis[col];
      }
    }
    return trend;
  }

  private static double[] detrendBasis(int t, IntArrayList kinks) {
    double[] basis = new double[2 + kinks.size()];
    basis[0] = 1;
    basis[1] = t;
    for (int k = 0; k < kinks.size(); k++) {
      basis[2 + k] = Math.max(0, t - kinks.getInt(k));
    }
    return basis;
  }

  @VisibleForTesting
  static double[] spline(double[] x, double p) {
    if (!(p >= 0 && p <= 1)) {
      throw new InvalidConfigurationException(String.format(
          "The spline smoothing parameter must be in [0,1], got %s.", p));
    }
    IntArrayList valid = validIndices(x);
    double[] sites = new double[valid.size()];
    double[] values = new double[valid.size()];
    for (int i = 0; i < valid.size(); i++) {
      sites[i] = valid.getInt(i);
      values[i] = x[valid.getInt(i)];
    }
    double[] fitted = new SmoothingSpline(p).fit(sites, values);
    return scatter(x.length, valid, fitted);
  }

  /**
   * Polynomial least squares fit on centered and scaled positions, evaluated at the valid
   * observations.
   */
  @VisibleForTesting
  static double[] polynomial(double[] x, double degree, Consumer<String> warnings) {
    if (!(degree >= 0) || degree != Math.floor(degree)) {
      throw new InvalidConfigurationException(String.format(
          "The polynomial degree must be a non-negative integer, got %s.", degree));
    }
    IntArrayList valid = validIndices(x);
    if (valid.isEmpty()) {
      return scatter(x.length, valid, new double[0]);
    }
    int d = (int) degree;
    if (d > valid.size() - 1) {
      String message = String.format("Polynomial of degree %d cannot be fitted to %d "
          + "observations; using degree %d.", d, valid.size(), valid.size() - 1);
      LOG.warn(message);
      warnings.accept(message);
      d = valid.size() - 1;
    }

    double[] positions = new double[valid.size()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = valid.getInt(i);
    }
    double mu = new Mean().evaluate(positions);
    double sigma = positions.length > 1 ? new StandardDeviation().evaluate(positions) : 1;

    FitGenerator fitGenerator = new FitGenerator();
    fitGenerator.init(positions.length, d + 1);
    for (int row = 0; row < positions.length; row++) {
      double z = (positions[row] - mu) / sigma;
      for (int col = 0; col <= d; col++) {
        fitGenerator.setObservation(row, col, Math.pow(z, col));
      }
      fitGenerator.setTarget(row, x[valid.getInt(row)]);
    }
    double[] beta = fitGenerator.linearFit();
    if (beta == null) {
      throw new IllegalStateException("Polynomial fit is rank deficient for degree " + d);
    }
    double[] fitted = new double[positions.length];
    for (int row = 0; row < positions.length; row++) {
      double z = (positions[row] - mu) / sigma;
      // Horner
      double v = 0;
      for (int col = d; col >= 0; col--) {
        v = v * z + beta[col];
      }
      fitted[row] = v;
    }
    return scatter(x.length, valid, fitted);
  }

  /**
   * Hodrick-Prescott trend. Interior gaps are filled by linear interpolation; the filter runs on
   * the span between the first and the last valid observation.
   */
  @VisibleForTesting
  static double[] hodrickPrescott(double[] x, double lambda) {
    if (!(lambda >= 0) || Double.isInfinite(lambda)) {
      throw new InvalidConfigurationException(String.format(
          "The Hodrick-Prescott lambda must be a non-negative number, got %s.", lambda));
    }
    double[] filled = ArrayHelper.fillHoles(x);
    double[] trend = new double[x.length];
    Arrays.fill(trend, Double.NaN);
    IntArrayList valid = validIndices(filled);
    if (valid.isEmpty()) {
      return trend;
    }
    int first = valid.getInt(0);
    int last = valid.getInt(valid.size() - 1);
    double[] span = Arrays.copyOfRange(filled, first, last + 1);
    double[] filtered = new HodrickPrescottFilter(lambda).filter(span);
    System.arraycopy(filtered, 0, trend, first, filtered.length);
    return trend;
  }

  private static IntArrayList validIndices(double[] x) {
    IntArrayList valid = new IntArrayList(x.length);
    for (int i = 0; i < x.length; i++) {
      if (!Double.isNaN(x[i])) {
        valid.add(i);
      }
    }
    return valid;
  }

  private static double[] scatter(int n, IntArrayList positions, double[] values) {
    double[] result = new double[n];
    Arrays.fill(result, Double.NaN);
    for (int i = 0; i < positions.size(); i++) {
      result[positions.getInt(i)] = values[i];
    }
    return result;
  }
}
