package net.larse.seas.timeseries;

import java.util.Arrays;
import net.larse.seas.helper.ArrayHelper;

/**
 * Seasonal factors from a seasonal-irregular series. The series is split into one column per
 * phase of the cycle (see {@link ArrayHelper#splitPeriods}), each column is reduced, and the
 * columns are joined back into a series of the original length.
 */
public final class SeasonalFilter {
  private SeasonalFilter() {}

  /**
   * Fixed seasonal factors: the mean of every phase, re-centered so that the factors average to
   * zero (additive) or one (multiplicative) over a cycle.
   */
  public static double[] deviation(double[] si, int period, boolean multiplicative) {
    double[][] phases = ArrayHelper.splitPeriods(si, period);
    double[] means = new double[period];
    for (int c = 0; c < period; c++) {
      means[c] = ArrayHelper.nanMean(ArrayHelper.column(phases, c));
    }
    double center = ArrayHelper.nanMean(means);
    double[][] factors = new double[phases.length][period];
    for (int r = 0; r < phases.length; r++) {
      for (int c = 0; c < period; c++) {
        factors[r][c] = multiplicative ? means[c] / center : means[c] - center;
      }
    }
    return ArrayHelper.joinPeriods(factors, si.length);
  }

  /**
   * Moving seasonal factors: every phase column is smoothed across cycles with the given
   * weights, after mirroring mirrorRows cycles at both ends.
   */
  public static double[] smoothed(double[] si, int period, double[] weights, int mirrorRows) {
    double[][] phases = ArrayHelper.splitPeriods(si, period);
    int rows = phases.length;
    int e = Math.max(0, Math.min(mirrorRows, rows));
    // cycles e-1..0, all cycles, last..last-e+1
    double[][] extended = new double[rows + 2 * e][];
    for (int r = 0; r < e; r++) {
      extended[r] = phases[e - 1 - r];
      extended[rows + 2 * e - 1 - r] = phases[rows - e + r];
    }
    System.arraycopy(phases, 0, extended, e, rows);
    double[][] filtered =
        WeightedMean.smoothColumns(extended, weights, WeightedMean.Direction.CENTERED);
    double[][] smoothed = Arrays.copyOfRange(filtered, e, e + rows);
    return ArrayHelper.joinPeriods(smoothed, si.length);
  }
}
