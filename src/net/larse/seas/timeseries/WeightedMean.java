package net.larse.seas.timeseries;

import net.larse.seas.exceptions.ShapeMismatchException;
import net.larse.seas.helper.NameResolver;

/**
 * Weighted moving average that tolerates missing data.
 *
 * <p>At the edges of the series the part of the weight vector that falls outside of the data is
 * dropped. Missing observations (NaN) are dropped together with their weight. The result at
 * every position is therefore the weighted average of the valid observations in the window,
 * divided by the sum of the weights actually used. A window without valid observations yields
 * NaN.
 */
public final class WeightedMean {

  /** Which half of the weight vector is used. */
  public enum Direction {
    CENTERED("centered"),
    /** Left half of the weights set to zero. */
    BACKWARD("backward"),
    /** Right half of the weights set to zero. */
    FORWARD("forward");

    private static final NameResolver<Direction> NAMES = new NameResolver<>();

    static {
      for (Direction d : values()) {
        NAMES.add(d, d.name);
      }
    }

    private final String name;

    Direction(String name) {
      this.name = name;
    }

    public static Direction fromName(String name) {
      return NAMES.resolve(name);
    }
  }

  private WeightedMean() {}

  public static double[] smooth(double[] data, double[] weights) {
    return smooth(data, weights, Direction.CENTERED);
  }

  /**
   * Smooth data with the given weights.
   *
   * @param weights must have an odd number of entries, the center entry applies to the current
   *     observation
   */
  public static double[] smooth(double[] data, double[] weights, Direction direction) {
    double[] w = directedWeights(weights, direction);
    int lagLead = (w.length - 1) / 2;
    int n = data.length;
    double[] result = new double[n];
    for (int t = 0; t < n; t++) {
      int from = Math.max(0, t - lagLead);
      int to = Math.min(n - 1, t + lagLead);
      double sum = 0;
      double weightSum = 0;
      int valid = 0;
      for (int i = from; i <= to; i++) {
        if (Double.isNaN(data[i])) {
          continue;
        }
        double wi = w[i - t + lagLead];
        sum += wi * data[i];
        weightSum += wi;
        valid++;
      }
      result[t] = valid == 0 ? Double.NaN : sum / weightSum;
    }
    return result;
  }

  /** Smooth every column of matrix separately. */
  public static double[][] smoothColumns(double[][] matrix, double[] weights, Direction direction) {
    if (matrix.length == 0) {
      return new double[0][];
    }
    int cols = matrix[0].length;
    double[][] result = new double[matrix.length][cols];
    double[] column = new double[matrix.length];
    for (int c = 0; c < cols; c++) {
      for (int r = 0; r < matrix.length; r++) {
        column[r] = matrix[r][c];
      }
      double[] smoothed = smooth(column, weights, direction);
      for (int r = 0; r < matrix.length; r++) {
        result[r][c] = smoothed[r];
      }
    }
    return result;
  }

  private static double[] directedWeights(double[] weights, Direction direction) {
    if (weights.length % 2 != 1) {
      throw new ShapeMismatchException(String.format(
          "Weights vector must contain an odd number of components, got %d.", weights.length));
    }
    int lagLead = (weights.length - 1) / 2;
    double[] w = weights.clone();
    switch (direction) {
      case BACKWARD:
        for (int i = 0; i < lagLead; i++) {
          w[i] = 0;
        }
        break;
      case FORWARD:
        for (int i = lagLead + 1; i < w.length; i++) {
          w[i] = 0;
        }
        break;
      default:
        break;
    }
    return w;
  }
}
