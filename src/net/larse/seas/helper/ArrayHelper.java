package net.larse.seas.helper;

import com.google.common.base.Preconditions;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.seas.exceptions.ShapeMismatchException;
import org.apache.commons.math.stat.StatUtils;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Reshape data into one row per cycle and one column per phase. The last row is padded with
   * NaN if the length of data is not a multiple of period.
   */
  public static double[][] splitPeriods(double[] data, int period) {
    Preconditions.checkArgument(period > 0, "period must be positive, got %s", period);
    int rows = (data.length + period - 1) / period;
    double[][] result = new double[rows][period];
    for (int i = 0; i < rows * period; i++) {
      result[i / period][i % period] = i < data.length ? data[i] : Double.NaN;
    }
    return result;
  }

  /**
   * Flatten a matrix row by row. The result is truncated, or padded with NaN, so that it has
   * exactly length entries.
   */
  public static double[] joinPeriods(double[][] matrix, int length) {
    double[] result = new double[length];
    Arrays.fill(result, Double.NaN);
    int pos = 0;
    for (double[] row : matrix) {
      for (double v : row) {
        if (pos == length) {
          return result;
        }
        result[pos++] = v;
      }
    }
    return result;
  }

  /**
   * Deviation of data from reference, data - reference or data / reference when multiplicative.
   */
  public static double[] normalize(double[] data, double[] reference, boolean multiplicative) {
    if (data.length != reference.length) {
      throw new ShapeMismatchException(String.format(
          "Cannot normalize %d observations by %d values.", data.length, reference.length));
    }
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = multiplicative ? data[i] / reference[i] : data[i] - reference[i];
    }
    return result;
  }

  /**
   * Replace missing values by linear interpolation between their valid neighbours. Leading and
   * trailing missing values are kept.
   */
  public static double[] fillHoles(double[] data) {
    double[] result = data.clone();
    int previous = -1;
    for (int i = 0; i < result.length; i++) {
      if (Double.isNaN(result[i])) {
        continue;
      }
      if (previous >= 0 && i - previous > 1) {
        double slope = (result[i] - result[previous]) / (i - previous);
        for (int j = previous + 1; j < i; j++) {
          result[j] = result[previous] + slope * (j - previous);
        }
      }
      previous = i;
    }
    return result;
  }

  /**
   * Return a list of exactly length entries. Missing entries repeat the last given one; an empty
   * or null list yields length copies of defaultValue.
   */
  public static <T> List<T> broadcastToLength(List<T> values, int length, T defaultValue) {
    List<T> result = new ArrayList<>(length);
    T last = defaultValue;
    for (int i = 0; i < length; i++) {
      if (values != null && i < values.size()) {
        last = values.get(i);
      }
      result.add(last);
    }
    return result;
  }

  /** Full discrete convolution, of length a.length + b.length - 1. */
  public static double[] convolve(double[] a, double[] b) {
    double[] result = new double[a.length + b.length - 1];
    for (int i = 0; i < a.length; i++) {
      for (int j = 0; j < b.length; j++) {
        result[i + j] += a[i] * b[j];
      }
    }
    return result;
  }

  /** Mean of the non-missing values, NaN if there are none. */
  public static double nanMean(double[] values) {
    DoubleArrayList valid = new DoubleArrayList(values.length);
    for (double v : values) {
      if (!Double.isNaN(v)) {
        valid.add(v);
      }
    }
    return valid.isEmpty() ? Double.NaN : StatUtils.mean(valid.toDoubleArray());
  }

  /** Divide every entry by the sum of all entries. */
  public static double[] normalizeSum(double[] values) {
    double sum = StatUtils.sum(values);
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = values[i] / sum;
    }
    return result;
  }

  /** Extract column col of a matrix. */
  public static double[] column(double[][] matrix, int col) {
    double[] result = new double[matrix.length];
    for (int i = 0; i < matrix.length; i++) {
      result[i] = matrix[i][col];
    }
    return result;
  }
}
