package net.larse.seas.timeseries;

import java.util.Arrays;
import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.exceptions.ShapeMismatchException;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Helpers for series and their dates. Dates are plain numbers, e.g. day counts; only their
 * ordering and differences are used.
 */
public class TimeSeriesUtils {

  /** Dates 1, 2, ..., n used when the caller supplies none. */
  public static double[] defaultDates(int n) {
    double[] dates = new double[n];
    for (int i = 0; i < n; i++) {
      dates[i] = i + 1;
    }
    return dates;
  }

  /**
   * Check that dates are aligned with data and strictly increasing.
   *
   * @throws ShapeMismatchException if the lengths differ
   * @throws InvalidConfigurationException if dates are not strictly increasing
   */
  public static void checkDates(double[] data, double[] dates) {
    if (dates.length != data.length) {
      throw new ShapeMismatchException(String.format(
          "Got %d dates for %d observations.", dates.length, data.length));
    }
    for (int i = 1; i < dates.length; i++) {
      if (!(dates[i] > dates[i - 1])) {
        throw new InvalidConfigurationException(String.format(
            "Dates must be strictly increasing, but date %d (%s) follows %s.",
            i, dates[i], dates[i - 1]));
      }
    }
  }

  /** Average distance between consecutive dates. */
  public static double averageSpacing(double[] dates) {
    return (dates[dates.length - 1] - dates[0]) / (dates.length - 1);
  }

  /** Index of the last date not after date, or -1 if date precedes all dates. */
  public static int lastIndexNotAfter(double[] dates, double date) {
    int idx = Arrays.binarySearch(dates, date);
    if (idx >= 0) {
      return idx;
    }
    return -idx - 2;
  }

  /** Extend data at both ends by length observations. */
  public static double[] extend(double[] data, EdgeHandling edge, int length) {
    if (edge == EdgeHandling.NONE || length <= 0) {
      return data.clone();
    }
    int n = data.length;
    double[] head = Arrays.copyOfRange(data, 0, length);
    double[] tail = Arrays.copyOfRange(data, n - length, n);
    if (edge == EdgeHandling.MIRROR) {
      ArrayUtils.reverse(head);
      ArrayUtils.reverse(tail);
    }
    return ArrayUtils.addAll(ArrayUtils.addAll(head, data), tail);
  }

  /** Undo {@link #extend}. */
  public static double[] trim(double[] extended, EdgeHandling edge, int length) {
    if (edge == EdgeHandling.NONE || length <= 0) {
      return extended;
    }
    return Arrays.copyOfRange(extended, length, extended.length - length);
  }

  public static double[] log(double[] data) {
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = Math.log(data[i]);
    }
    return result;
  }

  public static double[] exp(double[] data) {
    double[] result = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      result[i] = Math.exp(data[i]);
    }
    return result;
  }

  /** True if every non-missing value is strictly positive. */
  public static boolean isPositive(double[] data) {
    for (double v : data) {
      if (!Double.isNaN(v) && v <= 0) {
        return false;
      }
    }
    return true;
  }
}
