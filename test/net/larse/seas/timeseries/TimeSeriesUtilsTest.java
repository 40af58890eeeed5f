package net.larse.seas.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.exceptions.ShapeMismatchException;
import org.junit.Test;

public class TimeSeriesUtilsTest {
  private static final double EPS = 1e-12;

  @Test
  public void testExtend() {
    double[] data = {1, 2, 3, 4};
    assertArrayEquals(new double[] {2, 1, 1, 2, 3, 4, 4, 3},
        TimeSeriesUtils.extend(data, EdgeHandling.MIRROR, 2), EPS);
    assertArrayEquals(new double[] {1, 2, 1, 2, 3, 4, 3, 4},
        TimeSeriesUtils.extend(data, EdgeHandling.EXTEND, 2), EPS);
    assertArrayEquals(data, TimeSeriesUtils.extend(data, EdgeHandling.NONE, 2), EPS);
    assertArrayEquals(data,
        TimeSeriesUtils.trim(TimeSeriesUtils.extend(data, EdgeHandling.MIRROR, 3),
            EdgeHandling.MIRROR, 3), EPS);
  }

  @Test
  public void testDates() {
    double[] dates = TimeSeriesUtils.defaultDates(4);
    assertArrayEquals(new double[] {1, 2, 3, 4}, dates, EPS);
    assertEquals(1, TimeSeriesUtils.averageSpacing(new double[] {0, 0.5, 2}), EPS);
    assertEquals(1, TimeSeriesUtils.lastIndexNotAfter(dates, 2.5));
    assertEquals(2, TimeSeriesUtils.lastIndexNotAfter(dates, 3));
    assertEquals(-1, TimeSeriesUtils.lastIndexNotAfter(dates, 0));
  }

  @Test(expected = ShapeMismatchException.class)
  public void testDatesLengthMismatch() {
    TimeSeriesUtils.checkDates(new double[3], new double[] {1, 2});
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testDatesNotIncreasing() {
    TimeSeriesUtils.checkDates(new double[3], new double[] {1, 3, 2});
  }

  @Test
  public void testIsPositive() {
    assertTrue(TimeSeriesUtils.isPositive(new double[] {1, Double.NaN, 2}));
    assertFalse(TimeSeriesUtils.isPositive(new double[] {1, 0}));
  }
}
