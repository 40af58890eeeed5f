package net.larse.seas.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import net.larse.seas.exceptions.ShapeMismatchException;
import net.larse.seas.timeseries.WeightedMean.Direction;
import org.junit.Test;

public class WeightedMeanTest {
  private static final double EPS = 1e-12;
  private static final double NAN = Double.NaN;

  @Test
  public void testConstantSeriesIsPreserved() {
    double[] data = new double[40];
    Arrays.fill(data, 7);
    double[] smoothed = WeightedMean.smooth(data, KernelWeights.generate("henderson", 13));
    for (double v : smoothed) {
      assertEquals(7, v, 1e-9);
    }
  }

  @Test
  public void testWindowIsTruncatedAtTheEdges() {
    double[] smoothed = WeightedMean.smooth(new double[] {1, 2, 3, 4, 5}, new double[] {1, 2, 1});
    assertEquals(4.0 / 3, smoothed[0], EPS);
    assertEquals(2, smoothed[1], EPS);
    assertEquals(3, smoothed[2], EPS);
    assertEquals(14.0 / 3, smoothed[4], EPS);
  }

  @Test
  public void testMissingValuesAreSkipped() {
    double[] smoothed = WeightedMean.smooth(new double[] {1, NAN, 3}, new double[] {1, 1, 1});
    assertArrayEquals(new double[] {1, 2, 3}, smoothed, EPS);
  }

  @Test
  public void testAllMissingWindow() {
    double[] smoothed =
        WeightedMean.smooth(new double[] {NAN, NAN, NAN, 5}, new double[] {1, 1, 1});
    assertTrue(Double.isNaN(smoothed[0]));
    assertTrue(Double.isNaN(smoothed[1]));
    assertEquals(5, smoothed[2], EPS);
    assertEquals(5, smoothed[3], EPS);
  }

  @Test(expected = ShapeMismatchException.class)
  public void testEvenWeights() {
    WeightedMean.smooth(new double[] {1, 2, 3}, new double[] {1, 1});
  }

  @Test
  public void testDirections() {
    double[] data = {1, 2, 3, 4};
    double[] w = {1, 1, 1};
    double[] backward = WeightedMean.smooth(data, w, Direction.BACKWARD);
    assertArrayEquals(new double[] {1.5, 2.5, 3.5, 4}, backward, EPS);
    double[] forward = WeightedMean.smooth(data, w, Direction.FORWARD);
    assertArrayEquals(new double[] {1, 1.5, 2.5, 3.5}, forward, EPS);
    assertEquals(Direction.BACKWARD, Direction.fromName("back"));
  }

  @Test
  public void testSmoothColumns() {
    double[][] matrix = {{1, 10}, {2, NAN}, {3, 30}};
    double[][] smoothed = WeightedMean.smoothColumns(matrix, new double[] {1, 1, 1},
        Direction.CENTERED);
    assertArrayEquals(new double[] {1.5, 10}, smoothed[0], EPS);
    assertArrayEquals(new double[] {2, 20}, smoothed[1], EPS);
    assertArrayEquals(new double[] {2.5, 30}, smoothed[2], EPS);
  }
}
