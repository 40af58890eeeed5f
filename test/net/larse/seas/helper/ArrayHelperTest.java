package net.larse.seas.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.larse.seas.exceptions.ShapeMismatchException;
import org.junit.Test;

public class ArrayHelperTest {
  private static final double EPS = 1e-12;

  @Test
  public void testSplitPeriodsPadsLastRow() {
    double[] data = {1, 2, 3, 4, 5, 6, 7};
    double[][] split = ArrayHelper.splitPeriods(data, 3);

    assertEquals(3, split.length);
    assertArrayEquals(new double[] {1, 2, 3}, split[0], EPS);
    assertArrayEquals(new double[] {4, 5, 6}, split[1], EPS);
    assertEquals(7, split[2][0], EPS);
    assertTrue(Double.isNaN(split[2][1]));
    assertTrue(Double.isNaN(split[2][2]));
  }

  @Test
  public void testSplitPeriodsExactMultiple() {
    double[][] split = ArrayHelper.splitPeriods(new double[] {1, 2, 3, 4}, 2);
    assertEquals(2, split.length);
    assertArrayEquals(new double[] {3, 4}, split[1], EPS);
  }

  @Test
  public void testJoinPeriods() {
    double[] data = {1, 2, 3, 4, 5, 6, 7};
    double[][] split = ArrayHelper.splitPeriods(data, 4);
    assertArrayEquals(data, ArrayHelper.joinPeriods(split, 7), EPS);

    double[] longer = ArrayHelper.joinPeriods(new double[][] {{1, 2}}, 3);
    assertEquals(2, longer[1], EPS);
    assertTrue(Double.isNaN(longer[2]));
  }

  @Test
  public void testNormalize() {
    double[] a = {4, 9, Double.NaN};
    double[] b = {2, 3, 1};
    assertArrayEquals(new double[] {2, 6, Double.NaN}, ArrayHelper.normalize(a, b, false), EPS);
    assertArrayEquals(new double[] {2, 3, Double.NaN}, ArrayHelper.normalize(a, b, true), EPS);
  }

  @Test
  public void testNormalizeLengthMismatch() {
    try {
      ArrayHelper.normalize(new double[3], new double[2], false);
      fail("expected ShapeMismatchException");
    } catch (ShapeMismatchException e) {
      // expected
    }
  }

  @Test
  public void testFillHoles() {
    double[] data = {Double.NaN, 1, Double.NaN, Double.NaN, 4, Double.NaN};
    double[] filled = ArrayHelper.fillHoles(data);
    assertTrue(Double.isNaN(filled[0]));
    assertEquals(2, filled[2], EPS);
    assertEquals(3, filled[3], EPS);
    assertTrue(Double.isNaN(filled[5]));
    // input untouched
    assertTrue(Double.isNaN(data[2]));
  }

  @Test
  public void testBroadcastToLength() {
    assertEquals(Arrays.asList("a", "b", "b"),
        ArrayHelper.broadcastToLength(Arrays.asList("a", "b"), 3, "x"));
    assertEquals(Collections.singletonList("a"),
        ArrayHelper.broadcastToLength(Arrays.asList("a", "b"), 1, "x"));
    assertEquals(Arrays.asList("x", "x"), ArrayHelper.broadcastToLength(null, 2, "x"));
    List<String> empty = Collections.emptyList();
    assertEquals(Arrays.asList("x"), ArrayHelper.broadcastToLength(empty, 1, "x"));
  }

  @Test
  public void testConvolve() {
    double[] result = ArrayHelper.convolve(new double[] {1, 1, 1, 1}, new double[] {1, 1, 1, 1});
    assertArrayEquals(new double[] {1, 2, 3, 4, 3, 2, 1}, result, EPS);
  }

  @Test
  public void testNanMean() {
    assertEquals(2, ArrayHelper.nanMean(new double[] {1, Double.NaN, 3}), EPS);
    assertTrue(Double.isNaN(ArrayHelper.nanMean(new double[] {Double.NaN})));
  }
}
