package net.larse.seas.timeseries;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import net.larse.seas.exceptions.InvalidKernelParameterException;
import net.larse.seas.exceptions.UnsupportedKernelException;
import org.junit.Before;
import org.junit.Test;

public class KernelWeightsTest {
  private static final double EPS = 1e-12;

  private List<String> warnings;

  @Before
  public void setUp() {
    warnings = new ArrayList<>();
  }

  private static double sum(double[] w) {
    double s = 0;
    for (double v : w) {
      s += v;
    }
    return s;
  }

  private static void assertSymmetric(double[] w) {
    for (int i = 0; i < w.length / 2; i++) {
      assertEquals(w[i], w[w.length - 1 - i], 1e-10);
    }
  }

  @Test
  public void testCenteredMovingAverageEvenLength() {
    double[] w = KernelWeights.generate("cma", 12);
    assertEquals(13, w.length);
    assertEquals(1, sum(w), EPS);
    assertEquals(1.0 / 24, w[0], EPS);
    assertEquals(1.0 / 12, w[6], EPS);
    assertEquals(1.0 / 24, w[12], EPS);
  }

  @Test
  public void testCenteredMovingAverageFractionalLength() {
    double[] w = KernelWeights.generate("cma", 6.5);
    assertEquals(7, w.length);
    assertEquals(1, sum(w), EPS);
    // edge weights shrink to 0.75 before normalization
    assertEquals(0.75 / 6.5, w[0], EPS);
    assertEquals(1 / 6.5, w[3], EPS);
  }

  @Test
  public void testConvolvedMovingAverages() {
    double[] w = KernelWeights.generate("ma", 5, 4, 4);
    double[] expected = {1, 3, 6, 10, 13, 14, 13, 10, 6, 3, 1};
    for (int i = 0; i < expected.length; i++) {
      expected[i] /= 80;
    }
    assertArrayEquals(expected, w, EPS);
  }

  @Test
  public void testHendersonMatchesClosedForm() {
    int n = 13;
    double[] w = KernelWeights.generate("henderson", n);
    assertEquals(n, w.length);

    double m = (n + 3) / 2.0;
    double denominator = 8 * m * (m * m - 1) * (4 * m * m - 1) * (4 * m * m - 9)
        * (4 * m * m - 25);
    for (int j = -6; j <= 6; j++) {
      double expected = 315 * ((m - 1) * (m - 1) - j * j) * (m * m - j * j)
          * ((m + 1) * (m + 1) - j * j) * (3 * m * m - 16 - 11 * j * j) / denominator;
      assertEquals(expected, w[j + 6], 1e-9);
    }
  }

  @Test
  public void testBongard() {
    double[] w = KernelWeights.generate("bongard", 5);
    double[] expected = {-6 / 70.0, 24 / 70.0, 34 / 70.0, 24 / 70.0, -6 / 70.0};
    assertArrayEquals(expected, w, 1e-10);
  }

  @Test
  public void testRehommeLadirayReproducesQuadratics() {
    double[] w = KernelWeights.generate("rehomme-ladiray", 9, 3, 0.3);
    assertEquals(9, w.length);
    assertSymmetric(w);
    assertEquals(1, sum(w), 1e-10);
    double second = 0;
    for (int j = -4; j <= 4; j++) {
      second += j * j * w[j + 4];
    }
    assertEquals(0, second, 1e-9);
  }

  @Test
  public void testHendersonEvenLengthIsCorrected() {
    double[] w = KernelWeights.generate(KernelSpec.parse("henderson", 12), warnings::add);
    assertEquals(13, w.length);
    assertEquals(1, warnings.size());
    assertArrayEquals(KernelWeights.generate("henderson", 13), w, EPS);
  }

  @Test
  public void testRehommeLadirayWarnsOnLargeH() {
    double[] w = KernelWeights.generate(KernelSpec.parse("rehomme-ladiray", 7, 3, 2), warnings::add);
    assertEquals(7, w.length);
    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).contains("h = 2"));
  }

  @Test
  public void testSpencer() {
    double[] expected = {-3, -6, -5, 3, 21, 46, 67, 74, 67, 46, 21, 3, -5, -6, -3};
    for (int i = 0; i < expected.length; i++) {
      expected[i] /= 320;
    }
    assertArrayEquals(expected, KernelWeights.generate("spencer"), EPS);
    assertArrayEquals(expected, KernelWeights.generate("spencer", 1), EPS);
    assertEquals(29, KernelWeights.generate("spencer", 2).length);
  }

  @Test
  public void testTriangle() {
    assertArrayEquals(new double[] {0.25, 0.5, 0.25}, KernelWeights.generate("triangle", 5), EPS);
  }

  @Test
  public void testEpanechnikovDropsZeroWeights() {
    double[] w = KernelWeights.generate("epanech", 15);
    assertEquals(13, w.length);
    assertEquals(1, sum(w), EPS);
    assertSymmetric(w);
    for (double v : w) {
      assertTrue(v > 0);
    }
  }

  @Test
  public void testNarrowFiniteKernel() {
    assertArrayEquals(new double[] {1}, KernelWeights.generate("biweight", 1), EPS);
  }

  @Test
  public void testGaussianLength() {
    assertEquals(39, KernelWeights.generate("gaussian", 2).length);
    double[] w = KernelWeights.generate("gaussian", 2, 15);
    assertEquals(15, w.length);
    assertEquals(1, sum(w), EPS);
    assertSymmetric(w);
    assertTrue(w[7] > w[6]);
  }

  @Test
  public void testUnknownKernel() {
    try {
      KernelWeights.generate("foo", 3);
      fail("expected UnsupportedKernelException");
    } catch (UnsupportedKernelException e) {
      assertEquals("foo", e.getKernel());
    }
  }

  @Test
  public void testInvalidParameters() {
    try {
      KernelWeights.generate("cma", -1);
      fail("expected InvalidKernelParameterException");
    } catch (InvalidKernelParameterException e) {
      assertEquals(-1, e.getValue(), EPS);
    }
    try {
      KernelWeights.generate("rehomme-ladiray", 5, 7, 0.5);
      fail("expected InvalidKernelParameterException");
    } catch (InvalidKernelParameterException e) {
      assertEquals(7, e.getValue(), EPS);
    }
    try {
      KernelWeights.generate("spencer", 1.5);
      fail("expected InvalidKernelParameterException");
    } catch (InvalidKernelParameterException e) {
      assertEquals(1.5, e.getValue(), EPS);
    }
  }

  @Test(expected = InvalidKernelParameterException.class)
  public void testMissingArgument() {
    KernelWeights.generate("gaussian");
  }
}
