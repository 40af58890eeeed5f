package net.larse.seas.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.timeseries.EdgeHandling;
import net.larse.seas.timeseries.KernelWeights;
import net.larse.seas.timeseries.TimeSeriesUtils;
import net.larse.seas.timeseries.WeightedMean;
import org.junit.Before;
import org.junit.Test;

public class SeasTest {
  private static final double EPS = 1e-9;

  private double[] data;

  @Before
  public void setUp() {
    data = new double[84];
    for (int t = 0; t < data.length; t++) {
      // seasonal amplitude grows slowly
      data[t] = 50 + 0.3 * t + (2 + 0.02 * t) * Math.sin(2 * Math.PI * t / 7)
          + 0.1 * Math.cos(2.2 * t);
    }
  }

  private static Seas seas(String mode) {
    Seas.Args args = new Seas.Args();
    args.mode = mode;
    return new Seas(args);
  }

  @Test
  public void testAdditiveIdentity() {
    DecompositionResult.Component c = seas("add").getResult(data, 7);
    for (int t = 0; t < data.length; t++) {
      assertEquals(data[t], c.getTrend()[t] + c.getSeasonalFactor()[t] + c.getIrregular()[t],
          EPS);
      assertEquals(data[t], c.getSeasonallyAdjusted()[t] + c.getSeasonalFactor()[t], EPS);
      assertEquals(data[t], c.getTrend()[t] + c.getSeasonalIrregular()[t], EPS);
    }
    assertEquals(Mode.ADDITIVE, c.getMode());
    assertArrayEquals(new double[] {7}, c.getPeriods(), 0);
  }

  @Test
  public void testTrendUsesFractionalMovingAverages() {
    DecompositionResult.Component c = seas("add").getResult(data, 7);
    assertEquals("cma", c.getMethod());
    assertArrayEquals(new double[] {7, 3.5, 7 / 3.0}, c.getMethodArg(), 1e-15);

    double[] weights = KernelWeights.generate("cma", 7, 3.5, 7 / 3.0);
    // 7 + 5 + 3 terms convolved
    assertEquals(13, weights.length);
    int mirror = Seas.trendMirror(7);
    assertEquals(9, mirror);
    double[] expected = TimeSeriesUtils.trim(
        WeightedMean.smooth(TimeSeriesUtils.extend(data, EdgeHandling.MIRROR, mirror), weights),
        EdgeHandling.MIRROR, mirror);
    assertArrayEquals(expected, c.getTrend(), 1e-12);
  }

  @Test
  public void testSeasonalFactorMoves() {
    DecompositionResult.Component c = seas("add").getResult(data, 7);
    double[] sf = c.getSeasonalFactor();
    // same phase, cycles 2 and 9: the factor follows the growing amplitude
    assertTrue(sf[65] > sf[16] + 0.5);
    assertEquals((2 + 0.02 * 37) * Math.sin(2 * Math.PI * 37 / 7), sf[37], 0.3);
  }

  @Test
  public void testLogAdditiveIsAdditiveOnLogs() {
    DecompositionResult.Component logadd = new Seas().getResult(data, 7);
    DecompositionResult.Component add = seas("add").getResult(TimeSeriesUtils.log(data), 7);
    assertEquals(Mode.LOG_ADDITIVE, logadd.getMode());
    assertArrayEquals(TimeSeriesUtils.exp(add.getTrend()), logadd.getTrend(), EPS);
    assertArrayEquals(TimeSeriesUtils.exp(add.getSeasonalFactor()),
        logadd.getSeasonalFactor(), EPS);
    assertArrayEquals(data, logadd.getData(), 0);
  }

  @Test
  public void testMultiplicativeConstantSeries() {
    double[] constant = new double[30];
    Arrays.fill(constant, 8);
    DecompositionResult.Component c = seas("mult").getResult(constant, 4);
    for (int t = 0; t < constant.length; t++) {
      assertEquals(8, c.getTrend()[t], EPS);
      assertEquals(1, c.getSeasonalFactor()[t], EPS);
      assertEquals(1, c.getIrregular()[t], EPS);
    }
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testUnknownMode() {
    seas("cubic");
  }

  @Test(expected = InvalidConfigurationException.class)
  public void testNonPositiveData() {
    data[3] = 0;
    new Seas().getResult(data, 7);
  }
}
