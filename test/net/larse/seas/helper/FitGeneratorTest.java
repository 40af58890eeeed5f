package net.larse.seas.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class FitGeneratorTest {

  @Test
  public void testLinearFit() {
    FitGenerator fitGenerator = new FitGenerator();
    fitGenerator.init(5, 2);
    for (int i = 0; i < 5; i++) {
      fitGenerator.setObservation(i, 0, 1);
      fitGenerator.setObservation(i, 1, i);
      fitGenerator.setTarget(i, 3 - 2 * i);
    }
    double[] beta = fitGenerator.linearFit();
    assertEquals(3, beta[0], 1e-10);
    assertEquals(-2, beta[1], 1e-10);
  }

  @Test
  public void testTooFewObservations() {
    FitGenerator fitGenerator = new FitGenerator();
    fitGenerator.init(1, 2);
    fitGenerator.setObservation(0, 0, 1);
    fitGenerator.setObservation(0, 1, 1);
    fitGenerator.setTarget(0, 1);
    assertNull(fitGenerator.linearFit());
  }
}
