package net.larse.seas.timeseries;

import com.google.common.base.Preconditions;
import net.larse.seas.helper.FitGenerator;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

/**
 * Cubic smoothing spline evaluated at its knots.
 *
 * <p>Minimizes p * sum((y - f(x))^2) + (1 - p) * integral(f''^2). p = 1 interpolates the data,
 * p = 0 is the least squares straight line. The fitted values are computed in the Reinsch form:
 * g = y - a Q gamma with (R + a Q'Q) gamma = Q'y and a = (1 - p) / p.
 */
public final class SmoothingSpline {
  private final double p;

  public SmoothingSpline(double p) {
    Preconditions.checkArgument(p >= 0 && p <= 1, "smoothing parameter must be in [0,1], got %s",
        p);
    this.p = p;
  }

  /**
   * Fitted values at the sites x.
   *
   * @param x strictly increasing sites
   * @param y values at the sites, no missing values
   */
  public double[] fit(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length);
    int n = x.length;
    if (n < 3 || p == 1) {
      return y.clone();
    }
    if (p == 0) {
      return straightLine(x, y);
    }

    double[] h = new double[n - 1];
    for (int i = 0; i < n - 1; i++) {
      h[i] = x[i + 1] - x[i];
    }
    int m = n - 2;
    DenseMatrix64F q = new DenseMatrix64F(n, m);
    DenseMatrix64F r = new DenseMatrix64F(m, m);
    for (int j = 0; j < m; j++) {
      q.set(j, j, 1 / h[j]);
      q.set(j + 1, j, -1 / h[j] - 1 / h[j + 1]);
      q.set(j + 2, j, 1 / h[j + 1]);
      r.set(j, j, (h[j] + h[j + 1]) / 3);
      if (j + 1 < m) {
        r.set(j, j + 1, h[j + 1] / 6);
        r.set(j + 1, j, h[j + 1] / 6);
      }
    }

    double a = (1 - p) / p;
    DenseMatrix64F system = new DenseMatrix64F(m, m);
    CommonOps.multTransA(q, q, system);
    CommonOps.scale(a, system);
    CommonOps.addEquals(system, r);

    DenseMatrix64F values = DenseMatrix64F.wrap(n, 1, y.clone());
    DenseMatrix64F qty = new DenseMatrix64F(m, 1);
    CommonOps.multTransA(q, values, qty);
    DenseMatrix64F gamma = new DenseMatrix64F(m, 1);
    if (!CommonOps.solve(system, qty, gamma)) {
      throw new IllegalStateException("Smoothing spline system is singular.");
    }
    DenseMatrix64F correction = new DenseMatrix64F(n, 1);
    CommonOps.mult(q, gamma, correction);
    double[] fitted = new double[n];
    for (int i = 0; i < n; i++) {
      fitted[i] = y[i] - a * correction.get(i, 0);
    }
    return fitted;
  }

  private static double[] straightLine(double[] x, double[] y) {
    FitGenerator fitGenerator = new FitGenerator();
    fitGenerator.init(x.length, 2);
    for (int i = 0; i < x.length; i++) {
      fitGenerator.setObservation(i, 0, 1);
      fitGenerator.setObservation(i, 1, x[i]);
      fitGenerator.setTarget(i, y[i]);
    }
    double[] beta = fitGenerator.linearFit();
    double[] fitted = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      fitted[i] = beta[0] + beta[1] * x[i];
    }
    return fitted;
  }
}
