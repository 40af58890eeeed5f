package net.larse.seas.timeseries;

import com.google.common.base.Preconditions;

/**
 * Hodrick-Prescott trend: minimizes sum((y - t)^2) + lambda * sum((second difference of t)^2),
 * i.e. solves (I + lambda * D'D) t = y.
 *
 * <p>The system is pentadiagonal and solved by a banded Cholesky factorization in linear time
 * and memory.
 */
public final class HodrickPrescottFilter {
  private final double lambda;

  public HodrickPrescottFilter(double lambda) {
    Preconditions.checkArgument(lambda >= 0 && !Double.isInfinite(lambda),
        "lambda must be a non-negative number, got %s", lambda);
    this.lambda = lambda;
  }

  /** Trend of y. y must not contain missing values. */
  public double[] filter(double[] y) {
    int n = y.length;
    if (n < 3) {
      return y.clone();
    }
    // bands of I + lambda * D'D: diag[i] = A(i,i), off1[i] = A(i,i+1), off2[i] = A(i,i+2)
    double[] diag = new double[n];
    double[] off1 = new double[n];
    double[] off2 = new double[n];
    for (int k = 0; k < n - 2; k++) {
      diag[k] += lambda;
      diag[k + 1] += 4 * lambda;
      diag[k + 2] += lambda;
      off1[k] -= 2 * lambda;
      off1[k + 1] -= 2 * lambda;
      off2[k] += lambda;
    }
    for (int i = 0; i < n; i++) {
      diag[i] += 1;
    }

    // A = L L', l0 the diagonal of L, l1[i] = L(i,i-1), l2[i] = L(i,i-2)
    double[] l0 = new double[n];
    double[] l1 = new double[n];
    double[] l2 = new double[n];
    for (int i = 0; i < n; i++) {
      if (i >= 2) {
        l2[i] = off2[i - 2] / l0[i - 2];
      }
      if (i >= 1) {
        l1[i] = (off1[i - 1] - (i >= 2 ? l2[i] * l1[i - 1] : 0)) / l0[i - 1];
      }
      double pivot = diag[i] - l1[i] * l1[i] - l2[i] * l2[i];
      if (!(pivot > 0)) {
        throw new IllegalStateException("Hodrick-Prescott system is not positive definite.");
      }
      l0[i] = Math.sqrt(pivot);
    }

    double[] z = new double[n];
    for (int i = 0; i < n; i++) {
      double v = y[i];
      if (i >= 1) {
        v -= l1[i] * z[i - 1];
      }
      if (i >= 2) {
        v -= l2[i] * z[i - 2];
      }
      z[i] = v / l0[i];
    }
    double[] trend = new double[n];
    for (int i = n - 1; i >= 0; i--) {
      double v = z[i];
      if (i + 1 < n) {
        v -= l1[i + 1] * trend[i + 1];
      }
      if (i + 2 < n) {
        v -= l2[i + 2] * trend[i + 2];
      }
      trend[i] = v / l0[i];
    }
    return trend;
  }
}
