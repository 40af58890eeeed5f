/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.seas.timeseries;

import com.google.common.annotations.VisibleForTesting;
import java.util.Arrays;
import java.util.function.Consumer;
import net.larse.seas.exceptions.InvalidKernelParameterException;
import net.larse.seas.helper.ArrayHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;

/**
 * Builds weight vectors that smooth a time series when used with {@link WeightedMean}.
 *
 * <p>Every kernel takes one or more numeric arguments. If more arguments are given than one
 * kernel consumes, the weights of the successive kernels are convolved, e.g. ma(5,4,4) is a
 * five term moving average convolved with two four term moving averages. The result of each
 * convolution is normalized to sum to one.
 *
 * <ul>
 *   <li>ma, cma: simple and centered moving averages. The centered version accepts fractional
 *       lengths by shrinking the two extreme weights.
 *   <li>epanechnikov, triangle, biweight, triweight, tricube, cosine, optcosine, cauchy: kernels
 *       with finite support, one argument (the bandwidth) each.
 *   <li>logistic, sigmoid, gaussian, exponential, silverman: kernels with infinite support. The
 *       first argument is the bandwidth. The vector is truncated where all remaining weights
 *       are below 1e-15, unless a second argument gives the length explicitly.
 *   <li>henderson(n), bongard(n), rehomme-ladiray(n, p, h): filters of length n that reproduce
 *       polynomials of degree p exactly and minimize a mix of the Henderson (h = 1) and the
 *       Bongard (h = 0) criteria.
 *   <li>spencer: the 15 term Spencer filter, or a convolution of several of them.
 * </ul>
 */
public final class KernelWeights {
  private static final Logger LOG = LogManager.getLogger(KernelWeights.class);

  // 5x4x4 triple moving average followed by a weighted MA(5)
  private static final double[] SPENCER_WEIGHTS = {-3, 3, 4, 3, -3};

  private KernelWeights() {}

  public static double[] generate(String name, double... params) {
    return generate(KernelSpec.parse(name, params));
  }

  public static double[] generate(KernelSpec spec) {
    return generate(spec, message -> {});
  }

  /**
   * Compute the weights of a kernel.
   *
   * @param spec kernel type and arguments
   * @param warnings receives a message whenever an argument had to be corrected
   */
  public static double[] generate(KernelSpec spec, Consumer<String> warnings) {
    double[] args = spec.getParams();
    KernelType type = spec.getType();

    if (type == KernelType.SPENCER) {
      return spencer(args);
    }
    if (args.length == 0) {
      throw new InvalidKernelParameterException(
          String.format("Kernel '%s' requires at least one argument.", type.getName()),
          Double.NaN);
    }

    double[] w = {1.0};
    int pos = 0;
    while (pos < args.length) {
      int remaining = args.length - pos;
      double[] next;
      switch (type) {
        case REHOMME_LADIRAY:
          next = rehommeLadiray(
              args[pos],
              remaining > 1 ? args[pos + 1] : Double.NaN,
              remaining > 2 ? args[pos + 2] : Double.NaN,
              warnings);
          pos += 3;
          break;
        case BONGARD:
          next = rehommeLadiray(args[pos++], Double.NaN, 0, warnings);
          break;
        case HENDERSON:
          next = rehommeLadiray(args[pos++], Double.NaN, 1, warnings);
          break;
        case CMA:
          next = centeredMovingAverage(checkPositive(type, args[pos++]));
          break;
        case MA:
          next = movingAverage(checkPositive(type, args[pos++]));
          break;
        default:
          if (type.getSupport() == KernelType.Support.FINITE) {
            next = finiteSupport(type, checkPositive(type, args[pos++]));
          } else {
            double bandwidth = checkPositive(type, args[pos]);
            double length;
            if (remaining > 1) {
              length = checkPositive(type, args[pos + 1]);
              pos += 2;
            } else {
              length = Math.ceil(bandwidth * type.getTruncation());
              pos += 1;
            }
            next = infiniteSupport(type, bandwidth, length);
          }
      }
      w = ArrayHelper.normalizeSum(ArrayHelper.convolve(w, next));
    }
    return w;
  }

  private static double checkPositive(KernelType type, double value) {
    if (!(value > 0) || Double.isInfinite(value)) {
      throw new InvalidKernelParameterException(String.format(
          "Kernel '%s' needs a positive length or bandwidth, got %s.", type.getName(), value),
          value);
    }
    return value;
  }

  private static double[] spencer(double[] args) {
    int repeats = 1;
    if (args.length == 1) {
      double r = args[0];
      if (r < 0 || r != Math.floor(r) || Double.isInfinite(r)) {
        throw new InvalidKernelParameterException(String.format(
            "The number of Spencer kernels to convolve must be a non-negative integer, got %s.",
            r), r);
      }
      repeats = Math.max(1, (int) r);
    } else if (args.length > 1) {
      throw new InvalidKernelParameterException(
          "The 'spencer' kernel can be followed by at most one numerical argument.",
          args[1]);
    }
    double[] single = ArrayHelper.convolve(
        ArrayHelper.convolve(SPENCER_WEIGHTS, ones(5)),
        ArrayHelper.convolve(ones(4), ones(4)));
    double[] w = {1.0};
    for (int i = 0; i < repeats; i++) {
      w = ArrayHelper.normalizeSum(ArrayHelper.convolve(w, single));
    }
    return w;
  }

  private static double[] movingAverage(double length) {
    return ones((int) Math.ceil(length));
  }

  private static double[] centeredMovingAverage(double length) {
    // next weakly larger odd number
    int odd = (int) Math.ceil((length - 1) / 2) * 2 + 1;
    double[] w = ones(odd);
    w[0] = 1 - (odd - length) / 2;
    w[odd - 1] = w[0];
    return w;
  }

  private static double[] finiteSupport(KernelType type, double bandwidth) {
    int lagLead = (int) Math.ceil((bandwidth - 1) / 2);
    if (lagLead <= 0) {
      return new double[] {1.0};
    }
    double scale = (bandwidth - 1) / 2;
    double[] values = new double[2 * lagLead + 1];
    boolean[] keep = new boolean[values.length];
    int count = 0;
    for (int i = -lagLead; i <= lagLead; i++) {
      double k = i / scale;
      double v;
      switch (type) {
        case EPANECHNIKOV:
          v = 1 - k * k;
          break;
        case TRIANGLE:
          v = 1 - Math.abs(k);
          break;
        case BIWEIGHT:
          v = Math.pow(1 - k * k, 2);
          break;
        case TRIWEIGHT:
          v = Math.pow(1 - k * k, 3);
          break;
        case TRICUBE:
          v = Math.pow(1 - Math.pow(Math.abs(k), 3), 3);
          break;
        case COSINE:
          v = 1 + Math.cos(k * Math.PI);
          break;
        case OPTCOSINE:
          v = Math.cos(k * Math.PI / 2);
          break;
        case CAUCHY:
          v = 1 / (1 + k * k);
          break;
        default:
          throw new IllegalStateException("Not a finite support kernel: " + type);
      }
      int idx = i + lagLead;
      values[idx] = v;
      // cauchy is evaluated on the whole grid
      keep[idx] = type == KernelType.CAUCHY || (v > 0 && Math.abs(k) <= 1);
      if (keep[idx]) {
        count++;
      }
    }
    double[] w = new double[count];
    int pos = 0;
    for (int i = 0; i < values.length; i++) {
      if (keep[i]) {
        w[pos++] = values[i];
      }
    }
    return w;
  }

  private static double[] infiniteSupport(KernelType type, double bandwidth, double length) {
    int lagLead = (int) Math.ceil((length - 1) / 2);
    double[] w = new double[2 * lagLead + 1];
    double s2 = Math.sqrt(2) / 2;
    for (int i = -lagLead; i <= lagLead; i++) {
      double k = i / bandwidth;
      double v;
      switch (type) {
        case LOGISTIC:
          v = 1 / (Math.exp(k) + Math.exp(-k) + 2);
          break;
        case SIGMOID:
          v = 2 / (Math.exp(k) + Math.exp(-k));
          break;
        case GAUSSIAN:
          v = Math.exp(-k * k / 2);
          break;
        case EXPONENTIAL:
          v = Math.exp(-Math.abs(k) / 2);
          break;
        case SILVERMAN:
          v = Math.exp(-Math.abs(k) * s2) * Math.cos(Math.abs(k) * s2);
          break;
        default:
          throw new IllegalStateException("Not an infinite support kernel: " + type);
      }
      w[i + lagLead] = v;
    }
    return w;
  }

  /**
   * The Rehomme-Ladiray filter of length n. It reproduces polynomials of degree p and minimizes
   * h times the Henderson criterion plus (1 - h) times the Bongard criterion. A NaN degree
   * defaults to 3, a NaN h to 0.5.
   */
  @VisibleForTesting
  static double[] rehommeLadiray(double n, double p, double h, Consumer<String> warnings) {
    if (!(n > 0) || Double.isInfinite(n)) {
      throw new InvalidKernelParameterException(String.format(
          "The Rehomme-Ladiray filter needs a positive length, got %s.", n), n);
    }
    if (Double.isNaN(h)) {
      h = 0.5;
    } else if (h > 1 || h < 0) {
      warn(warnings, String.format("You have chosen to set h = %f. The computations will be "
          + "performed, but values outside [0,1] do not make much sense.", h));
    }

    int degree;
    if (Double.isNaN(p)) {
      degree = 3;
    } else {
      if (p != Math.floor(p) || p < 1 || p > n) {
        throw new InvalidKernelParameterException(String.format("The Rehomme-Ladiray filter "
            + "requires the degree to be a positive integer not exceeding the length. Degree is "
            + "%s, length is %s.", p, n), p);
      }
      degree = (int) p;
      if (degree % 2 == 0) {
        degree++;
      }
    }

    int length = (int) Math.ceil(n);
    if (length != n || length % 2 != 1 || length < 3) {
      length = Math.max(length, 3);
      if (length % 2 != 1) {
        length++;
      }
      warn(warnings, String.format("The Rehomme-Ladiray filter is only defined for odd integers "
          + "greater than or equal to 3. You have chosen %s. The length is set to %d instead.",
          n, length));
    }

    // convex combination of the Henderson (third differences) and the Bongard (identity) criteria
    double[] band = {20, -15, 6, -1};
    double scale = 19 * h + 1;
    DenseMatrix64F a = new DenseMatrix64F(length, length);
    for (int i = 0; i < length; i++) {
      for (int j = 0; j < length; j++) {
        int d = Math.abs(i - j);
        double value = (d < band.length ? h * band[d] : 0) + (i == j ? 1 - h : 0);
        a.set(i, j, scale == 0 ? value : value / scale);
      }
    }

    // constraints: reproduce monomials of even degree below p
    int half = (length - 1) / 2;
    int numConstraints = (degree + 1) / 2;
    DenseMatrix64F c = new DenseMatrix64F(length, numConstraints);
    for (int i = 0; i < length; i++) {
      for (int j = 0; j < numConstraints; j++) {
        c.set(i, j, Math.pow(i - half, 2 * j));
      }
    }
    DenseMatrix64F alpha = new DenseMatrix64F(numConstraints, 1);
    alpha.set(0, 0, 1);

    DenseMatrix64F aInvC = new DenseMatrix64F(length, numConstraints);
    DenseMatrix64F cAInvC = new DenseMatrix64F(numConstraints, numConstraints);
    DenseMatrix64F lambda = new DenseMatrix64F(numConstraints, 1);
    DenseMatrix64F w = new DenseMatrix64F(length, 1);
    if (!CommonOps.solve(a, c, aInvC)) {
      throw new InvalidKernelParameterException(String.format(
          "The Rehomme-Ladiray criterion is singular for h = %s.", h), h);
    }
    CommonOps.multTransA(c, aInvC, cAInvC);
    if (!CommonOps.solve(cAInvC, alpha, lambda)) {
      throw new InvalidKernelParameterException(String.format(
          "The Rehomme-Ladiray constraints cannot be met with length %d.", length), length);
    }
    // multiplier lambda = -2 * (C'A^-1 C)^-1 alpha, weights w = -0.5 * A^-1 C lambda
    CommonOps.scale(-2, lambda);
    CommonOps.mult(aInvC, lambda, w);
    CommonOps.scale(-0.5, w);
    return w.getData();
  }

  private static void warn(Consumer<String> warnings, String message) {
    LOG.warn(message);
    warnings.accept(message);
  }

  private static double[] ones(int length) {
    double[] w = new double[length];
    Arrays.fill(w, 1.0);
    return w;
  }
}
