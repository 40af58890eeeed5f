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

package net.larse.seas.algorithms;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The outcome of a decomposition: one component per period, in the order the periods were
 * processed, optionally followed by an aggregate over all periods.
 */
public final class DecompositionResult {
  private final double[] dates;
  private final List<Component> components;
  private final boolean aggregated;
  private final List<String> warnings;

  DecompositionResult(double[] dates, List<Component> components, boolean aggregated,
      List<String> warnings) {
    this.dates = dates.clone();
    this.components = ImmutableList.copyOf(components);
    this.aggregated = aggregated;
    this.warnings = ImmutableList.copyOf(warnings);
  }

  public double[] getDates() {
    return dates.clone();
  }

  public List<Component> getComponents() {
    return components;
  }

  /** The last component: the aggregate if there is one, the last period otherwise. */
  public Component getFinal() {
    return components.get(components.size() - 1);
  }

  /** True if the last component combines all periods. */
  public boolean isAggregated() {
    return aggregated;
  }

  /** Messages about arguments that were corrected during the computation. */
  public List<String> getWarnings() {
    return warnings;
  }

  /** Decomposition for one period, or the aggregate over several. */
  public static final class Component {
    private final double[] periods;
    private final Mode mode;
    private final String method;
    private final double[] methodArg;
    private final double[] data;
    private final double[] trend;
    private final double[] seasonallyAdjusted;
    private final double[] seasonalFactor;
    private final double[] seasonalIrregular;
    private final double[] irregular;

    Component(double[] periods, Mode mode, String method, double[] methodArg, double[] data,
        double[] trend, double[] seasonallyAdjusted, double[] seasonalFactor,
        double[] seasonalIrregular, double[] irregular) {
      this.periods = periods.clone();
      this.mode = mode;
      this.method = method;
      this.methodArg = methodArg == null ? null : methodArg.clone();
      this.data = data.clone();
      this.trend = trend.clone();
      this.seasonallyAdjusted = seasonallyAdjusted.clone();
      this.seasonalFactor = seasonalFactor.clone();
      this.seasonalIrregular = seasonalIrregular.clone();
      this.irregular = irregular.clone();
    }

    /** The period of this component; all periods for the aggregate. */
    public double[] getPeriods() {
      return periods.clone();
    }

    public boolean isAggregate() {
      return periods.length > 1;
    }

    public Mode getMode() {
      return mode;
    }

    /** Name of the trend method; a comma separated list for the aggregate. */
    public String getMethod() {
      return method;
    }

    /** Arguments the trend method was run with; null for the aggregate. */
    public double[] getMethodArg() {
      return methodArg == null ? null : methodArg.clone();
    }

    /** Input of this stage, before any log transformation. */
    public double[] getData() {
      return data.clone();
    }

    public double[] getTrend() {
      return trend.clone();
    }

    public double[] getSeasonallyAdjusted() {
      return seasonallyAdjusted.clone();
    }

    public double[] getSeasonalFactor() {
      return seasonalFactor.clone();
    }

    public double[] getSeasonalIrregular() {
      return seasonalIrregular.clone();
    }

    public double[] getIrregular() {
      return irregular.clone();
    }
  }
}
