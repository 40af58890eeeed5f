package net.larse.seas.timeseries;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import net.larse.seas.exceptions.UnsupportedKernelException;

/** A kernel type together with its numeric arguments. */
public final class KernelSpec {
  private final KernelType type;
  private final double[] params;

  public KernelSpec(KernelType type, double... params) {
    this.type = Preconditions.checkNotNull(type);
    this.params = params == null ? new double[0] : params.clone();
  }

  /**
   * Build a spec from a kernel name.
   *
   * @throws UnsupportedKernelException if no kernel has this name
   */
  public static KernelSpec parse(String name, double... params) {
    KernelType type = KernelType.fromName(name);
    if (type == null) {
      throw new UnsupportedKernelException(name);
    }
    return new KernelSpec(type, params);
  }

  public KernelType getType() {
    return type;
  }

  public double[] getParams() {
    return params.clone();
  }

  @Override
  public String toString() {
    return type.getName() + Arrays.toString(params);
  }
}
