package net.larse.seas.timeseries;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import net.larse.seas.exceptions.InvalidConfigurationException;
import net.larse.seas.helper.NameResolver;

/** A trend method with its arguments. Kernel trends also carry the kernel type. */
public final class TrendSpec {
  private static final NameResolver<Enum<?>> NAMES = new NameResolver<>();

  static {
    for (TrendMethod method : TrendMethod.values()) {
      if (method != TrendMethod.KERNEL) {
        NAMES.add(method, method.getName());
      }
    }
    for (KernelType type : KernelType.values()) {
      NAMES.add(type, type.getAliases());
    }
  }

  private final TrendMethod method;
  private final KernelType kernel;
  private final double[] args;

  private TrendSpec(TrendMethod method, KernelType kernel, double[] args) {
    this.method = method;
    this.kernel = kernel;
    this.args = args == null ? new double[0] : args.clone();
  }

  public static TrendSpec of(TrendMethod method, double... args) {
    Preconditions.checkArgument(method != TrendMethod.KERNEL, "kernel trends need a kernel type");
    return new TrendSpec(method, null, args);
  }

  public static TrendSpec kernel(KernelType kernel, double... args) {
    return new TrendSpec(TrendMethod.KERNEL, Preconditions.checkNotNull(kernel), args);
  }

  /**
   * Build a spec from a method or kernel name (or an unambiguous abbreviation of one).
   *
   * @throws InvalidConfigurationException if the name is unknown or ambiguous
   */
  public static TrendSpec parse(String name, double... args) {
    Enum<?> target = NAMES.resolve(name);
    if (target instanceof KernelType) {
      return kernel((KernelType) target, args);
    }
    if (target instanceof TrendMethod) {
      return of((TrendMethod) target, args);
    }
    throw new InvalidConfigurationException(String.format("Unknown trend method '%s'.", name));
  }

  /** Same method and kernel, other arguments. */
  public TrendSpec withArgs(double... newArgs) {
    return new TrendSpec(method, kernel, newArgs);
  }

  public TrendMethod getMethod() {
    return method;
  }

  /** The kernel type, null unless the method is {@link TrendMethod#KERNEL}. */
  public KernelType getKernel() {
    return kernel;
  }

  public double[] getArgs() {
    return args.clone();
  }

  public boolean hasArgs() {
    return args.length > 0;
  }

  /** The method name, or the kernel name for kernel trends. */
  public String getName() {
    return kernel == null ? method.getName() : kernel.getName();
  }

  @Override
  public String toString() {
    return getName() + Arrays.toString(args);
  }
}
