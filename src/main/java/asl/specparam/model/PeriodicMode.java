package asl.specparam.model;

/**
 * Forms of the periodic (peak) component. Parameters for n peaks are a flat array of
 * n consecutive parameter groups.
 */
public enum PeriodicMode implements FitFunction {

  /**
   * Sum of gaussians, each as {mean, height, standard deviation}
   */
  GAUSSIAN("gaussian", 3) {
    @Override
    public double[] evaluate(double[] freqs, double[] params) {
      checkGrouping(params);
      double[] out = new double[freqs.length];
      for (int p = 0; p < params.length; p += 3) {
        double center = params[p];
        double height = params[p + 1];
        double std = params[p + 2];
        double twoVar = 2 * std * std;
        for (int i = 0; i < freqs.length; ++i) {
          double diff = freqs[i] - center;
          out[i] += height * Math.exp(-(diff * diff) / twoVar);
        }
      }
      return out;
    }

    @Override
    public double[][] jacobian(double[] freqs, double[] params) {
      checkGrouping(params);
      double[][] jacobian = new double[freqs.length][params.length];
      for (int p = 0; p < params.length; p += 3) {
        double center = params[p];
        double height = params[p + 1];
        double std = params[p + 2];
        double variance = std * std;
        for (int i = 0; i < freqs.length; ++i) {
          double diff = freqs[i] - center;
          double diffSq = diff * diff;
          double exp = Math.exp(-diffSq / (2 * variance));
          jacobian[i][p] = height * exp * diff / variance;
          jacobian[i][p + 1] = exp;
          jacobian[i][p + 2] = height * exp * diffSq / (variance * std);
        }
      }
      return jacobian;
    }
  };

  private final String name;
  private final int parameterCount;

  PeriodicMode(String name, int parameterCount) {
    this.name = name;
    this.parameterCount = parameterCount;
  }

  /**
   * Get the mode matching the given name (case insensitive)
   *
   * @param name Name of the mode
   * @return matching mode
   */
  public static PeriodicMode fromName(String name) {
    for (PeriodicMode mode : values()) {
      if (mode.name.equalsIgnoreCase(name.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Periodic mode not understood: " + name);
  }

  public String getName() {
    return name;
  }

  @Override
  public int getParameterCount() {
    return parameterCount;
  }

  void checkGrouping(double[] params) {
    if (params.length % parameterCount != 0) {
      throw new IllegalArgumentException("Expected parameters in groups of " + parameterCount
          + " but got " + params.length + " values");
    }
  }

  /**
   * Build bounds for a joint fit of several peaks. Each center may move by
   * 2 * cfBound standard deviations of its guess width, restricted to the frequency range;
   * heights are non-negative; widths are restricted to the given standard deviation limits.
   *
   * @param guesses Guess rows as {center, height, std}
   * @param cfBound Center frequency bound, in units of guess standard deviation
   * @param stdLimits Lowest and highest allowed standard deviation
   * @param freqRange Lowest and highest frequency of the data
   * @return bounds on the flattened parameter array
   */
  public ParameterBounds buildBounds(double[][] guesses, double cfBound, double[] stdLimits,
      double[] freqRange) {
    double[] lower = new double[guesses.length * 3];
    double[] upper = new double[guesses.length * 3];
    for (int i = 0; i < guesses.length; ++i) {
      double center = guesses[i][0];
      double std = guesses[i][2];
      double lowCenter = center - 2 * cfBound * std;
      double highCenter = center + 2 * cfBound * std;
      if (!(lowCenter > freqRange[0])) {
        lowCenter = freqRange[0];
      }
      if (!(highCenter < freqRange[1])) {
        highCenter = freqRange[1];
      }
      int p = i * 3;
      lower[p] = lowCenter;
      upper[p] = highCenter;
      lower[p + 1] = 0.;
      upper[p + 1] = Double.POSITIVE_INFINITY;
      lower[p + 2] = stdLimits[0];
      upper[p + 2] = stdLimits[1];
    }
    return new ParameterBounds(lower, upper);
  }

  @Override
  public String toString() {
    return name;
  }

}
