package asl.specparam.model;

/**
 * Forms of the aperiodic (1/f-like) component. Each mode knows its function, its parameter
 * count, how to build its bounds and how to build an initial guess from data.
 *
 * Parameters are ordered as {offset, (knee), exponent}. Settings that cover every mode are
 * given as three-element {offset, knee, exponent} arrays, and each mode selects the entries it
 * uses.
 */
public enum AperiodicMode implements FitFunction {

  /**
   * Straight line in log-log space: offset - log10(f^exponent)
   */
  FIXED("fixed", 2) {
    @Override
    public double[] evaluate(double[] freqs, double[] params) {
      double offset = params[0];
      double exponent = params[1];
      double[] out = new double[freqs.length];
      for (int i = 0; i < freqs.length; ++i) {
        out[i] = offset - Math.log10(Math.pow(freqs[i], exponent));
      }
      return out;
    }

    @Override
    public double[][] jacobian(double[] freqs, double[] params) {
      double[][] jacobian = new double[freqs.length][2];
      for (int i = 0; i < freqs.length; ++i) {
        jacobian[i][0] = 1.;
        jacobian[i][1] = -Math.log10(freqs[i]);
      }
      return jacobian;
    }

    @Override
    double[] selectParameters(double[] offsetKneeExponent) {
      return new double[]{offsetKneeExponent[0], offsetKneeExponent[2]};
    }
  },

  /**
   * Power law with a bend: offset - log10(knee + f^exponent)
   */
  KNEE("knee", 3) {
    @Override
    public double[] evaluate(double[] freqs, double[] params) {
      double offset = params[0];
      double knee = params[1];
      double exponent = params[2];
      double[] out = new double[freqs.length];
      for (int i = 0; i < freqs.length; ++i) {
        out[i] = offset - Math.log10(knee + Math.pow(freqs[i], exponent));
      }
      return out;
    }

    @Override
    public double[][] jacobian(double[] freqs, double[] params) {
      double knee = params[1];
      double exponent = params[2];
      double[][] jacobian = new double[freqs.length][3];
      for (int i = 0; i < freqs.length; ++i) {
        double fExp = Math.pow(freqs[i], exponent);
        double denom = (knee + fExp) * LN_10;
        jacobian[i][0] = 1.;
        jacobian[i][1] = -1. / denom;
        jacobian[i][2] = -(fExp * Math.log(freqs[i])) / denom;
      }
      return jacobian;
    }

    @Override
    double[] selectParameters(double[] offsetKneeExponent) {
      return offsetKneeExponent.clone();
    }
  };

  private static final double LN_10 = Math.log(10.);

  private final String name;
  private final int parameterCount;

  AperiodicMode(String name, int parameterCount) {
    this.name = name;
    this.parameterCount = parameterCount;
  }

  /**
   * Get the mode matching the given name ("fixed" or "knee", case insensitive)
   *
   * @param name Name of the mode
   * @return matching mode
   */
  public static AperiodicMode fromName(String name) {
    for (AperiodicMode mode : values()) {
      if (mode.name.equalsIgnoreCase(name.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Aperiodic mode not understood: " + name);
  }

  /**
   * Infer which mode a set of aperiodic parameters was produced by, from its length
   *
   * @param parameterCount number of aperiodic parameters
   * @return mode taking that many parameters
   */
  public static AperiodicMode fromParameterCount(int parameterCount) {
    for (AperiodicMode mode : values()) {
      if (mode.parameterCount == parameterCount) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "Aperiodic parameters not consistent with any available option: " + parameterCount);
  }

  /**
   * Pick out the parameters used by this mode from an {offset, knee, exponent} array
   *
   * @param offsetKneeExponent full three-parameter array
   * @return the values this mode uses, in this mode's parameter order
   */
  abstract double[] selectParameters(double[] offsetKneeExponent);

  public String getName() {
    return name;
  }

  @Override
  public int getParameterCount() {
    return parameterCount;
  }

  /**
   * Build bounds for this mode from bounds given for all of {offset, knee, exponent}
   *
   * @param lower lower bounds on offset, knee, exponent
   * @param upper upper bounds on offset, knee, exponent
   * @return bounds on this mode's parameters
   */
  public ParameterBounds buildBounds(double[] lower, double[] upper) {
    return new ParameterBounds(selectParameters(lower), selectParameters(upper));
  }

  /**
   * Build an initial guess for fitting this mode. Entries of the supplied guess that are NaN
   * are derived from the data: the offset from the first power value, and the exponent as the
   * absolute log-log slope between the first and last points.
   *
   * @param freqs Frequency values, linear space
   * @param spectrum Power values, log10 space
   * @param offsetKneeExponent Guess values as {offset, knee, exponent}, NaN to derive
   * @return starting point for the solver
   */
  public double[] initialGuess(double[] freqs, double[] spectrum, double[] offsetKneeExponent) {
    int last = freqs.length - 1;
    double offset = offsetKneeExponent[0];
    if (Double.isNaN(offset)) {
      offset = spectrum[0];
    }
    double exponent = offsetKneeExponent[2];
    if (Double.isNaN(exponent)) {
      exponent = Math.abs((spectrum[last] - spectrum[0])
          / (Math.log10(freqs[last]) - Math.log10(freqs[0])));
    }
    return selectParameters(new double[]{offset, offsetKneeExponent[1], exponent});
  }

  @Override
  public String toString() {
    return name;
  }

}
