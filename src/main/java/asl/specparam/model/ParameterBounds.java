package asl.specparam.model;

import java.util.Arrays;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.RealVector;

/**
 * Lower and upper limits on each parameter of a fit. Used by the solver as a parameter
 * validator: every trial point is projected back into the box before it is evaluated, so the
 * solver only ever sees in-bounds parameters.
 */
public class ParameterBounds implements ParameterValidator {

  private final double[] lower;
  private final double[] upper;

  /**
   * Create a set of bounds
   *
   * @param lower Lowest allowed value of each parameter (may be negative infinity)
   * @param upper Highest allowed value of each parameter (may be positive infinity)
   */
  public ParameterBounds(double[] lower, double[] upper) {
    if (lower.length != upper.length) {
      throw new IllegalArgumentException("Lower and upper bounds must be the same length");
    }
    for (int i = 0; i < lower.length; ++i) {
      if (Double.isNaN(lower[i]) || Double.isNaN(upper[i])) {
        throw new IllegalArgumentException("Bounds for parameter " + i + " must not be NaN");
      }
      if (lower[i] > upper[i]) {
        throw new IllegalArgumentException("Lower bound " + lower[i] + " exceeds upper bound "
            + upper[i] + " for parameter " + i);
      }
    }
    this.lower = lower.clone();
    this.upper = upper.clone();
  }

  /**
   * Bounds that put no restriction on any of the given number of parameters
   *
   * @param dimension number of parameters
   * @return unbounded limits
   */
  public static ParameterBounds unbounded(int dimension) {
    double[] lower = new double[dimension];
    double[] upper = new double[dimension];
    Arrays.fill(lower, Double.NEGATIVE_INFINITY);
    Arrays.fill(upper, Double.POSITIVE_INFINITY);
    return new ParameterBounds(lower, upper);
  }

  public int getDimension() {
    return lower.length;
  }

  public double[] getLower() {
    return lower.clone();
  }

  public double[] getUpper() {
    return upper.clone();
  }

  /**
   * Project a point into the bounds
   *
   * @param point Parameter values
   * @return copy of the point with each value clipped to its bounds
   */
  public double[] clip(double[] point) {
    double[] out = point.clone();
    for (int i = 0; i < out.length; ++i) {
      out[i] = Math.min(Math.max(out[i], lower[i]), upper[i]);
    }
    return out;
  }

  @Override
  public RealVector validate(RealVector params) {
    for (int i = 0; i < params.getDimension(); ++i) {
      double value = params.getEntry(i);
      if (value < lower[i]) {
        params.setEntry(i, lower[i]);
      } else if (value > upper[i]) {
        params.setEntry(i, upper[i]);
      }
    }
    return params;
  }

}
