package asl.specparam.input;

import asl.specparam.output.ErrorMetric;
import java.util.Arrays;

/**
 * Internal tuning values for the fitting procedure. These are not expected to be changed for
 * ordinary use; defaults come from {@link Configuration}.
 *
 * Aperiodic guess and bounds arrays always hold three values as {offset, knee, exponent},
 * and the knee entry is ignored when fitting without a knee. A NaN guess entry means the value
 * is derived from the data.
 */
public class AlgorithmSettings {

  public static final double DEFAULT_AP_PERCENTILE_THRESHOLD = 2.5;
  public static final double DEFAULT_BW_STD_EDGE = 1.0;
  public static final double DEFAULT_GAUSS_OVERLAP_THRESHOLD = 0.75;
  public static final double DEFAULT_CF_BOUND = 1.5;
  public static final int DEFAULT_MAX_EVALUATIONS = 5000;

  private final double apPercentileThreshold;
  private final double[] apGuess;
  private final double[] apLowerBounds;
  private final double[] apUpperBounds;
  private final double bwStdEdge;
  private final double gaussOverlapThreshold;
  private final double cfBound;
  private final int maxEvaluations;
  private final ErrorMetric errorMetric;

  private AlgorithmSettings(Builder builder) {
    apPercentileThreshold = builder.apPercentileThreshold;
    apGuess = builder.apGuess.clone();
    apLowerBounds = builder.apLowerBounds.clone();
    apUpperBounds = builder.apUpperBounds.clone();
    bwStdEdge = builder.bwStdEdge;
    gaussOverlapThreshold = builder.gaussOverlapThreshold;
    cfBound = builder.cfBound;
    maxEvaluations = builder.maxEvaluations;
    errorMetric = builder.errorMetric;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Compiled-in defaults, without reading any configuration file
   *
   * @return default settings
   */
  public static AlgorithmSettings defaults() {
    return builder().build();
  }

  /**
   * Percentile (0-100] of the flattened spectrum used to select the points for the second,
   * robust aperiodic fit
   *
   * @return percentile threshold
   */
  public double getApPercentileThreshold() {
    return apPercentileThreshold;
  }

  public double[] getApGuess() {
    return apGuess.clone();
  }

  public double[] getApLowerBounds() {
    return apLowerBounds.clone();
  }

  public double[] getApUpperBounds() {
    return apUpperBounds.clone();
  }

  /**
   * Distance a peak guess must be from either edge of the frequency range to be kept, in
   * units of its standard deviation
   *
   * @return edge threshold
   */
  public double getBwStdEdge() {
    return bwStdEdge;
  }

  /**
   * Half-width of the window around each peak guess used for overlap checks, in units of its
   * standard deviation
   *
   * @return overlap threshold
   */
  public double getGaussOverlapThreshold() {
    return gaussOverlapThreshold;
  }

  /**
   * Range a peak's center may move during fitting, as +/- 2 * cfBound standard deviations
   *
   * @return center frequency bound
   */
  public double getCfBound() {
    return cfBound;
  }

  /**
   * Maximum number of function evaluations (and iterations) allowed per solver call
   *
   * @return evaluation budget
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public ErrorMetric getErrorMetric() {
    return errorMetric;
  }

  /**
   * Start a builder holding the values of this instance
   *
   * @return builder pre-populated with these settings
   */
  public Builder toBuilder() {
    return builder()
        .apPercentileThreshold(apPercentileThreshold)
        .apGuess(apGuess)
        .apBounds(apLowerBounds, apUpperBounds)
        .bwStdEdge(bwStdEdge)
        .gaussOverlapThreshold(gaussOverlapThreshold)
        .cfBound(cfBound)
        .maxEvaluations(maxEvaluations)
        .errorMetric(errorMetric);
  }

  @Override
  public String toString() {
    return "AlgorithmSettings{apPercentileThreshold=" + apPercentileThreshold
        + ", apGuess=" + Arrays.toString(apGuess)
        + ", apLowerBounds=" + Arrays.toString(apLowerBounds)
        + ", apUpperBounds=" + Arrays.toString(apUpperBounds)
        + ", bwStdEdge=" + bwStdEdge
        + ", gaussOverlapThreshold=" + gaussOverlapThreshold
        + ", cfBound=" + cfBound
        + ", maxEvaluations=" + maxEvaluations
        + ", errorMetric=" + errorMetric + '}';
  }

  public static class Builder {

    private double apPercentileThreshold = DEFAULT_AP_PERCENTILE_THRESHOLD;
    private double[] apGuess = {Double.NaN, 0., Double.NaN};
    private double[] apLowerBounds =
        {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
    private double[] apUpperBounds =
        {Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
    private double bwStdEdge = DEFAULT_BW_STD_EDGE;
    private double gaussOverlapThreshold = DEFAULT_GAUSS_OVERLAP_THRESHOLD;
    private double cfBound = DEFAULT_CF_BOUND;
    private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
    private ErrorMetric errorMetric = ErrorMetric.MAE;

    private Builder() {
    }

    public Builder apPercentileThreshold(double apPercentileThreshold) {
      this.apPercentileThreshold = apPercentileThreshold;
      return this;
    }

    public Builder apGuess(double[] offsetKneeExponent) {
      apGuess = offsetKneeExponent.clone();
      return this;
    }

    public Builder apBounds(double[] lower, double[] upper) {
      apLowerBounds = lower.clone();
      apUpperBounds = upper.clone();
      return this;
    }

    public Builder bwStdEdge(double bwStdEdge) {
      this.bwStdEdge = bwStdEdge;
      return this;
    }

    public Builder gaussOverlapThreshold(double gaussOverlapThreshold) {
      this.gaussOverlapThreshold = gaussOverlapThreshold;
      return this;
    }

    public Builder cfBound(double cfBound) {
      this.cfBound = cfBound;
      return this;
    }

    public Builder maxEvaluations(int maxEvaluations) {
      this.maxEvaluations = maxEvaluations;
      return this;
    }

    public Builder errorMetric(ErrorMetric errorMetric) {
      this.errorMetric = errorMetric;
      return this;
    }

    /**
     * Check and build the settings
     *
     * @return immutable settings
     * @throws IllegalArgumentException if any setting is out of its valid range
     */
    public AlgorithmSettings build() {
      if (!(apPercentileThreshold > 0. && apPercentileThreshold <= 100.)) {
        throw new IllegalArgumentException("Percentile threshold must be in (0, 100]: "
            + apPercentileThreshold);
      }
      if (apGuess.length != 3 || apLowerBounds.length != 3 || apUpperBounds.length != 3) {
        throw new IllegalArgumentException(
            "Aperiodic guess and bounds must be given as {offset, knee, exponent}");
      }
      if (maxEvaluations < 1) {
        throw new IllegalArgumentException("Evaluation budget must be positive: "
            + maxEvaluations);
      }
      if (errorMetric == null) {
        throw new IllegalArgumentException("Error metric must be set");
      }
      return new AlgorithmSettings(this);
    }
  }

}
