package asl.specparam.input;

import asl.specparam.model.AperiodicMode;
import java.util.Arrays;

/**
 * User-facing settings for fitting a spectrum. Immutable; create with {@link #builder()}.
 */
public class ModelSettings {

  /**
   * Value of max peaks meaning there is no limit on the number of peaks
   */
  public static final int UNLIMITED_PEAKS = Integer.MAX_VALUE;

  private final double[] peakWidthLimits;
  private final int maxNPeaks;
  private final double minPeakHeight;
  private final double peakThreshold;
  private final AperiodicMode aperiodicMode;

  private ModelSettings(Builder builder) {
    peakWidthLimits = builder.peakWidthLimits.clone();
    maxNPeaks = builder.maxNPeaks;
    minPeakHeight = builder.minPeakHeight;
    peakThreshold = builder.peakThreshold;
    aperiodicMode = builder.aperiodicMode;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Settings with all defaults: width limits of 0.5 to 12 Hz, no peak limit, no minimum
   * height, a relative threshold of 2 standard deviations, and no knee
   *
   * @return default settings
   */
  public static ModelSettings defaults() {
    return builder().build();
  }

  /**
   * Limits on the (two-sided) width of a peak, in Hz
   *
   * @return {lower, upper}
   */
  public double[] getPeakWidthLimits() {
    return peakWidthLimits.clone();
  }

  /**
   * Peak width limits converted to gaussian standard deviation limits (half the bandwidth)
   *
   * @return {lower, upper}
   */
  public double[] getGaussStdLimits() {
    return new double[]{peakWidthLimits[0] / 2, peakWidthLimits[1] / 2};
  }

  public int getMaxNPeaks() {
    return maxNPeaks;
  }

  /**
   * Absolute threshold on peak height, in log10 power units above the aperiodic fit
   *
   * @return minimum peak height
   */
  public double getMinPeakHeight() {
    return minPeakHeight;
  }

  /**
   * Relative threshold on peak height, in units of standard deviation of the flattened
   * spectrum
   *
   * @return peak threshold
   */
  public double getPeakThreshold() {
    return peakThreshold;
  }

  public AperiodicMode getAperiodicMode() {
    return aperiodicMode;
  }

  @Override
  public String toString() {
    return "ModelSettings{peakWidthLimits=" + Arrays.toString(peakWidthLimits)
        + ", maxNPeaks=" + (maxNPeaks == UNLIMITED_PEAKS ? "inf" : String.valueOf(maxNPeaks))
        + ", minPeakHeight=" + minPeakHeight
        + ", peakThreshold=" + peakThreshold
        + ", aperiodicMode=" + aperiodicMode + '}';
  }

  public static class Builder {

    private double[] peakWidthLimits = {0.5, 12.0};
    private int maxNPeaks = UNLIMITED_PEAKS;
    private double minPeakHeight = 0.;
    private double peakThreshold = 2.0;
    private AperiodicMode aperiodicMode = AperiodicMode.FIXED;

    private Builder() {
    }

    public Builder peakWidthLimits(double lower, double upper) {
      peakWidthLimits = new double[]{lower, upper};
      return this;
    }

    public Builder maxNPeaks(int maxNPeaks) {
      this.maxNPeaks = maxNPeaks;
      return this;
    }

    public Builder minPeakHeight(double minPeakHeight) {
      this.minPeakHeight = minPeakHeight;
      return this;
    }

    public Builder peakThreshold(double peakThreshold) {
      this.peakThreshold = peakThreshold;
      return this;
    }

    public Builder aperiodicMode(AperiodicMode aperiodicMode) {
      this.aperiodicMode = aperiodicMode;
      return this;
    }

    /**
     * Check and build the settings
     *
     * @return immutable settings
     * @throws IllegalArgumentException if any setting is out of its valid range
     */
    public ModelSettings build() {
      if (!(peakWidthLimits[0] > 0.) || !(peakWidthLimits[1] >= peakWidthLimits[0])) {
        throw new IllegalArgumentException("Peak width limits must be positive and given as "
            + "{lower, upper}: " + Arrays.toString(peakWidthLimits));
      }
      if (maxNPeaks < 0) {
        throw new IllegalArgumentException("Max number of peaks must not be negative: "
            + maxNPeaks);
      }
      if (!(minPeakHeight >= 0.)) {
        throw new IllegalArgumentException("Minimum peak height must not be negative: "
            + minPeakHeight);
      }
      if (!(peakThreshold >= 0.)) {
        throw new IllegalArgumentException("Peak threshold must not be negative: "
            + peakThreshold);
      }
      if (aperiodicMode == null) {
        throw new IllegalArgumentException("Aperiodic mode must be set");
      }
      return new ModelSettings(this);
    }
  }

}
