package asl.specparam.output;

import asl.specparam.model.AperiodicMode;
import asl.specparam.utils.NumericUtils;
import asl.specparam.utils.SpectrumUtils;
import java.text.DecimalFormat;
import java.util.Arrays;

/**
 * Parameters and goodness of fit produced by fitting one spectrum.
 *
 * Peak parameters are rows of {center frequency, power over the aperiodic fit, bandwidth}
 * and gaussian parameters are rows of {mean, height, standard deviation}. Both are sorted by
 * ascending center frequency. A failed fit is represented by the null result: NaN aperiodic
 * parameters, no peaks, NaN r-squared and error, and no model components.
 */
public class FitResult {

  private final AperiodicMode aperiodicMode;
  private final double[] aperiodicParams;
  private final double[][] peakParams;
  private final double[][] gaussianParams;
  private final double rSquared;
  private final double error;
  private final ModelComponents components;

  public FitResult(AperiodicMode aperiodicMode, double[] aperiodicParams, double[][] peakParams,
      double[][] gaussianParams, double rSquared, double error, ModelComponents components) {
    if (aperiodicParams.length != aperiodicMode.getParameterCount()) {
      throw new IllegalArgumentException("Expected " + aperiodicMode.getParameterCount()
          + " aperiodic parameters for mode " + aperiodicMode + ", got "
          + aperiodicParams.length);
    }
    if (peakParams.length != gaussianParams.length) {
      throw new IllegalArgumentException("Peak and gaussian parameters describe different "
          + "numbers of peaks");
    }
    this.aperiodicMode = aperiodicMode;
    this.aperiodicParams = aperiodicParams.clone();
    this.peakParams = SpectrumUtils.copyRows(peakParams);
    this.gaussianParams = SpectrumUtils.copyRows(gaussianParams);
    this.rSquared = rSquared;
    this.error = error;
    this.components = components;
  }

  /**
   * Result representing a failed fit
   *
   * @param aperiodicMode Mode the fit was run with
   * @return result with NaN parameters and metrics and no peaks
   */
  public static FitResult nullResult(AperiodicMode aperiodicMode) {
    return new FitResult(aperiodicMode,
        NumericUtils.nanArray(aperiodicMode.getParameterCount()),
        new double[0][3], new double[0][3], Double.NaN, Double.NaN, null);
  }

  /**
   * Whether this result holds a fitted model, rather than being the null result
   *
   * @return true if the fit succeeded
   */
  public boolean hasModel() {
    return components != null;
  }

  public AperiodicMode getAperiodicMode() {
    return aperiodicMode;
  }

  public double[] getAperiodicParams() {
    return aperiodicParams.clone();
  }

  public double[][] getPeakParams() {
    return SpectrumUtils.copyRows(peakParams);
  }

  public double[][] getGaussianParams() {
    return SpectrumUtils.copyRows(gaussianParams);
  }

  public int getNumberOfPeaks() {
    return peakParams.length;
  }

  public double getRSquared() {
    return rSquared;
  }

  public double getError() {
    return error;
  }

  /**
   * Arrays produced during fitting, for inspecting the model
   *
   * @return model components, or null if this is the null result
   */
  public ModelComponents getComponents() {
    return components;
  }

  /**
   * Exponent of the aperiodic fit
   *
   * @return exponent (last aperiodic parameter)
   */
  public double getExponent() {
    return aperiodicParams[aperiodicParams.length - 1];
  }

  /**
   * Frequency at which the knee occurs, in Hz
   *
   * @return knee frequency, or NaN if the fit was run without a knee
   */
  public double getKneeFrequency() {
    if (aperiodicMode != AperiodicMode.KNEE) {
      return Double.NaN;
    }
    return SpectrumUtils.computeKneeFrequency(aperiodicParams[1], aperiodicParams[2]);
  }

  /**
   * Produce a readable summary of the fit parameters and metrics
   *
   * @return multi-line text
   */
  public String getResultString() {
    DecimalFormat df = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    sb.append("Aperiodic mode: ").append(aperiodicMode).append('\n');
    sb.append("Aperiodic parameters (offset, ");
    if (aperiodicMode == AperiodicMode.KNEE) {
      sb.append("knee, ");
    }
    sb.append("exponent):\n");
    for (int i = 0; i < aperiodicParams.length; ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(df.format(aperiodicParams[i]));
    }
    sb.append('\n');
    sb.append(peakParams.length).append(" peaks were found:\n");
    for (double[] peak : peakParams) {
      sb.append("CF: ").append(df.format(peak[0]));
      sb.append(", PW: ").append(df.format(peak[1]));
      sb.append(", BW: ").append(df.format(peak[2])).append('\n');
    }
    sb.append("R^2 of model fit: ").append(df.format(rSquared)).append('\n');
    sb.append("Error of the fit: ").append(df.format(error));
    return sb.toString();
  }

  @Override
  public String toString() {
    return "FitResult{mode=" + aperiodicMode
        + ", aperiodicParams=" + Arrays.toString(aperiodicParams)
        + ", peaks=" + peakParams.length
        + ", rSquared=" + rSquared
        + ", error=" + error + '}';
  }

}
