package asl.specparam.output;

/**
 * The per-frequency arrays produced by a successful fit: the data that was fit, each model
 * component, and the intermediate spectra used while fitting. All arrays are in log10 power
 * unless stated otherwise and have one entry per frequency.
 */
public class ModelComponents {

  /**
   * Which part of the model to retrieve
   */
  public enum Component {
    FULL,
    APERIODIC,
    PEAK
  }

  private final double[] freqs;
  private final double[] powerSpectrum;
  private final double[] aperiodicFit;
  private final double[] peakFit;
  private final double[] fullModel;
  private final double[] flattenedSpectrum;
  private final double[] peakRemovedSpectrum;

  /**
   * Collect the components of a fit. Arrays are copied.
   *
   * @param freqs Frequencies of the data
   * @param powerSpectrum Log10 power of the data
   * @param aperiodicFit Aperiodic component from the final aperiodic fit
   * @param peakFit Sum of the fitted gaussians
   * @param flattenedSpectrum Data minus the final aperiodic fit
   * @param peakRemovedSpectrum Data minus the peak fit
   */
  public ModelComponents(double[] freqs, double[] powerSpectrum, double[] aperiodicFit,
      double[] peakFit, double[] flattenedSpectrum, double[] peakRemovedSpectrum) {
    this.freqs = freqs.clone();
    this.powerSpectrum = powerSpectrum.clone();
    this.aperiodicFit = aperiodicFit.clone();
    this.peakFit = peakFit.clone();
    this.flattenedSpectrum = flattenedSpectrum.clone();
    this.peakRemovedSpectrum = peakRemovedSpectrum.clone();
    fullModel = new double[freqs.length];
    for (int i = 0; i < fullModel.length; ++i) {
      fullModel[i] = aperiodicFit[i] + peakFit[i];
    }
  }

  public double[] getFreqs() {
    return freqs.clone();
  }

  public double[] getPowerSpectrum() {
    return powerSpectrum.clone();
  }

  public double[] getAperiodicFit() {
    return aperiodicFit.clone();
  }

  public double[] getPeakFit() {
    return peakFit.clone();
  }

  public double[] getFullModel() {
    return fullModel.clone();
  }

  public double[] getFlattenedSpectrum() {
    return flattenedSpectrum.clone();
  }

  public double[] getPeakRemovedSpectrum() {
    return peakRemovedSpectrum.clone();
  }

  /**
   * Get a model component in log10 or linear power. The model is additive in log space, so
   * in linear space the peak component is the linear full model less the linear aperiodic
   * component rather than the unlogged peak fit.
   *
   * @param component Which component to get
   * @param linear True to return linear power, false for log10 power
   * @return component values, one per frequency
   */
  public double[] getComponent(Component component, boolean linear) {
    switch (component) {
      case FULL:
        return linear ? unlog(fullModel) : fullModel.clone();
      case APERIODIC:
        return linear ? unlog(aperiodicFit) : aperiodicFit.clone();
      case PEAK:
        if (!linear) {
          return peakFit.clone();
        }
        double[] full = unlog(fullModel);
        double[] aperiodic = unlog(aperiodicFit);
        for (int i = 0; i < full.length; ++i) {
          full[i] -= aperiodic[i];
        }
        return full;
      default:
        throw new IllegalArgumentException("Component not understood: " + component);
    }
  }

  /**
   * Absolute difference between the data and the full model at each frequency
   *
   * @return pointwise error
   */
  public double[] getPointwiseError() {
    double[] error = new double[powerSpectrum.length];
    for (int i = 0; i < error.length; ++i) {
      error[i] = Math.abs(powerSpectrum[i] - fullModel[i]);
    }
    return error;
  }

  private static double[] unlog(double[] logValues) {
    double[] out = new double[logValues.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = Math.pow(10., logValues[i]);
    }
    return out;
  }

}
