package asl.specparam.fit;

import asl.specparam.model.AperiodicMode;
import asl.specparam.model.PeriodicMode;
import asl.specparam.output.ErrorMetric;
import asl.specparam.output.FitResult;
import asl.specparam.output.ModelComponents;
import asl.specparam.utils.NumericUtils;

/**
 * Builds the model spectrum from fitted parameters, converts gaussian parameters to peak
 * parameters and scores the model against the data.
 */
public class ModelAssembler {

  private final AperiodicMode aperiodicMode;
  private final ErrorMetric errorMetric;

  public ModelAssembler(AperiodicMode aperiodicMode, ErrorMetric errorMetric) {
    this.aperiodicMode = aperiodicMode;
    this.errorMetric = errorMetric;
  }

  /**
   * Put together a result from the final parameters of a fit
   *
   * @param freqs Frequencies of the data
   * @param powerSpectrum Log10 power of the data
   * @param aperiodicParams Final aperiodic parameters
   * @param gaussianParams Fitted gaussians as rows of {mean, height, std}, ascending by mean
   * @param peakFit Sum of the fitted gaussians at each frequency
   * @return completed result, with components
   */
  public FitResult assemble(double[] freqs, double[] powerSpectrum, double[] aperiodicParams,
      double[][] gaussianParams, double[] peakFit) {
    double[] apFit = aperiodicMode.evaluate(freqs, aperiodicParams);
    double[] flat = NumericUtils.subtract(powerSpectrum, apFit);
    double[] peakRemoved = NumericUtils.subtract(powerSpectrum, peakFit);
    ModelComponents components =
        new ModelComponents(freqs, powerSpectrum, apFit, peakFit, flat, peakRemoved);
    double[] fullModel = components.getFullModel();

    double[][] peakParams = createPeakParams(freqs, gaussianParams, fullModel, apFit);
    double rSquared = computeRSquared(powerSpectrum, fullModel);
    double error = errorMetric.compute(powerSpectrum, fullModel);

    return new FitResult(aperiodicMode, aperiodicParams, peakParams, gaussianParams,
        rSquared, error, components);
  }

  /**
   * Sum of the given gaussians at each frequency
   *
   * @param freqs Frequencies to evaluate at
   * @param gaussianParams Gaussians as rows of {mean, height, std}
   * @return peak component
   */
  public static double[] evaluatePeaks(double[] freqs, double[][] gaussianParams) {
    double[] flattened = new double[gaussianParams.length * 3];
    for (int i = 0; i < gaussianParams.length; ++i) {
      System.arraycopy(gaussianParams[i], 0, flattened, i * 3, 3);
    }
    return PeriodicMode.GAUSSIAN.evaluate(freqs, flattened);
  }

  /**
   * Convert gaussian parameters to peak parameters. The center is unchanged; the power is the
   * full model's height over the aperiodic fit at the frequency nearest the center; the
   * bandwidth is twice the gaussian standard deviation.
   *
   * @param freqs Frequencies of the model
   * @param gaussianParams Gaussians as rows of {mean, height, std}
   * @param fullModel Full model spectrum
   * @param apFit Aperiodic component
   * @return peak parameters as rows of {center, power, bandwidth}
   */
  public static double[][] createPeakParams(double[] freqs, double[][] gaussianParams,
      double[] fullModel, double[] apFit) {
    double[][] peakParams = new double[gaussianParams.length][];
    for (int i = 0; i < gaussianParams.length; ++i) {
      double[] peak = gaussianParams[i];
      int idx = NumericUtils.nearestIndex(freqs, peak[0]);
      peakParams[i] = new double[]{peak[0], fullModel[idx] - apFit[idx], peak[2] * 2};
    }
    return peakParams;
  }

  /**
   * Squared Pearson correlation between data and model
   *
   * @param data Observed log power
   * @param model Modeled log power
   * @return r-squared
   */
  public static double computeRSquared(double[] data, double[] model) {
    return NumericUtils.rSquared(data, model);
  }

}
