package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.model.AperiodicMode;
import asl.specparam.model.ParameterBounds;
import asl.specparam.utils.NumericUtils;
import org.apache.log4j.Logger;

/**
 * Fits the aperiodic component of a log power spectrum, either directly or robustly by
 * refitting on the points that lie lowest relative to an initial fit.
 */
public class AperiodicEstimator {

  private static final Logger logger = Logger.getLogger(AperiodicEstimator.class);

  private final AperiodicMode mode;
  private final AlgorithmSettings algorithm;
  private final CurveFitter fitter;

  public AperiodicEstimator(AperiodicMode mode, AlgorithmSettings algorithm,
      CurveFitter fitter) {
    this.mode = mode;
    this.algorithm = algorithm;
    this.fitter = fitter;
  }

  public AperiodicMode getMode() {
    return mode;
  }

  /**
   * Fit the aperiodic component using the configured guess and bounds. Guess entries left as
   * NaN are derived from the data being fit.
   *
   * @param freqs Frequency values, linear space
   * @param spectrum Power values, log10 space
   * @return aperiodic parameters
   * @throws FitError if the solver fails
   */
  public double[] simpleFit(double[] freqs, double[] spectrum) throws FitError {
    double[] guess = mode.initialGuess(freqs, spectrum, algorithm.getApGuess());
    ParameterBounds bounds =
        mode.buildBounds(algorithm.getApLowerBounds(), algorithm.getApUpperBounds());
    return simpleFit(freqs, spectrum, guess, bounds);
  }

  /**
   * Fit the aperiodic component from the given starting point
   *
   * @param freqs Frequency values, linear space
   * @param spectrum Power values, log10 space
   * @param guess Starting parameters, in this mode's parameter order
   * @param bounds Limits on this mode's parameters
   * @return aperiodic parameters
   * @throws FitError if the solver fails
   */
  public double[] simpleFit(double[] freqs, double[] spectrum, double[] guess,
      ParameterBounds bounds) throws FitError {
    return fitter.fit(mode, freqs, spectrum, guess, bounds,
        FitErrorKind.APERIODIC_NOT_CONVERGED, FitErrorKind.APERIODIC_SINGULAR);
  }

  /**
   * Fit the aperiodic component while ignoring points raised by peaks. An initial fit is
   * used to flatten the spectrum; points of the flattened spectrum at or below the configured
   * percentile are then refit, starting from the initial parameters.
   *
   * @param freqs Frequency values, linear space
   * @param spectrum Power values, log10 space
   * @return aperiodic parameters
   * @throws FitError if either fit fails, or too few points remain for the second fit
   */
  public double[] robustFit(double[] freqs, double[] spectrum) throws FitError {
    double[] initial = simpleFit(freqs, spectrum);
    double[] flat = NumericUtils.subtract(spectrum, mode.evaluate(freqs, initial));

    int[] keep = selectSubsample(flat, algorithm.getApPercentileThreshold());
    logger.debug("Robust aperiodic fit using " + keep.length + " of " + freqs.length
        + " points");
    double[] subFreqs = new double[keep.length];
    double[] subSpectrum = new double[keep.length];
    for (int i = 0; i < keep.length; ++i) {
      subFreqs[i] = freqs[keep[i]];
      subSpectrum[i] = spectrum[keep[i]];
    }

    ParameterBounds bounds =
        mode.buildBounds(algorithm.getApLowerBounds(), algorithm.getApUpperBounds());
    return fitter.fit(mode, subFreqs, subSpectrum, initial, bounds,
        FitErrorKind.ROBUST_APERIODIC_NOT_CONVERGED, FitErrorKind.ROBUST_SUBSAMPLE_DEGENERATE);
  }

  /**
   * Indices of the points used for the robust refit. Negative values of the flattened
   * spectrum are treated as zero, and every point at or below the given percentile of the
   * result is selected.
   *
   * @param flat Spectrum with an initial aperiodic fit removed
   * @param percentile Percentile threshold, in (0, 100]
   * @return selected indices, ascending
   */
  static int[] selectSubsample(double[] flat, double percentile) {
    double[] clipped = new double[flat.length];
    for (int i = 0; i < flat.length; ++i) {
      clipped[i] = Math.max(flat[i], 0.);
    }
    double threshold = NumericUtils.percentile(clipped, percentile);
    int count = 0;
    int[] indices = new int[clipped.length];
    for (int i = 0; i < clipped.length; ++i) {
      if (clipped[i] <= threshold) {
        indices[count++] = i;
      }
    }
    int[] out = new int[count];
    System.arraycopy(indices, 0, out, 0, count);
    return out;
  }

}
