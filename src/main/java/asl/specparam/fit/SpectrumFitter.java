package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.input.ModelSettings;
import asl.specparam.input.SpectralData;
import asl.specparam.model.AperiodicMode;
import asl.specparam.output.FitResult;
import asl.specparam.utils.NumericUtils;
import org.apache.log4j.Logger;

/**
 * Fits the full model to a single spectrum.
 *
 * The aperiodic component is fit robustly and removed, peaks are found and fit in the
 * flattened spectrum, then the aperiodic component is refit to the spectrum with the peaks
 * removed. A failure at any nonlinear stage produces the null result, unless debug mode is
 * set, in which case the {@link FitError} is thrown to the caller.
 *
 * Instances are immutable and may be shared between threads.
 */
public class SpectrumFitter {

  private static final Logger logger = Logger.getLogger(SpectrumFitter.class);

  private final ModelSettings settings;
  private final AlgorithmSettings algorithm;
  private final boolean debug;

  public SpectrumFitter(ModelSettings settings) {
    this(settings, AlgorithmSettings.defaults(), false);
  }

  public SpectrumFitter(ModelSettings settings, AlgorithmSettings algorithm, boolean debug) {
    this.settings = settings;
    this.algorithm = algorithm;
    this.debug = debug;
  }

  public ModelSettings getSettings() {
    return settings;
  }

  public AlgorithmSettings getAlgorithmSettings() {
    return algorithm;
  }

  public boolean isDebug() {
    return debug;
  }

  /**
   * Get a fitter with the same settings and the given debug mode
   *
   * @param debug True to throw fit errors rather than return null results
   * @return fitter with debug mode set
   */
  public SpectrumFitter withDebugMode(boolean debug) {
    return new SpectrumFitter(settings, algorithm, debug);
  }

  /**
   * Fit the model to the data
   *
   * @param data Spectrum to fit
   * @return fit result; the null result if fitting failed and debug mode is off
   * @throws FitError in debug mode, if fitting failed
   */
  public FitResult fit(SpectralData data) throws FitError {
    FitOutcome outcome = tryFit(data);
    if (outcome.isSuccess()) {
      return outcome.getResult();
    }
    if (debug) {
      throw outcome.getError();
    }
    logger.warn("Model fitting was unsuccessful: " + outcome.getError().getMessage());
    return FitResult.nullResult(settings.getAperiodicMode());
  }

  /**
   * Fit the model to the data, returning failures as a value regardless of debug mode
   *
   * @param data Spectrum to fit
   * @return result or error
   */
  public FitOutcome tryFit(SpectralData data) {
    checkWidthLimits(data.getFreqRes());
    try {
      return FitOutcome.success(runFit(data));
    } catch (FitError e) {
      logger.debug("Fit failed at stage " + e.getKind(), e);
      return FitOutcome.failure(e);
    }
  }

  private FitResult runFit(SpectralData data) throws FitError {
    double[] freqs = data.getFreqs();
    double[] spectrum = data.getPowerSpectrum();
    if (!NumericUtils.allFinite(spectrum)) {
      throw new FitError(FitErrorKind.INVALID_DATA);
    }

    AperiodicMode mode = settings.getAperiodicMode();
    CurveFitter fitter = new CurveFitter(algorithm.getMaxEvaluations());
    AperiodicEstimator estimator = new AperiodicEstimator(mode, algorithm, fitter);

    double[] apParams = estimator.robustFit(freqs, spectrum);
    double[] flat = NumericUtils.subtract(spectrum, mode.evaluate(freqs, apParams));
    logger.debug("Initial aperiodic parameters: " + describe(apParams));

    PeakExtractor extractor = new PeakExtractor(freqs, settings, algorithm, fitter);
    double[][] gaussianParams = extractor.fitPeaks(flat);
    double[] peakFit = ModelAssembler.evaluatePeaks(freqs, gaussianParams);
    logger.debug("Fit " + gaussianParams.length + " peaks");

    double[] peakRemoved = NumericUtils.subtract(spectrum, peakFit);
    apParams = estimator.simpleFit(freqs, peakRemoved);
    logger.debug("Final aperiodic parameters: " + describe(apParams));

    ModelAssembler assembler = new ModelAssembler(mode, algorithm.getErrorMetric());
    return assembler.assemble(freqs, spectrum, apParams, gaussianParams, peakFit);
  }

  /**
   * Warn if the lower peak width limit is close to the frequency resolution, since peaks
   * narrower than a few bins cannot be fit reliably
   *
   * @param freqRes Frequency resolution of the data
   * @return true if the warning was raised
   */
  boolean checkWidthLimits(double freqRes) {
    double lowerLimit = settings.getPeakWidthLimits()[0];
    if (1.5 * freqRes >= lowerLimit) {
      logger.warn("Lower-bound peak width limit is < or ~= the frequency resolution: "
          + NumericUtils.DECIMAL_FORMAT.get().format(lowerLimit) + " <= "
          + NumericUtils.DECIMAL_FORMAT.get().format(freqRes) + " (x1.5); "
          + "lower bounds below frequency resolution have no effect and may lead to "
          + "overfitting");
      return true;
    }
    return false;
  }

  private static String describe(double[] params) {
    StringBuilder sb = new StringBuilder();
    for (double param : params) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(NumericUtils.DECIMAL_FORMAT.get().format(param));
    }
    return sb.toString();
  }

}
