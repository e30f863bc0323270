package asl.specparam;

import asl.specparam.errors.DataError;
import asl.specparam.errors.FitError;
import asl.specparam.errors.NoDataError;
import asl.specparam.errors.NoModelError;
import asl.specparam.fit.SpectrumFitter;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.input.Configuration;
import asl.specparam.input.ModelSettings;
import asl.specparam.input.SpectralData;
import asl.specparam.output.FitResult;

/**
 * Holds one spectrum and the model fit to it. Data is added, the model is fit, then results
 * can be queried. Adding new data clears any previous results.
 *
 * Run modes (debug, frequency checks, data checks) and algorithm settings default to the
 * values from {@link Configuration}.
 */
public class SpectralModel {

  private final ModelSettings settings;
  private final AlgorithmSettings algorithm;

  private boolean debug;
  private boolean checkFreqs;
  private boolean checkData;

  private SpectralData data;
  private FitResult result;

  public SpectralModel(ModelSettings settings) {
    this(settings, Configuration.getInstance());
  }

  /**
   * Create a model with algorithm settings and run modes from the given configuration
   *
   * @param settings Model settings
   * @param config Source of algorithm settings and default run modes
   */
  public SpectralModel(ModelSettings settings, Configuration config) {
    this(settings, config.getAlgorithmSettings());
    debug = config.isDebug();
    checkFreqs = config.isCheckFreqs();
    checkData = config.isCheckData();
  }

  public SpectralModel(ModelSettings settings, AlgorithmSettings algorithm) {
    this.settings = settings;
    this.algorithm = algorithm;
    debug = false;
    checkFreqs = true;
    checkData = true;
  }

  public ModelSettings getSettings() {
    return settings;
  }

  public AlgorithmSettings getAlgorithmSettings() {
    return algorithm;
  }

  /**
   * Set whether fit errors are thrown to the caller rather than producing a null result
   *
   * @param debug True to enable debug mode
   */
  public void setDebugMode(boolean debug) {
    this.debug = debug;
  }

  public boolean isDebugMode() {
    return debug;
  }

  /**
   * Set which checks are run when data is added
   *
   * @param checkFreqs True to require evenly spaced frequencies
   * @param checkData True to reject NaN or Inf values after log transform
   */
  public void setCheckModes(boolean checkFreqs, boolean checkData) {
    this.checkFreqs = checkFreqs;
    this.checkData = checkData;
  }

  public boolean isCheckFreqs() {
    return checkFreqs;
  }

  public boolean isCheckData() {
    return checkData;
  }

  /**
   * Add a spectrum to the model, replacing any current data and clearing results
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @param freqRange Range to restrict to as {low, high}, or null to keep all
   * @throws DataError if the data is invalid
   */
  public void addData(double[] freqs, double[] power, double[] freqRange) {
    SpectralData newData = SpectralData.create(freqs, power, freqRange, checkFreqs, checkData);
    data = newData;
    result = null;
  }

  /**
   * Add an already-prepared spectrum, replacing any current data and clearing results
   *
   * @param data Spectrum to fit
   */
  public void addData(SpectralData data) {
    this.data = data;
    result = null;
  }

  /**
   * Add data then fit the model to it
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @param freqRange Range to restrict to as {low, high}, or null to keep all
   * @return the fit result
   * @throws FitError in debug mode, if fitting failed
   */
  public FitResult fit(double[] freqs, double[] power, double[] freqRange) throws FitError {
    addData(freqs, power, freqRange);
    return fit();
  }

  /**
   * Fit the model to the current data. When not in debug mode, a failed fit stores and
   * returns the null result.
   *
   * @return the fit result
   * @throws NoDataError if no data has been added
   * @throws FitError in debug mode, if fitting failed
   */
  public FitResult fit() throws FitError {
    if (data == null) {
      throw new NoDataError("No data available to fit, can not proceed.");
    }
    result = null;
    SpectrumFitter fitter = new SpectrumFitter(settings, algorithm, debug);
    result = fitter.fit(data);
    return result;
  }

  public boolean hasData() {
    return data != null;
  }

  /**
   * Whether a successful fit is available
   *
   * @return true if the last fit produced a model
   */
  public boolean hasModel() {
    return result != null && result.hasModel();
  }

  /**
   * @return the current data
   * @throws NoDataError if no data has been added
   */
  public SpectralData getData() {
    if (data == null) {
      throw new NoDataError("No data available, add data first.");
    }
    return data;
  }

  /**
   * Get the result of the last fit, which may be the null result if that fit failed
   *
   * @return fit result
   * @throws NoModelError if no fit has been run on the current data
   */
  public FitResult getResult() {
    if (result == null) {
      throw new NoModelError("No model fit results are available, can not proceed.");
    }
    return result;
  }

}
